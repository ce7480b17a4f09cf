package org.buildlens.model;

/**
 * Direction in which a metric value is considered better.
 */
public enum MetricPolarity {
    LOWER_IS_BETTER {
        @Override
        public boolean isImprovement(double delta) {
            return delta < 0;
        }
    },
    HIGHER_IS_BETTER {
        @Override
        public boolean isImprovement(double delta) {
            return delta > 0;
        }
    };

    /**
     * Whether a change of {@code delta} in the metric value is an improvement.
     */
    public abstract boolean isImprovement(double delta);

    public boolean isLowerBetter() {
        return this == LOWER_IS_BETTER;
    }
}
