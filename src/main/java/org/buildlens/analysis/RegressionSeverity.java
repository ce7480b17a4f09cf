package org.buildlens.analysis;

/**
 * Regression severity; {@link #rank()} grows with severity.
 */
public enum RegressionSeverity {
    MINOR(1),
    MAJOR(2),
    CRITICAL(3);

    private final int rank;

    RegressionSeverity(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    /**
     * Classifies an absolute percentage change against a metric threshold.
     */
    static RegressionSeverity classify(double absoluteChangePercent, double thresholdPercent) {
        if (absoluteChangePercent >= thresholdPercent * 3) {
            return CRITICAL;
        }
        if (absoluteChangePercent >= thresholdPercent * 2) {
            return MAJOR;
        }
        return MINOR;
    }
}
