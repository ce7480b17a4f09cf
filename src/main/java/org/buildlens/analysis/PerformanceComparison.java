package org.buildlens.analysis;

import java.util.Objects;
import org.buildlens.model.Metric;

/**
 * Latest value of a metric against the previous run, the early-history baseline and its target.
 *
 * @param targetProgress share of the baseline-to-target distance covered, within [0, 100]
 */
public record PerformanceComparison(
        Metric metric,
        double current,
        double previous,
        double baseline,
        double target,
        double changeFromPrevious,
        double changeFromBaseline,
        double targetProgress,
        ComparisonStatus status) {
    public PerformanceComparison {
        Objects.requireNonNull(metric, "metric");
        Objects.requireNonNull(status, "status");
    }
}
