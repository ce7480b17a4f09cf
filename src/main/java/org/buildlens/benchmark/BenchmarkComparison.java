package org.buildlens.benchmark;

import java.util.Map;
import java.util.Objects;
import org.buildlens.model.Metric;

/**
 * Metric-level differences between two results of the same config.
 *
 * @param improvements metrics that moved in their better direction, by absolute percent change
 * @param regressions metrics that moved in their worse direction, by absolute percent change
 * @param overallChange current overall score minus baseline overall score
 */
public record BenchmarkComparison(
        BenchmarkResult baseline,
        BenchmarkResult current,
        Map<Metric, Double> improvements,
        Map<Metric, Double> regressions,
        double overallChange,
        String summary) {
    public BenchmarkComparison {
        Objects.requireNonNull(baseline, "baseline");
        Objects.requireNonNull(current, "current");
        improvements = Map.copyOf(improvements);
        regressions = Map.copyOf(regressions);
        Objects.requireNonNull(summary, "summary");
    }
}
