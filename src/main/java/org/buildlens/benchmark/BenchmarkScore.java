package org.buildlens.benchmark;

import java.util.Map;
import java.util.Objects;
import org.buildlens.model.Metric;

/**
 * Scores of one snapshot against a config, before the result is persisted.
 */
public record BenchmarkScore(
        Map<Metric, Double> results,
        Map<Metric, Double> scores,
        double overallScore,
        Grade grade,
        boolean passed) {
    public BenchmarkScore {
        results = Map.copyOf(results);
        scores = Map.copyOf(scores);
        Objects.requireNonNull(grade, "grade");
    }
}
