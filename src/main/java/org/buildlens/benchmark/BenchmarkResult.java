package org.buildlens.benchmark;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import org.buildlens.model.Metric;

/**
 * Outcome of scoring one snapshot against a benchmark config.
 *
 * @param id identifier of the persisted result, {@code <configName>/<timestamp>}
 */
public record BenchmarkResult(
        String id,
        String configName,
        Instant timestamp,
        Map<Metric, Double> results,
        Map<Metric, Double> scores,
        double overallScore,
        Grade grade,
        boolean passed,
        Map<String, String> metadata) {
    public BenchmarkResult {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        if (configName == null || configName.isBlank()) {
            throw new IllegalArgumentException("configName must not be blank");
        }
        Objects.requireNonNull(timestamp, "timestamp");
        results = Map.copyOf(results);
        scores = Map.copyOf(scores);
        if (!results.keySet().equals(scores.keySet())) {
            throw new IllegalArgumentException("results and scores must cover the same metrics");
        }
        if (!Double.isFinite(overallScore)) {
            throw new IllegalArgumentException("overallScore must be finite");
        }
        Objects.requireNonNull(grade, "grade");
        metadata = Map.copyOf(metadata);
    }
}
