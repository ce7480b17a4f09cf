package org.buildlens.analysis;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import org.buildlens.model.Metric;

/**
 * Degradation of a metric's recent mean against its baseline mean.
 *
 * @param regressionPercentage absolute percentage change between the two means
 */
public record Regression(
        Metric metric,
        double baselineValue,
        double currentValue,
        double regressionPercentage,
        RegressionSeverity severity,
        Instant detectedAt,
        List<String> possibleCauses,
        List<String> recommendations) {
    public Regression {
        Objects.requireNonNull(metric, "metric");
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(detectedAt, "detectedAt");
        possibleCauses = List.copyOf(possibleCauses);
        recommendations = List.copyOf(recommendations);
    }
}
