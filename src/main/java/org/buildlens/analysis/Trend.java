package org.buildlens.analysis;

import java.util.Objects;
import org.buildlens.model.Metric;

/**
 * Fitted trend of one metric over a window.
 *
 * @param changeRatePerDay slope of the fit expressed in metric units per calendar day
 * @param confidence coefficient of determination clamped to [0, 1]
 * @param spanDays days between the first and the last point of the window
 */
public record Trend(
        Metric metric,
        TrendDirection direction,
        double changeRatePerDay,
        double confidence,
        int dataPoints,
        TrendSignificance significance,
        double spanDays) {
    public Trend {
        Objects.requireNonNull(metric, "metric");
        Objects.requireNonNull(direction, "direction");
        Objects.requireNonNull(significance, "significance");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0, 1]");
        }
        if (dataPoints < 2) {
            throw new IllegalArgumentException("dataPoints must be >= 2");
        }
    }

    public String timeframe() {
        return Math.round(spanDays) + " days";
    }
}
