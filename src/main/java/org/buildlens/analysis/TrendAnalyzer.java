package org.buildlens.analysis;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.buildlens.model.Metric;
import org.buildlens.model.MetricSnapshot;
import org.buildlens.obs.CorrelationContext;
import org.buildlens.obs.JsonLinesLogger;
import org.buildlens.timeseries.MetricHistory;

/**
 * Fits a least-squares trend per metric over a history window and classifies it.
 */
public final class TrendAnalyzer {
    public static final int DEFAULT_WINDOW_DAYS = 30;

    private static final double MILLIS_PER_DAY = Duration.ofDays(1).toMillis();
    private static final double STABILITY_RATIO = 0.01;

    private final MetricHistory history;
    private final JsonLinesLogger logger;
    private final CorrelationContext correlation;

    public TrendAnalyzer(MetricHistory history) {
        this(history, JsonLinesLogger.noop(), CorrelationContext.of("analysis", "trend-analysis"));
    }

    public TrendAnalyzer(MetricHistory history, JsonLinesLogger logger, CorrelationContext correlation) {
        this.history = Objects.requireNonNull(history, "history");
        this.logger = Objects.requireNonNull(logger, "logger");
        this.correlation = Objects.requireNonNull(correlation, "correlation");
    }

    /**
     * Trends over snapshots taken within the last {@code windowDays} days.
     */
    public List<Trend> analyze(int windowDays) {
        return analyze(history.lastDays(windowDays));
    }

    /**
     * Trends over an explicit chronological window; metrics that cannot be fitted are skipped.
     */
    public List<Trend> analyze(List<MetricSnapshot> window) {
        Objects.requireNonNull(window, "window");
        if (window.size() < 2) {
            return List.of();
        }
        List<Trend> trends = new ArrayList<>();
        for (Metric metric : Metric.values()) {
            try {
                trends.add(fit(metric, window));
            } catch (IllegalArgumentException e) {
                logger.warn(
                        "trend skipped",
                        correlation,
                        Map.of("metric", metric.key(), "reason", String.valueOf(e.getMessage())));
            }
        }
        return List.copyOf(trends);
    }

    static Trend fit(Metric metric, List<MetricSnapshot> window) {
        int n = window.size();
        double[] x = new double[n];
        double[] y = new double[n];
        // x is measured from the first timestamp to keep the sums well conditioned.
        long origin = window.get(0).timestamp().toEpochMilli();
        for (int i = 0; i < n; i++) {
            MetricSnapshot snapshot = window.get(i);
            x[i] = snapshot.timestamp().toEpochMilli() - origin;
            y[i] = snapshot.value(metric);
        }
        LinearFit fit = LinearFit.of(x, y);

        double mean = 0.0;
        for (double value : y) {
            mean += value;
        }
        mean /= n;

        double changePerDay = fit.slope() * MILLIS_PER_DAY;
        double threshold = Math.abs(mean * STABILITY_RATIO);
        double magnitude = Math.abs(changePerDay);

        TrendDirection direction;
        if (magnitude < threshold) {
            direction = TrendDirection.STABLE;
        } else if (metric.polarity().isImprovement(changePerDay)) {
            direction = TrendDirection.IMPROVING;
        } else if (changePerDay == 0.0) {
            direction = TrendDirection.STABLE;
        } else {
            direction = TrendDirection.DEGRADING;
        }

        double confidence = fit.rSquared();
        TrendSignificance significance;
        if (confidence > 0.8 && magnitude > threshold * 2) {
            significance = TrendSignificance.HIGH;
        } else if (confidence > 0.5 && magnitude > threshold) {
            significance = TrendSignificance.MEDIUM;
        } else {
            significance = TrendSignificance.LOW;
        }

        double spanDays = (x[n - 1] - x[0]) / MILLIS_PER_DAY;
        return new Trend(metric, direction, changePerDay, confidence, n, significance, spanDays);
    }
}
