package org.buildlens.analysis;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import org.buildlens.model.Metric;
import org.buildlens.model.MetricSnapshot;
import org.buildlens.timeseries.MetricHistory;

/**
 * Compares a baseline window against a recent window and flags metrics that degraded past their threshold.
 */
public final class RegressionDetector {
    public static final int DEFAULT_BASELINE_DAYS = 7;
    public static final int DEFAULT_RECENT_DAYS = 1;

    private final MetricHistory history;
    private final Clock clock;

    public RegressionDetector(MetricHistory history) {
        this(history, Clock.systemUTC());
    }

    public RegressionDetector(MetricHistory history, Clock clock) {
        this.history = Objects.requireNonNull(history, "history");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Baseline is every snapshot older than {@code baselineDays}; recent is every snapshot within
     * the last {@code recentDays}.
     */
    public List<Regression> detect(int baselineDays, int recentDays) {
        if (baselineDays < 0 || recentDays < 0) {
            throw new IllegalArgumentException("window days must be >= 0");
        }
        List<MetricSnapshot> snapshots = history.snapshots();
        if (snapshots.size() < 2) {
            return List.of();
        }
        Instant now = Instant.now(clock);
        Instant baselineCutoff = now.minus(Duration.ofDays(baselineDays));
        Instant recentCutoff = now.minus(Duration.ofDays(recentDays));

        List<MetricSnapshot> baseline = new ArrayList<>();
        List<MetricSnapshot> recent = new ArrayList<>();
        for (MetricSnapshot snapshot : snapshots) {
            if (snapshot.timestamp().isBefore(baselineCutoff)) {
                baseline.add(snapshot);
            }
            if (!snapshot.timestamp().isBefore(recentCutoff)) {
                recent.add(snapshot);
            }
        }
        return detect(baseline, recent);
    }

    /**
     * Regressions of {@code recent} against {@code baseline}, most severe first.
     */
    public List<Regression> detect(List<MetricSnapshot> baseline, List<MetricSnapshot> recent) {
        Objects.requireNonNull(baseline, "baseline");
        Objects.requireNonNull(recent, "recent");
        if (baseline.isEmpty() || recent.isEmpty()) {
            return List.of();
        }
        Instant detectedAt = Instant.now(clock);
        List<Regression> regressions = new ArrayList<>();
        for (Metric metric : Metric.values()) {
            Regression regression = detect(metric, mean(baseline, metric), mean(recent, metric), detectedAt);
            if (regression != null) {
                regressions.add(regression);
            }
        }
        regressions.sort(Comparator.comparingInt((Regression r) -> r.severity().rank()).reversed());
        return List.copyOf(regressions);
    }

    static Regression detect(Metric metric, double baselineMean, double recentMean, Instant detectedAt) {
        if (baselineMean == 0.0) {
            return null;
        }
        double changePercent = (recentMean - baselineMean) * 100.0 / baselineMean;
        double threshold = metric.regressionThresholdPercent();
        boolean regressed = metric.lowerIsBetter() ? changePercent > threshold : changePercent < -threshold;
        if (!regressed) {
            return null;
        }
        double magnitude = Math.abs(changePercent);
        RegressionSeverity severity = RegressionSeverity.classify(magnitude, threshold);
        return new Regression(
                metric,
                baselineMean,
                recentMean,
                magnitude,
                severity,
                detectedAt,
                RegressionGuidance.causes(metric),
                RegressionGuidance.recommendations(metric, severity));
    }

    private static double mean(List<MetricSnapshot> snapshots, Metric metric) {
        double sum = 0.0;
        for (MetricSnapshot snapshot : snapshots) {
            sum += snapshot.value(metric);
        }
        return sum / snapshots.size();
    }
}
