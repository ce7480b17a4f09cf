package org.buildlens.analysis;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.buildlens.model.Metric;
import org.buildlens.model.MetricSnapshot;

/**
 * Compares the latest snapshot with the previous one, the early-history baseline and metric targets.
 */
public final class PerformanceComparator {
    private static final double STABLE_CHANGE_PERCENT = 2.0;
    private static final double BASELINE_SHARE = 0.1;

    private PerformanceComparator() {
    }

    /**
     * One comparison per metric, empty when the history holds fewer than two snapshots.
     */
    public static List<PerformanceComparison> compare(List<MetricSnapshot> history) {
        Objects.requireNonNull(history, "history");
        if (history.size() < 2) {
            return List.of();
        }
        MetricSnapshot current = history.get(history.size() - 1);
        MetricSnapshot previous = history.get(history.size() - 2);
        int baselineCount = Math.max(1, (int) Math.floor(history.size() * BASELINE_SHARE));
        List<MetricSnapshot> baselineWindow = history.subList(0, baselineCount);

        List<PerformanceComparison> comparisons = new ArrayList<>();
        for (Metric metric : Metric.values()) {
            double currentValue = current.value(metric);
            double previousValue = previous.value(metric);
            double baselineValue = 0.0;
            for (MetricSnapshot snapshot : baselineWindow) {
                baselineValue += snapshot.value(metric);
            }
            baselineValue /= baselineWindow.size();

            double changeFromPrevious = percentChange(previousValue, currentValue);
            double changeFromBaseline = percentChange(baselineValue, currentValue);
            double progress = targetProgress(metric, baselineValue, currentValue);

            ComparisonStatus status;
            if (Math.abs(changeFromPrevious) < STABLE_CHANGE_PERCENT) {
                status = ComparisonStatus.STABLE;
            } else if (metric.polarity().isImprovement(changeFromPrevious)) {
                status = ComparisonStatus.IMPROVED;
            } else {
                status = ComparisonStatus.DEGRADED;
            }
            comparisons.add(new PerformanceComparison(
                    metric,
                    currentValue,
                    previousValue,
                    baselineValue,
                    metric.target(),
                    changeFromPrevious,
                    changeFromBaseline,
                    progress,
                    status));
        }
        return List.copyOf(comparisons);
    }

    private static double percentChange(double from, double to) {
        if (from == 0.0) {
            return 0.0;
        }
        return (to - from) * 100.0 / from;
    }

    private static double targetProgress(Metric metric, double baseline, double current) {
        double target = metric.target();
        double distance = metric.lowerIsBetter() ? baseline - target : target - baseline;
        double covered = metric.lowerIsBetter() ? baseline - current : current - baseline;
        if (distance <= 0.0) {
            // Baseline already met the target.
            boolean meets = metric.lowerIsBetter() ? current <= target : current >= target;
            return meets ? 100.0 : 0.0;
        }
        return Math.min(100.0, Math.max(0.0, covered * 100.0 / distance));
    }
}
