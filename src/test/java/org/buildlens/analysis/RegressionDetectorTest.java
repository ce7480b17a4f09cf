package org.buildlens.analysis;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.buildlens.model.Metric;
import org.buildlens.model.MetricSnapshot;
import org.buildlens.timeseries.InMemorySnapshotStorage;
import org.buildlens.timeseries.MetricHistory;
import org.junit.jupiter.api.Test;

class RegressionDetectorTest {
    private static final Instant NOW = Instant.parse("2026-03-10T00:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    @Test
    void doubledBuildTimeIsCriticalRegression() {
        MetricHistory history = new MetricHistory(new InMemorySnapshotStorage(), 100, CLOCK);
        history.append(buildTime(NOW.minus(Duration.ofDays(10)), 30));
        history.append(buildTime(NOW.minus(Duration.ofDays(9)), 30));
        history.append(buildTime(NOW.minus(Duration.ofHours(1)), 60));

        List<Regression> regressions = new RegressionDetector(history, CLOCK).detect(7, 1);

        assertEquals(1, regressions.size());
        Regression regression = regressions.get(0);
        assertEquals(Metric.BUILD_TIME, regression.metric());
        assertEquals(RegressionSeverity.CRITICAL, regression.severity());
        assertEquals(100.0, regression.regressionPercentage(), 1e-9);
        assertEquals(30.0, regression.baselineValue());
        assertEquals(60.0, regression.currentValue());
        assertEquals(NOW, regression.detectedAt());
        assertFalse(regression.possibleCauses().isEmpty());
        assertTrue(regression.recommendations().size() > RegressionGuidance.recommendations(
                Metric.BUILD_TIME, RegressionSeverity.MINOR).size());
    }

    @Test
    void severityBoundariesAreInclusive() {
        assertEquals(RegressionSeverity.MAJOR, RegressionDetector.detect(Metric.BUILD_TIME, 100, 120, NOW).severity());
        assertEquals(
                RegressionSeverity.CRITICAL, RegressionDetector.detect(Metric.BUILD_TIME, 100, 130, NOW).severity());
        assertEquals(RegressionSeverity.MINOR, RegressionDetector.detect(Metric.BUILD_TIME, 100, 115, NOW).severity());
    }

    @Test
    void changeAtThresholdIsNotRegression() {
        assertNull(RegressionDetector.detect(Metric.BUILD_TIME, 100, 110, NOW));
        assertNull(RegressionDetector.detect(Metric.BUILD_TIME, 100, 80, NOW));
        assertNull(RegressionDetector.detect(Metric.TEST_COVERAGE, 80, 76, NOW));
    }

    @Test
    void higherIsBetterMetricsRegressWhenTheyDrop() {
        Regression regression = RegressionDetector.detect(Metric.TEST_COVERAGE, 80, 72, NOW);

        assertEquals(RegressionSeverity.MAJOR, regression.severity());
        assertEquals(10.0, regression.regressionPercentage(), 1e-9);
        assertNull(RegressionDetector.detect(Metric.TEST_COVERAGE, 80, 95, NOW));
    }

    @Test
    void zeroBaselineIsSkipped() {
        assertNull(RegressionDetector.detect(Metric.BUNDLE_SIZE, 0, 50, NOW));
    }

    @Test
    void needsSnapshotsInBothWindows() {
        MetricHistory history = new MetricHistory(new InMemorySnapshotStorage(), 100, CLOCK);
        history.append(buildTime(NOW.minus(Duration.ofHours(3)), 30));
        history.append(buildTime(NOW.minus(Duration.ofHours(1)), 90));

        assertTrue(new RegressionDetector(history, CLOCK).detect(7, 1).isEmpty());
        assertTrue(new RegressionDetector(MetricHistory.inMemory(), CLOCK).detect(7, 1).isEmpty());
    }

    @Test
    void ordersRegressionsBySeverity() {
        MetricSnapshot baseline = MetricSnapshot.builder(NOW.minus(Duration.ofDays(10)))
                .value(Metric.BUILD_TIME, 100)
                .value(Metric.BUNDLE_SIZE, 10)
                .build();
        MetricSnapshot recent = MetricSnapshot.builder(NOW)
                .value(Metric.BUILD_TIME, 112)
                .value(Metric.BUNDLE_SIZE, 20)
                .build();

        List<Regression> regressions = new RegressionDetector(MetricHistory.inMemory(), CLOCK)
                .detect(List.of(baseline), List.of(recent));

        assertEquals(2, regressions.size());
        assertEquals(Metric.BUNDLE_SIZE, regressions.get(0).metric());
        assertEquals(RegressionSeverity.CRITICAL, regressions.get(0).severity());
        assertEquals(Metric.BUILD_TIME, regressions.get(1).metric());
        assertEquals(RegressionSeverity.MINOR, regressions.get(1).severity());
    }

    private static MetricSnapshot buildTime(Instant timestamp, double seconds) {
        return MetricSnapshot.builder(timestamp).value(Metric.BUILD_TIME, seconds).build();
    }
}
