package org.buildlens.analysis;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import org.buildlens.model.Metric;
import org.buildlens.model.MetricSnapshot;
import org.buildlens.obs.CorrelationContext;
import org.buildlens.obs.StructuredJsonLinesLogger;
import org.buildlens.timeseries.InMemorySnapshotStorage;
import org.buildlens.timeseries.MetricHistory;
import org.junit.jupiter.api.Test;

class TrendAnalyzerTest {
    private static final Instant START = Instant.parse("2026-03-01T00:00:00Z");

    @Test
    void decreasingBuildTimeIsImproving() {
        List<MetricSnapshot> window = daily(Metric.BUILD_TIME, 50, 48, 46, 44, 42);

        Trend trend = trendOf(new TrendAnalyzer(MetricHistory.inMemory()).analyze(window), Metric.BUILD_TIME);

        assertEquals(TrendDirection.IMPROVING, trend.direction());
        assertEquals(-2.0, trend.changeRatePerDay(), 1e-9);
        assertEquals(1.0, trend.confidence(), 1e-9);
        assertEquals(TrendSignificance.HIGH, trend.significance());
        assertEquals(5, trend.dataPoints());
        assertEquals("4 days", trend.timeframe());
    }

    @Test
    void decreasingCoverageIsDegrading() {
        List<MetricSnapshot> window = daily(Metric.TEST_COVERAGE, 90, 86, 82, 78);

        Trend trend = trendOf(new TrendAnalyzer(MetricHistory.inMemory()).analyze(window), Metric.TEST_COVERAGE);

        assertEquals(TrendDirection.DEGRADING, trend.direction());
        assertTrue(trend.changeRatePerDay() < 0);
    }

    @Test
    void increasingBuildTimeIsDegradingAndSlopeSignFollowsData() {
        List<MetricSnapshot> window = daily(Metric.BUILD_TIME, 40, 44, 48);

        Trend trend = trendOf(new TrendAnalyzer(MetricHistory.inMemory()).analyze(window), Metric.BUILD_TIME);

        assertEquals(TrendDirection.DEGRADING, trend.direction());
        assertTrue(trend.changeRatePerDay() > 0);
    }

    @Test
    void constantSeriesIsStableWithFullConfidence() {
        List<MetricSnapshot> window = daily(Metric.CACHE_HIT_RATE, 85, 85, 85);

        Trend trend = trendOf(new TrendAnalyzer(MetricHistory.inMemory()).analyze(window), Metric.CACHE_HIT_RATE);

        assertEquals(TrendDirection.STABLE, trend.direction());
        assertEquals(0.0, trend.changeRatePerDay(), 1e-12);
        assertEquals(1.0, trend.confidence());
        assertEquals(TrendSignificance.LOW, trend.significance());
    }

    @Test
    void smallRelativeChangeIsStable() {
        // 0.1 per day against a mean near 100 stays under the 1% stability band.
        List<MetricSnapshot> window = daily(Metric.MEMORY_USAGE, 100.0, 100.1, 100.2);

        Trend trend = trendOf(new TrendAnalyzer(MetricHistory.inMemory()).analyze(window), Metric.MEMORY_USAGE);

        assertEquals(TrendDirection.STABLE, trend.direction());
    }

    @Test
    void fewerThanTwoSnapshotsYieldNoTrends() {
        TrendAnalyzer analyzer = new TrendAnalyzer(MetricHistory.inMemory());

        assertTrue(analyzer.analyze(List.of()).isEmpty());
        assertTrue(analyzer.analyze(daily(Metric.BUILD_TIME, 10)).isEmpty());
    }

    @Test
    void identicalTimestampsAreSkippedAndLogged() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        StructuredJsonLinesLogger logger = new StructuredJsonLinesLogger(
                new OutputStreamWriter(out, StandardCharsets.UTF_8),
                Clock.fixed(START, ZoneOffset.UTC),
                true);
        TrendAnalyzer analyzer = new TrendAnalyzer(
                MetricHistory.inMemory(), logger, CorrelationContext.of("run-1", "trend-analysis"));
        List<MetricSnapshot> window = List.of(
                MetricSnapshot.builder(START).value(Metric.BUILD_TIME, 10).build(),
                MetricSnapshot.builder(START).value(Metric.BUILD_TIME, 12).build());

        List<Trend> trends = analyzer.analyze(window);

        assertTrue(trends.isEmpty());
        String logged = out.toString(StandardCharsets.UTF_8);
        assertEquals(Metric.values().length, logged.lines().count());
        assertTrue(logged.contains("\"message\":\"trend skipped\""));
    }

    @Test
    void analyzesHistoryWindowRelativeToClock() {
        Clock clock = Clock.fixed(START.plus(Duration.ofDays(40)), ZoneOffset.UTC);
        MetricHistory history = new MetricHistory(new InMemorySnapshotStorage(), 100, clock);
        history.append(MetricSnapshot.builder(START).value(Metric.BUILD_TIME, 500).build());
        for (int day = 31; day <= 35; day++) {
            history.append(MetricSnapshot.builder(START.plus(Duration.ofDays(day)))
                    .value(Metric.BUILD_TIME, 100 - day)
                    .build());
        }

        Trend trend = trendOf(new TrendAnalyzer(history).analyze(30), Metric.BUILD_TIME);

        assertEquals(5, trend.dataPoints());
        assertEquals(-1.0, trend.changeRatePerDay(), 1e-9);
    }

    private static List<MetricSnapshot> daily(Metric metric, double... values) {
        List<MetricSnapshot> snapshots = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            snapshots.add(MetricSnapshot.builder(START.plus(Duration.ofDays(i))).value(metric, values[i]).build());
        }
        return snapshots;
    }

    private static Trend trendOf(List<Trend> trends, Metric metric) {
        return trends.stream()
                .filter(trend -> trend.metric() == metric)
                .findFirst()
                .orElseThrow(() -> new AssertionError("missing trend for " + metric));
    }
}
