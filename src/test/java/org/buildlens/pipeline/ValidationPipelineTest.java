package org.buildlens.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.StringWriter;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.bson.Document;
import org.buildlens.analysis.Regression;
import org.buildlens.analysis.RegressionSeverity;
import org.buildlens.benchmark.BenchmarkComparison;
import org.buildlens.benchmark.BenchmarkEngine;
import org.buildlens.benchmark.BenchmarkResult;
import org.buildlens.config.StructuredDocumentLoader;
import org.buildlens.controller.ValidationController;
import org.buildlens.model.Metric;
import org.buildlens.model.MetricSnapshot;
import org.buildlens.model.Recommendation;
import org.buildlens.model.RecommendationPriority;
import org.buildlens.model.SnapshotMetadata;
import org.buildlens.model.ValidationStatus;
import org.buildlens.obs.JsonLinesLogger;
import org.buildlens.obs.StructuredJsonLinesLogger;
import org.buildlens.report.ValidationReport;
import org.buildlens.timeseries.InMemorySnapshotStorage;
import org.buildlens.timeseries.MetricHistory;
import org.buildlens.timeseries.NdjsonSnapshotStorage;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ValidationPipelineTest {
    private static final Instant START = Instant.parse("2026-03-01T12:00:00Z");

    @Test
    void firstRunRecordsSnapshotAndScoresEveryBenchmark() throws URISyntaxException {
        SteppingClock clock = new SteppingClock(START);
        MetricHistory history = new MetricHistory(new InMemorySnapshotStorage(), 100, clock);
        BenchmarkEngine benchmarks = BenchmarkEngine.inMemory(clock);
        benchmarks.installDefaultConfigs();

        PipelineOutcome outcome = pipeline(MeasurementBundle.load(MeasurementBundleTest.measurementsFile()),
                history, benchmarks, clock, JsonLinesLogger.noop())
                .execute(new SnapshotMetadata("abc123", "main", null, null, null));

        MetricSnapshot snapshot = outcome.snapshot();
        assertEquals(START, snapshot.timestamp());
        assertEquals(20.0, snapshot.value(Metric.BUILD_TIME));
        assertEquals(4.0, snapshot.value(Metric.BUNDLE_SIZE));
        assertEquals(256.0, snapshot.value(Metric.MEMORY_USAGE));
        assertEquals("abc123", snapshot.metadata().gitCommit());
        assertEquals(List.of(snapshot), history.snapshots());

        ValidationReport report = outcome.report();
        assertEquals(ValidationStatus.SUCCESS, report.summary().overallStatus());
        assertEquals(3, report.summary().completedValidations());
        assertEquals(
                List.of("developer-experience", "phase-a-validation"),
                report.benchmarkResults().stream().map(BenchmarkResult::configName).toList());
        assertTrue(report.benchmarkComparisons().isEmpty());
        assertTrue(report.regressions().isEmpty());
        assertTrue(report.comparisons().isEmpty());
        assertTrue(report.recommendations().isEmpty());
        assertEquals("abc123", report.benchmarkResults().get(0).metadata().get("gitCommit"));
    }

    @Test
    void slowerBuildTenDaysLaterIsReportedAsRegression() throws URISyntaxException {
        SteppingClock clock = new SteppingClock(START);
        MetricHistory history = new MetricHistory(new InMemorySnapshotStorage(), 100, clock);
        BenchmarkEngine benchmarks = BenchmarkEngine.inMemory(clock);
        benchmarks.installDefaultConfigs();
        StringWriter logOutput = new StringWriter();
        JsonLinesLogger logger = new StructuredJsonLinesLogger(logOutput, clock, true);

        Map<String, Object> document = StructuredDocumentLoader.load(MeasurementBundleTest.measurementsFile());
        pipeline(new MeasurementBundle(document), history, benchmarks, clock, logger).execute(null);

        clock.advance(Duration.ofDays(10));
        Map<String, Object> slower = new LinkedHashMap<>(document);
        slower.put("build-metrics", Map.of(
                "totalBuildTimeMillis", 45_000,
                "packageBuildTimes", Map.of("core", 30_000, "ui", 15_000),
                "parallelEfficiency", 80,
                "cacheHitRate", 90,
                "improvementPercentage", 35));
        PipelineOutcome outcome = pipeline(new MeasurementBundle(slower), history, benchmarks, clock, logger)
                .execute(SnapshotMetadata.empty());

        ValidationReport report = outcome.report();
        assertEquals(2, history.size());
        assertEquals(1, report.regressions().size());
        Regression regression = report.regressions().get(0);
        assertEquals(Metric.BUILD_TIME, regression.metric());
        assertEquals(RegressionSeverity.CRITICAL, regression.severity());
        assertEquals(125.0, regression.regressionPercentage(), 1e-9);

        assertEquals(2, report.benchmarkComparisons().size());
        for (BenchmarkComparison comparison : report.benchmarkComparisons()) {
            assertTrue(comparison.overallChange() <= 0.0);
        }
        assertEquals(2, benchmarks.history("phase-a-validation", 10).size());

        assertTrue(report.comparisons().stream()
                .anyMatch(comparison -> comparison.metric() == Metric.BUILD_TIME));
        assertTrue(report.trends().stream().anyMatch(trend -> trend.metric() == Metric.BUILD_TIME));

        Recommendation first = report.recommendations().get(0);
        assertEquals("Resolve Build Time Regression", first.title());
        assertEquals(RecommendationPriority.CRITICAL, first.priority());

        List<String> messages = logOutput.toString().lines()
                .map(Document::parse)
                .map(line -> line.getString("message"))
                .toList();
        assertTrue(messages.contains("snapshot recorded"));
        assertTrue(messages.contains("benchmark scored"));
        assertTrue(messages.contains("regressions detected"));
        assertEquals("report aggregated", messages.get(messages.size() - 1));
    }

    @Test
    void fromConfigPersistsHistoryAndBenchmarksUnderConfiguredPaths(@TempDir Path tempDir)
            throws IOException, URISyntaxException {
        Path thresholds = tempDir.resolve("thresholds.yaml");
        Files.writeString(thresholds, "buildTimeSeconds:\n  excellent: 5\n  good: 10\n  poor: 15\n");
        PipelineConfig config = PipelineConfig.fromArgs(new String[] {
            "--measurements=" + MeasurementBundleTest.measurementsFile(),
            "--history-file=" + tempDir.resolve("state/history.ndjson"),
            "--benchmark-dir=" + tempDir.resolve("state/benchmarks"),
            "--results-dir=" + tempDir.resolve("state/results"),
            "--thresholds=" + thresholds
        }, Map.of());
        SteppingClock clock = new SteppingClock(START);

        ValidationPipeline pipeline = ValidationPipeline.fromConfig(
                config, MeasurementBundle.load(config.measurementsFile()), JsonLinesLogger.noop(), clock);
        PipelineOutcome outcome = pipeline.execute(config.metadata());

        assertTrue(Files.exists(tempDir.resolve("state/history.ndjson")));
        assertTrue(Files.exists(tempDir.resolve("state/benchmarks/phase-a-validation.json")));
        assertEquals(List.of("developer-experience", "phase-a-validation"), pipeline.benchmarks().configNames());
        assertEquals(
                "Build time of 20s exceeds acceptable threshold of 15s",
                outcome.report().recommendations().get(0).description());

        clock.advance(Duration.ofHours(1));
        MetricHistory reloaded = new MetricHistory(
                new NdjsonSnapshotStorage(config.historyFile()), 100, clock);
        assertEquals(1, reloaded.size());
        assertEquals(20.0, reloaded.latest().orElseThrow().value(Metric.BUILD_TIME));
    }

    private static ValidationPipeline pipeline(
            MeasurementBundle bundle,
            MetricHistory history,
            BenchmarkEngine benchmarks,
            SteppingClock clock,
            JsonLinesLogger logger) {
        ValidationController controller = new ValidationController(
                bundle, logger, clock, null, ValidationController.DEFAULT_COMPONENT_TIMEOUT);
        return ValidationPipeline.builder(controller, history, benchmarks)
                .logger(logger)
                .clock(clock)
                .build();
    }
}
