package org.buildlens.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.Map;
import org.buildlens.analysis.RegressionDetector;
import org.buildlens.analysis.TrendAnalyzer;
import org.buildlens.model.SnapshotMetadata;
import org.buildlens.timeseries.MetricHistory;
import org.junit.jupiter.api.Test;

class PipelineConfigTest {
    @Test
    void defaultsApplyWhenOnlyMeasurementsAreGiven() {
        PipelineConfig config = PipelineConfig.fromArgs(new String[] {"--measurements=m.yaml"}, Map.of());

        assertEquals(Path.of("m.yaml"), config.measurementsFile());
        assertEquals(Path.of(".buildlens", "history.ndjson"), config.historyFile());
        assertEquals(Path.of(".buildlens", "benchmarks"), config.benchmarkDir());
        assertEquals(Path.of(".buildlens", "results"), config.resultsDir());
        assertEquals(Path.of("build", "reports", "buildlens"), config.outputDir());
        assertEquals(MetricHistory.DEFAULT_MAX_POINTS, config.maxPoints());
        assertEquals(TrendAnalyzer.DEFAULT_WINDOW_DAYS, config.trendDays());
        assertEquals(RegressionDetector.DEFAULT_BASELINE_DAYS, config.baselineDays());
        assertEquals(RegressionDetector.DEFAULT_RECENT_DAYS, config.recentDays());
        assertTrue(config.thresholdsFile().isEmpty());
        assertEquals(SnapshotMetadata.empty(), config.metadata());
        assertTrue(config.failOnStatus());
    }

    @Test
    void parsesEveryOption() {
        PipelineConfig config = PipelineConfig.fromArgs(new String[] {
            "--measurements=in/measurements.json",
            "--history-file=state/history.ndjson",
            "--max-points=20",
            "--benchmark-dir=state/benchmarks",
            "--results-dir=state/results",
            "--thresholds=thresholds.yaml",
            "--output-dir=out",
            "--trend-days=14",
            "--baseline-days=10",
            "--recent-days=2",
            "--commit=abc123",
            "--branch=main",
            "--version=1.4.0",
            "--environment=ci",
            "--triggered-by=nightly",
            "--no-fail-on-status"
        }, Map.of());

        assertEquals(Path.of("in", "measurements.json"), config.measurementsFile());
        assertEquals(Path.of("state", "history.ndjson"), config.historyFile());
        assertEquals(20, config.maxPoints());
        assertEquals(Path.of("state", "benchmarks"), config.benchmarkDir());
        assertEquals(Path.of("state", "results"), config.resultsDir());
        assertEquals(Path.of("thresholds.yaml"), config.thresholdsFile().orElseThrow());
        assertEquals(Path.of("out"), config.outputDir());
        assertEquals(14, config.trendDays());
        assertEquals(10, config.baselineDays());
        assertEquals(2, config.recentDays());
        assertEquals(new SnapshotMetadata("abc123", "main", "1.4.0", "ci", "nightly"), config.metadata());
        assertFalse(config.failOnStatus());
    }

    @Test
    void historyFileFallsBackToEnvironmentButFlagWins() {
        Map<String, String> env = Map.of("BUILDLENS_HISTORY_FILE", "/var/buildlens/history.ndjson");

        PipelineConfig fromEnv = PipelineConfig.fromArgs(new String[] {"--measurements=m.yaml"}, env);
        PipelineConfig fromFlag = PipelineConfig.fromArgs(
                new String[] {"--measurements=m.yaml", "--history-file=local.ndjson"}, env);

        assertEquals(Path.of("/var/buildlens/history.ndjson"), fromEnv.historyFile());
        assertEquals(Path.of("local.ndjson"), fromFlag.historyFile());
    }

    @Test
    void blankEnvironmentValueIsIgnored() {
        PipelineConfig config = PipelineConfig.fromArgs(
                new String[] {"--measurements=m.yaml"}, Map.of("BUILDLENS_HISTORY_FILE", "  "));

        assertEquals(Path.of(".buildlens", "history.ndjson"), config.historyFile());
    }

    @Test
    void rejectsInvalidArguments() {
        assertEquals("--measurements= is required", rejected());
        assertEquals("unknown option: --verbose", rejected("--measurements=m.yaml", "--verbose"));
        assertEquals("--commit= requires a value", rejected("--measurements=m.yaml", "--commit="));
        assertEquals("max-points must be an integer: many", rejected("--measurements=m.yaml", "--max-points=many"));
        assertEquals("maxPoints must be > 0", rejected("--measurements=m.yaml", "--max-points=0"));
        assertEquals("trendDays must be > 0", rejected("--measurements=m.yaml", "--trend-days=-1"));
        assertEquals(
                "recentDays must be <= baselineDays",
                rejected("--measurements=m.yaml", "--baseline-days=3", "--recent-days=5"));
    }

    private static String rejected(String... args) {
        IllegalArgumentException error = assertThrows(
                IllegalArgumentException.class, () -> PipelineConfig.fromArgs(args, Map.of()));
        return error.getMessage();
    }
}
