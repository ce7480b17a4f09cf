package org.buildlens.pipeline;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.buildlens.analysis.PerformanceComparator;
import org.buildlens.analysis.PerformanceComparison;
import org.buildlens.analysis.Regression;
import org.buildlens.analysis.RegressionDetector;
import org.buildlens.analysis.Trend;
import org.buildlens.analysis.TrendAnalyzer;
import org.buildlens.benchmark.BenchmarkEngine;
import org.buildlens.benchmark.BenchmarkResult;
import org.buildlens.benchmark.ConfigMismatchException;
import org.buildlens.benchmark.DirectoryBenchmarkConfigRepository;
import org.buildlens.benchmark.DirectoryBenchmarkResultRepository;
import org.buildlens.controller.ValidationCheckers;
import org.buildlens.controller.ValidationController;
import org.buildlens.model.MetricSnapshot;
import org.buildlens.model.MetricSnapshots;
import org.buildlens.model.Recommendation;
import org.buildlens.model.SnapshotMetadata;
import org.buildlens.model.ValidationResult;
import org.buildlens.obs.CorrelationContext;
import org.buildlens.obs.JsonLinesLogger;
import org.buildlens.recommend.RecommendationEngine;
import org.buildlens.recommend.RecommendationThresholds;
import org.buildlens.report.ReportAggregator;
import org.buildlens.report.ReportInputs;
import org.buildlens.report.ValidationReport;
import org.buildlens.timeseries.MetricHistory;
import org.buildlens.timeseries.NdjsonSnapshotStorage;

/**
 * One end-to-end run: validate, record the snapshot, benchmark it, analyze the history and
 * aggregate everything into a report.
 */
public final class ValidationPipeline {
    private static final String OPERATION = "pipeline";

    private final ValidationController controller;
    private final MetricHistory history;
    private final BenchmarkEngine benchmarks;
    private final RecommendationEngine recommendations;
    private final ReportAggregator aggregator;
    private final JsonLinesLogger logger;
    private final Clock clock;
    private final int trendDays;
    private final int baselineDays;
    private final int recentDays;

    private ValidationPipeline(Builder builder) {
        this.controller = Objects.requireNonNull(builder.controller, "controller");
        this.history = Objects.requireNonNull(builder.history, "history");
        this.benchmarks = Objects.requireNonNull(builder.benchmarks, "benchmarks");
        this.recommendations = Objects.requireNonNull(builder.recommendations, "recommendations");
        this.logger = Objects.requireNonNull(builder.logger, "logger");
        this.clock = Objects.requireNonNull(builder.clock, "clock");
        this.aggregator = new ReportAggregator(clock);
        this.trendDays = builder.trendDays;
        this.baselineDays = builder.baselineDays;
        this.recentDays = builder.recentDays;
    }

    public static Builder builder(ValidationController controller, MetricHistory history, BenchmarkEngine benchmarks) {
        return new Builder(controller, history, benchmarks);
    }

    /**
     * Wires file-backed stores from the config; default benchmark configs are installed into an
     * empty benchmark directory.
     */
    public static ValidationPipeline fromConfig(
            PipelineConfig config, ValidationCheckers checkers, JsonLinesLogger logger, Clock clock) {
        Objects.requireNonNull(config, "config");
        ValidationController controller = new ValidationController(
                checkers, logger, clock, null, ValidationController.DEFAULT_COMPONENT_TIMEOUT);
        MetricHistory history = new MetricHistory(
                new NdjsonSnapshotStorage(config.historyFile()), config.maxPoints(), clock);
        BenchmarkEngine benchmarks = new BenchmarkEngine(
                new DirectoryBenchmarkConfigRepository(config.benchmarkDir()),
                new DirectoryBenchmarkResultRepository(config.resultsDir()),
                clock);
        benchmarks.installDefaultConfigs();
        RecommendationThresholds thresholds = config.thresholdsFile()
                .map(RecommendationThresholds::load)
                .orElseGet(RecommendationThresholds::defaults);
        return builder(controller, history, benchmarks)
                .recommendations(new RecommendationEngine(thresholds))
                .logger(logger)
                .clock(clock)
                .trendDays(config.trendDays())
                .baselineDays(config.baselineDays())
                .recentDays(config.recentDays())
                .build();
    }

    public MetricHistory history() {
        return history;
    }

    public BenchmarkEngine benchmarks() {
        return benchmarks;
    }

    public PipelineOutcome execute(SnapshotMetadata metadata) {
        SnapshotMetadata effective = metadata == null ? SnapshotMetadata.empty() : metadata;
        ValidationResult result = controller.run();
        CorrelationContext correlation = CorrelationContext.of(
                Long.toString(result.timestamp().toEpochMilli()), OPERATION);

        MetricSnapshot snapshot = MetricSnapshots.fromResult(result, effective);
        history.append(snapshot);
        logger.info("snapshot recorded", correlation, Map.of("historySize", history.size()));

        ReportInputs.Builder inputs = ReportInputs.builder(result);
        for (String configName : benchmarks.configNames()) {
            List<BenchmarkResult> previous = benchmarks.history(configName, 1);
            BenchmarkResult current = benchmarks.run(configName, snapshot, effective);
            inputs.benchmarkResult(current);
            if (!previous.isEmpty()) {
                try {
                    inputs.benchmarkComparison(benchmarks.compare(previous.get(0).id(), current.id()));
                } catch (ConfigMismatchException e) {
                    logger.warn("benchmark comparison skipped", correlation, Map.of(
                            "config", configName, "reason", String.valueOf(e.getMessage())));
                }
            }
            logger.info("benchmark scored", correlation, Map.of(
                    "config", configName,
                    "score", current.overallScore(),
                    "grade", current.grade().name()));
        }

        List<Trend> trends = new TrendAnalyzer(history, logger, correlation).analyze(trendDays);
        List<Regression> regressions = new RegressionDetector(history, clock).detect(baselineDays, recentDays);
        List<PerformanceComparison> comparisons = PerformanceComparator.compare(history.snapshots());
        List<Recommendation> generated = recommendations.generate(result, regressions, trends);
        if (!regressions.isEmpty()) {
            logger.warn("regressions detected", correlation, Map.of("count", regressions.size()));
        }

        ValidationReport report = aggregator.aggregate(inputs
                .trends(trends)
                .regressions(regressions)
                .comparisons(comparisons)
                .recommendations(generated)
                .build());
        logger.info("report aggregated", correlation, Map.of(
                "status", result.status().key(),
                "recommendations", report.recommendations().size()));
        return new PipelineOutcome(result, snapshot, report);
    }

    public static final class Builder {
        private final ValidationController controller;
        private final MetricHistory history;
        private final BenchmarkEngine benchmarks;
        private RecommendationEngine recommendations = new RecommendationEngine();
        private JsonLinesLogger logger = JsonLinesLogger.noop();
        private Clock clock = Clock.systemUTC();
        private int trendDays = TrendAnalyzer.DEFAULT_WINDOW_DAYS;
        private int baselineDays = RegressionDetector.DEFAULT_BASELINE_DAYS;
        private int recentDays = RegressionDetector.DEFAULT_RECENT_DAYS;

        private Builder(ValidationController controller, MetricHistory history, BenchmarkEngine benchmarks) {
            this.controller = controller;
            this.history = history;
            this.benchmarks = benchmarks;
        }

        public Builder recommendations(RecommendationEngine value) {
            this.recommendations = value;
            return this;
        }

        public Builder logger(JsonLinesLogger value) {
            this.logger = value;
            return this;
        }

        public Builder clock(Clock value) {
            this.clock = value;
            return this;
        }

        public Builder trendDays(int value) {
            this.trendDays = value;
            return this;
        }

        public Builder baselineDays(int value) {
            this.baselineDays = value;
            return this;
        }

        public Builder recentDays(int value) {
            this.recentDays = value;
            return this;
        }

        public ValidationPipeline build() {
            return new ValidationPipeline(this);
        }
    }
}
