package org.buildlens.pipeline;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.buildlens.analysis.RegressionDetector;
import org.buildlens.analysis.TrendAnalyzer;
import org.buildlens.model.SnapshotMetadata;
import org.buildlens.timeseries.MetricHistory;

/**
 * Settings of one pipeline invocation, parsed from {@code --key=value} arguments.
 */
public final class PipelineConfig {
    static final Path DEFAULT_OUTPUT_DIR = Path.of("build", "reports", "buildlens");
    static final Path DEFAULT_HISTORY_FILE = Path.of(".buildlens", "history.ndjson");
    static final Path DEFAULT_BENCHMARK_DIR = Path.of(".buildlens", "benchmarks");
    static final Path DEFAULT_RESULTS_DIR = Path.of(".buildlens", "results");
    static final String HISTORY_FILE_ENV = "BUILDLENS_HISTORY_FILE";

    private final Path measurementsFile;
    private final Path historyFile;
    private final int maxPoints;
    private final Path benchmarkDir;
    private final Path resultsDir;
    private final Path thresholdsFile;
    private final Path outputDir;
    private final int trendDays;
    private final int baselineDays;
    private final int recentDays;
    private final SnapshotMetadata metadata;
    private final boolean failOnStatus;

    private PipelineConfig(Builder builder) {
        this.measurementsFile = Objects.requireNonNull(builder.measurementsFile, "measurementsFile").normalize();
        this.historyFile = Objects.requireNonNull(builder.historyFile, "historyFile").normalize();
        this.benchmarkDir = Objects.requireNonNull(builder.benchmarkDir, "benchmarkDir").normalize();
        this.resultsDir = Objects.requireNonNull(builder.resultsDir, "resultsDir").normalize();
        this.thresholdsFile = builder.thresholdsFile == null ? null : builder.thresholdsFile.normalize();
        this.outputDir = Objects.requireNonNull(builder.outputDir, "outputDir").normalize();
        if (builder.maxPoints <= 0) {
            throw new IllegalArgumentException("maxPoints must be > 0");
        }
        if (builder.trendDays <= 0) {
            throw new IllegalArgumentException("trendDays must be > 0");
        }
        if (builder.baselineDays <= 0) {
            throw new IllegalArgumentException("baselineDays must be > 0");
        }
        if (builder.recentDays <= 0) {
            throw new IllegalArgumentException("recentDays must be > 0");
        }
        if (builder.recentDays > builder.baselineDays) {
            throw new IllegalArgumentException("recentDays must be <= baselineDays");
        }
        this.maxPoints = builder.maxPoints;
        this.trendDays = builder.trendDays;
        this.baselineDays = builder.baselineDays;
        this.recentDays = builder.recentDays;
        this.metadata = new SnapshotMetadata(
                builder.commit, builder.branch, builder.version, builder.environment, builder.triggeredBy);
        this.failOnStatus = builder.failOnStatus;
    }

    public static Builder builder(Path measurementsFile) {
        return new Builder(measurementsFile);
    }

    public static PipelineConfig fromArgs(String[] args) {
        return fromArgs(args, System.getenv());
    }

    static PipelineConfig fromArgs(String[] args, Map<String, String> environment) {
        Path measurements = null;
        Builder builder = new Builder(null);
        String historyFromEnv = environment.get(HISTORY_FILE_ENV);
        if (historyFromEnv != null && !historyFromEnv.isBlank()) {
            builder.historyFile(Path.of(historyFromEnv.trim()));
        }

        for (String arg : args) {
            if (arg == null || arg.isBlank()) {
                continue;
            }
            if (arg.startsWith("--measurements=")) {
                measurements = Path.of(readValue(arg, "--measurements="));
                continue;
            }
            if (arg.startsWith("--history-file=")) {
                builder.historyFile(Path.of(readValue(arg, "--history-file=")));
                continue;
            }
            if (arg.startsWith("--max-points=")) {
                builder.maxPoints(parseInt(readValue(arg, "--max-points="), "max-points"));
                continue;
            }
            if (arg.startsWith("--benchmark-dir=")) {
                builder.benchmarkDir(Path.of(readValue(arg, "--benchmark-dir=")));
                continue;
            }
            if (arg.startsWith("--results-dir=")) {
                builder.resultsDir(Path.of(readValue(arg, "--results-dir=")));
                continue;
            }
            if (arg.startsWith("--thresholds=")) {
                builder.thresholdsFile(Path.of(readValue(arg, "--thresholds=")));
                continue;
            }
            if (arg.startsWith("--output-dir=")) {
                builder.outputDir(Path.of(readValue(arg, "--output-dir=")));
                continue;
            }
            if (arg.startsWith("--trend-days=")) {
                builder.trendDays(parseInt(readValue(arg, "--trend-days="), "trend-days"));
                continue;
            }
            if (arg.startsWith("--baseline-days=")) {
                builder.baselineDays(parseInt(readValue(arg, "--baseline-days="), "baseline-days"));
                continue;
            }
            if (arg.startsWith("--recent-days=")) {
                builder.recentDays(parseInt(readValue(arg, "--recent-days="), "recent-days"));
                continue;
            }
            if (arg.startsWith("--commit=")) {
                builder.commit(readValue(arg, "--commit="));
                continue;
            }
            if (arg.startsWith("--branch=")) {
                builder.branch(readValue(arg, "--branch="));
                continue;
            }
            if (arg.startsWith("--version=")) {
                builder.version(readValue(arg, "--version="));
                continue;
            }
            if (arg.startsWith("--environment=")) {
                builder.environment(readValue(arg, "--environment="));
                continue;
            }
            if (arg.startsWith("--triggered-by=")) {
                builder.triggeredBy(readValue(arg, "--triggered-by="));
                continue;
            }
            if ("--fail-on-status".equals(arg)) {
                builder.failOnStatus(true);
                continue;
            }
            if ("--no-fail-on-status".equals(arg)) {
                builder.failOnStatus(false);
                continue;
            }
            throw new IllegalArgumentException("unknown option: " + arg);
        }

        if (measurements == null) {
            throw new IllegalArgumentException("--measurements= is required");
        }
        builder.measurementsFile = measurements;
        return builder.build();
    }

    public Path measurementsFile() {
        return measurementsFile;
    }

    public Path historyFile() {
        return historyFile;
    }

    public int maxPoints() {
        return maxPoints;
    }

    public Path benchmarkDir() {
        return benchmarkDir;
    }

    public Path resultsDir() {
        return resultsDir;
    }

    public Optional<Path> thresholdsFile() {
        return Optional.ofNullable(thresholdsFile);
    }

    public Path outputDir() {
        return outputDir;
    }

    public int trendDays() {
        return trendDays;
    }

    public int baselineDays() {
        return baselineDays;
    }

    public int recentDays() {
        return recentDays;
    }

    public SnapshotMetadata metadata() {
        return metadata;
    }

    public boolean failOnStatus() {
        return failOnStatus;
    }

    private static String readValue(String arg, String prefix) {
        String value = arg.substring(prefix.length()).trim();
        if (value.isEmpty()) {
            throw new IllegalArgumentException(prefix + " requires a value");
        }
        return value;
    }

    private static int parseInt(String value, String optionName) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException exception) {
            throw new IllegalArgumentException(optionName + " must be an integer: " + value);
        }
    }

    public static final class Builder {
        private Path measurementsFile;
        private Path historyFile = DEFAULT_HISTORY_FILE;
        private int maxPoints = MetricHistory.DEFAULT_MAX_POINTS;
        private Path benchmarkDir = DEFAULT_BENCHMARK_DIR;
        private Path resultsDir = DEFAULT_RESULTS_DIR;
        private Path thresholdsFile;
        private Path outputDir = DEFAULT_OUTPUT_DIR;
        private int trendDays = TrendAnalyzer.DEFAULT_WINDOW_DAYS;
        private int baselineDays = RegressionDetector.DEFAULT_BASELINE_DAYS;
        private int recentDays = RegressionDetector.DEFAULT_RECENT_DAYS;
        private String commit;
        private String branch;
        private String version;
        private String environment;
        private String triggeredBy;
        private boolean failOnStatus = true;

        private Builder(Path measurementsFile) {
            this.measurementsFile = measurementsFile;
        }

        public Builder historyFile(Path value) {
            this.historyFile = value;
            return this;
        }

        public Builder maxPoints(int value) {
            this.maxPoints = value;
            return this;
        }

        public Builder benchmarkDir(Path value) {
            this.benchmarkDir = value;
            return this;
        }

        public Builder resultsDir(Path value) {
            this.resultsDir = value;
            return this;
        }

        public Builder thresholdsFile(Path value) {
            this.thresholdsFile = value;
            return this;
        }

        public Builder outputDir(Path value) {
            this.outputDir = value;
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

        public Builder commit(String value) {
            this.commit = value;
            return this;
        }

        public Builder branch(String value) {
            this.branch = value;
            return this;
        }

        public Builder version(String value) {
            this.version = value;
            return this;
        }

        public Builder environment(String value) {
            this.environment = value;
            return this;
        }

        public Builder triggeredBy(String value) {
            this.triggeredBy = value;
            return this;
        }

        public Builder failOnStatus(boolean value) {
            this.failOnStatus = value;
            return this;
        }

        public PipelineConfig build() {
            return new PipelineConfig(this);
        }
    }
}
