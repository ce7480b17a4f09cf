package org.buildlens.benchmark;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.buildlens.model.Metric;
import org.buildlens.model.MetricSnapshot;
import org.buildlens.model.SnapshotMetadata;

/**
 * Scores snapshots against named benchmark configs, keeps their history and compares results.
 */
public final class BenchmarkEngine {
    public static final int DEFAULT_HISTORY_LIMIT = 50;
    static final double NEUTRAL_SCORE = 50.0;
    static final double SIGNIFICANT_CHANGE_PERCENT = 1.0;
    static final double SIGNIFICANT_SCORE_CHANGE = 5.0;
    private static final int REPORT_HISTORY_LIMIT = 10;
    private static final int REPORT_TREND_ROWS = 5;

    private final BenchmarkConfigRepository configs;
    private final BenchmarkResultRepository results;
    private final Clock clock;

    public BenchmarkEngine(BenchmarkConfigRepository configs, BenchmarkResultRepository results) {
        this(configs, results, Clock.systemUTC());
    }

    public BenchmarkEngine(BenchmarkConfigRepository configs, BenchmarkResultRepository results, Clock clock) {
        this.configs = Objects.requireNonNull(configs, "configs");
        this.results = Objects.requireNonNull(results, "results");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public static BenchmarkEngine inMemory(Clock clock) {
        return new BenchmarkEngine(new InMemoryBenchmarkConfigRepository(), new InMemoryBenchmarkResultRepository(), clock);
    }

    public void createConfig(BenchmarkConfig config) {
        configs.save(Objects.requireNonNull(config, "config"));
    }

    public BenchmarkConfig config(String name) {
        return configs.find(name)
                .orElseThrow(() -> new NotFoundException("benchmark config '" + name + "' not found", name));
    }

    public List<String> configNames() {
        return configs.names();
    }

    /**
     * Saves every bundled default config whose name is not already taken.
     */
    public void installDefaultConfigs() {
        for (BenchmarkConfig config : BenchmarkConfigs.defaults()) {
            if (configs.find(config.name()).isEmpty()) {
                configs.save(config);
            }
        }
    }

    public BenchmarkScore score(BenchmarkConfig config, MetricSnapshot snapshot) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(snapshot, "snapshot");
        Map<Metric, Double> values = new EnumMap<>(Metric.class);
        Map<Metric, Double> scores = new EnumMap<>(Metric.class);
        double total = 0.0;
        for (Metric metric : config.metrics()) {
            double value = snapshot.value(metric);
            double score = scoreMetric(metric, value, config);
            values.put(metric, value);
            scores.put(metric, score);
            total += score;
        }
        double overall = total / config.metrics().size();
        return new BenchmarkScore(values, scores, overall, Grade.of(overall), passed(values, config));
    }

    /**
     * Scores the snapshot against the named config and appends the result to its history.
     *
     * @throws NotFoundException if the config does not exist
     */
    public BenchmarkResult run(String configName, MetricSnapshot snapshot, SnapshotMetadata metadata) {
        BenchmarkConfig config = config(configName);
        BenchmarkScore score = score(config, snapshot);
        Instant timestamp = Instant.now(clock);

        Map<String, String> resultMetadata = new LinkedHashMap<>();
        if (metadata != null) {
            resultMetadata.putAll(metadata.asMap());
        }
        config.environment().ifPresent(value -> resultMetadata.put("environment", value));
        config.version().ifPresent(value -> resultMetadata.put("version", value));

        BenchmarkResult result = new BenchmarkResult(
                nextId(config.name(), timestamp),
                config.name(),
                timestamp,
                score.results(),
                score.scores(),
                score.overallScore(),
                score.grade(),
                score.passed(),
                resultMetadata);
        results.save(result);
        return result;
    }

    public BenchmarkResult result(String id) {
        return results.find(id)
                .orElseThrow(() -> new NotFoundException("benchmark result '" + id + "' not found", id));
    }

    /**
     * @throws NotFoundException if either result is missing
     * @throws ConfigMismatchException if the results were produced by different configs
     */
    public BenchmarkComparison compare(String baselineId, String currentId) {
        BenchmarkResult baseline = result(baselineId);
        BenchmarkResult current = result(currentId);
        if (!baseline.configName().equals(current.configName())) {
            throw new ConfigMismatchException(baseline.configName(), current.configName());
        }

        Map<Metric, Double> improvements = new EnumMap<>(Metric.class);
        Map<Metric, Double> regressions = new EnumMap<>(Metric.class);
        for (Metric metric : Metric.values()) {
            Double baselineValue = baseline.results().get(metric);
            Double currentValue = current.results().get(metric);
            if (baselineValue == null || currentValue == null || baselineValue == 0.0) {
                continue;
            }
            double change = (currentValue - baselineValue) * 100.0 / baselineValue;
            if (Math.abs(change) <= SIGNIFICANT_CHANGE_PERCENT) {
                continue;
            }
            if (metric.polarity().isImprovement(change)) {
                improvements.put(metric, Math.abs(change));
            } else {
                regressions.put(metric, Math.abs(change));
            }
        }
        double overallChange = current.overallScore() - baseline.overallScore();
        return new BenchmarkComparison(
                baseline, current, improvements, regressions, overallChange,
                summarize(improvements, regressions, overallChange));
    }

    /**
     * Latest {@code limit} results of a config, newest first.
     */
    public List<BenchmarkResult> history(String configName, int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be >= 1");
        }
        List<BenchmarkResult> all = new ArrayList<>(results.history(configName));
        all.sort(Comparator.comparing(BenchmarkResult::timestamp).reversed());
        return List.copyOf(all.subList(0, Math.min(limit, all.size())));
    }

    /**
     * Markdown report of the latest result of a config with its recent history and thresholds.
     *
     * @throws NotFoundException if the config does not exist or has no results
     */
    public String renderReport(String configName) {
        BenchmarkConfig config = config(configName);
        List<BenchmarkResult> recent = history(configName, REPORT_HISTORY_LIMIT);
        if (recent.isEmpty()) {
            throw new NotFoundException("no benchmark results found for '" + configName + "'", configName);
        }
        return renderMarkdown(config, recent, Instant.now(clock));
    }

    public Path writeReport(String configName, Path outputDir) {
        Objects.requireNonNull(outputDir, "outputDir");
        String markdown = renderReport(configName);
        Path normalized = outputDir.toAbsolutePath().normalize();
        Path target = normalized.resolve(configName + "-report.md");
        try {
            Files.createDirectories(normalized);
            Files.writeString(target, markdown, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("failed to write benchmark report: " + target, e);
        }
        return target;
    }

    static double scoreMetric(Metric metric, double value, BenchmarkConfig config) {
        if (!config.hasThresholds(metric)) {
            return NEUTRAL_SCORE;
        }
        double excellent = config.thresholds(ThresholdTier.EXCELLENT).get(metric);
        double good = config.thresholds(ThresholdTier.GOOD).get(metric);
        double poor = config.thresholds(ThresholdTier.POOR).get(metric);
        if (metric.lowerIsBetter()) {
            if (value <= excellent) {
                return ThresholdTier.EXCELLENT.score();
            }
            if (value <= good) {
                return ThresholdTier.GOOD.score();
            }
            if (value <= poor) {
                return ThresholdTier.POOR.score();
            }
            return decay(value - poor, poor);
        }
        if (value >= excellent) {
            return ThresholdTier.EXCELLENT.score();
        }
        if (value >= good) {
            return ThresholdTier.GOOD.score();
        }
        if (value >= poor) {
            return ThresholdTier.POOR.score();
        }
        return decay(poor - value, poor);
    }

    // Past the poor threshold the score loses 30 points per poor-threshold distance, floored at 0.
    private static double decay(double distance, double poor) {
        if (poor == 0.0) {
            return 0.0;
        }
        return Math.max(0.0, ThresholdTier.POOR.score() - (distance / poor) * 30.0);
    }

    static boolean passed(Map<Metric, Double> values, BenchmarkConfig config) {
        for (Metric metric : config.metrics()) {
            Double target = config.targets().get(metric);
            if (target == null) {
                continue;
            }
            double value = values.get(metric);
            if (metric.lowerIsBetter() ? value > target : value < target) {
                return false;
            }
        }
        return true;
    }

    static String summarize(Map<Metric, Double> improvements, Map<Metric, Double> regressions, double overallChange) {
        if (improvements.isEmpty() && regressions.isEmpty()) {
            return "No significant changes detected";
        }
        StringBuilder summary = new StringBuilder();
        if (overallChange > SIGNIFICANT_SCORE_CHANGE) {
            summary.append("Overall performance improved significantly.");
        } else if (overallChange < -SIGNIFICANT_SCORE_CHANGE) {
            summary.append("Overall performance degraded significantly.");
        } else {
            summary.append("Overall performance remained stable.");
        }
        if (!improvements.isEmpty()) {
            Map.Entry<Metric, Double> best = largest(improvements);
            summary.append(" Best improvement: ")
                    .append(best.getKey().key())
                    .append(" (+")
                    .append(formatOne(best.getValue()))
                    .append("%).");
        }
        if (!regressions.isEmpty()) {
            Map.Entry<Metric, Double> worst = largest(regressions);
            summary.append(" Biggest regression: ")
                    .append(worst.getKey().key())
                    .append(" (-")
                    .append(formatOne(worst.getValue()))
                    .append("%).");
        }
        return summary.toString();
    }

    private static Map.Entry<Metric, Double> largest(Map<Metric, Double> changes) {
        Map.Entry<Metric, Double> largest = null;
        for (Map.Entry<Metric, Double> entry : changes.entrySet()) {
            if (largest == null || entry.getValue() > largest.getValue()) {
                largest = entry;
            }
        }
        return largest;
    }

    private String nextId(String configName, Instant timestamp) {
        String base = configName + "/" + timestamp.toString().replace(':', '-').replace('.', '-');
        String candidate = base;
        int suffix = 2;
        while (results.exists(candidate)) {
            candidate = base + "-" + suffix++;
        }
        return candidate;
    }

    private static String renderMarkdown(BenchmarkConfig config, List<BenchmarkResult> recent, Instant generatedAt) {
        BenchmarkResult latest = recent.get(0);
        String trend = "flat";
        if (recent.size() > 1) {
            double delta = latest.overallScore() - recent.get(1).overallScore();
            trend = delta > 0 ? "up" : delta < 0 ? "down" : "flat";
        }

        StringBuilder sb = new StringBuilder();
        sb.append("# ").append(config.name()).append(" Benchmark Report\n\n");
        sb.append("## Overview\n\n");
        sb.append("- description: ").append(config.description()).append('\n');
        sb.append("- latestScore: ").append(formatOne(latest.overallScore()))
                .append("/100 (grade ").append(latest.grade()).append(", trend ").append(trend).append(")\n");
        sb.append("- status: ").append(latest.passed() ? "PASSED" : "FAILED").append('\n');
        sb.append("- timestamp: ").append(latest.timestamp()).append("\n\n");

        sb.append("## Metrics\n\n");
        sb.append("| Metric | Current | Target | Score | Status |\n");
        sb.append("|---|---:|---:|---:|---|\n");
        for (Metric metric : config.metrics()) {
            double value = latest.results().getOrDefault(metric, 0.0);
            Double target = config.targets().get(metric);
            String status = "n/a";
            if (target != null) {
                boolean met = metric.lowerIsBetter() ? value <= target : value >= target;
                status = met ? "met" : "missed";
            }
            sb.append("| ")
                    .append(metric.key())
                    .append(" | ")
                    .append(String.format(Locale.ROOT, "%.2f", value))
                    .append(" | ")
                    .append(target == null ? "-" : formatNumber(target))
                    .append(" | ")
                    .append(formatOne(latest.scores().getOrDefault(metric, 0.0)))
                    .append(" | ")
                    .append(status)
                    .append(" |\n");
        }

        sb.append("\n## Historical Trend\n\n");
        for (int i = 0; i < Math.min(REPORT_TREND_ROWS, recent.size()); i++) {
            BenchmarkResult result = recent.get(i);
            sb.append(i + 1)
                    .append(". ")
                    .append(result.timestamp().toString(), 0, 10)
                    .append(" - score ")
                    .append(formatOne(result.overallScore()))
                    .append(" (")
                    .append(result.grade())
                    .append(")\n");
        }

        sb.append("\n## Thresholds\n");
        for (ThresholdTier tier : ThresholdTier.values()) {
            sb.append("\n### ").append(tier.key()).append("\n\n");
            for (Metric metric : config.metrics()) {
                Double threshold = config.thresholds(tier).get(metric);
                if (threshold != null) {
                    sb.append("- ").append(metric.key()).append(": ").append(formatNumber(threshold)).append('\n');
                }
            }
        }
        sb.append("\n---\ngenerated: ").append(generatedAt).append('\n');
        return sb.toString();
    }

    private static String formatOne(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }

    private static String formatNumber(double value) {
        if (value == Math.rint(value)) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }
}
