package org.buildlens.report;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.buildlens.analysis.PerformanceComparison;
import org.buildlens.analysis.Regression;
import org.buildlens.analysis.Trend;
import org.buildlens.benchmark.BenchmarkComparison;
import org.buildlens.benchmark.BenchmarkResult;
import org.buildlens.model.Metric;
import org.buildlens.model.Recommendation;
import org.buildlens.model.RecommendationPriority;
import org.buildlens.model.ValidationComponent;
import org.buildlens.model.ValidationIssue;
import org.buildlens.obs.JsonEncoder;

/**
 * Renders validation reports as CI-friendly markdown and JSON artifacts.
 */
public final class ReportArtifactRenderer {
    public static final String JSON_FILE_NAME = "buildlens-report.json";
    public static final String MARKDOWN_FILE_NAME = "buildlens-report.md";

    public String toMarkdown(ValidationReport report) {
        Objects.requireNonNull(report, "report");
        ReportSummary summary = report.summary();
        StringBuilder sb = new StringBuilder();
        sb.append("# Build Validation Report\n\n");
        sb.append("- generatedAt: ").append(report.generatedAt()).append('\n');
        sb.append("- status: ").append(summary.overallStatus().name()).append('\n');
        sb.append("- validations: ")
                .append(summary.completedValidations())
                .append('/')
                .append(summary.totalValidations())
                .append('\n');
        sb.append("- criticalIssues: ").append(summary.criticalIssues()).append('\n');
        sb.append("- buildTimeImprovement: ").append(percent(summary.buildTimeImprovement())).append('\n');
        sb.append("- bundleSizeReduction: ").append(percent(summary.bundleSizeReduction())).append("\n\n");

        if (!report.metricCards().isEmpty()) {
            sb.append("## Metrics\n\n");
            sb.append("| Metric | Value | Status |\n");
            sb.append("|---|---:|---|\n");
            for (MetricCard card : report.metricCards()) {
                sb.append("| ")
                        .append(card.title())
                        .append(" | ")
                        .append(formatOne(card.value()))
                        .append(card.unit())
                        .append(" | ")
                        .append(card.status().key())
                        .append(" |\n");
            }
            sb.append('\n');
        }

        List<ValidationIssue> issues = report.result().issues();
        if (!issues.isEmpty()) {
            sb.append("## Issues\n\n");
            for (ValidationIssue issue : issues) {
                sb.append("- ")
                        .append(issue.severity())
                        .append(' ')
                        .append(issue.type())
                        .append(issue.component() == null ? "" : " [" + issue.component() + "]")
                        .append(": ")
                        .append(issue.message())
                        .append('\n');
            }
            sb.append('\n');
        }

        if (!report.regressions().isEmpty()) {
            sb.append("## Regressions\n\n");
            for (Regression regression : report.regressions()) {
                sb.append("- ")
                        .append(regression.metric().key())
                        .append(": ")
                        .append(regression.severity().name())
                        .append(' ')
                        .append(formatOne(regression.baselineValue()))
                        .append(" -> ")
                        .append(formatOne(regression.currentValue()))
                        .append(" (")
                        .append(percent(regression.regressionPercentage()))
                        .append(")\n");
            }
            sb.append('\n');
        }

        if (!report.trends().isEmpty()) {
            sb.append("## Trends\n\n");
            sb.append("| Metric | Direction | Change/day | Confidence | Significance |\n");
            sb.append("|---|---|---:|---:|---|\n");
            for (Trend trend : report.trends()) {
                sb.append("| ")
                        .append(trend.metric().key())
                        .append(" | ")
                        .append(trend.direction().name())
                        .append(" | ")
                        .append(String.format(Locale.ROOT, "%.3f", trend.changeRatePerDay()))
                        .append(" | ")
                        .append(String.format(Locale.ROOT, "%.2f", trend.confidence()))
                        .append(" | ")
                        .append(trend.significance().name())
                        .append(" |\n");
            }
            sb.append('\n');
        }

        if (!report.comparisons().isEmpty()) {
            sb.append("## Comparisons\n\n");
            sb.append("| Metric | Current | Baseline | Target | Progress | Status |\n");
            sb.append("|---|---:|---:|---:|---:|---|\n");
            for (PerformanceComparison comparison : report.comparisons()) {
                sb.append("| ")
                        .append(comparison.metric().key())
                        .append(" | ")
                        .append(formatOne(comparison.current()))
                        .append(" | ")
                        .append(formatOne(comparison.baseline()))
                        .append(" | ")
                        .append(formatOne(comparison.target()))
                        .append(" | ")
                        .append(percent(comparison.targetProgress()))
                        .append(" | ")
                        .append(comparison.status().name())
                        .append(" |\n");
            }
            sb.append('\n');
        }

        if (!report.benchmarkResults().isEmpty()) {
            sb.append("## Benchmarks\n\n");
            for (BenchmarkResult result : report.benchmarkResults()) {
                sb.append("- ")
                        .append(result.configName())
                        .append(": ")
                        .append(formatOne(result.overallScore()))
                        .append("/100 grade ")
                        .append(result.grade())
                        .append(result.passed() ? " PASSED" : " FAILED")
                        .append('\n');
            }
            for (BenchmarkComparison comparison : report.benchmarkComparisons()) {
                sb.append("- ").append(comparison.summary()).append('\n');
            }
            sb.append('\n');
        }

        sb.append("## Recommendations\n");
        if (report.recommendations().isEmpty()) {
            sb.append("\n- none\n");
        }
        for (Map.Entry<RecommendationPriority, List<Recommendation>> group : report.recommendationsByPriority().entrySet()) {
            sb.append("\n### ").append(group.getKey().key()).append("\n\n");
            for (Recommendation recommendation : group.getValue()) {
                sb.append("- **")
                        .append(recommendation.title())
                        .append("** (")
                        .append(recommendation.category().key())
                        .append(", effort ")
                        .append(recommendation.effort().key())
                        .append("): ")
                        .append(recommendation.description())
                        .append('\n');
            }
        }

        sb.append("\n## Next Steps\n\n");
        for (String step : summary.nextSteps()) {
            sb.append("- ").append(step).append('\n');
        }
        return sb.toString();
    }

    public String toJson(ValidationReport report) {
        Objects.requireNonNull(report, "report");
        ReportSummary summary = report.summary();
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("generatedAt", report.generatedAt());
        root.put("timestamp", report.result().timestamp());
        root.put("status", summary.overallStatus().key());

        Map<String, Object> summaryFields = new LinkedHashMap<>();
        summaryFields.put("completedValidations", summary.completedValidations());
        summaryFields.put("totalValidations", summary.totalValidations());
        summaryFields.put("criticalIssues", summary.criticalIssues());
        summaryFields.put("buildTimeImprovement", summary.buildTimeImprovement());
        summaryFields.put("bundleSizeReduction", summary.bundleSizeReduction());
        summaryFields.put("nextSteps", summary.nextSteps());
        root.put("summary", summaryFields);

        List<Map<String, Object>> cards = new ArrayList<>();
        for (MetricCard card : report.metricCards()) {
            Map<String, Object> fields = new LinkedHashMap<>();
            fields.put("id", card.id());
            fields.put("title", card.title());
            fields.put("value", card.value());
            fields.put("unit", card.unit());
            fields.put("status", card.status().key());
            cards.add(fields);
        }
        root.put("metricCards", cards);

        List<Map<String, Object>> issues = new ArrayList<>();
        for (ValidationIssue issue : report.result().issues()) {
            Map<String, Object> fields = new LinkedHashMap<>();
            fields.put("type", issue.type());
            fields.put("severity", issue.severity());
            fields.put("phase", issue.phase() == null ? null : issue.phase().key());
            fields.put("component", issue.component());
            fields.put("message", issue.message());
            fields.put("affectedPackages", issue.affectedPackages());
            fields.put("suggestions", issue.suggestions());
            fields.put("timestamp", issue.timestamp());
            issues.add(fields);
        }
        root.put("issues", issues);
        root.put(
                "substitutedComponents",
                report.result().substitutedComponents().stream()
                        .sorted()
                        .map(ValidationComponent::key)
                        .toList());

        List<Map<String, Object>> trends = new ArrayList<>();
        for (Trend trend : report.trends()) {
            Map<String, Object> fields = new LinkedHashMap<>();
            fields.put("metric", trend.metric().key());
            fields.put("direction", trend.direction());
            fields.put("changeRate", trend.changeRatePerDay());
            fields.put("confidence", trend.confidence());
            fields.put("dataPoints", trend.dataPoints());
            fields.put("significance", trend.significance());
            fields.put("timeframe", trend.timeframe());
            trends.add(fields);
        }
        root.put("trends", trends);

        List<Map<String, Object>> regressions = new ArrayList<>();
        for (Regression regression : report.regressions()) {
            Map<String, Object> fields = new LinkedHashMap<>();
            fields.put("metric", regression.metric().key());
            fields.put("baselineValue", regression.baselineValue());
            fields.put("currentValue", regression.currentValue());
            fields.put("regressionPercentage", regression.regressionPercentage());
            fields.put("severity", regression.severity());
            fields.put("detectedAt", regression.detectedAt());
            fields.put("possibleCauses", regression.possibleCauses());
            fields.put("recommendations", regression.recommendations());
            regressions.add(fields);
        }
        root.put("regressions", regressions);

        List<Map<String, Object>> comparisons = new ArrayList<>();
        for (PerformanceComparison comparison : report.comparisons()) {
            Map<String, Object> fields = new LinkedHashMap<>();
            fields.put("metric", comparison.metric().key());
            fields.put("current", comparison.current());
            fields.put("previous", comparison.previous());
            fields.put("baseline", comparison.baseline());
            fields.put("target", comparison.target());
            fields.put("changeFromPrevious", comparison.changeFromPrevious());
            fields.put("changeFromBaseline", comparison.changeFromBaseline());
            fields.put("targetProgress", comparison.targetProgress());
            fields.put("status", comparison.status());
            comparisons.add(fields);
        }
        root.put("comparisons", comparisons);

        List<Map<String, Object>> benchmarks = new ArrayList<>();
        for (BenchmarkResult result : report.benchmarkResults()) {
            Map<String, Object> fields = new LinkedHashMap<>();
            fields.put("id", result.id());
            fields.put("configName", result.configName());
            fields.put("timestamp", result.timestamp());
            fields.put("overallScore", result.overallScore());
            fields.put("grade", result.grade());
            fields.put("passed", result.passed());
            fields.put("scores", byMetricKey(result.scores()));
            benchmarks.add(fields);
        }
        root.put("benchmarks", benchmarks);

        List<Map<String, Object>> benchmarkComparisons = new ArrayList<>();
        for (BenchmarkComparison comparison : report.benchmarkComparisons()) {
            Map<String, Object> fields = new LinkedHashMap<>();
            fields.put("baselineId", comparison.baseline().id());
            fields.put("currentId", comparison.current().id());
            fields.put("improvements", byMetricKey(comparison.improvements()));
            fields.put("regressions", byMetricKey(comparison.regressions()));
            fields.put("overallChange", comparison.overallChange());
            fields.put("summary", comparison.summary());
            benchmarkComparisons.add(fields);
        }
        root.put("benchmarkComparisons", benchmarkComparisons);

        List<Map<String, Object>> recommendations = new ArrayList<>();
        for (Recommendation recommendation : report.recommendations()) {
            Map<String, Object> fields = new LinkedHashMap<>();
            fields.put("category", recommendation.category().key());
            fields.put("priority", recommendation.priority().key());
            fields.put("title", recommendation.title());
            fields.put("description", recommendation.description());
            fields.put("impact", recommendation.impact());
            fields.put("effort", recommendation.effort().key());
            fields.put("steps", recommendation.steps());
            fields.put("affectedPackages", recommendation.affectedPackages());
            recommendations.add(fields);
        }
        root.put("recommendations", recommendations);
        return JsonEncoder.encode(root);
    }

    /**
     * Writes both artifacts into {@code outputDir}, creating it when missing.
     *
     * @return the JSON path followed by the markdown path
     */
    public List<Path> writeArtifacts(ValidationReport report, Path outputDir) {
        Objects.requireNonNull(report, "report");
        Objects.requireNonNull(outputDir, "outputDir");
        Path normalized = outputDir.toAbsolutePath().normalize();
        Path jsonPath = normalized.resolve(JSON_FILE_NAME);
        Path markdownPath = normalized.resolve(MARKDOWN_FILE_NAME);
        try {
            Files.createDirectories(normalized);
            Files.writeString(jsonPath, toJson(report), StandardCharsets.UTF_8);
            Files.writeString(markdownPath, toMarkdown(report), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("failed to write report artifacts: " + normalized, e);
        }
        return List.of(jsonPath, markdownPath);
    }

    private static Map<String, Double> byMetricKey(Map<Metric, Double> values) {
        Map<String, Double> byKey = new LinkedHashMap<>();
        for (Metric metric : Metric.values()) {
            Double value = values.get(metric);
            if (value != null) {
                byKey.put(metric.key(), value);
            }
        }
        return byKey;
    }

    private static String percent(double value) {
        return String.format(Locale.ROOT, "%.1f%%", value);
    }

    private static String formatOne(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }
}
