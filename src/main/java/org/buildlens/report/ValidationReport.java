package org.buildlens.report;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.buildlens.analysis.PerformanceComparison;
import org.buildlens.analysis.Regression;
import org.buildlens.analysis.Trend;
import org.buildlens.benchmark.BenchmarkComparison;
import org.buildlens.benchmark.BenchmarkResult;
import org.buildlens.model.Recommendation;
import org.buildlens.model.RecommendationPriority;
import org.buildlens.model.ValidationResult;

/**
 * Aggregated report of one pipeline run.
 *
 * @param recommendations merged recommendations in canonical order
 * @param recommendationsByPriority the same recommendations grouped by priority, most urgent first
 */
public record ValidationReport(
        Instant generatedAt,
        ReportSummary summary,
        ValidationResult result,
        List<MetricCard> metricCards,
        List<Trend> trends,
        List<Regression> regressions,
        List<PerformanceComparison> comparisons,
        List<BenchmarkResult> benchmarkResults,
        List<BenchmarkComparison> benchmarkComparisons,
        List<Recommendation> recommendations,
        Map<RecommendationPriority, List<Recommendation>> recommendationsByPriority) {
    public ValidationReport {
        Objects.requireNonNull(generatedAt, "generatedAt");
        Objects.requireNonNull(summary, "summary");
        Objects.requireNonNull(result, "result");
        metricCards = List.copyOf(metricCards);
        trends = List.copyOf(trends);
        regressions = List.copyOf(regressions);
        comparisons = List.copyOf(comparisons);
        benchmarkResults = List.copyOf(benchmarkResults);
        benchmarkComparisons = List.copyOf(benchmarkComparisons);
        recommendations = List.copyOf(recommendations);
        Map<RecommendationPriority, List<Recommendation>> grouped = new LinkedHashMap<>();
        recommendationsByPriority.forEach((priority, values) -> grouped.put(priority, List.copyOf(values)));
        recommendationsByPriority = Collections.unmodifiableMap(grouped);
    }
}
