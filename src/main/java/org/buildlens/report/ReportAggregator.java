package org.buildlens.report;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.buildlens.model.IssueSeverity;
import org.buildlens.model.PerformanceAnalysis;
import org.buildlens.model.Recommendation;
import org.buildlens.model.RecommendationPriority;
import org.buildlens.model.SystemValidation;
import org.buildlens.model.ValidationComponent;
import org.buildlens.model.ValidationPhase;
import org.buildlens.model.ValidationResult;
import org.buildlens.recommend.RecommendationOrdering;

/**
 * Combines a validation result with analytics outputs into one {@link ValidationReport}.
 */
public final class ReportAggregator {
    private final Clock clock;

    public ReportAggregator() {
        this(Clock.systemUTC());
    }

    public ReportAggregator(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public ValidationReport aggregate(ReportInputs inputs) {
        Objects.requireNonNull(inputs, "inputs");
        ValidationResult result = inputs.result();
        List<Recommendation> recommendations = mergeRecommendations(result.recommendations(), inputs.recommendations());
        return new ValidationReport(
                clock.instant(),
                summarize(result),
                result,
                metricCards(result),
                inputs.trends(),
                inputs.regressions(),
                inputs.comparisons(),
                inputs.benchmarkResults(),
                inputs.benchmarkComparisons(),
                recommendations,
                groupByPriority(recommendations));
    }

    static ReportSummary summarize(ValidationResult result) {
        int completed = 0;
        for (ValidationPhase phase : ValidationPhase.values()) {
            boolean complete = ValidationComponent.of(phase).stream().noneMatch(result::isSubstituted);
            if (complete) {
                completed++;
            }
        }
        PerformanceAnalysis performance = result.performanceAnalysis();
        return new ReportSummary(
                result.status(),
                completed,
                ValidationPhase.values().length,
                result.countIssues(IssueSeverity.CRITICAL),
                performance.buildMetrics().improvementPercentage(),
                performance.bundleMetrics().reductionPercentage(),
                result.nextSteps());
    }

    /**
     * Keeps the first recommendation for each title, then applies the canonical order.
     */
    static List<Recommendation> mergeRecommendations(List<Recommendation> first, List<Recommendation> second) {
        Set<String> titles = new LinkedHashSet<>();
        List<Recommendation> merged = new ArrayList<>();
        for (List<Recommendation> source : List.of(first, second)) {
            for (Recommendation recommendation : source) {
                if (titles.add(recommendation.title())) {
                    merged.add(recommendation);
                }
            }
        }
        return RecommendationOrdering.sort(merged);
    }

    static Map<RecommendationPriority, List<Recommendation>> groupByPriority(List<Recommendation> recommendations) {
        Map<RecommendationPriority, List<Recommendation>> grouped = new LinkedHashMap<>();
        List<RecommendationPriority> priorities = new ArrayList<>(List.of(RecommendationPriority.values()));
        priorities.sort((left, right) -> Integer.compare(right.rank(), left.rank()));
        for (RecommendationPriority priority : priorities) {
            List<Recommendation> matching = recommendations.stream()
                    .filter(recommendation -> recommendation.priority() == priority)
                    .toList();
            if (!matching.isEmpty()) {
                grouped.put(priority, matching);
            }
        }
        return grouped;
    }

    /**
     * Dashboard cards for every section that holds a real measurement.
     */
    static List<MetricCard> metricCards(ValidationResult result) {
        List<MetricCard> cards = new ArrayList<>();
        PerformanceAnalysis performance = result.performanceAnalysis();
        if (!result.isSubstituted(ValidationComponent.BUILD_METRICS)) {
            PerformanceAnalysis.BuildMetrics build = performance.buildMetrics();
            cards.add(new MetricCard(
                    "build-time-improvement",
                    "Build Time Improvement",
                    build.improvementPercentage(),
                    "%",
                    CardStatus.of(build.improvementPercentage(), 30.0, 15.0)));
            cards.add(new MetricCard(
                    "cache-hit-rate",
                    "Build Cache Hit Rate",
                    build.cacheHitRate(),
                    "%",
                    CardStatus.of(build.cacheHitRate(), 80.0, 60.0)));
            cards.add(new MetricCard(
                    "parallel-efficiency",
                    "Build Parallel Efficiency",
                    build.parallelEfficiency(),
                    "%",
                    CardStatus.of(build.parallelEfficiency(), 70.0, 50.0)));
        }
        if (!result.isSubstituted(ValidationComponent.BUNDLE_METRICS)) {
            double reduction = performance.bundleMetrics().reductionPercentage();
            cards.add(new MetricCard(
                    "bundle-size-reduction",
                    "Bundle Size Reduction",
                    reduction,
                    "%",
                    CardStatus.of(reduction, 20.0, 10.0)));
        }
        SystemValidation system = result.systemValidation();
        if (!result.isSubstituted(ValidationComponent.TEST_RUNNER)) {
            SystemValidation.TestResults tests = system.testResults();
            cards.add(new MetricCard(
                    "test-coverage",
                    "Overall Test Coverage",
                    tests.coverage().overall(),
                    "%",
                    CardStatus.of(tests.coverage().overall(), 80.0, 60.0)));
            cards.add(new MetricCard(
                    "test-success-rate",
                    "Test Success Rate",
                    tests.successRate(),
                    "%",
                    CardStatus.of(tests.successRate(), 95.0, 90.0)));
        }
        if (!result.isSubstituted(ValidationComponent.DEPENDENCY_ANALYSIS)) {
            double health = result.architectureValidation().dependencyAnalysis().healthScore();
            cards.add(new MetricCard(
                    "architecture-health-score",
                    "Architecture Health Score",
                    health,
                    "/100",
                    CardStatus.of(health, 90.0, 70.0)));
        }
        if (!result.isSubstituted(ValidationComponent.API_VALIDATOR)) {
            double health = system.apiValidation().healthRate();
            cards.add(new MetricCard(
                    "api-endpoint-health",
                    "API Endpoint Health",
                    health,
                    "%",
                    CardStatus.of(health, 95.0, 90.0)));
        }
        return cards;
    }
}
