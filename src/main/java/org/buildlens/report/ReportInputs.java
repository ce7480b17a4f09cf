package org.buildlens.report;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.buildlens.analysis.PerformanceComparison;
import org.buildlens.analysis.Regression;
import org.buildlens.analysis.Trend;
import org.buildlens.benchmark.BenchmarkComparison;
import org.buildlens.benchmark.BenchmarkResult;
import org.buildlens.model.Recommendation;
import org.buildlens.model.ValidationResult;

/**
 * Everything one report is built from. Only the validation result is required.
 */
public final class ReportInputs {
    private final ValidationResult result;
    private final List<Trend> trends;
    private final List<Regression> regressions;
    private final List<PerformanceComparison> comparisons;
    private final List<BenchmarkResult> benchmarkResults;
    private final List<BenchmarkComparison> benchmarkComparisons;
    private final List<Recommendation> recommendations;

    private ReportInputs(Builder builder) {
        this.result = Objects.requireNonNull(builder.result, "result");
        this.trends = List.copyOf(builder.trends);
        this.regressions = List.copyOf(builder.regressions);
        this.comparisons = List.copyOf(builder.comparisons);
        this.benchmarkResults = List.copyOf(builder.benchmarkResults);
        this.benchmarkComparisons = List.copyOf(builder.benchmarkComparisons);
        this.recommendations = List.copyOf(builder.recommendations);
    }

    public static ReportInputs of(ValidationResult result) {
        return builder(result).build();
    }

    public static Builder builder(ValidationResult result) {
        return new Builder(result);
    }

    public ValidationResult result() {
        return result;
    }

    public List<Trend> trends() {
        return trends;
    }

    public List<Regression> regressions() {
        return regressions;
    }

    public List<PerformanceComparison> comparisons() {
        return comparisons;
    }

    public List<BenchmarkResult> benchmarkResults() {
        return benchmarkResults;
    }

    public List<BenchmarkComparison> benchmarkComparisons() {
        return benchmarkComparisons;
    }

    /**
     * Recommendations from the analytics engine, merged with the result's own on aggregation.
     */
    public List<Recommendation> recommendations() {
        return recommendations;
    }

    public static final class Builder {
        private final ValidationResult result;
        private final List<Trend> trends = new ArrayList<>();
        private final List<Regression> regressions = new ArrayList<>();
        private final List<PerformanceComparison> comparisons = new ArrayList<>();
        private final List<BenchmarkResult> benchmarkResults = new ArrayList<>();
        private final List<BenchmarkComparison> benchmarkComparisons = new ArrayList<>();
        private final List<Recommendation> recommendations = new ArrayList<>();

        private Builder(ValidationResult result) {
            this.result = Objects.requireNonNull(result, "result");
        }

        public Builder trends(List<Trend> values) {
            trends.addAll(values);
            return this;
        }

        public Builder regressions(List<Regression> values) {
            regressions.addAll(values);
            return this;
        }

        public Builder comparisons(List<PerformanceComparison> values) {
            comparisons.addAll(values);
            return this;
        }

        public Builder benchmarkResult(BenchmarkResult value) {
            benchmarkResults.add(Objects.requireNonNull(value, "value"));
            return this;
        }

        public Builder benchmarkComparison(BenchmarkComparison value) {
            benchmarkComparisons.add(Objects.requireNonNull(value, "value"));
            return this;
        }

        public Builder recommendations(List<Recommendation> values) {
            recommendations.addAll(values);
            return this;
        }

        public ReportInputs build() {
            return new ReportInputs(this);
        }
    }
}
