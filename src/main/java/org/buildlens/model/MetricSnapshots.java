package org.buildlens.model;

import java.util.Objects;

/**
 * Resolves a validation result into a fully populated snapshot with display units.
 */
public final class MetricSnapshots {
    private static final double BYTES_PER_MEGABYTE = 1024.0 * 1024.0;

    private MetricSnapshots() {
    }

    public static MetricSnapshot fromResult(ValidationResult result, SnapshotMetadata metadata) {
        Objects.requireNonNull(result, "result");
        PerformanceAnalysis performance = result.performanceAnalysis();
        PerformanceAnalysis.BuildMetrics build = performance.buildMetrics();

        return MetricSnapshot.builder(result.timestamp())
                .value(Metric.BUILD_TIME, nonNegative(build.totalBuildTimeMillis() / 1000.0))
                .value(Metric.BUNDLE_SIZE,
                        nonNegative(performance.bundleMetrics().totalSizeBytes() / BYTES_PER_MEGABYTE))
                .value(Metric.TEST_COVERAGE,
                        nonNegative(result.systemValidation().testResults().coverage().overall()))
                .value(Metric.MEMORY_USAGE,
                        nonNegative(performance.memoryProfile().build().heapUsedBytes() / BYTES_PER_MEGABYTE))
                .value(Metric.CACHE_HIT_RATE, nonNegative(build.cacheHitRate()))
                .value(Metric.PARALLEL_EFFICIENCY, nonNegative(build.parallelEfficiency()))
                .value(Metric.ARCHITECTURE_HEALTH_SCORE,
                        nonNegative(result.architectureValidation().dependencyAnalysis().healthScore()))
                .value(Metric.TYPESCRIPT_COMPILATION_TIME,
                        nonNegative(performance.devExperience().typeScriptCompilationMillis() / 1000.0))
                .value(Metric.AUTOCOMPLETE_SPEED, nonNegative(performance.devExperience().autocompleteMillis()))
                .metadata(metadata == null ? SnapshotMetadata.empty() : metadata)
                .build();
    }

    private static double nonNegative(double value) {
        if (!Double.isFinite(value) || value < 0) {
            return 0.0;
        }
        return value;
    }
}
