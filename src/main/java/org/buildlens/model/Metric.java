package org.buildlens.model;

import java.util.Locale;

/**
 * Tracked snapshot metrics with their polarity, regression threshold and comparison target.
 */
public enum Metric {
    BUILD_TIME("buildTime", "Build Time", "seconds", MetricPolarity.LOWER_IS_BETTER, 10.0, 30.0),
    BUNDLE_SIZE("bundleSize", "Bundle Size", "MB", MetricPolarity.LOWER_IS_BETTER, 5.0, 5.0),
    TEST_COVERAGE("testCoverage", "Test Coverage", "%", MetricPolarity.HIGHER_IS_BETTER, 5.0, 80.0),
    MEMORY_USAGE("memoryUsage", "Memory Usage", "MB", MetricPolarity.LOWER_IS_BETTER, 15.0, 512.0),
    CACHE_HIT_RATE("cacheHitRate", "Cache Hit Rate", "%", MetricPolarity.HIGHER_IS_BETTER, 10.0, 90.0),
    PARALLEL_EFFICIENCY("parallelEfficiency", "Parallel Efficiency", "%", MetricPolarity.HIGHER_IS_BETTER, 10.0, 80.0),
    ARCHITECTURE_HEALTH_SCORE(
            "architectureHealthScore", "Architecture Health", "/100", MetricPolarity.HIGHER_IS_BETTER, 5.0, 90.0),
    TYPESCRIPT_COMPILATION_TIME(
            "typeScriptCompilationTime", "TypeScript Compilation", "seconds", MetricPolarity.LOWER_IS_BETTER, 20.0, 10.0),
    AUTOCOMPLETE_SPEED("autocompleteSpeed", "Autocomplete Speed", "ms", MetricPolarity.LOWER_IS_BETTER, 25.0, 200.0);

    private final String key;
    private final String displayName;
    private final String unit;
    private final MetricPolarity polarity;
    private final double regressionThresholdPercent;
    private final double target;

    Metric(
            String key,
            String displayName,
            String unit,
            MetricPolarity polarity,
            double regressionThresholdPercent,
            double target) {
        this.key = key;
        this.displayName = displayName;
        this.unit = unit;
        this.polarity = polarity;
        this.regressionThresholdPercent = regressionThresholdPercent;
        this.target = target;
    }

    public String key() {
        return key;
    }

    public String displayName() {
        return displayName;
    }

    public String unit() {
        return unit;
    }

    public MetricPolarity polarity() {
        return polarity;
    }

    public boolean lowerIsBetter() {
        return polarity.isLowerBetter();
    }

    public double regressionThresholdPercent() {
        return regressionThresholdPercent;
    }

    public double target() {
        return target;
    }

    public static Metric fromKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("metric key must not be blank");
        }
        String normalized = key.trim();
        for (Metric metric : values()) {
            if (metric.key.equals(normalized) || metric.name().equals(normalized.toUpperCase(Locale.ROOT))) {
                return metric;
            }
        }
        throw new IllegalArgumentException("unknown metric: " + key);
    }
}
