package org.buildlens.recommend;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import org.buildlens.config.ConfigValues;
import org.buildlens.config.StructuredDocumentLoader;

/**
 * Threshold table driving the recommendation checks.
 *
 * <p>Values can be overridden from a JSON or YAML document whose keys match the accessor names,
 * with tiers nested as {@code buildTimeSeconds: {good: 60, poor: 120}}.
 */
public final class RecommendationThresholds {
    private static final RecommendationThresholds DEFAULTS = new Builder().build();

    private final Tier buildTimeSeconds;
    private final Tier bundleSizeMegabytes;
    private final Tier testCoverage;
    private final Tier cacheHitRate;
    private final Tier memoryMegabytes;
    private final double minParallelEfficiency;
    private final double bottleneckMillis;
    private final double packageBundleMegabytes;
    private final double bundleReductionTarget;
    private final double bundleReductionFloor;
    private final double memorySavingsMegabytes;
    private final double autocompleteMillis;
    private final double navigationMillis;
    private final int inconsistentImportPaths;
    private final double apiP95Millis;
    private final double healthScore;
    private final double criticalHealthScore;
    private final double separationScore;
    private final double duplicationPercentage;
    private final double namingScore;
    private final double typeConsistency;

    private RecommendationThresholds(Builder builder) {
        this.buildTimeSeconds = builder.buildTimeSeconds;
        this.bundleSizeMegabytes = builder.bundleSizeMegabytes;
        this.testCoverage = builder.testCoverage;
        this.cacheHitRate = builder.cacheHitRate;
        this.memoryMegabytes = builder.memoryMegabytes;
        this.minParallelEfficiency = builder.minParallelEfficiency;
        this.bottleneckMillis = builder.bottleneckMillis;
        this.packageBundleMegabytes = builder.packageBundleMegabytes;
        this.bundleReductionTarget = builder.bundleReductionTarget;
        this.bundleReductionFloor = builder.bundleReductionFloor;
        this.memorySavingsMegabytes = builder.memorySavingsMegabytes;
        this.autocompleteMillis = builder.autocompleteMillis;
        this.navigationMillis = builder.navigationMillis;
        this.inconsistentImportPaths = builder.inconsistentImportPaths;
        this.apiP95Millis = builder.apiP95Millis;
        this.healthScore = builder.healthScore;
        this.criticalHealthScore = builder.criticalHealthScore;
        this.separationScore = builder.separationScore;
        this.duplicationPercentage = builder.duplicationPercentage;
        this.namingScore = builder.namingScore;
        this.typeConsistency = builder.typeConsistency;
    }

    public static RecommendationThresholds defaults() {
        return DEFAULTS;
    }

    public static RecommendationThresholds load(Path path) {
        return fromMap(StructuredDocumentLoader.load(path));
    }

    public static RecommendationThresholds fromMap(Map<String, ?> document) {
        Objects.requireNonNull(document, "document");
        Builder builder = new Builder();
        builder.buildTimeSeconds = readTier(document, "buildTimeSeconds", builder.buildTimeSeconds);
        builder.bundleSizeMegabytes = readTier(document, "bundleSizeMegabytes", builder.bundleSizeMegabytes);
        builder.testCoverage = readTier(document, "testCoverage", builder.testCoverage);
        builder.cacheHitRate = readTier(document, "cacheHitRate", builder.cacheHitRate);
        builder.memoryMegabytes = readTier(document, "memoryMegabytes", builder.memoryMegabytes);
        builder.minParallelEfficiency =
                ConfigValues.readDouble(document, "minParallelEfficiency", builder.minParallelEfficiency);
        builder.bottleneckMillis = ConfigValues.readDouble(document, "bottleneckMillis", builder.bottleneckMillis);
        builder.packageBundleMegabytes =
                ConfigValues.readDouble(document, "packageBundleMegabytes", builder.packageBundleMegabytes);
        builder.bundleReductionTarget =
                ConfigValues.readDouble(document, "bundleReductionTarget", builder.bundleReductionTarget);
        builder.bundleReductionFloor =
                ConfigValues.readDouble(document, "bundleReductionFloor", builder.bundleReductionFloor);
        builder.memorySavingsMegabytes =
                ConfigValues.readDouble(document, "memorySavingsMegabytes", builder.memorySavingsMegabytes);
        builder.autocompleteMillis = ConfigValues.readDouble(document, "autocompleteMillis", builder.autocompleteMillis);
        builder.navigationMillis = ConfigValues.readDouble(document, "navigationMillis", builder.navigationMillis);
        builder.inconsistentImportPaths =
                ConfigValues.readInt(document, "inconsistentImportPaths", builder.inconsistentImportPaths);
        builder.apiP95Millis = ConfigValues.readDouble(document, "apiP95Millis", builder.apiP95Millis);
        builder.healthScore = ConfigValues.readDouble(document, "healthScore", builder.healthScore);
        builder.criticalHealthScore =
                ConfigValues.readDouble(document, "criticalHealthScore", builder.criticalHealthScore);
        builder.separationScore = ConfigValues.readDouble(document, "separationScore", builder.separationScore);
        builder.duplicationPercentage =
                ConfigValues.readDouble(document, "duplicationPercentage", builder.duplicationPercentage);
        builder.namingScore = ConfigValues.readDouble(document, "namingScore", builder.namingScore);
        builder.typeConsistency = ConfigValues.readDouble(document, "typeConsistency", builder.typeConsistency);
        return builder.build();
    }

    private static Tier readTier(Map<String, ?> document, String key, Tier defaults) {
        Map<String, Object> raw = ConfigValues.readMap(document, key);
        if (raw == null) {
            return defaults;
        }
        return new Tier(
                ConfigValues.readDouble(raw, "excellent", defaults.excellent()),
                ConfigValues.readDouble(raw, "good", defaults.good()),
                ConfigValues.readDouble(raw, "poor", defaults.poor()));
    }

    public Tier buildTimeSeconds() {
        return buildTimeSeconds;
    }

    public Tier bundleSizeMegabytes() {
        return bundleSizeMegabytes;
    }

    public Tier testCoverage() {
        return testCoverage;
    }

    public Tier cacheHitRate() {
        return cacheHitRate;
    }

    public Tier memoryMegabytes() {
        return memoryMegabytes;
    }

    public double minParallelEfficiency() {
        return minParallelEfficiency;
    }

    public double bottleneckMillis() {
        return bottleneckMillis;
    }

    public double packageBundleMegabytes() {
        return packageBundleMegabytes;
    }

    public double bundleReductionTarget() {
        return bundleReductionTarget;
    }

    public double bundleReductionFloor() {
        return bundleReductionFloor;
    }

    public double memorySavingsMegabytes() {
        return memorySavingsMegabytes;
    }

    public double autocompleteMillis() {
        return autocompleteMillis;
    }

    public double navigationMillis() {
        return navigationMillis;
    }

    public int inconsistentImportPaths() {
        return inconsistentImportPaths;
    }

    public double apiP95Millis() {
        return apiP95Millis;
    }

    public double healthScore() {
        return healthScore;
    }

    public double criticalHealthScore() {
        return criticalHealthScore;
    }

    public double separationScore() {
        return separationScore;
    }

    public double duplicationPercentage() {
        return duplicationPercentage;
    }

    public double namingScore() {
        return namingScore;
    }

    public double typeConsistency() {
        return typeConsistency;
    }

    /**
     * Excellent, good and poor boundaries of one metric, in the metric's own direction.
     */
    public record Tier(double excellent, double good, double poor) {
        public Tier {
            if (!Double.isFinite(excellent) || !Double.isFinite(good) || !Double.isFinite(poor)) {
                throw new IllegalArgumentException("tier thresholds must be finite");
            }
        }
    }

    private static final class Builder {
        private Tier buildTimeSeconds = new Tier(30, 60, 120);
        private Tier bundleSizeMegabytes = new Tier(5, 10, 20);
        private Tier testCoverage = new Tier(90, 80, 60);
        private Tier cacheHitRate = new Tier(90, 80, 60);
        private Tier memoryMegabytes = new Tier(512, 1024, 2048);
        private double minParallelEfficiency = 70;
        private double bottleneckMillis = 30_000;
        private double packageBundleMegabytes = 2;
        private double bundleReductionTarget = 20;
        private double bundleReductionFloor = 10;
        private double memorySavingsMegabytes = 100;
        private double autocompleteMillis = 1000;
        private double navigationMillis = 500;
        private int inconsistentImportPaths = 5;
        private double apiP95Millis = 2000;
        private double healthScore = 70;
        private double criticalHealthScore = 50;
        private double separationScore = 70;
        private double duplicationPercentage = 10;
        private double namingScore = 80;
        private double typeConsistency = 90;

        private RecommendationThresholds build() {
            return new RecommendationThresholds(this);
        }
    }
}
