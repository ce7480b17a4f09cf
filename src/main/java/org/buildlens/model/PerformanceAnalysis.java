package org.buildlens.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outputs of the performance phase: build and bundle metrics, memory profile and developer experience.
 */
public record PerformanceAnalysis(
        BuildMetrics buildMetrics,
        BundleMetrics bundleMetrics,
        MemoryProfile memoryProfile,
        DevExperienceMetrics devExperience) {
    public PerformanceAnalysis {
        Objects.requireNonNull(buildMetrics, "buildMetrics");
        Objects.requireNonNull(bundleMetrics, "bundleMetrics");
        Objects.requireNonNull(memoryProfile, "memoryProfile");
        Objects.requireNonNull(devExperience, "devExperience");
    }

    public static PerformanceAnalysis empty() {
        return new PerformanceAnalysis(
                BuildMetrics.empty(), BundleMetrics.empty(), MemoryProfile.empty(), DevExperienceMetrics.empty());
    }

    public PerformanceAnalysis withBuildMetrics(BuildMetrics value) {
        return new PerformanceAnalysis(value, bundleMetrics, memoryProfile, devExperience);
    }

    public PerformanceAnalysis withBundleMetrics(BundleMetrics value) {
        return new PerformanceAnalysis(buildMetrics, value, memoryProfile, devExperience);
    }

    public PerformanceAnalysis withMemoryProfile(MemoryProfile value) {
        return new PerformanceAnalysis(buildMetrics, bundleMetrics, value, devExperience);
    }

    public PerformanceAnalysis withDevExperience(DevExperienceMetrics value) {
        return new PerformanceAnalysis(buildMetrics, bundleMetrics, memoryProfile, value);
    }

    public record BuildMetrics(
            double totalBuildTimeMillis,
            Map<String, Double> packageBuildTimes,
            double parallelEfficiency,
            double cacheHitRate,
            double improvementPercentage,
            List<BuildBottleneck> bottlenecks) {
        public BuildMetrics {
            packageBuildTimes = Map.copyOf(packageBuildTimes);
            bottlenecks = List.copyOf(bottlenecks);
        }

        public static BuildMetrics empty() {
            return new BuildMetrics(0, Map.of(), 0, 0, 0, List.of());
        }
    }

    public record BuildBottleneck(String packageName, double buildTimeMillis, List<String> suggestions) {
        public BuildBottleneck {
            Objects.requireNonNull(packageName, "packageName");
            suggestions = List.copyOf(suggestions);
        }
    }

    public record BundleMetrics(
            double totalSizeBytes,
            Map<String, Double> packageSizes,
            double reductionPercentage,
            List<LargeBundle> largestBundles) {
        public BundleMetrics {
            packageSizes = Map.copyOf(packageSizes);
            largestBundles = List.copyOf(largestBundles);
        }

        public static BundleMetrics empty() {
            return new BundleMetrics(0, Map.of(), 0, List.of());
        }
    }

    public record LargeBundle(String packageName, double sizeBytes, List<String> suggestions) {
        public LargeBundle {
            Objects.requireNonNull(packageName, "packageName");
            suggestions = List.copyOf(suggestions);
        }
    }

    public record MemoryProfile(
            MemoryStats development,
            MemoryStats build,
            MemoryStats runtime,
            List<MemoryLeak> leaks,
            List<MemoryOptimization> optimizations) {
        public MemoryProfile {
            Objects.requireNonNull(development, "development");
            Objects.requireNonNull(build, "build");
            Objects.requireNonNull(runtime, "runtime");
            leaks = List.copyOf(leaks);
            optimizations = List.copyOf(optimizations);
        }

        public static MemoryProfile empty() {
            return new MemoryProfile(
                    MemoryStats.empty(), MemoryStats.empty(), MemoryStats.empty(), List.of(), List.of());
        }
    }

    public record MemoryStats(double heapUsedBytes, double heapTotalBytes, double rssBytes, double peakBytes) {
        public static MemoryStats empty() {
            return new MemoryStats(0, 0, 0, 0);
        }
    }

    public record MemoryLeak(String location, FindingSeverity severity, String description, String suggestion) {
        public MemoryLeak {
            Objects.requireNonNull(location, "location");
            Objects.requireNonNull(severity, "severity");
        }
    }

    public record MemoryOptimization(
            String area, double currentUsageBytes, double potentialSavingsBytes, String recommendation) {
        public MemoryOptimization {
            Objects.requireNonNull(area, "area");
        }
    }

    public record DevExperienceMetrics(
            double typeScriptCompilationMillis,
            double autocompleteMillis,
            int typeErrorCount,
            double navigationMillis,
            double intelliSenseMillis,
            int circularImports,
            int inconsistentImportPaths) {
        public static DevExperienceMetrics empty() {
            return new DevExperienceMetrics(0, 0, 0, 0, 0, 0, 0);
        }
    }
}
