package org.buildlens.pipeline;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.buildlens.config.ConfigValues;
import org.buildlens.config.StructuredDocumentLoader;
import org.buildlens.controller.ComponentException;
import org.buildlens.controller.ValidationCheckers;
import org.buildlens.model.ArchitectureValidation;
import org.buildlens.model.FindingSeverity;
import org.buildlens.model.PerformanceAnalysis;
import org.buildlens.model.SystemValidation;
import org.buildlens.model.ValidationComponent;

/**
 * Checkers backed by a JSON or YAML document holding one optional section per component, keyed
 * by the component key ({@code test-runner}, {@code build-metrics}, ...).
 *
 * <p>A missing section makes its component fail, so the run records the gap and uses the
 * component's empty section.
 */
public final class MeasurementBundle implements ValidationCheckers {
    private final Map<String, Object> sections;

    public MeasurementBundle(Map<String, ?> document) {
        this.sections = ConfigValues.normalizeKeys(Objects.requireNonNull(document, "document"));
    }

    public static MeasurementBundle load(Path path) {
        return new MeasurementBundle(StructuredDocumentLoader.load(path));
    }

    public static MeasurementBundle empty() {
        return new MeasurementBundle(Map.of());
    }

    public boolean hasSection(ValidationComponent component) {
        return sections.get(component.key()) != null;
    }

    @Override
    public SystemValidation.TestResults runTests() {
        Map<String, Object> section = section(ValidationComponent.TEST_RUNNER);
        Map<String, Object> coverage = orEmpty(ConfigValues.readMap(section, "coverage"));
        List<SystemValidation.PackageTestResult> packages = new ArrayList<>();
        for (Map<String, Object> entry : ConfigValues.readMapList(section, "packageResults")) {
            packages.add(new SystemValidation.PackageTestResult(
                    ConfigValues.requireString(entry, "packageName"),
                    ConfigValues.readBoolean(entry, "passed", true),
                    ConfigValues.readInt(entry, "testCount", 0),
                    ConfigValues.readInt(entry, "failedCount", 0)));
        }
        return new SystemValidation.TestResults(
                ConfigValues.readInt(section, "totalTests", 0),
                ConfigValues.readInt(section, "passedTests", 0),
                ConfigValues.readInt(section, "failedTests", 0),
                ConfigValues.readInt(section, "skippedTests", 0),
                new SystemValidation.Coverage(
                        ConfigValues.readDouble(coverage, "overall", 0.0),
                        ConfigValues.readDouble(coverage, "statements", 0.0),
                        ConfigValues.readDouble(coverage, "branches", 0.0),
                        ConfigValues.readDouble(coverage, "functions", 0.0),
                        ConfigValues.readDouble(coverage, "lines", 0.0),
                        ConfigValues.readNumberMap(coverage, "packageCoverage")),
                packages,
                (long) ConfigValues.readDouble(section, "durationMillis", 0.0));
    }

    @Override
    public SystemValidation.EndpointResults validateApi() {
        Map<String, Object> section = section(ValidationComponent.API_VALIDATOR);
        Map<String, Object> times = orEmpty(ConfigValues.readMap(section, "responseTimes"));
        List<SystemValidation.EndpointFailure> failures = new ArrayList<>();
        for (Map<String, Object> entry : ConfigValues.readMapList(section, "failedEndpoints")) {
            failures.add(new SystemValidation.EndpointFailure(
                    ConfigValues.requireString(entry, "endpoint"),
                    ConfigValues.readString(entry, "method"),
                    ConfigValues.readString(entry, "error")));
        }
        return new SystemValidation.EndpointResults(
                ConfigValues.readInt(section, "totalEndpoints", 0),
                ConfigValues.readInt(section, "validatedEndpoints", 0),
                failures,
                new SystemValidation.ResponseTimes(
                        ConfigValues.readDouble(times, "averageMillis", 0.0),
                        ConfigValues.readDouble(times, "medianMillis", 0.0),
                        ConfigValues.readDouble(times, "p95Millis", 0.0),
                        ConfigValues.readDouble(times, "p99Millis", 0.0)));
    }

    @Override
    public SystemValidation.WorkflowResults validateEndToEnd() {
        Map<String, Object> section = section(ValidationComponent.E2E_VALIDATOR);
        List<SystemValidation.WorkflowFailure> workflows = new ArrayList<>();
        for (Map<String, Object> entry : ConfigValues.readMapList(section, "failedWorkflows")) {
            workflows.add(new SystemValidation.WorkflowFailure(
                    ConfigValues.requireString(entry, "workflowName"), ConfigValues.readString(entry, "error")));
        }
        List<SystemValidation.IntegrationFailure> integrations = new ArrayList<>();
        for (Map<String, Object> entry : ConfigValues.readMapList(section, "failedIntegrations")) {
            integrations.add(new SystemValidation.IntegrationFailure(
                    ConfigValues.requireString(entry, "fromPackage"),
                    ConfigValues.requireString(entry, "toPackage"),
                    ConfigValues.readString(entry, "error")));
        }
        return new SystemValidation.WorkflowResults(
                ConfigValues.readInt(section, "totalWorkflows", 0),
                ConfigValues.readInt(section, "passedWorkflows", 0),
                workflows,
                ConfigValues.readInt(section, "testedIntegrations", 0),
                ConfigValues.readInt(section, "passedIntegrations", 0),
                integrations);
    }

    @Override
    public SystemValidation.BuildResults validateBuild() {
        Map<String, Object> section = section(ValidationComponent.BUILD_VALIDATOR);
        List<SystemValidation.PackageBuild> builds = new ArrayList<>();
        for (Map<String, Object> entry : ConfigValues.readMapList(section, "packageBuilds")) {
            builds.add(new SystemValidation.PackageBuild(
                    ConfigValues.requireString(entry, "packageName"),
                    ConfigValues.readBoolean(entry, "passed", true),
                    ConfigValues.readDouble(entry, "buildTimeMillis", 0.0),
                    ConfigValues.readBoolean(entry, "cacheHit", false)));
        }
        return new SystemValidation.BuildResults(
                ConfigValues.readBoolean(section, "passed", true),
                builds,
                ConfigValues.readDouble(section, "totalBuildTimeMillis", 0.0),
                ConfigValues.readDouble(section, "parallelEfficiency", 0.0),
                ConfigValues.readDouble(section, "cacheHitRate", 0.0));
    }

    @Override
    public PerformanceAnalysis.BuildMetrics measureBuild() {
        Map<String, Object> section = section(ValidationComponent.BUILD_METRICS);
        List<PerformanceAnalysis.BuildBottleneck> bottlenecks = new ArrayList<>();
        for (Map<String, Object> entry : ConfigValues.readMapList(section, "bottlenecks")) {
            bottlenecks.add(new PerformanceAnalysis.BuildBottleneck(
                    ConfigValues.requireString(entry, "packageName"),
                    ConfigValues.readDouble(entry, "buildTimeMillis", 0.0),
                    ConfigValues.readStringList(entry, "suggestions")));
        }
        return new PerformanceAnalysis.BuildMetrics(
                ConfigValues.readDouble(section, "totalBuildTimeMillis", 0.0),
                ConfigValues.readNumberMap(section, "packageBuildTimes"),
                ConfigValues.readDouble(section, "parallelEfficiency", 0.0),
                ConfigValues.readDouble(section, "cacheHitRate", 0.0),
                ConfigValues.readDouble(section, "improvementPercentage", 0.0),
                bottlenecks);
    }

    @Override
    public PerformanceAnalysis.BundleMetrics measureBundles() {
        Map<String, Object> section = section(ValidationComponent.BUNDLE_METRICS);
        List<PerformanceAnalysis.LargeBundle> largest = new ArrayList<>();
        for (Map<String, Object> entry : ConfigValues.readMapList(section, "largestBundles")) {
            largest.add(new PerformanceAnalysis.LargeBundle(
                    ConfigValues.requireString(entry, "packageName"),
                    ConfigValues.readDouble(entry, "sizeBytes", 0.0),
                    ConfigValues.readStringList(entry, "suggestions")));
        }
        return new PerformanceAnalysis.BundleMetrics(
                ConfigValues.readDouble(section, "totalSizeBytes", 0.0),
                ConfigValues.readNumberMap(section, "packageSizes"),
                ConfigValues.readDouble(section, "reductionPercentage", 0.0),
                largest);
    }

    @Override
    public PerformanceAnalysis.MemoryProfile profileMemory() {
        Map<String, Object> section = section(ValidationComponent.MEMORY_PROFILE);
        List<PerformanceAnalysis.MemoryLeak> leaks = new ArrayList<>();
        for (Map<String, Object> entry : ConfigValues.readMapList(section, "leaks")) {
            leaks.add(new PerformanceAnalysis.MemoryLeak(
                    ConfigValues.requireString(entry, "location"),
                    FindingSeverity.fromKey(ConfigValues.readString(entry, "severity")),
                    ConfigValues.readString(entry, "description"),
                    ConfigValues.readString(entry, "suggestion")));
        }
        List<PerformanceAnalysis.MemoryOptimization> optimizations = new ArrayList<>();
        for (Map<String, Object> entry : ConfigValues.readMapList(section, "optimizations")) {
            optimizations.add(new PerformanceAnalysis.MemoryOptimization(
                    ConfigValues.requireString(entry, "area"),
                    ConfigValues.readDouble(entry, "currentUsageBytes", 0.0),
                    ConfigValues.readDouble(entry, "potentialSavingsBytes", 0.0),
                    ConfigValues.readString(entry, "recommendation")));
        }
        return new PerformanceAnalysis.MemoryProfile(
                memoryStats(ConfigValues.readMap(section, "development")),
                memoryStats(ConfigValues.readMap(section, "build")),
                memoryStats(ConfigValues.readMap(section, "runtime")),
                leaks,
                optimizations);
    }

    @Override
    public PerformanceAnalysis.DevExperienceMetrics measureDevExperience() {
        Map<String, Object> section = section(ValidationComponent.DEV_EXPERIENCE);
        return new PerformanceAnalysis.DevExperienceMetrics(
                ConfigValues.readDouble(section, "typeScriptCompilationMillis", 0.0),
                ConfigValues.readDouble(section, "autocompleteMillis", 0.0),
                ConfigValues.readInt(section, "typeErrorCount", 0),
                ConfigValues.readDouble(section, "navigationMillis", 0.0),
                ConfigValues.readDouble(section, "intelliSenseMillis", 0.0),
                ConfigValues.readInt(section, "circularImports", 0),
                ConfigValues.readInt(section, "inconsistentImportPaths", 0));
    }

    @Override
    public ArchitectureValidation.DependencyReport analyzeDependencies() {
        Map<String, Object> section = section(ValidationComponent.DEPENDENCY_ANALYSIS);
        List<ArchitectureValidation.CircularDependency> cycles = new ArrayList<>();
        for (Map<String, Object> entry : ConfigValues.readMapList(section, "circularDependencies")) {
            cycles.add(new ArchitectureValidation.CircularDependency(
                    ConfigValues.readStringList(entry, "packages"),
                    FindingSeverity.fromKey(ConfigValues.readString(entry, "severity")),
                    ConfigValues.readString(entry, "suggestion")));
        }
        List<ArchitectureValidation.BoundaryViolation> violations = new ArrayList<>();
        for (Map<String, Object> entry : ConfigValues.readMapList(section, "boundaryViolations")) {
            violations.add(new ArchitectureValidation.BoundaryViolation(
                    ConfigValues.requireString(entry, "fromPackage"),
                    ConfigValues.requireString(entry, "toPackage"),
                    ConfigValues.readString(entry, "violationType"),
                    ConfigValues.readString(entry, "suggestion")));
        }
        return new ArchitectureValidation.DependencyReport(
                cycles, violations, ConfigValues.readDouble(section, "healthScore", 100.0));
    }

    @Override
    public ArchitectureValidation.OrganizationReport analyzeOrganization() {
        Map<String, Object> section = section(ValidationComponent.CODE_ORGANIZATION);
        return new ArchitectureValidation.OrganizationReport(
                ConfigValues.readDouble(section, "separationScore", 100.0),
                ConfigValues.readStringList(section, "separationSuggestions"),
                ConfigValues.readDouble(section, "duplicationPercentage", 0.0),
                ConfigValues.readStringList(section, "duplicatedPackages"),
                ConfigValues.readDouble(section, "namingConsistencyScore", 100.0),
                ConfigValues.readStringList(section, "namingSuggestions"),
                ConfigValues.readDouble(section, "overallScore", 100.0));
    }

    @Override
    public ArchitectureValidation.TypeSafetyReport analyzeTypeSafety() {
        Map<String, Object> section = section(ValidationComponent.TYPE_SAFETY);
        List<ArchitectureValidation.InterfaceIncompatibility> incompatible = new ArrayList<>();
        for (Map<String, Object> entry : ConfigValues.readMapList(section, "incompatibleInterfaces")) {
            incompatible.add(new ArchitectureValidation.InterfaceIncompatibility(
                    ConfigValues.requireString(entry, "interfaceName"),
                    ConfigValues.readStringList(entry, "packages"),
                    ConfigValues.readString(entry, "issue"),
                    FindingSeverity.fromKey(ConfigValues.readString(entry, "severity"))));
        }
        return new ArchitectureValidation.TypeSafetyReport(
                ConfigValues.readDouble(section, "crossPackageTypeConsistency", 100.0),
                ConfigValues.readInt(section, "compatibleInterfaces", 0),
                incompatible,
                ConfigValues.readStringList(section, "suggestions"),
                ConfigValues.readDouble(section, "overallScore", 100.0));
    }

    private Map<String, Object> section(ValidationComponent component) {
        Map<String, Object> section = ConfigValues.readMap(sections, component.key());
        if (section == null) {
            throw new ComponentException(
                    null,
                    "no measurements for " + component.key(),
                    List.of("Add a '" + component.key() + "' section to the measurement bundle"),
                    List.of());
        }
        return section;
    }

    private static PerformanceAnalysis.MemoryStats memoryStats(Map<String, Object> stats) {
        if (stats == null) {
            return PerformanceAnalysis.MemoryStats.empty();
        }
        return new PerformanceAnalysis.MemoryStats(
                ConfigValues.readDouble(stats, "heapUsedBytes", 0.0),
                ConfigValues.readDouble(stats, "heapTotalBytes", 0.0),
                ConfigValues.readDouble(stats, "rssBytes", 0.0),
                ConfigValues.readDouble(stats, "peakBytes", 0.0));
    }

    private static Map<String, Object> orEmpty(Map<String, Object> map) {
        return map == null ? Map.of() : map;
    }
}
