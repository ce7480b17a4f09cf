package org.buildlens.recommend;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.buildlens.analysis.Regression;
import org.buildlens.analysis.RegressionSeverity;
import org.buildlens.analysis.Trend;
import org.buildlens.analysis.TrendDirection;
import org.buildlens.analysis.TrendSignificance;
import org.buildlens.model.ArchitectureValidation;
import org.buildlens.model.FindingSeverity;
import org.buildlens.model.Metric;
import org.buildlens.model.PerformanceAnalysis;
import org.buildlens.model.Recommendation;
import org.buildlens.model.RecommendationCategory;
import org.buildlens.model.RecommendationEffort;
import org.buildlens.model.RecommendationPriority;
import org.buildlens.model.SystemValidation;
import org.buildlens.model.ValidationComponent;
import org.buildlens.model.ValidationResult;

/**
 * Rule-based generator of optimization recommendations from validation and analytics results.
 *
 * <p>Each check reads one section and is independent of the others. Sections that hold a
 * substituted default are not checked.
 */
public final class RecommendationEngine {
    private static final double BYTES_PER_MEGABYTE = 1024.0 * 1024.0;

    private final RecommendationThresholds thresholds;

    public RecommendationEngine() {
        this(RecommendationThresholds.defaults());
    }

    public RecommendationEngine(RecommendationThresholds thresholds) {
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds");
    }

    public RecommendationThresholds thresholds() {
        return thresholds;
    }

    public List<Recommendation> generate(ValidationResult result) {
        return generate(result, List.of(), List.of());
    }

    /**
     * Recommendations from a validation result, regressions and trends, in canonical order.
     */
    public List<Recommendation> generate(ValidationResult result, List<Regression> regressions, List<Trend> trends) {
        Objects.requireNonNull(result, "result");
        List<Recommendation> out = new ArrayList<>();

        PerformanceAnalysis performance = result.performanceAnalysis();
        if (!result.isSubstituted(ValidationComponent.BUILD_METRICS)) {
            checkBuild(performance.buildMetrics(), out);
        }
        if (!result.isSubstituted(ValidationComponent.BUNDLE_METRICS)) {
            checkBundle(performance.bundleMetrics(), out);
        }
        if (!result.isSubstituted(ValidationComponent.MEMORY_PROFILE)) {
            checkMemory(performance.memoryProfile(), out);
        }
        if (!result.isSubstituted(ValidationComponent.DEV_EXPERIENCE)) {
            checkDeveloperExperience(performance.devExperience(), out);
        }

        SystemValidation system = result.systemValidation();
        if (!result.isSubstituted(ValidationComponent.TEST_RUNNER)) {
            checkTests(system.testResults(), out);
        }
        if (!result.isSubstituted(ValidationComponent.API_VALIDATOR)) {
            checkApi(system.apiValidation(), out);
        }
        if (!result.isSubstituted(ValidationComponent.E2E_VALIDATOR)) {
            checkEndToEnd(system.e2eResults(), out);
        }

        ArchitectureValidation architecture = result.architectureValidation();
        if (!result.isSubstituted(ValidationComponent.DEPENDENCY_ANALYSIS)) {
            checkDependencies(architecture.dependencyAnalysis(), out);
        }
        if (!result.isSubstituted(ValidationComponent.CODE_ORGANIZATION)) {
            checkOrganization(architecture.codeOrganization(), out);
        }
        if (!result.isSubstituted(ValidationComponent.TYPE_SAFETY)) {
            checkTypeSafety(architecture.typeSafety(), out);
        }

        out.addAll(fromRegressions(regressions));
        out.addAll(fromTrends(trends));
        return RecommendationOrdering.sort(out);
    }

    public List<Recommendation> fromRegressions(List<Regression> regressions) {
        List<Recommendation> out = new ArrayList<>();
        for (Regression regression : Objects.requireNonNull(regressions, "regressions")) {
            Metric metric = regression.metric();
            out.add(new Recommendation(
                    categoryOf(metric),
                    priorityOf(regression.severity()),
                    "Resolve " + metric.displayName() + " Regression",
                    String.format(
                            Locale.ROOT,
                            "%s regressed %.1f%% against its baseline (%.2f to %.2f %s)",
                            metric.displayName(),
                            regression.regressionPercentage(),
                            regression.baselineValue(),
                            regression.currentValue(),
                            metric.unit()),
                    "Possible causes: " + String.join(", ", regression.possibleCauses()),
                    RecommendationEffort.MEDIUM,
                    regression.recommendations(),
                    List.of()));
        }
        return out;
    }

    public List<Recommendation> fromTrends(List<Trend> trends) {
        List<Recommendation> out = new ArrayList<>();
        for (Trend trend : Objects.requireNonNull(trends, "trends")) {
            if (trend.direction() != TrendDirection.DEGRADING || trend.significance() != TrendSignificance.HIGH) {
                continue;
            }
            Metric metric = trend.metric();
            out.add(new Recommendation(
                    categoryOf(metric),
                    RecommendationPriority.MEDIUM,
                    "Reverse " + metric.displayName() + " Degradation Trend",
                    String.format(
                            Locale.ROOT,
                            "%s has been degrading by %.2f %s per day over %s",
                            metric.displayName(),
                            Math.abs(trend.changeRatePerDay()),
                            metric.unit(),
                            trend.timeframe()),
                    "A sustained degradation compounds with every build",
                    RecommendationEffort.MEDIUM,
                    List.of(
                            "Review changes merged during the last " + trend.timeframe(),
                            "Compare recent builds against the last known good snapshot",
                            "Add a regression gate for " + metric.displayName()),
                    List.of()));
        }
        return out;
    }

    public static List<Recommendation> byCategory(List<Recommendation> recommendations, RecommendationCategory category) {
        return recommendations.stream().filter(r -> r.category() == category).toList();
    }

    public static List<Recommendation> byPriority(List<Recommendation> recommendations, RecommendationPriority priority) {
        return recommendations.stream().filter(r -> r.priority() == priority).toList();
    }

    public static List<Recommendation> forPackage(List<Recommendation> recommendations, String packageName) {
        return recommendations.stream().filter(r -> r.affects(packageName)).toList();
    }

    void checkBuild(PerformanceAnalysis.BuildMetrics build, List<Recommendation> out) {
        double seconds = build.totalBuildTimeMillis() / 1000.0;
        List<String> bottleneckPackages = build.bottlenecks().stream()
                .map(PerformanceAnalysis.BuildBottleneck::packageName)
                .toList();
        List<String> builtPackages = build.packageBuildTimes().keySet().stream().sorted().toList();
        RecommendationThresholds.Tier buildTier = thresholds.buildTimeSeconds();

        if (seconds > buildTier.poor()) {
            out.add(new Recommendation(
                    RecommendationCategory.PERFORMANCE,
                    RecommendationPriority.CRITICAL,
                    "Optimize Build Performance",
                    "Build time of " + Math.round(seconds) + "s exceeds acceptable threshold of "
                            + format(buildTier.poor()) + "s",
                    "Significantly impacts developer productivity and CI/CD pipeline efficiency",
                    RecommendationEffort.MEDIUM,
                    List.of(
                            "Enable build caching across all packages",
                            "Implement incremental compilation",
                            "Optimize package dependency graph to reduce build order complexity",
                            "Consider splitting large packages into smaller, focused modules",
                            "Use parallel build execution where possible"),
                    bottleneckPackages));
        } else if (seconds > buildTier.good()) {
            out.add(new Recommendation(
                    RecommendationCategory.PERFORMANCE,
                    RecommendationPriority.MEDIUM,
                    "Improve Build Performance",
                    "Build time can be optimized from " + Math.round(seconds) + "s",
                    "Moderate improvement to developer experience",
                    RecommendationEffort.LOW,
                    List.of(
                            "Review and optimize build scripts",
                            "Ensure proper build caching configuration",
                            "Consider using build output caching"),
                    builtPackages));
        }

        if (build.cacheHitRate() < thresholds.cacheHitRate().poor()) {
            out.add(new Recommendation(
                    RecommendationCategory.BUILD,
                    RecommendationPriority.HIGH,
                    "Improve Build Cache Efficiency",
                    String.format(Locale.ROOT, "Cache hit rate of %.1f%% is below optimal threshold", build.cacheHitRate()),
                    "Poor cache utilization leads to unnecessary rebuilds and slower development cycles",
                    RecommendationEffort.MEDIUM,
                    List.of(
                            "Review cache configuration and ensure proper cache keys",
                            "Verify that build outputs are deterministic",
                            "Check for unnecessary file changes that invalidate cache",
                            "Make package build scripts cache-friendly",
                            "Consider using remote caching for team collaboration"),
                    builtPackages));
        }

        if (build.parallelEfficiency() < thresholds.minParallelEfficiency()) {
            out.add(new Recommendation(
                    RecommendationCategory.BUILD,
                    RecommendationPriority.MEDIUM,
                    "Optimize Build Parallelization",
                    String.format(
                            Locale.ROOT,
                            "Parallel efficiency of %.1f%% indicates suboptimal resource utilization",
                            build.parallelEfficiency()),
                    "Better parallelization can significantly reduce build times",
                    RecommendationEffort.MEDIUM,
                    List.of(
                            "Review package dependency graph for unnecessary sequential builds",
                            "Optimize build task dependencies",
                            "Consider breaking up large packages to enable better parallelization",
                            "Ensure build tasks are properly configured for parallel execution"),
                    bottleneckPackages));
        }

        for (PerformanceAnalysis.BuildBottleneck bottleneck : build.bottlenecks()) {
            if (bottleneck.buildTimeMillis() > thresholds.bottleneckMillis()) {
                out.add(new Recommendation(
                        RecommendationCategory.PERFORMANCE,
                        RecommendationPriority.HIGH,
                        "Optimize " + bottleneck.packageName() + " Build Performance",
                        "Package " + bottleneck.packageName() + " takes "
                                + Math.round(bottleneck.buildTimeMillis() / 1000.0) + "s to build",
                        "Package-specific optimization can improve overall build time",
                        RecommendationEffort.MEDIUM,
                        bottleneck.suggestions(),
                        List.of(bottleneck.packageName())));
            }
        }
    }

    void checkBundle(PerformanceAnalysis.BundleMetrics bundle, List<Recommendation> out) {
        double megabytes = bundle.totalSizeBytes() / BYTES_PER_MEGABYTE;
        if (megabytes > thresholds.bundleSizeMegabytes().poor()) {
            out.add(new Recommendation(
                    RecommendationCategory.PERFORMANCE,
                    RecommendationPriority.HIGH,
                    "Reduce Bundle Size",
                    String.format(Locale.ROOT, "Total bundle size of %.1fMB exceeds recommended threshold", megabytes),
                    "Large bundles impact application load time and user experience",
                    RecommendationEffort.HIGH,
                    List.of(
                            "Implement code splitting and lazy loading",
                            "Remove unused dependencies and dead code",
                            "Optimize asset compression and minification",
                            "Consider using dynamic imports for large modules",
                            "Analyze bundle composition"),
                    bundle.largestBundles().stream().map(PerformanceAnalysis.LargeBundle::packageName).toList()));
        }

        for (PerformanceAnalysis.LargeBundle large : bundle.largestBundles()) {
            double packageMegabytes = large.sizeBytes() / BYTES_PER_MEGABYTE;
            if (packageMegabytes > thresholds.packageBundleMegabytes()) {
                out.add(new Recommendation(
                        RecommendationCategory.PERFORMANCE,
                        RecommendationPriority.MEDIUM,
                        "Optimize " + large.packageName() + " Bundle Size",
                        String.format(
                                Locale.ROOT, "Package %s bundle size is %.1fMB", large.packageName(), packageMegabytes),
                        "Package-specific optimization can reduce overall bundle size",
                        RecommendationEffort.MEDIUM,
                        large.suggestions(),
                        List.of(large.packageName())));
            }
        }

        if (bundle.reductionPercentage() < thresholds.bundleReductionTarget()) {
            out.add(new Recommendation(
                    RecommendationCategory.PERFORMANCE,
                    bundle.reductionPercentage() < thresholds.bundleReductionFloor()
                            ? RecommendationPriority.HIGH
                            : RecommendationPriority.MEDIUM,
                    "Achieve Bundle Size Reduction Target",
                    String.format(
                            Locale.ROOT,
                            "Current bundle size reduction of %.1f%% is below %s%% target",
                            bundle.reductionPercentage(),
                            format(thresholds.bundleReductionTarget())),
                    "Meeting bundle size reduction targets improves application performance",
                    RecommendationEffort.MEDIUM,
                    List.of(
                            "Identify and remove duplicate dependencies across packages",
                            "Implement tree shaking for unused exports",
                            "Optimize shared utilities to reduce redundancy",
                            "Consider package consolidation opportunities"),
                    bundle.packageSizes().keySet().stream().sorted().toList()));
        }
    }

    void checkMemory(PerformanceAnalysis.MemoryProfile memory, List<Recommendation> out) {
        List<PerformanceAnalysis.MemoryLeak> severe = memory.leaks().stream()
                .filter(leak -> leak.severity() == FindingSeverity.HIGH)
                .toList();
        if (!severe.isEmpty()) {
            out.add(new Recommendation(
                    RecommendationCategory.PERFORMANCE,
                    RecommendationPriority.CRITICAL,
                    "Fix Critical Memory Leaks",
                    severe.size() + " critical memory leaks detected",
                    "Memory leaks can cause application crashes and performance degradation",
                    RecommendationEffort.HIGH,
                    severe.stream().map(leak -> "Fix memory leak in " + leak.location() + ": " + leak.suggestion()).toList(),
                    distinct(severe.stream().map(leak -> leak.location().split("/")[0]).toList())));
        }
        List<PerformanceAnalysis.MemoryLeak> moderate = memory.leaks().stream()
                .filter(leak -> leak.severity() == FindingSeverity.MEDIUM)
                .toList();
        if (!moderate.isEmpty()) {
            out.add(new Recommendation(
                    RecommendationCategory.PERFORMANCE,
                    RecommendationPriority.MEDIUM,
                    "Address Memory Leaks",
                    moderate.size() + " memory leaks need attention",
                    "Addressing memory leaks improves application stability",
                    RecommendationEffort.MEDIUM,
                    moderate.stream().map(PerformanceAnalysis.MemoryLeak::suggestion).toList(),
                    distinct(moderate.stream().map(leak -> leak.location().split("/")[0]).toList())));
        }

        for (PerformanceAnalysis.MemoryOptimization optimization : memory.optimizations()) {
            double savings = optimization.potentialSavingsBytes() / BYTES_PER_MEGABYTE;
            if (savings > thresholds.memorySavingsMegabytes()) {
                out.add(new Recommendation(
                        RecommendationCategory.PERFORMANCE,
                        RecommendationPriority.MEDIUM,
                        "Optimize Memory Usage in " + optimization.area(),
                        "Potential memory savings of " + Math.round(savings) + "MB identified",
                        "Memory optimization improves application performance and resource utilization",
                        RecommendationEffort.MEDIUM,
                        optimization.recommendation() == null ? List.of() : List.of(optimization.recommendation()),
                        List.of(optimization.area())));
            }
        }

        double buildMegabytes = memory.build().heapUsedBytes() / BYTES_PER_MEGABYTE;
        if (buildMegabytes > thresholds.memoryMegabytes().poor()) {
            out.add(new Recommendation(
                    RecommendationCategory.BUILD,
                    RecommendationPriority.MEDIUM,
                    "Optimize Build Memory Usage",
                    "Build process uses " + Math.round(buildMegabytes) + "MB of memory",
                    "High memory usage during builds can slow down CI/CD and development",
                    RecommendationEffort.MEDIUM,
                    List.of(
                            "Reduce compiler memory usage with incremental compilation",
                            "Consider using build workers to distribute memory load",
                            "Review build tools configuration for memory efficiency",
                            "Implement build process memory monitoring"),
                    List.of("build-system")));
        }
    }

    void checkDeveloperExperience(PerformanceAnalysis.DevExperienceMetrics dev, List<Recommendation> out) {
        if (dev.autocompleteMillis() > thresholds.autocompleteMillis()) {
            out.add(new Recommendation(
                    RecommendationCategory.DEVELOPER_EXPERIENCE,
                    RecommendationPriority.MEDIUM,
                    "Improve TypeScript Autocomplete Performance",
                    "Autocomplete response time of " + format(dev.autocompleteMillis()) + "ms is slow",
                    "Slow autocomplete impacts developer productivity",
                    RecommendationEffort.MEDIUM,
                    List.of(
                            "Optimize TypeScript configuration for better performance",
                            "Consider using project references for large codebases",
                            "Review and optimize type definitions",
                            "Enable incremental compilation"),
                    List.of("typescript-config")));
        }
        if (dev.navigationMillis() > thresholds.navigationMillis()) {
            out.add(new Recommendation(
                    RecommendationCategory.DEVELOPER_EXPERIENCE,
                    RecommendationPriority.MEDIUM,
                    "Optimize IDE Navigation Performance",
                    "IDE navigation takes " + format(dev.navigationMillis()) + "ms on average",
                    "Slow navigation reduces development efficiency",
                    RecommendationEffort.LOW,
                    List.of(
                            "Optimize IDE indexing configuration",
                            "Review workspace settings for performance",
                            "Consider excluding unnecessary files from indexing"),
                    List.of("ide-config")));
        }
        if (dev.circularImports() > 0) {
            out.add(new Recommendation(
                    RecommendationCategory.ARCHITECTURE,
                    RecommendationPriority.HIGH,
                    "Resolve Circular Import Dependencies",
                    dev.circularImports() + " circular dependencies found in import paths",
                    "Circular dependencies can cause build issues and runtime errors",
                    RecommendationEffort.HIGH,
                    List.of(
                            "Identify and break circular import chains",
                            "Refactor shared utilities to eliminate circular references",
                            "Implement dependency injection where appropriate",
                            "Use interface segregation to reduce coupling"),
                    List.of("shared-utilities")));
        }
        if (dev.inconsistentImportPaths() > thresholds.inconsistentImportPaths()) {
            out.add(new Recommendation(
                    RecommendationCategory.DEVELOPER_EXPERIENCE,
                    RecommendationPriority.LOW,
                    "Standardize Import Paths",
                    dev.inconsistentImportPaths() + " inconsistent import paths found",
                    "Consistent import paths improve code maintainability",
                    RecommendationEffort.LOW,
                    List.of(
                            "Establish import path conventions",
                            "Use path mapping consistently",
                            "Implement linting rules for import path consistency",
                            "Create automated tools to fix inconsistent imports"),
                    List.of("all-packages")));
        }
    }

    void checkTests(SystemValidation.TestResults tests, List<Recommendation> out) {
        double coverage = tests.coverage().overall();
        RecommendationThresholds.Tier tier = thresholds.testCoverage();
        if (coverage < tier.poor()) {
            out.add(new Recommendation(
                    RecommendationCategory.BUILD,
                    RecommendationPriority.CRITICAL,
                    "Improve Test Coverage",
                    "Test coverage of " + format(coverage) + "% is below acceptable threshold",
                    "Low test coverage increases risk of bugs and reduces code quality",
                    RecommendationEffort.HIGH,
                    List.of(
                            "Identify untested code paths and add comprehensive tests",
                            "Implement test-driven development practices",
                            "Add integration tests for critical workflows",
                            "Set up automated coverage reporting and enforcement"),
                    packagesBelow(tests.coverage(), tier.poor())));
        } else if (coverage < tier.good()) {
            out.add(new Recommendation(
                    RecommendationCategory.BUILD,
                    RecommendationPriority.MEDIUM,
                    "Enhance Test Coverage",
                    "Test coverage can be improved from " + format(coverage) + "%",
                    "Better test coverage improves code quality and reduces bugs",
                    RecommendationEffort.MEDIUM,
                    List.of(
                            "Add tests for edge cases and error conditions",
                            "Improve test coverage for utility functions",
                            "Add integration tests where missing"),
                    packagesBelow(tests.coverage(), tier.good())));
        }
        if (tests.failedTests() > 0) {
            out.add(new Recommendation(
                    RecommendationCategory.BUILD,
                    RecommendationPriority.CRITICAL,
                    "Fix Failing Tests",
                    tests.failedTests() + " tests are currently failing",
                    "Failing tests indicate potential bugs and prevent reliable deployments",
                    RecommendationEffort.HIGH,
                    List.of(
                            "Investigate and fix root causes of test failures",
                            "Update tests if they are outdated due to code changes",
                            "Ensure test environment consistency",
                            "Implement proper test isolation"),
                    tests.packageResults().stream()
                            .filter(result -> !result.passed())
                            .map(SystemValidation.PackageTestResult::packageName)
                            .toList()));
        }
    }

    void checkApi(SystemValidation.EndpointResults api, List<Recommendation> out) {
        if (!api.failedEndpoints().isEmpty()) {
            out.add(new Recommendation(
                    RecommendationCategory.BUILD,
                    RecommendationPriority.CRITICAL,
                    "Fix API Endpoint Failures",
                    api.failedEndpoints().size() + " API endpoints are failing validation",
                    "Failed API endpoints can break application functionality",
                    RecommendationEffort.HIGH,
                    List.of(
                            "Investigate and fix failing API endpoints",
                            "Ensure proper error handling and response formats",
                            "Update API documentation and contracts",
                            "Implement comprehensive API testing"),
                    List.of("backend", "api")));
        }
        if (api.responseTimes().p95Millis() > thresholds.apiP95Millis()) {
            out.add(new Recommendation(
                    RecommendationCategory.PERFORMANCE,
                    RecommendationPriority.MEDIUM,
                    "Optimize API Response Times",
                    "95th percentile response time is " + format(api.responseTimes().p95Millis()) + "ms",
                    "Slow API responses impact user experience",
                    RecommendationEffort.MEDIUM,
                    List.of(
                            "Identify and optimize slow API endpoints",
                            "Implement caching strategies",
                            "Optimize database queries",
                            "Consider API response compression"),
                    List.of("backend", "api")));
        }
    }

    void checkEndToEnd(SystemValidation.WorkflowResults e2e, List<Recommendation> out) {
        if (!e2e.failedWorkflows().isEmpty()) {
            out.add(new Recommendation(
                    RecommendationCategory.BUILD,
                    RecommendationPriority.CRITICAL,
                    "Fix E2E Workflow Failures",
                    e2e.failedWorkflows().size() + " E2E workflows are failing",
                    "Failed E2E tests indicate broken user workflows",
                    RecommendationEffort.HIGH,
                    List.of(
                            "Investigate and fix failing E2E workflows",
                            "Update E2E tests for recent UI changes",
                            "Ensure test environment stability",
                            "Implement better error handling in tests"),
                    List.of("frontend", "e2e-tests")));
        }
        if (!e2e.failedIntegrations().isEmpty()) {
            List<String> packages = new ArrayList<>();
            for (SystemValidation.IntegrationFailure failure : e2e.failedIntegrations()) {
                packages.add(failure.fromPackage());
                packages.add(failure.toPackage());
            }
            out.add(new Recommendation(
                    RecommendationCategory.ARCHITECTURE,
                    RecommendationPriority.HIGH,
                    "Fix Cross-Package Integration Issues",
                    e2e.failedIntegrations().size() + " cross-package integrations are failing",
                    "Integration failures can break application functionality",
                    RecommendationEffort.HIGH,
                    List.of(
                            "Fix broken integrations between packages",
                            "Update integration contracts and interfaces",
                            "Implement comprehensive integration testing",
                            "Review package boundaries and dependencies"),
                    distinct(packages)));
        }
    }

    void checkDependencies(ArchitectureValidation.DependencyReport dependencies, List<Recommendation> out) {
        List<ArchitectureValidation.CircularDependency> severe = dependencies.circularDependencies().stream()
                .filter(cycle -> cycle.severity() == FindingSeverity.HIGH)
                .toList();
        if (!severe.isEmpty()) {
            out.add(new Recommendation(
                    RecommendationCategory.ARCHITECTURE,
                    RecommendationPriority.CRITICAL,
                    "Resolve Critical Circular Dependencies",
                    severe.size() + " critical circular dependencies found",
                    "Circular dependencies can cause build failures and runtime issues",
                    RecommendationEffort.HIGH,
                    severe.stream().map(ArchitectureValidation.CircularDependency::suggestion).toList(),
                    distinct(severe.stream().flatMap(cycle -> cycle.packages().stream()).toList())));
        }
        if (!dependencies.boundaryViolations().isEmpty()) {
            List<String> packages = new ArrayList<>();
            for (ArchitectureValidation.BoundaryViolation violation : dependencies.boundaryViolations()) {
                packages.add(violation.fromPackage());
                packages.add(violation.toPackage());
            }
            out.add(new Recommendation(
                    RecommendationCategory.ARCHITECTURE,
                    RecommendationPriority.HIGH,
                    "Fix Package Boundary Violations",
                    dependencies.boundaryViolations().size() + " package boundary violations found",
                    "Boundary violations compromise architectural integrity",
                    RecommendationEffort.MEDIUM,
                    dependencies.boundaryViolations().stream()
                            .map(ArchitectureValidation.BoundaryViolation::suggestion)
                            .toList(),
                    distinct(packages)));
        }
        if (dependencies.healthScore() < thresholds.healthScore()) {
            out.add(new Recommendation(
                    RecommendationCategory.ARCHITECTURE,
                    dependencies.healthScore() < thresholds.criticalHealthScore()
                            ? RecommendationPriority.CRITICAL
                            : RecommendationPriority.HIGH,
                    "Improve Architecture Health Score",
                    "Architecture health score of " + format(dependencies.healthScore()) + "/100 needs improvement",
                    "Poor architecture health affects maintainability and scalability",
                    RecommendationEffort.HIGH,
                    List.of(
                            "Address circular dependencies and boundary violations",
                            "Improve package cohesion and reduce coupling",
                            "Refactor complex dependency relationships",
                            "Implement clear architectural boundaries"),
                    List.of("architecture")));
        }
    }

    void checkOrganization(ArchitectureValidation.OrganizationReport organization, List<Recommendation> out) {
        if (organization.separationScore() < thresholds.separationScore()) {
            out.add(new Recommendation(
                    RecommendationCategory.ARCHITECTURE,
                    RecommendationPriority.MEDIUM,
                    "Improve Separation of Concerns",
                    "Separation of concerns score is " + format(organization.separationScore()) + "/100",
                    "Poor separation of concerns reduces code maintainability",
                    RecommendationEffort.HIGH,
                    organization.separationSuggestions(),
                    List.of("code-organization")));
        }
        if (organization.duplicationPercentage() > thresholds.duplicationPercentage()) {
            out.add(new Recommendation(
                    RecommendationCategory.ARCHITECTURE,
                    RecommendationPriority.MEDIUM,
                    "Reduce Code Duplication",
                    format(organization.duplicationPercentage()) + "% code duplication found",
                    "Code duplication increases maintenance burden and bug risk",
                    RecommendationEffort.MEDIUM,
                    List.of(
                            "Extract common functionality into shared utilities",
                            "Implement proper abstraction layers",
                            "Refactor duplicated code blocks",
                            "Establish code reuse patterns"),
                    distinct(organization.duplicatedPackages())));
        }
        if (organization.namingConsistencyScore() < thresholds.namingScore()) {
            out.add(new Recommendation(
                    RecommendationCategory.DEVELOPER_EXPERIENCE,
                    RecommendationPriority.LOW,
                    "Improve Naming Consistency",
                    "Naming consistency score is " + format(organization.namingConsistencyScore()) + "/100",
                    "Consistent naming improves code readability and maintainability",
                    RecommendationEffort.LOW,
                    organization.namingSuggestions(),
                    List.of("naming-conventions")));
        }
    }

    void checkTypeSafety(ArchitectureValidation.TypeSafetyReport typeSafety, List<Recommendation> out) {
        if (typeSafety.crossPackageTypeConsistency() < thresholds.typeConsistency()) {
            out.add(new Recommendation(
                    RecommendationCategory.ARCHITECTURE,
                    RecommendationPriority.MEDIUM,
                    "Improve Cross-Package Type Consistency",
                    "Type consistency score is " + format(typeSafety.crossPackageTypeConsistency()) + "/100",
                    "Inconsistent types can cause runtime errors and integration issues",
                    RecommendationEffort.MEDIUM,
                    List.of(
                            "Standardize shared type definitions",
                            "Enable strict compiler settings",
                            "Create shared type libraries",
                            "Establish type compatibility testing"),
                    List.of("shared-types")));
        }
        if (!typeSafety.incompatibleInterfaces().isEmpty()) {
            out.add(new Recommendation(
                    RecommendationCategory.ARCHITECTURE,
                    RecommendationPriority.HIGH,
                    "Fix Interface Compatibility Issues",
                    typeSafety.incompatibleInterfaces().size() + " interface compatibility issues found",
                    "Interface incompatibilities can cause integration failures",
                    RecommendationEffort.MEDIUM,
                    typeSafety.suggestions(),
                    distinct(typeSafety.incompatibleInterfaces().stream()
                            .flatMap(incompatibility -> incompatibility.packages().stream())
                            .toList())));
        }
    }

    static RecommendationCategory categoryOf(Metric metric) {
        return switch (metric) {
            case BUILD_TIME, CACHE_HIT_RATE, PARALLEL_EFFICIENCY, TEST_COVERAGE -> RecommendationCategory.BUILD;
            case ARCHITECTURE_HEALTH_SCORE -> RecommendationCategory.ARCHITECTURE;
            case TYPESCRIPT_COMPILATION_TIME, AUTOCOMPLETE_SPEED -> RecommendationCategory.DEVELOPER_EXPERIENCE;
            case BUNDLE_SIZE, MEMORY_USAGE -> RecommendationCategory.PERFORMANCE;
        };
    }

    static RecommendationPriority priorityOf(RegressionSeverity severity) {
        return switch (severity) {
            case CRITICAL -> RecommendationPriority.CRITICAL;
            case MAJOR -> RecommendationPriority.HIGH;
            case MINOR -> RecommendationPriority.MEDIUM;
        };
    }

    private static List<String> packagesBelow(SystemValidation.Coverage coverage, double threshold) {
        return coverage.packageCoverage().entrySet().stream()
                .filter(entry -> entry.getValue() < threshold)
                .map(Map.Entry::getKey)
                .sorted()
                .toList();
    }

    private static List<String> distinct(List<String> values) {
        return List.copyOf(new LinkedHashSet<>(values));
    }

    private static String format(double value) {
        if (value == Math.rint(value)) {
            return Long.toString((long) value);
        }
        return String.format(Locale.ROOT, "%.1f", value);
    }
}
