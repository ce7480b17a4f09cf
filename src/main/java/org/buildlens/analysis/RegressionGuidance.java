package org.buildlens.analysis;

import java.util.ArrayList;
import java.util.List;
import org.buildlens.model.Metric;

/**
 * Templated causes and remediation steps for a regressed metric.
 */
final class RegressionGuidance {
    static final String ROLLBACK_STEP = "Investigate immediately and consider rollback if necessary";

    private RegressionGuidance() {
    }

    static List<String> causes(Metric metric) {
        return switch (metric) {
            case BUILD_TIME -> List.of(
                    "New dependencies added",
                    "Build cache invalidation",
                    "Increased code complexity",
                    "CI/CD environment changes",
                    "TypeScript configuration changes");
            case BUNDLE_SIZE -> List.of(
                    "New large dependencies",
                    "Unused code not tree-shaken",
                    "Asset optimization disabled",
                    "Code duplication increased",
                    "Dynamic imports not used");
            case TEST_COVERAGE -> List.of(
                    "New untested code added",
                    "Tests removed or disabled",
                    "Coverage configuration changed",
                    "Test files excluded",
                    "Code complexity increased");
            case MEMORY_USAGE -> List.of(
                    "Memory leaks introduced",
                    "Large objects not garbage collected",
                    "Caching strategy changed",
                    "Build process changes",
                    "Runtime version upgrade");
            case CACHE_HIT_RATE -> List.of(
                    "Cache configuration changed",
                    "Build outputs not deterministic",
                    "Cache invalidation rules changed",
                    "File system changes",
                    "Environment differences");
            default -> List.of(
                    "Code changes affecting performance",
                    "Configuration changes",
                    "Environment differences",
                    "Dependency updates");
        };
    }

    static List<String> recommendations(Metric metric, RegressionSeverity severity) {
        List<String> steps = new ArrayList<>();
        if (severity == RegressionSeverity.CRITICAL) {
            steps.add(ROLLBACK_STEP);
        }
        switch (metric) {
            case BUILD_TIME -> steps.addAll(List.of(
                    "Review recent dependency changes",
                    "Check build cache configuration",
                    "Analyze build bottlenecks",
                    "Consider parallel build optimization"));
            case BUNDLE_SIZE -> steps.addAll(List.of(
                    "Analyze bundle composition",
                    "Review new dependencies",
                    "Implement code splitting",
                    "Enable tree shaking"));
            case TEST_COVERAGE -> steps.addAll(List.of(
                    "Add tests for new code",
                    "Review coverage configuration",
                    "Identify untested code paths",
                    "Update test exclusion rules"));
            case MEMORY_USAGE -> steps.addAll(List.of(
                    "Profile memory usage",
                    "Check for memory leaks",
                    "Review caching strategies",
                    "Optimize object lifecycle"));
            default -> steps.addAll(List.of(
                    "Review recent changes",
                    "Compare with baseline configuration",
                    "Monitor metric closely",
                    "Consider performance optimization"));
        }
        return List.copyOf(steps);
    }
}
