package org.buildlens.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validation sections whose values pass every recommendation check.
 */
public final class ValidationFixtures {
    public static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");
    public static final double MEGABYTE = 1024.0 * 1024.0;

    private ValidationFixtures() {
    }

    public static PerformanceAnalysis.BuildMetrics healthyBuild() {
        return new PerformanceAnalysis.BuildMetrics(
                20_000, Map.of("core", 12_000.0, "ui", 8_000.0), 80, 90, 35, List.of());
    }

    public static PerformanceAnalysis healthyPerformance() {
        return new PerformanceAnalysis(
                healthyBuild(),
                new PerformanceAnalysis.BundleMetrics(
                        4 * MEGABYTE, Map.of("core", 3 * MEGABYTE, "ui", MEGABYTE), 25, List.of()),
                PerformanceAnalysis.MemoryProfile.empty(),
                PerformanceAnalysis.DevExperienceMetrics.empty());
    }

    public static SystemValidation.TestResults healthyTests() {
        return new SystemValidation.TestResults(
                200,
                200,
                0,
                0,
                new SystemValidation.Coverage(85, 86, 80, 88, 85, Map.of("core", 90.0, "ui", 80.0)),
                List.of(),
                12_000L);
    }

    public static SystemValidation healthySystem() {
        return new SystemValidation(
                healthyTests(),
                new SystemValidation.EndpointResults(10, 10, List.of(), new SystemValidation.ResponseTimes(90, 80, 300, 500)),
                new SystemValidation.WorkflowResults(5, 5, List.of(), 3, 3, List.of()),
                SystemValidation.BuildResults.empty());
    }

    public static ValidationResult healthyResult() {
        return result(healthySystem(), healthyPerformance(), ArchitectureValidation.empty(), Set.of());
    }

    public static ValidationResult result(
            SystemValidation system,
            PerformanceAnalysis performance,
            ArchitectureValidation architecture,
            Set<ValidationComponent> substituted) {
        return new ValidationResult(
                NOW,
                ValidationStatus.SUCCESS,
                system,
                performance,
                architecture,
                List.of(),
                List.of(),
                List.of(),
                substituted);
    }
}
