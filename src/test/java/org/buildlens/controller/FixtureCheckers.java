package org.buildlens.controller;

import org.buildlens.model.ArchitectureValidation;
import org.buildlens.model.PerformanceAnalysis;
import org.buildlens.model.SystemValidation;
import org.buildlens.model.ValidationFixtures;

/**
 * Checkers returning healthy fixture values; tests override single components.
 */
class FixtureCheckers implements ValidationCheckers {
    private final SystemValidation system = ValidationFixtures.healthySystem();
    private final PerformanceAnalysis performance = ValidationFixtures.healthyPerformance();
    private final ArchitectureValidation architecture = ArchitectureValidation.empty();

    @Override
    public SystemValidation.TestResults runTests() {
        return system.testResults();
    }

    @Override
    public SystemValidation.EndpointResults validateApi() {
        return system.apiValidation();
    }

    @Override
    public SystemValidation.WorkflowResults validateEndToEnd() {
        return system.e2eResults();
    }

    @Override
    public SystemValidation.BuildResults validateBuild() {
        return system.buildValidation();
    }

    @Override
    public PerformanceAnalysis.BuildMetrics measureBuild() {
        return performance.buildMetrics();
    }

    @Override
    public PerformanceAnalysis.BundleMetrics measureBundles() {
        return performance.bundleMetrics();
    }

    @Override
    public PerformanceAnalysis.MemoryProfile profileMemory() {
        return performance.memoryProfile();
    }

    @Override
    public PerformanceAnalysis.DevExperienceMetrics measureDevExperience() {
        return performance.devExperience();
    }

    @Override
    public ArchitectureValidation.DependencyReport analyzeDependencies() {
        return architecture.dependencyAnalysis();
    }

    @Override
    public ArchitectureValidation.OrganizationReport analyzeOrganization() {
        return architecture.codeOrganization();
    }

    @Override
    public ArchitectureValidation.TypeSafetyReport analyzeTypeSafety() {
        return architecture.typeSafety();
    }
}
