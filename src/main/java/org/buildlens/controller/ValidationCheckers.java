package org.buildlens.controller;

import org.buildlens.model.ArchitectureValidation;
import org.buildlens.model.PerformanceAnalysis;
import org.buildlens.model.SystemValidation;

/**
 * External measurement collaborators, one method per validation component.
 *
 * <p>Implementations may throw any runtime exception; {@link ComponentException} adds an issue
 * type, suggestions and affected packages to the recorded issue.
 */
public interface ValidationCheckers {
    SystemValidation.TestResults runTests();

    SystemValidation.EndpointResults validateApi();

    SystemValidation.WorkflowResults validateEndToEnd();

    SystemValidation.BuildResults validateBuild();

    PerformanceAnalysis.BuildMetrics measureBuild();

    PerformanceAnalysis.BundleMetrics measureBundles();

    PerformanceAnalysis.MemoryProfile profileMemory();

    PerformanceAnalysis.DevExperienceMetrics measureDevExperience();

    ArchitectureValidation.DependencyReport analyzeDependencies();

    ArchitectureValidation.OrganizationReport analyzeOrganization();

    ArchitectureValidation.TypeSafetyReport analyzeTypeSafety();
}
