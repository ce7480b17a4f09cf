package org.buildlens.model;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Run-level aggregate produced once per validation run.
 *
 * <p>{@code substitutedComponents} lists the components whose section holds the neutral default
 * because the checker failed.
 */
public record ValidationResult(
        Instant timestamp,
        ValidationStatus status,
        SystemValidation systemValidation,
        PerformanceAnalysis performanceAnalysis,
        ArchitectureValidation architectureValidation,
        List<Recommendation> recommendations,
        List<String> nextSteps,
        List<ValidationIssue> issues,
        Set<ValidationComponent> substitutedComponents) {
    public ValidationResult {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(systemValidation, "systemValidation");
        Objects.requireNonNull(performanceAnalysis, "performanceAnalysis");
        Objects.requireNonNull(architectureValidation, "architectureValidation");
        recommendations = List.copyOf(recommendations);
        nextSteps = List.copyOf(nextSteps);
        issues = List.copyOf(issues);
        substitutedComponents = substitutedComponents.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(substitutedComponents));
    }

    public boolean isSubstituted(ValidationComponent component) {
        return substitutedComponents.contains(component);
    }

    public long countIssues(IssueSeverity severity) {
        return issues.stream().filter(issue -> issue.severity() == severity).count();
    }
}
