package org.buildlens.model;

import java.util.List;
import java.util.Objects;

/**
 * Outputs of the architecture phase: dependency graph health, code organization and type safety.
 *
 * <p>Neutral defaults report a clean architecture (scores of 100, no findings).
 */
public record ArchitectureValidation(
        DependencyReport dependencyAnalysis,
        OrganizationReport codeOrganization,
        TypeSafetyReport typeSafety) {
    public ArchitectureValidation {
        Objects.requireNonNull(dependencyAnalysis, "dependencyAnalysis");
        Objects.requireNonNull(codeOrganization, "codeOrganization");
        Objects.requireNonNull(typeSafety, "typeSafety");
    }

    public static ArchitectureValidation empty() {
        return new ArchitectureValidation(DependencyReport.empty(), OrganizationReport.empty(), TypeSafetyReport.empty());
    }

    public ArchitectureValidation withDependencyAnalysis(DependencyReport value) {
        return new ArchitectureValidation(value, codeOrganization, typeSafety);
    }

    public ArchitectureValidation withCodeOrganization(OrganizationReport value) {
        return new ArchitectureValidation(dependencyAnalysis, value, typeSafety);
    }

    public ArchitectureValidation withTypeSafety(TypeSafetyReport value) {
        return new ArchitectureValidation(dependencyAnalysis, codeOrganization, value);
    }

    public record DependencyReport(
            List<CircularDependency> circularDependencies,
            List<BoundaryViolation> boundaryViolations,
            double healthScore) {
        public DependencyReport {
            circularDependencies = List.copyOf(circularDependencies);
            boundaryViolations = List.copyOf(boundaryViolations);
        }

        public static DependencyReport empty() {
            return new DependencyReport(List.of(), List.of(), 100.0);
        }
    }

    public record CircularDependency(List<String> packages, FindingSeverity severity, String suggestion) {
        public CircularDependency {
            packages = List.copyOf(packages);
            Objects.requireNonNull(severity, "severity");
        }
    }

    public record BoundaryViolation(String fromPackage, String toPackage, String violationType, String suggestion) {
    }

    public record OrganizationReport(
            double separationScore,
            List<String> separationSuggestions,
            double duplicationPercentage,
            List<String> duplicatedPackages,
            double namingConsistencyScore,
            List<String> namingSuggestions,
            double overallScore) {
        public OrganizationReport {
            separationSuggestions = List.copyOf(separationSuggestions);
            duplicatedPackages = List.copyOf(duplicatedPackages);
            namingSuggestions = List.copyOf(namingSuggestions);
        }

        public static OrganizationReport empty() {
            return new OrganizationReport(100.0, List.of(), 0.0, List.of(), 100.0, List.of(), 100.0);
        }
    }

    public record TypeSafetyReport(
            double crossPackageTypeConsistency,
            int compatibleInterfaces,
            List<InterfaceIncompatibility> incompatibleInterfaces,
            List<String> suggestions,
            double overallScore) {
        public TypeSafetyReport {
            incompatibleInterfaces = List.copyOf(incompatibleInterfaces);
            suggestions = List.copyOf(suggestions);
        }

        public static TypeSafetyReport empty() {
            return new TypeSafetyReport(100.0, 0, List.of(), List.of(), 100.0);
        }
    }

    public record InterfaceIncompatibility(
            String interfaceName, List<String> packages, String issue, FindingSeverity severity) {
        public InterfaceIncompatibility {
            packages = List.copyOf(packages);
            Objects.requireNonNull(severity, "severity");
        }
    }
}
