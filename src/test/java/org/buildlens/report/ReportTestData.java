package org.buildlens.report;

import java.util.List;
import java.util.Set;
import org.buildlens.model.ArchitectureValidation;
import org.buildlens.model.IssueSeverity;
import org.buildlens.model.IssueType;
import org.buildlens.model.Recommendation;
import org.buildlens.model.RecommendationCategory;
import org.buildlens.model.RecommendationEffort;
import org.buildlens.model.RecommendationPriority;
import org.buildlens.model.ValidationComponent;
import org.buildlens.model.ValidationFixtures;
import org.buildlens.model.ValidationIssue;
import org.buildlens.model.ValidationPhase;
import org.buildlens.model.ValidationResult;
import org.buildlens.model.ValidationStatus;

final class ReportTestData {
    private ReportTestData() {
    }

    static ValidationIssue bundleFailure() {
        return new ValidationIssue(
                IssueType.PERFORMANCE_REGRESSION,
                IssueSeverity.WARNING,
                ValidationPhase.PERFORMANCE,
                "bundle-metrics",
                "bundle analyzer crashed",
                "",
                List.of(),
                List.of(),
                ValidationFixtures.NOW);
    }

    /**
     * Healthy sections except for a failed bundle analysis.
     */
    static ValidationResult warningResult(List<Recommendation> recommendations) {
        return new ValidationResult(
                ValidationFixtures.NOW,
                ValidationStatus.WARNING,
                ValidationFixtures.healthySystem(),
                ValidationFixtures.healthyPerformance(),
                ArchitectureValidation.empty(),
                recommendations,
                List.of("Review and address warnings for optimal performance"),
                List.of(bundleFailure()),
                Set.of(ValidationComponent.BUNDLE_METRICS));
    }

    static Recommendation recommendation(String title, RecommendationPriority priority, RecommendationEffort effort) {
        return new Recommendation(
                RecommendationCategory.BUILD, priority, title, title + " description", "", effort, List.of(), List.of());
    }
}
