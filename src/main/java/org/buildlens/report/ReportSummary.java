package org.buildlens.report;

import java.util.List;
import java.util.Objects;
import org.buildlens.model.ValidationStatus;

/**
 * @param completedValidations phases whose components all produced a measurement
 */
public record ReportSummary(
        ValidationStatus overallStatus,
        int completedValidations,
        int totalValidations,
        long criticalIssues,
        double buildTimeImprovement,
        double bundleSizeReduction,
        List<String> nextSteps) {
    public ReportSummary {
        Objects.requireNonNull(overallStatus, "overallStatus");
        nextSteps = List.copyOf(nextSteps);
    }
}
