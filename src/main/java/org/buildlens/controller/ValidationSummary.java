package org.buildlens.controller;

import java.util.List;
import org.buildlens.model.ValidationStatus;

/**
 * Headline numbers of the last completed run.
 */
public record ValidationSummary(
        ValidationStatus overallStatus,
        int completedValidations,
        int totalValidations,
        long criticalIssues,
        double buildTimeImprovement,
        double bundleSizeReduction,
        List<String> nextSteps) {
    public ValidationSummary {
        nextSteps = List.copyOf(nextSteps);
    }
}
