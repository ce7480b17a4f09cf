package org.buildlens.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Failure recorded during a run; {@code component} and {@code phase} are null for run-level issues.
 */
public record ValidationIssue(
        IssueType type,
        IssueSeverity severity,
        ValidationPhase phase,
        String component,
        String message,
        String stackTrace,
        List<String> affectedPackages,
        List<String> suggestions,
        Instant timestamp) {
    public ValidationIssue {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(severity, "severity");
        message = message == null ? "" : message;
        stackTrace = stackTrace == null ? "" : stackTrace;
        affectedPackages = List.copyOf(affectedPackages);
        suggestions = List.copyOf(suggestions);
        Objects.requireNonNull(timestamp, "timestamp");
    }
}
