package org.buildlens.controller;

import java.util.List;
import java.util.Objects;
import org.buildlens.model.IssueType;

/**
 * Failure raised by a checker, carrying the remediation hints recorded with the issue.
 */
public final class ComponentException extends RuntimeException {
    private final IssueType issueType;
    private final List<String> suggestions;
    private final List<String> affectedPackages;

    public ComponentException(String message) {
        this(null, message, List.of(), List.of(), null);
    }

    public ComponentException(IssueType issueType, String message, List<String> suggestions, List<String> affectedPackages) {
        this(issueType, message, suggestions, affectedPackages, null);
    }

    public ComponentException(
            IssueType issueType,
            String message,
            List<String> suggestions,
            List<String> affectedPackages,
            Throwable cause) {
        super(message, cause);
        this.issueType = issueType;
        this.suggestions = List.copyOf(Objects.requireNonNull(suggestions, "suggestions"));
        this.affectedPackages = List.copyOf(Objects.requireNonNull(affectedPackages, "affectedPackages"));
    }

    /**
     * Issue type to record, or null to use the component's default.
     */
    public IssueType issueType() {
        return issueType;
    }

    public List<String> suggestions() {
        return suggestions;
    }

    public List<String> affectedPackages() {
        return affectedPackages;
    }
}
