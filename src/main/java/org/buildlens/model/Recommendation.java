package org.buildlens.model;

import java.util.List;
import java.util.Objects;

/**
 * Actionable optimization suggestion.
 */
public record Recommendation(
        RecommendationCategory category,
        RecommendationPriority priority,
        String title,
        String description,
        String impact,
        RecommendationEffort effort,
        List<String> steps,
        List<String> affectedPackages) {
    public Recommendation {
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(priority, "priority");
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("title must not be blank");
        }
        description = description == null ? "" : description;
        impact = impact == null ? "" : impact;
        Objects.requireNonNull(effort, "effort");
        steps = List.copyOf(steps);
        affectedPackages = List.copyOf(affectedPackages);
    }

    public boolean affects(String packageName) {
        return affectedPackages.contains(packageName);
    }
}
