package org.buildlens.model;

import java.util.Locale;

/**
 * Urgency of a recommendation; {@link #rank()} grows with urgency.
 */
public enum RecommendationPriority {
    LOW(1),
    MEDIUM(2),
    HIGH(3),
    CRITICAL(4);

    private final int rank;

    RecommendationPriority(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
