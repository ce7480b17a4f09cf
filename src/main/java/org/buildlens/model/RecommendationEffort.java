package org.buildlens.model;

import java.util.Locale;

/**
 * Estimated cost of acting on a recommendation; {@link #rank()} grows with cost.
 */
public enum RecommendationEffort {
    LOW(1),
    MEDIUM(2),
    HIGH(3);

    private final int rank;

    RecommendationEffort(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
