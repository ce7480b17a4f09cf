package org.buildlens.recommend;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.buildlens.model.Recommendation;

/**
 * Canonical recommendation order: priority descending, then effort ascending.
 */
public final class RecommendationOrdering {
    public static final Comparator<Recommendation> COMPARATOR = Comparator
            .comparingInt((Recommendation r) -> r.priority().rank())
            .reversed()
            .thenComparingInt(r -> r.effort().rank());

    private RecommendationOrdering() {
    }

    /**
     * Returns a sorted copy; recommendations that compare equal keep their input order.
     */
    public static List<Recommendation> sort(List<Recommendation> recommendations) {
        List<Recommendation> sorted = new ArrayList<>(recommendations);
        sorted.sort(COMPARATOR);
        return List.copyOf(sorted);
    }
}
