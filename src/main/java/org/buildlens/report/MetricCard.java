package org.buildlens.report;

import java.util.Objects;

/**
 * Headline metric shown on the report dashboard.
 */
public record MetricCard(String id, String title, double value, String unit, CardStatus status) {
    public MetricCard {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        Objects.requireNonNull(title, "title");
        unit = unit == null ? "" : unit;
        Objects.requireNonNull(status, "status");
    }
}
