package org.buildlens.model;

import java.util.Locale;

/**
 * Severity reported by a checker for an individual finding (leak, cycle, incompatibility).
 */
public enum FindingSeverity {
    LOW,
    MEDIUM,
    HIGH;

    public static FindingSeverity fromKey(String key) {
        if (key == null || key.isBlank()) {
            return LOW;
        }
        return valueOf(key.trim().toUpperCase(Locale.ROOT));
    }
}
