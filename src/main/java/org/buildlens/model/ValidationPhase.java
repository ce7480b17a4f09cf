package org.buildlens.model;

/**
 * Validation phases in execution order.
 */
public enum ValidationPhase {
    SYSTEM("system"),
    PERFORMANCE("performance"),
    ARCHITECTURE("architecture");

    private final String key;

    ValidationPhase(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }
}
