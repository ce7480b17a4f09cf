package org.buildlens.model;

public enum ValidationStatus {
    SUCCESS("success"),
    WARNING("warning"),
    FAILURE("failure");

    private final String key;

    ValidationStatus(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }
}
