package org.buildlens.model;

public enum IssueSeverity {
    CRITICAL,
    WARNING,
    INFO
}
