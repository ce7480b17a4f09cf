package org.buildlens.analysis;

public enum ComparisonStatus {
    IMPROVED,
    DEGRADED,
    STABLE
}
