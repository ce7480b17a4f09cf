package org.buildlens.analysis;

public enum TrendSignificance {
    HIGH,
    MEDIUM,
    LOW
}
