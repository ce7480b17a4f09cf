package org.buildlens.analysis;

public enum TrendDirection {
    IMPROVING,
    DEGRADING,
    STABLE
}
