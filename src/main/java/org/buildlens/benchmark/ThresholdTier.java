package org.buildlens.benchmark;

/**
 * Scoring tiers of a benchmark; each maps to the score awarded at or better than its threshold.
 */
public enum ThresholdTier {
    EXCELLENT("excellent", 100.0),
    GOOD("good", 80.0),
    POOR("poor", 60.0);

    private final String key;
    private final double score;

    ThresholdTier(String key, double score) {
        this.key = key;
        this.score = score;
    }

    public String key() {
        return key;
    }

    public double score() {
        return score;
    }
}
