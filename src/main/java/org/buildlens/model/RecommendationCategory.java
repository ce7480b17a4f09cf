package org.buildlens.model;

public enum RecommendationCategory {
    PERFORMANCE("performance"),
    BUILD("build"),
    ARCHITECTURE("architecture"),
    DEVELOPER_EXPERIENCE("developer-experience");

    private final String key;

    RecommendationCategory(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }
}
