package org.buildlens.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Provenance of a snapshot; every field is optional and blank values normalize to null.
 */
public record SnapshotMetadata(
        String gitCommit,
        String branch,
        String version,
        String environment,
        String triggeredBy) {
    private static final SnapshotMetadata EMPTY = new SnapshotMetadata(null, null, null, null, null);

    public SnapshotMetadata {
        gitCommit = normalize(gitCommit);
        branch = normalize(branch);
        version = normalize(version);
        environment = normalize(environment);
        triggeredBy = normalize(triggeredBy);
    }

    public static SnapshotMetadata empty() {
        return EMPTY;
    }

    public Map<String, String> asMap() {
        Map<String, String> values = new LinkedHashMap<>();
        putIfPresent(values, "gitCommit", gitCommit);
        putIfPresent(values, "branch", branch);
        putIfPresent(values, "version", version);
        putIfPresent(values, "environment", environment);
        putIfPresent(values, "triggeredBy", triggeredBy);
        return values;
    }

    private static void putIfPresent(Map<String, String> values, String key, String value) {
        if (value != null) {
            values.put(key, value);
        }
    }

    private static String normalize(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
