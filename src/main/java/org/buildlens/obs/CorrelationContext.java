package org.buildlens.obs;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Correlation metadata emitted with every structured log event of a pipeline run.
 */
public final class CorrelationContext {
    private final String runId;
    private final String operation;
    private final String phase;
    private final String component;

    private CorrelationContext(Builder builder) {
        this.runId = requireText(builder.runId, "runId");
        this.operation = requireText(builder.operation, "operation");
        this.phase = normalize(builder.phase);
        this.component = normalize(builder.component);
    }

    public static CorrelationContext of(String runId, String operation) {
        return builder(runId, operation).build();
    }

    public static Builder builder(String runId, String operation) {
        return new Builder(runId, operation);
    }

    public String runId() {
        return runId;
    }

    public String operation() {
        return operation;
    }

    public Optional<String> phase() {
        return Optional.ofNullable(phase);
    }

    public Optional<String> component() {
        return Optional.ofNullable(component);
    }

    /**
     * Returns a copy scoped to one component of one phase.
     */
    public CorrelationContext forComponent(String phaseName, String componentName) {
        return builder(runId, operation).phase(phaseName).component(componentName).build();
    }

    public Map<String, Object> asFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("runId", runId);
        fields.put("operation", operation);
        if (phase != null) {
            fields.put("phase", phase);
        }
        if (component != null) {
            fields.put("component", component);
        }
        return fields;
    }

    private static String requireText(String value, String fieldName) {
        String normalized = normalize(value);
        if (normalized == null) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return normalized;
    }

    private static String normalize(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public static final class Builder {
        private final String runId;
        private final String operation;
        private String phase;
        private String component;

        private Builder(String runId, String operation) {
            this.runId = Objects.requireNonNull(runId, "runId");
            this.operation = Objects.requireNonNull(operation, "operation");
        }

        public Builder phase(String phase) {
            this.phase = phase;
            return this;
        }

        public Builder component(String component) {
            this.component = component;
            return this;
        }

        public CorrelationContext build() {
            return new CorrelationContext(this);
        }
    }
}
