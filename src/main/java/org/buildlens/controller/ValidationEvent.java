package org.buildlens.controller;

import java.time.Instant;
import java.util.Objects;
import org.buildlens.model.ValidationComponent;
import org.buildlens.model.ValidationPhase;

/**
 * Lifecycle notification emitted by {@link ValidationController}.
 *
 * <p>{@code phase} and {@code component} are null for run-level events; {@code message} holds
 * the failure text of failure events and the run status of {@link Type#COMPLETED}.
 */
public record ValidationEvent(
        Type type,
        String runId,
        ValidationPhase phase,
        ValidationComponent component,
        String message,
        Instant timestamp) {
    public ValidationEvent {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(runId, "runId");
        Objects.requireNonNull(timestamp, "timestamp");
    }

    public enum Type {
        STARTED,
        PHASE_STARTED,
        COMPONENT_STARTED,
        COMPONENT_COMPLETED,
        COMPONENT_FAILED,
        PHASE_COMPLETED,
        COMPLETED,
        FAILED
    }
}
