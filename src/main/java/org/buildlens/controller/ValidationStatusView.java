package org.buildlens.controller;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.buildlens.model.ValidationIssue;
import org.buildlens.model.ValidationPhase;

/**
 * Point-in-time view of a controller; {@code startTime} and {@code currentPhase} may be null.
 */
public record ValidationStatusView(
        ControllerState state,
        boolean running,
        Instant startTime,
        ValidationPhase currentPhase,
        List<ValidationIssue> issues) {
    public ValidationStatusView {
        issues = List.copyOf(issues);
    }

    public Optional<Instant> startedAt() {
        return Optional.ofNullable(startTime);
    }
}
