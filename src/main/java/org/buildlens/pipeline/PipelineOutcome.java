package org.buildlens.pipeline;

import java.util.Objects;
import org.buildlens.model.MetricSnapshot;
import org.buildlens.model.ValidationResult;
import org.buildlens.report.ValidationReport;

/**
 * Products of one pipeline execution.
 */
public record PipelineOutcome(ValidationResult result, MetricSnapshot snapshot, ValidationReport report) {
    public PipelineOutcome {
        Objects.requireNonNull(result, "result");
        Objects.requireNonNull(snapshot, "snapshot");
        Objects.requireNonNull(report, "report");
    }
}
