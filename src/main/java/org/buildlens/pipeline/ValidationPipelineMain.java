package org.buildlens.pipeline;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Locale;
import org.buildlens.model.ValidationStatus;
import org.buildlens.obs.JsonLinesLogger;
import org.buildlens.obs.StructuredJsonLinesLogger;
import org.buildlens.report.ReportArtifactRenderer;
import org.buildlens.report.ValidationReport;
import org.buildlens.timeseries.MetricHistory;

/**
 * Command-line entry point: runs the pipeline once and writes the report artifacts.
 */
public final class ValidationPipelineMain {
    private ValidationPipelineMain() {
    }

    public static void main(String[] args) {
        if (containsHelpFlag(args)) {
            printUsage();
            return;
        }

        final PipelineConfig config;
        try {
            config = PipelineConfig.fromArgs(args);
        } catch (IllegalArgumentException exception) {
            System.err.println("Invalid argument: " + exception.getMessage());
            printUsage();
            System.exit(1);
            return;
        }

        final MeasurementBundle bundle;
        try {
            bundle = MeasurementBundle.load(config.measurementsFile());
        } catch (IllegalArgumentException exception) {
            System.err.println("Invalid measurements: " + exception.getMessage());
            System.exit(1);
            return;
        }

        ValidationReport report;
        List<Path> artifacts;
        try (JsonLinesLogger logger = StructuredJsonLinesLogger.stderr()) {
            ValidationPipeline pipeline = ValidationPipeline.fromConfig(config, bundle, logger, Clock.systemUTC());
            report = pipeline.execute(config.metadata()).report();
            artifacts = new ReportArtifactRenderer().writeArtifacts(report, config.outputDir());
            for (String configName : pipeline.benchmarks().configNames()) {
                pipeline.benchmarks().writeReport(configName, config.outputDir().resolve("benchmarks"));
            }
        }

        ValidationStatus status = report.summary().overallStatus();
        System.out.println("Build validation report generated.");
        System.out.println("- status: " + status.name());
        System.out.println("- criticalIssues: " + report.summary().criticalIssues());
        System.out.println("- regressions: " + report.regressions().size());
        System.out.println("- recommendations: " + report.recommendations().size());
        System.out.println("- reportJson: " + artifacts.get(0));
        System.out.println("- reportMarkdown: " + artifacts.get(1));

        if (config.failOnStatus() && status == ValidationStatus.FAILURE) {
            System.err.println("Build validation failed.");
            System.exit(2);
        }
    }

    private static boolean containsHelpFlag(String[] args) {
        for (String arg : args) {
            if ("--help".equals(arg) || "-h".equals(arg)) {
                return true;
            }
        }
        return false;
    }

    private static void printUsage() {
        System.out.println(String.format(
                Locale.ROOT,
                "Usage: ValidationPipelineMain --measurements=<file> [options]%n"
                        + "  --history-file=<file>      snapshot history (env %s, default %s)%n"
                        + "  --max-points=<n>           history capacity (default %d)%n"
                        + "  --benchmark-dir=<dir>      benchmark configs (default %s)%n"
                        + "  --results-dir=<dir>        benchmark results (default %s)%n"
                        + "  --thresholds=<file>        recommendation thresholds (JSON or YAML)%n"
                        + "  --output-dir=<dir>         report output (default %s)%n"
                        + "  --trend-days=<n>           trend window in days%n"
                        + "  --baseline-days=<n>        regression baseline window in days%n"
                        + "  --recent-days=<n>          regression recent window in days%n"
                        + "  --commit= --branch= --version= --environment= --triggered-by=%n"
                        + "  --no-fail-on-status        exit 0 even when the status is FAILURE",
                PipelineConfig.HISTORY_FILE_ENV,
                PipelineConfig.DEFAULT_HISTORY_FILE,
                MetricHistory.DEFAULT_MAX_POINTS,
                PipelineConfig.DEFAULT_BENCHMARK_DIR,
                PipelineConfig.DEFAULT_RESULTS_DIR,
                PipelineConfig.DEFAULT_OUTPUT_DIR));
    }
}
