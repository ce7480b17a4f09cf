package org.buildlens.controller;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.buildlens.model.ArchitectureValidation;
import org.buildlens.model.IssueSeverity;
import org.buildlens.model.IssueType;
import org.buildlens.model.PerformanceAnalysis;
import org.buildlens.model.Recommendation;
import org.buildlens.model.RecommendationEffort;
import org.buildlens.model.RecommendationPriority;
import org.buildlens.model.SystemValidation;
import org.buildlens.model.ValidationComponent;
import org.buildlens.model.ValidationIssue;
import org.buildlens.model.ValidationPhase;
import org.buildlens.model.ValidationResult;
import org.buildlens.model.ValidationStatus;
import org.buildlens.obs.CorrelationContext;
import org.buildlens.obs.JsonLinesLogger;

/**
 * Runs the system, performance and architecture phases in order and assembles a
 * {@link ValidationResult}.
 *
 * <p>A failing component never aborts the run: the failure is recorded as a warning issue and the
 * component's empty section is used instead. Only orchestrator failures end the run in
 * {@link ControllerState#FAILED}.
 */
public final class ValidationController {
    public static final Duration DEFAULT_COMPONENT_TIMEOUT = Duration.ofMinutes(5);
    private static final String OPERATION = "validate";

    private final ValidationCheckers checkers;
    private final JsonLinesLogger logger;
    private final Clock clock;
    private final ExecutorService executor;
    private final Duration componentTimeout;
    private final List<ValidationListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final List<ValidationIssue> issues = new CopyOnWriteArrayList<>();

    private volatile ControllerState state = ControllerState.IDLE;
    private volatile ValidationPhase currentPhase;
    private volatile Instant startTime;
    private volatile int completedPhases;
    private volatile ValidationResult lastResult;

    public ValidationController(ValidationCheckers checkers) {
        this(checkers, JsonLinesLogger.noop());
    }

    public ValidationController(ValidationCheckers checkers, JsonLinesLogger logger) {
        this(checkers, logger, Clock.systemUTC(), null, DEFAULT_COMPONENT_TIMEOUT);
    }

    /**
     * @param executor pool for component calls; when null each run uses its own pool sized to the
     *     largest phase and shuts it down afterwards
     */
    public ValidationController(
            ValidationCheckers checkers,
            JsonLinesLogger logger,
            Clock clock,
            ExecutorService executor,
            Duration componentTimeout) {
        this.checkers = Objects.requireNonNull(checkers, "checkers");
        this.logger = Objects.requireNonNull(logger, "logger");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.executor = executor;
        Objects.requireNonNull(componentTimeout, "componentTimeout");
        if (componentTimeout.isNegative() || componentTimeout.isZero()) {
            throw new IllegalArgumentException("componentTimeout must be positive");
        }
        this.componentTimeout = componentTimeout;
    }

    public void addListener(ValidationListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(ValidationListener listener) {
        listeners.remove(listener);
    }

    public ControllerState state() {
        return state;
    }

    public Optional<ValidationPhase> currentPhase() {
        return Optional.ofNullable(currentPhase);
    }

    public boolean isRunning() {
        return running.get();
    }

    public Optional<ValidationResult> lastResult() {
        return Optional.ofNullable(lastResult);
    }

    public ValidationResult run() {
        if (!running.compareAndSet(false, true)) {
            throw new AlreadyRunningException();
        }
        String runId = UUID.randomUUID().toString();
        CorrelationContext correlation = CorrelationContext.of(runId, OPERATION);
        issues.clear();
        completedPhases = 0;
        startTime = clock.instant();
        state = ControllerState.RUNNING;
        logger.info("validation started", correlation);
        emit(new ValidationEvent(ValidationEvent.Type.STARTED, runId, null, null, null, clock.instant()));

        try {
            ValidationResult result = execute(runId, correlation);
            lastResult = result;
            state = ControllerState.COMPLETED;
            logger.info("validation completed", correlation, Map.of(
                    "status", result.status().key(),
                    "issues", result.issues().size(),
                    "substituted", result.substitutedComponents().size()));
            emit(new ValidationEvent(
                    ValidationEvent.Type.COMPLETED, runId, null, null, result.status().key(), clock.instant()));
            return result;
        } catch (ValidationFatalException ex) {
            fail(runId, correlation, ex);
            throw ex;
        } catch (RuntimeException ex) {
            ValidationFatalException fatal = new ValidationFatalException("validation run failed: " + describe(ex), ex);
            fail(runId, correlation, fatal);
            throw fatal;
        } finally {
            currentPhase = null;
            running.set(false);
        }
    }

    public ValidationStatusView statusView() {
        return new ValidationStatusView(state, running.get(), startTime, currentPhase, issues);
    }

    /**
     * Summary of the current or last run; empty until the first phase has completed.
     */
    public Optional<ValidationSummary> summary() {
        if (completedPhases == 0) {
            return Optional.empty();
        }
        ValidationStatus status = statusOf(issues);
        ValidationResult result = lastResult;
        double buildTime = result == null ? 0.0 : result.performanceAnalysis().buildMetrics().improvementPercentage();
        double bundleSize = result == null ? 0.0 : result.performanceAnalysis().bundleMetrics().reductionPercentage();
        long critical = issues.stream().filter(issue -> issue.severity() == IssueSeverity.CRITICAL).count();
        return Optional.of(new ValidationSummary(
                status,
                completedPhases,
                ValidationPhase.values().length,
                critical,
                buildTime,
                bundleSize,
                nextSteps(status, List.of())));
    }

    private ValidationResult execute(String runId, CorrelationContext correlation) {
        ExecutorService pool = executor;
        boolean ownedPool = false;
        if (pool == null) {
            pool = Executors.newFixedThreadPool(largestPhase(), daemonThreads());
            ownedPool = true;
        }
        try {
            Sections sections = new Sections();
            for (ValidationPhase phase : ValidationPhase.values()) {
                runPhase(runId, correlation, phase, pool, sections);
                completedPhases++;
            }
            return assemble(correlation, sections);
        } finally {
            if (ownedPool) {
                pool.shutdownNow();
            }
        }
    }

    private void runPhase(
            String runId,
            CorrelationContext correlation,
            ValidationPhase phase,
            ExecutorService pool,
            Sections sections) {
        currentPhase = phase;
        emit(new ValidationEvent(ValidationEvent.Type.PHASE_STARTED, runId, phase, null, null, clock.instant()));

        Map<ValidationComponent, Future<Object>> futures = new LinkedHashMap<>();
        for (ValidationComponent component : ValidationComponent.of(phase)) {
            emit(new ValidationEvent(
                    ValidationEvent.Type.COMPONENT_STARTED, runId, phase, component, null, clock.instant()));
            try {
                futures.put(component, pool.submit(() -> invoke(component)));
            } catch (RejectedExecutionException ex) {
                throw new ValidationFatalException("cannot schedule component " + component.key(), ex);
            }
        }

        for (Map.Entry<ValidationComponent, Future<Object>> entry : futures.entrySet()) {
            ValidationComponent component = entry.getKey();
            Object value;
            try {
                value = await(component, entry.getValue());
            } catch (RuntimeException ex) {
                recordComponentFailure(runId, correlation, component, ex);
                sections.substitute(component);
                continue;
            }
            sections.apply(component, value);
            emit(new ValidationEvent(
                    ValidationEvent.Type.COMPONENT_COMPLETED, runId, phase, component, null, clock.instant()));
        }

        emit(new ValidationEvent(ValidationEvent.Type.PHASE_COMPLETED, runId, phase, null, null, clock.instant()));
    }

    private Object invoke(ValidationComponent component) {
        Object value = switch (component) {
            case TEST_RUNNER -> checkers.runTests();
            case API_VALIDATOR -> checkers.validateApi();
            case E2E_VALIDATOR -> checkers.validateEndToEnd();
            case BUILD_VALIDATOR -> checkers.validateBuild();
            case BUILD_METRICS -> checkers.measureBuild();
            case BUNDLE_METRICS -> checkers.measureBundles();
            case MEMORY_PROFILE -> checkers.profileMemory();
            case DEV_EXPERIENCE -> checkers.measureDevExperience();
            case DEPENDENCY_ANALYSIS -> checkers.analyzeDependencies();
            case CODE_ORGANIZATION -> checkers.analyzeOrganization();
            case TYPE_SAFETY -> checkers.analyzeTypeSafety();
        };
        if (value == null) {
            throw new ComponentException(component.key() + " returned no result");
        }
        return value;
    }

    private Object await(ValidationComponent component, Future<Object> future) {
        try {
            return future.get(componentTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new ComponentException(null, describe(cause), List.of(), List.of(), cause);
        } catch (TimeoutException ex) {
            future.cancel(true);
            throw new ComponentException(
                    null,
                    component.key() + " timed out after " + componentTimeout.toMillis() + "ms",
                    List.of(),
                    List.of(),
                    ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new ValidationFatalException("validation interrupted while awaiting " + component.key(), ex);
        }
    }

    private void recordComponentFailure(
            String runId, CorrelationContext correlation, ValidationComponent component, RuntimeException failure) {
        if (failure instanceof ValidationFatalException fatal) {
            throw fatal;
        }
        IssueType type = component.defaultIssueType();
        List<String> suggestions = List.of();
        List<String> affectedPackages = List.of();
        if (failure instanceof ComponentException componentFailure) {
            if (componentFailure.issueType() != null) {
                type = componentFailure.issueType();
            }
            suggestions = componentFailure.suggestions();
            affectedPackages = componentFailure.affectedPackages();
        }
        String message = describe(failure);
        issues.add(new ValidationIssue(
                type,
                IssueSeverity.WARNING,
                component.phase(),
                component.key(),
                message,
                stackTraceOf(failure),
                affectedPackages,
                suggestions,
                clock.instant()));
        logger.warn(
                "component failed",
                correlation.forComponent(component.phase().key(), component.key()),
                Map.of("issueType", type.name(), "error", message));
        emit(new ValidationEvent(
                ValidationEvent.Type.COMPONENT_FAILED, runId, component.phase(), component, message, clock.instant()));
    }

    private ValidationResult assemble(CorrelationContext correlation, Sections sections) {
        Instant finishedAt = clock.instant();
        try {
            List<Recommendation> recommendations = recommendationsFrom(issues);
            ValidationStatus status = statusOf(issues);
            return new ValidationResult(
                    finishedAt,
                    status,
                    sections.system,
                    sections.performance,
                    sections.architecture,
                    recommendations,
                    nextSteps(status, recommendations),
                    issues,
                    sections.substituted);
        } catch (RuntimeException ex) {
            issues.add(new ValidationIssue(
                    IssueType.BUILD_ERROR,
                    IssueSeverity.CRITICAL,
                    null,
                    null,
                    "failed to assemble validation result: " + describe(ex),
                    stackTraceOf(ex),
                    List.of(),
                    List.of(),
                    finishedAt));
            logger.error("result assembly failed", correlation, Map.of("error", describe(ex)));
            return new ValidationResult(
                    finishedAt,
                    ValidationStatus.FAILURE,
                    sections.system,
                    sections.performance,
                    sections.architecture,
                    List.of(),
                    nextSteps(ValidationStatus.FAILURE, List.of()),
                    issues,
                    sections.substituted);
        }
    }

    static ValidationStatus statusOf(List<ValidationIssue> issues) {
        boolean warning = false;
        for (ValidationIssue issue : issues) {
            if (issue.severity() == IssueSeverity.CRITICAL) {
                return ValidationStatus.FAILURE;
            }
            if (issue.severity() == IssueSeverity.WARNING) {
                warning = true;
            }
        }
        return warning ? ValidationStatus.WARNING : ValidationStatus.SUCCESS;
    }

    static List<Recommendation> recommendationsFrom(List<ValidationIssue> issues) {
        List<Recommendation> recommendations = new ArrayList<>();
        for (ValidationIssue issue : issues) {
            if (issue.suggestions().isEmpty()) {
                continue;
            }
            String impact = issue.affectedPackages().isEmpty()
                    ? "Affects " + (issue.component() == null ? "the validation run" : issue.component())
                    : "Affects " + String.join(", ", issue.affectedPackages());
            String title = "Resolve " + issue.type().name().toLowerCase(Locale.ROOT).replace('_', ' ');
            if (issue.component() != null) {
                title = title + " in " + issue.component();
            }
            recommendations.add(new Recommendation(
                    issue.type().category(),
                    priorityOf(issue.severity()),
                    title,
                    issue.message(),
                    impact,
                    RecommendationEffort.MEDIUM,
                    issue.suggestions(),
                    issue.affectedPackages()));
        }
        return recommendations;
    }

    static List<String> nextSteps(ValidationStatus status, List<Recommendation> recommendations) {
        List<String> steps = new ArrayList<>();
        switch (status) {
            case FAILURE -> {
                steps.add("Address critical issues before promoting this build");
                long critical = recommendations.stream()
                        .filter(recommendation -> recommendation.priority() == RecommendationPriority.CRITICAL)
                        .count();
                if (critical > 0) {
                    steps.add("Focus on " + critical + " critical recommendations");
                }
            }
            case WARNING -> {
                steps.add("Review and address warnings for optimal performance");
                steps.add("Consider implementing high-priority optimizations");
            }
            case SUCCESS -> {
                steps.add("Validation completed successfully");
                steps.add("Build is ready for promotion");
            }
        }
        if (!recommendations.isEmpty()) {
            steps.add("Review " + recommendations.size() + " optimization recommendations");
        }
        return steps;
    }

    private static RecommendationPriority priorityOf(IssueSeverity severity) {
        return switch (severity) {
            case CRITICAL -> RecommendationPriority.CRITICAL;
            case WARNING -> RecommendationPriority.MEDIUM;
            case INFO -> RecommendationPriority.LOW;
        };
    }

    private void fail(String runId, CorrelationContext correlation, ValidationFatalException ex) {
        state = ControllerState.FAILED;
        logger.error("validation failed", correlation, Map.of("error", describe(ex)));
        emit(new ValidationEvent(ValidationEvent.Type.FAILED, runId, currentPhase, null, describe(ex), clock.instant()));
    }

    private void emit(ValidationEvent event) {
        for (ValidationListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException ex) {
                logger.warn(
                        "listener failed",
                        CorrelationContext.of(event.runId(), OPERATION),
                        Map.of("event", event.type().name(), "error", describe(ex)));
            }
        }
    }

    private static int largestPhase() {
        int largest = 1;
        for (ValidationPhase phase : ValidationPhase.values()) {
            largest = Math.max(largest, ValidationComponent.of(phase).size());
        }
        return largest;
    }

    private static ThreadFactory daemonThreads() {
        AtomicInteger counter = new AtomicInteger(1);
        return runnable -> {
            Thread thread = new Thread(runnable, "buildlens-component-" + counter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        if (message == null || message.isBlank()) {
            return error.getClass().getSimpleName();
        }
        return message;
    }

    private static String stackTraceOf(Throwable error) {
        StringWriter out = new StringWriter();
        error.printStackTrace(new PrintWriter(out));
        return out.toString();
    }

    /**
     * Sections under construction for one run; only touched from the run thread.
     */
    private static final class Sections {
        private SystemValidation system = SystemValidation.empty();
        private PerformanceAnalysis performance = PerformanceAnalysis.empty();
        private ArchitectureValidation architecture = ArchitectureValidation.empty();
        private final Set<ValidationComponent> substituted = EnumSet.noneOf(ValidationComponent.class);

        void substitute(ValidationComponent component) {
            substituted.add(component);
        }

        void apply(ValidationComponent component, Object value) {
            switch (component) {
                case TEST_RUNNER -> system = system.withTestResults((SystemValidation.TestResults) value);
                case API_VALIDATOR -> system = system.withApiValidation((SystemValidation.EndpointResults) value);
                case E2E_VALIDATOR -> system = system.withE2eResults((SystemValidation.WorkflowResults) value);
                case BUILD_VALIDATOR -> system = system.withBuildValidation((SystemValidation.BuildResults) value);
                case BUILD_METRICS -> performance = performance.withBuildMetrics((PerformanceAnalysis.BuildMetrics) value);
                case BUNDLE_METRICS -> performance = performance.withBundleMetrics((PerformanceAnalysis.BundleMetrics) value);
                case MEMORY_PROFILE -> performance = performance.withMemoryProfile((PerformanceAnalysis.MemoryProfile) value);
                case DEV_EXPERIENCE -> performance =
                        performance.withDevExperience((PerformanceAnalysis.DevExperienceMetrics) value);
                case DEPENDENCY_ANALYSIS -> architecture =
                        architecture.withDependencyAnalysis((ArchitectureValidation.DependencyReport) value);
                case CODE_ORGANIZATION -> architecture =
                        architecture.withCodeOrganization((ArchitectureValidation.OrganizationReport) value);
                case TYPE_SAFETY -> architecture =
                        architecture.withTypeSafety((ArchitectureValidation.TypeSafetyReport) value);
            }
        }
    }
}
