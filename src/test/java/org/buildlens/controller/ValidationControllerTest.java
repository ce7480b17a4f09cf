package org.buildlens.controller;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.StringWriter;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.bson.Document;
import org.buildlens.model.ArchitectureValidation;
import org.buildlens.model.IssueSeverity;
import org.buildlens.model.IssueType;
import org.buildlens.model.PerformanceAnalysis;
import org.buildlens.model.Recommendation;
import org.buildlens.model.RecommendationCategory;
import org.buildlens.model.RecommendationPriority;
import org.buildlens.model.SystemValidation;
import org.buildlens.model.ValidationComponent;
import org.buildlens.model.ValidationFixtures;
import org.buildlens.model.ValidationIssue;
import org.buildlens.model.ValidationPhase;
import org.buildlens.model.ValidationResult;
import org.buildlens.model.ValidationStatus;
import org.buildlens.obs.JsonLinesLogger;
import org.buildlens.obs.StructuredJsonLinesLogger;
import org.buildlens.report.ReportAggregator;
import org.buildlens.report.ReportInputs;
import org.buildlens.report.ValidationReport;
import org.junit.jupiter.api.Test;

class ValidationControllerTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-10T09:00:00Z"), ZoneOffset.UTC);

    @Test
    void healthyRunCompletesWithSuccess() {
        ValidationController controller = controller(new FixtureCheckers());

        ValidationResult result = controller.run();

        assertEquals(ValidationStatus.SUCCESS, result.status());
        assertEquals(CLOCK.instant(), result.timestamp());
        assertEquals(ValidationFixtures.healthySystem(), result.systemValidation());
        assertEquals(ValidationFixtures.healthyPerformance(), result.performanceAnalysis());
        assertTrue(result.issues().isEmpty());
        assertTrue(result.substitutedComponents().isEmpty());
        assertEquals(List.of("Validation completed successfully", "Build is ready for promotion"), result.nextSteps());
        assertEquals(ControllerState.COMPLETED, controller.state());
        assertFalse(controller.isRunning());
        assertTrue(controller.currentPhase().isEmpty());
        assertEquals(result, controller.lastResult().orElseThrow());
    }

    @Test
    void failingComponentIsRecordedAndSubstituted() {
        StringWriter logs = new StringWriter();
        JsonLinesLogger logger = new StructuredJsonLinesLogger(logs, CLOCK, true);
        ValidationController controller = new ValidationController(
                new FixtureCheckers() {
                    @Override
                    public PerformanceAnalysis.BundleMetrics measureBundles() {
                        throw new IllegalStateException("bundle analyzer crashed");
                    }
                },
                logger,
                CLOCK,
                null,
                ValidationController.DEFAULT_COMPONENT_TIMEOUT);

        ValidationResult result = controller.run();

        assertEquals(ValidationStatus.WARNING, result.status());
        assertEquals(Set.of(ValidationComponent.BUNDLE_METRICS), result.substitutedComponents());
        assertEquals(PerformanceAnalysis.BundleMetrics.empty(), result.performanceAnalysis().bundleMetrics());
        assertEquals(ValidationFixtures.healthyBuild(), result.performanceAnalysis().buildMetrics());
        assertEquals(
                List.of("Review and address warnings for optimal performance",
                        "Consider implementing high-priority optimizations"),
                result.nextSteps());
        assertTrue(result.recommendations().isEmpty());

        assertEquals(1, result.issues().size());
        ValidationIssue issue = result.issues().get(0);
        assertEquals(IssueType.PERFORMANCE_REGRESSION, issue.type());
        assertEquals(IssueSeverity.WARNING, issue.severity());
        assertEquals(ValidationPhase.PERFORMANCE, issue.phase());
        assertEquals("bundle-metrics", issue.component());
        assertEquals("bundle analyzer crashed", issue.message());
        assertTrue(issue.stackTrace().contains("IllegalStateException"));

        Document failure = logLines(logs).stream()
                .filter(line -> "component failed".equals(line.getString("message")))
                .findFirst()
                .orElseThrow();
        assertEquals("WARN", failure.getString("level"));
        assertEquals("validate", failure.getString("operation"));
        assertEquals("performance", failure.getString("phase"));
        assertEquals("bundle-metrics", failure.getString("component"));
        assertEquals("PERFORMANCE_REGRESSION", failure.getString("issueType"));
        assertEquals("bundle analyzer crashed", failure.getString("error"));
    }

    @Test
    void componentExceptionHintsBecomeRecommendation() {
        ValidationController controller = controller(new FixtureCheckers() {
            @Override
            public ArchitectureValidation.DependencyReport analyzeDependencies() {
                throw new ComponentException(
                        IssueType.DEPENDENCY_ISSUE, "cycle between core and ui", List.of("Break the cycle"), List.of("core"));
            }
        });

        ValidationResult result = controller.run();

        assertEquals(IssueType.DEPENDENCY_ISSUE, result.issues().get(0).type());
        assertEquals(List.of("core"), result.issues().get(0).affectedPackages());
        assertEquals(1, result.recommendations().size());
        Recommendation recommendation = result.recommendations().get(0);
        assertEquals("Resolve dependency issue in dependency-analysis", recommendation.title());
        assertEquals(RecommendationPriority.MEDIUM, recommendation.priority());
        assertEquals(RecommendationCategory.BUILD, recommendation.category());
        assertEquals("cycle between core and ui", recommendation.description());
        assertEquals("Affects core", recommendation.impact());
        assertEquals(List.of("Break the cycle"), recommendation.steps());
        assertEquals("Review 1 optimization recommendations", result.nextSteps().get(2));
    }

    @Test
    void sameTypeFailuresKeepOneRecommendationPerComponent() {
        ValidationController controller = controller(new FixtureCheckers() {
            @Override
            public SystemValidation.TestResults runTests() {
                throw new ComponentException(null, "jest exited with 1", List.of("Fix the failing suites"), List.of("core"));
            }

            @Override
            public SystemValidation.EndpointResults validateApi() {
                throw new ComponentException(null, "gateway unreachable", List.of("Start the gateway"), List.of("api"));
            }
        });

        ValidationResult result = controller.run();
        ValidationReport report = new ReportAggregator(CLOCK).aggregate(ReportInputs.builder(result).build());

        assertEquals(IssueType.TEST_FAILURE, result.issues().get(0).type());
        assertEquals(IssueType.TEST_FAILURE, result.issues().get(1).type());
        assertEquals(
                List.of("Resolve test failure in test-runner", "Resolve test failure in api-validator"),
                report.recommendations().stream().map(Recommendation::title).toList());
        assertEquals(List.of("api"), report.recommendations().get(1).affectedPackages());
        assertEquals(List.of("Start the gateway"), report.recommendations().get(1).steps());
    }

    @Test
    void missingResultIsComponentFailure() {
        ValidationController controller = controller(new FixtureCheckers() {
            @Override
            public PerformanceAnalysis.MemoryProfile profileMemory() {
                return null;
            }
        });

        ValidationResult result = controller.run();

        assertEquals("memory-profile returned no result", result.issues().get(0).message());
        assertTrue(result.isSubstituted(ValidationComponent.MEMORY_PROFILE));
    }

    @Test
    void slowComponentTimesOut() {
        CountDownLatch never = new CountDownLatch(1);
        ValidationController controller = new ValidationController(
                new FixtureCheckers() {
                    @Override
                    public ArchitectureValidation.TypeSafetyReport analyzeTypeSafety() {
                        try {
                            never.await(10, TimeUnit.SECONDS);
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        }
                        return super.analyzeTypeSafety();
                    }
                },
                JsonLinesLogger.noop(),
                CLOCK,
                null,
                Duration.ofMillis(100));

        ValidationResult result = controller.run();

        assertEquals(ValidationStatus.WARNING, result.status());
        assertEquals("type-safety timed out after 100ms", result.issues().get(0).message());
        assertEquals(IssueType.TYPE_ERROR, result.issues().get(0).type());
        assertTrue(result.isSubstituted(ValidationComponent.TYPE_SAFETY));
    }

    @Test
    void concurrentRunIsRejected() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ValidationController controller = controller(new FixtureCheckers() {
            @Override
            public SystemValidation.TestResults runTests() {
                entered.countDown();
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return super.runTests();
            }
        });
        ExecutorService caller = Executors.newSingleThreadExecutor();
        try {
            Future<ValidationResult> first = caller.submit(controller::run);
            assertTrue(entered.await(10, TimeUnit.SECONDS));

            assertTrue(controller.isRunning());
            assertEquals(ControllerState.RUNNING, controller.state());
            assertEquals(ValidationPhase.SYSTEM, controller.currentPhase().orElseThrow());
            ValidationStatusView view = controller.statusView();
            assertTrue(view.running());
            assertEquals(CLOCK.instant(), view.startedAt().orElseThrow());
            assertThrows(AlreadyRunningException.class, controller::run);

            release.countDown();
            assertEquals(ValidationStatus.SUCCESS, first.get(10, TimeUnit.SECONDS).status());
            assertFalse(controller.isRunning());
            assertNotNull(controller.run());
        } finally {
            release.countDown();
            caller.shutdownNow();
        }
    }

    @Test
    void listenersObserveLifecycleInOrder() {
        ValidationController controller = controller(new FixtureCheckers() {
            @Override
            public PerformanceAnalysis.BuildMetrics measureBuild() {
                throw new IllegalStateException("no build output");
            }
        });
        List<ValidationEvent> events = Collections.synchronizedList(new ArrayList<>());
        controller.addListener(event -> {
            throw new IllegalStateException("listener bug");
        });
        controller.addListener(events::add);

        controller.run();

        assertEquals(30, events.size());
        assertEquals(ValidationEvent.Type.STARTED, events.get(0).type());
        assertEquals(ValidationEvent.Type.PHASE_STARTED, events.get(1).type());
        assertEquals(ValidationPhase.SYSTEM, events.get(1).phase());
        assertEquals(ValidationComponent.TEST_RUNNER, events.get(2).component());
        assertEquals(ValidationEvent.Type.PHASE_COMPLETED, events.get(10).type());
        assertEquals(ValidationEvent.Type.PHASE_STARTED, events.get(11).type());
        assertEquals(ValidationPhase.PERFORMANCE, events.get(11).phase());
        ValidationEvent failed = events.get(16);
        assertEquals(ValidationEvent.Type.COMPONENT_FAILED, failed.type());
        assertEquals(ValidationComponent.BUILD_METRICS, failed.component());
        assertEquals("no build output", failed.message());
        ValidationEvent completed = events.get(events.size() - 1);
        assertEquals(ValidationEvent.Type.COMPLETED, completed.type());
        assertEquals("warning", completed.message());
        assertEquals(1, events.stream().map(ValidationEvent::runId).distinct().count());
    }

    @Test
    void schedulingFailureEndsRunInFailedState() {
        ExecutorService closed = Executors.newSingleThreadExecutor();
        closed.shutdown();
        ValidationController controller = new ValidationController(
                new FixtureCheckers(), JsonLinesLogger.noop(), CLOCK, closed, Duration.ofSeconds(5));
        List<ValidationEvent> events = new ArrayList<>();
        controller.addListener(events::add);

        ValidationFatalException error = assertThrows(ValidationFatalException.class, controller::run);

        assertEquals("cannot schedule component test-runner", error.getMessage());
        assertEquals(ControllerState.FAILED, controller.state());
        assertFalse(controller.isRunning());
        assertTrue(controller.lastResult().isEmpty());
        assertEquals(ValidationEvent.Type.FAILED, events.get(events.size() - 1).type());
    }

    @Test
    void summaryReflectsLastRun() {
        ValidationController controller = controller(new FixtureCheckers() {
            @Override
            public SystemValidation.EndpointResults validateApi() {
                throw new IllegalStateException("gateway down");
            }
        });
        assertTrue(controller.summary().isEmpty());

        controller.run();

        ValidationSummary summary = controller.summary().orElseThrow();
        assertEquals(ValidationStatus.WARNING, summary.overallStatus());
        assertEquals(3, summary.completedValidations());
        assertEquals(3, summary.totalValidations());
        assertEquals(0, summary.criticalIssues());
        assertEquals(35.0, summary.buildTimeImprovement());
        assertEquals(25.0, summary.bundleSizeReduction());
        assertEquals(1, controller.statusView().issues().size());
    }

    @Test
    void nextStepsForFailureCountCriticalRecommendations() {
        ValidationIssue critical = new ValidationIssue(
                IssueType.BUILD_ERROR,
                IssueSeverity.CRITICAL,
                null,
                null,
                "compiler crashed",
                "",
                List.of(),
                List.of("Pin the compiler version"),
                CLOCK.instant());

        assertEquals(ValidationStatus.FAILURE, ValidationController.statusOf(List.of(critical)));
        List<Recommendation> recommendations = ValidationController.recommendationsFrom(List.of(critical));
        assertEquals(RecommendationPriority.CRITICAL, recommendations.get(0).priority());
        assertEquals("Resolve build error", recommendations.get(0).title());
        assertEquals("Affects the validation run", recommendations.get(0).impact());
        assertEquals(
                List.of(
                        "Address critical issues before promoting this build",
                        "Focus on 1 critical recommendations",
                        "Review 1 optimization recommendations"),
                ValidationController.nextSteps(ValidationStatus.FAILURE, recommendations));
        assertEquals(ValidationStatus.SUCCESS, ValidationController.statusOf(List.of()));
    }

    private static ValidationController controller(ValidationCheckers checkers) {
        return new ValidationController(
                checkers, JsonLinesLogger.noop(), CLOCK, null, ValidationController.DEFAULT_COMPONENT_TIMEOUT);
    }

    private static List<Document> logLines(StringWriter logs) {
        List<Document> lines = new ArrayList<>();
        for (String line : logs.toString().trim().split("\\R")) {
            lines.add(Document.parse(line));
        }
        return lines;
    }
}
