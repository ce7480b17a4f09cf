package org.buildlens.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outputs of the system phase: tests, API endpoints, end-to-end workflows and the build.
 */
public record SystemValidation(
        TestResults testResults,
        EndpointResults apiValidation,
        WorkflowResults e2eResults,
        BuildResults buildValidation) {
    public SystemValidation {
        Objects.requireNonNull(testResults, "testResults");
        Objects.requireNonNull(apiValidation, "apiValidation");
        Objects.requireNonNull(e2eResults, "e2eResults");
        Objects.requireNonNull(buildValidation, "buildValidation");
    }

    public static SystemValidation empty() {
        return new SystemValidation(
                TestResults.empty(), EndpointResults.empty(), WorkflowResults.empty(), BuildResults.empty());
    }

    public SystemValidation withTestResults(TestResults value) {
        return new SystemValidation(value, apiValidation, e2eResults, buildValidation);
    }

    public SystemValidation withApiValidation(EndpointResults value) {
        return new SystemValidation(testResults, value, e2eResults, buildValidation);
    }

    public SystemValidation withE2eResults(WorkflowResults value) {
        return new SystemValidation(testResults, apiValidation, value, buildValidation);
    }

    public SystemValidation withBuildValidation(BuildResults value) {
        return new SystemValidation(testResults, apiValidation, e2eResults, value);
    }

    public record TestResults(
            int totalTests,
            int passedTests,
            int failedTests,
            int skippedTests,
            Coverage coverage,
            List<PackageTestResult> packageResults,
            long durationMillis) {
        public TestResults {
            Objects.requireNonNull(coverage, "coverage");
            packageResults = List.copyOf(packageResults);
        }

        public static TestResults empty() {
            return new TestResults(0, 0, 0, 0, Coverage.empty(), List.of(), 0L);
        }

        public boolean passed() {
            return failedTests == 0;
        }

        /**
         * Share of executed tests that passed, 100 when nothing ran.
         */
        public double successRate() {
            return totalTests == 0 ? 100.0 : passedTests * 100.0 / totalTests;
        }
    }

    public record Coverage(
            double overall,
            double statements,
            double branches,
            double functions,
            double lines,
            Map<String, Double> packageCoverage) {
        public Coverage {
            packageCoverage = Map.copyOf(packageCoverage);
        }

        public static Coverage empty() {
            return new Coverage(0, 0, 0, 0, 0, Map.of());
        }
    }

    public record PackageTestResult(String packageName, boolean passed, int testCount, int failedCount) {
        public PackageTestResult {
            Objects.requireNonNull(packageName, "packageName");
        }
    }

    public record EndpointResults(
            int totalEndpoints,
            int validatedEndpoints,
            List<EndpointFailure> failedEndpoints,
            ResponseTimes responseTimes) {
        public EndpointResults {
            failedEndpoints = List.copyOf(failedEndpoints);
            Objects.requireNonNull(responseTimes, "responseTimes");
        }

        public static EndpointResults empty() {
            return new EndpointResults(0, 0, List.of(), new ResponseTimes(0, 0, 0, 0));
        }

        /**
         * Share of endpoints without failures, 100 when there are none.
         */
        public double healthRate() {
            if (totalEndpoints == 0) {
                return 100.0;
            }
            return (totalEndpoints - failedEndpoints.size()) * 100.0 / totalEndpoints;
        }
    }

    public record EndpointFailure(String endpoint, String method, String error) {
    }

    public record ResponseTimes(double averageMillis, double medianMillis, double p95Millis, double p99Millis) {
    }

    public record WorkflowResults(
            int totalWorkflows,
            int passedWorkflows,
            List<WorkflowFailure> failedWorkflows,
            int testedIntegrations,
            int passedIntegrations,
            List<IntegrationFailure> failedIntegrations) {
        public WorkflowResults {
            failedWorkflows = List.copyOf(failedWorkflows);
            failedIntegrations = List.copyOf(failedIntegrations);
        }

        public static WorkflowResults empty() {
            return new WorkflowResults(0, 0, List.of(), 0, 0, List.of());
        }
    }

    public record WorkflowFailure(String workflowName, String error) {
    }

    public record IntegrationFailure(String fromPackage, String toPackage, String error) {
    }

    public record BuildResults(
            boolean passed,
            List<PackageBuild> packageBuilds,
            double totalBuildTimeMillis,
            double parallelEfficiency,
            double cacheHitRate) {
        public BuildResults {
            packageBuilds = List.copyOf(packageBuilds);
        }

        public static BuildResults empty() {
            return new BuildResults(true, List.of(), 0, 0, 0);
        }
    }

    public record PackageBuild(String packageName, boolean passed, double buildTimeMillis, boolean cacheHit) {
        public PackageBuild {
            Objects.requireNonNull(packageName, "packageName");
        }
    }
}
