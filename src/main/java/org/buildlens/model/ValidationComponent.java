package org.buildlens.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Named checker invoked by a validation phase, in declared order.
 */
public enum ValidationComponent {
    TEST_RUNNER("test-runner", ValidationPhase.SYSTEM, IssueType.TEST_FAILURE),
    API_VALIDATOR("api-validator", ValidationPhase.SYSTEM, IssueType.TEST_FAILURE),
    E2E_VALIDATOR("e2e-validator", ValidationPhase.SYSTEM, IssueType.TEST_FAILURE),
    BUILD_VALIDATOR("build-validator", ValidationPhase.SYSTEM, IssueType.BUILD_ERROR),
    BUILD_METRICS("build-metrics", ValidationPhase.PERFORMANCE, IssueType.PERFORMANCE_REGRESSION),
    BUNDLE_METRICS("bundle-metrics", ValidationPhase.PERFORMANCE, IssueType.PERFORMANCE_REGRESSION),
    MEMORY_PROFILE("memory-profile", ValidationPhase.PERFORMANCE, IssueType.PERFORMANCE_REGRESSION),
    DEV_EXPERIENCE("dev-experience", ValidationPhase.PERFORMANCE, IssueType.TYPE_ERROR),
    DEPENDENCY_ANALYSIS("dependency-analysis", ValidationPhase.ARCHITECTURE, IssueType.DEPENDENCY_ISSUE),
    CODE_ORGANIZATION("code-organization", ValidationPhase.ARCHITECTURE, IssueType.ARCHITECTURE_VIOLATION),
    TYPE_SAFETY("type-safety", ValidationPhase.ARCHITECTURE, IssueType.TYPE_ERROR);

    private final String key;
    private final ValidationPhase phase;
    private final IssueType defaultIssueType;

    ValidationComponent(String key, ValidationPhase phase, IssueType defaultIssueType) {
        this.key = key;
        this.phase = phase;
        this.defaultIssueType = defaultIssueType;
    }

    public String key() {
        return key;
    }

    public ValidationPhase phase() {
        return phase;
    }

    /**
     * Issue type recorded when the component fails without classifying its own failure.
     */
    public IssueType defaultIssueType() {
        return defaultIssueType;
    }

    public static List<ValidationComponent> of(ValidationPhase phase) {
        List<ValidationComponent> components = new ArrayList<>();
        for (ValidationComponent component : values()) {
            if (component.phase == phase) {
                components.add(component);
            }
        }
        return List.copyOf(components);
    }

    public static ValidationComponent fromKey(String key) {
        for (ValidationComponent component : values()) {
            if (component.key.equals(key)) {
                return component;
            }
        }
        throw new IllegalArgumentException("unknown validation component: " + key);
    }
}
