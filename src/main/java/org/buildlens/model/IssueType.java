package org.buildlens.model;

/**
 * Classification of a recorded validation issue.
 */
public enum IssueType {
    TEST_FAILURE(RecommendationCategory.BUILD),
    BUILD_ERROR(RecommendationCategory.BUILD),
    PERFORMANCE_REGRESSION(RecommendationCategory.PERFORMANCE),
    ARCHITECTURE_VIOLATION(RecommendationCategory.ARCHITECTURE),
    TYPE_ERROR(RecommendationCategory.DEVELOPER_EXPERIENCE),
    DEPENDENCY_ISSUE(RecommendationCategory.BUILD);

    private final RecommendationCategory category;

    IssueType(RecommendationCategory category) {
        this.category = category;
    }

    /**
     * Category used for recommendations derived from issues of this type.
     */
    public RecommendationCategory category() {
        return category;
    }
}
