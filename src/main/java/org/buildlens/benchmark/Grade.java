package org.buildlens.benchmark;

public enum Grade {
    A(90.0),
    B(80.0),
    C(70.0),
    D(60.0),
    F(Double.NEGATIVE_INFINITY);

    private final double minimumScore;

    Grade(double minimumScore) {
        this.minimumScore = minimumScore;
    }

    public double minimumScore() {
        return minimumScore;
    }

    public static Grade of(double score) {
        for (Grade grade : values()) {
            if (score >= grade.minimumScore) {
                return grade;
            }
        }
        return F;
    }
}
