package org.buildlens.analysis;

/**
 * Ordinary least-squares line through (x, y) points with its coefficient of determination.
 */
record LinearFit(double slope, double intercept, double rSquared) {
    /**
     * Fits {@code y = slope * x + intercept} from the closed-form sums.
     *
     * @throws IllegalArgumentException when fewer than two points are given or every x is equal
     */
    static LinearFit of(double[] x, double[] y) {
        if (x.length != y.length) {
            throw new IllegalArgumentException("x and y must have the same length");
        }
        int n = x.length;
        if (n < 2) {
            throw new IllegalArgumentException("at least two points are required");
        }
        double sumX = 0.0;
        double sumY = 0.0;
        double sumXY = 0.0;
        double sumXX = 0.0;
        for (int i = 0; i < n; i++) {
            sumX += x[i];
            sumY += y[i];
            sumXY += x[i] * y[i];
            sumXX += x[i] * x[i];
        }
        double denominator = n * sumXX - sumX * sumX;
        if (denominator == 0.0) {
            throw new IllegalArgumentException("x values must not all be equal");
        }
        double slope = (n * sumXY - sumX * sumY) / denominator;
        double intercept = (sumY - slope * sumX) / n;

        double meanY = sumY / n;
        double totalSquares = 0.0;
        double residualSquares = 0.0;
        for (int i = 0; i < n; i++) {
            double predicted = slope * x[i] + intercept;
            totalSquares += (y[i] - meanY) * (y[i] - meanY);
            residualSquares += (y[i] - predicted) * (y[i] - predicted);
        }
        // A constant series is fitted exactly by a flat line.
        double rSquared = totalSquares == 0.0 ? 1.0 : 1.0 - residualSquares / totalSquares;
        return new LinearFit(slope, intercept, Math.max(0.0, Math.min(1.0, rSquared)));
    }
}
