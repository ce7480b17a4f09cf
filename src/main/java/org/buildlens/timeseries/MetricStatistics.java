package org.buildlens.timeseries;

import java.util.Arrays;

/**
 * Descriptive statistics of one metric over a window; all zero when the window is empty.
 */
public record MetricStatistics(
        double min,
        double max,
        double average,
        double median,
        double standardDeviation,
        int dataPoints) {
    private static final MetricStatistics EMPTY = new MetricStatistics(0, 0, 0, 0, 0, 0);

    public static MetricStatistics empty() {
        return EMPTY;
    }

    /**
     * Computes statistics with the population standard deviation.
     */
    public static MetricStatistics of(double[] values) {
        if (values.length == 0) {
            return EMPTY;
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double sum = 0.0;
        for (double value : sorted) {
            sum += value;
        }
        double average = sum / sorted.length;
        double squares = 0.0;
        for (double value : sorted) {
            squares += (value - average) * (value - average);
        }
        int middle = sorted.length / 2;
        double median = sorted.length % 2 == 0
                ? (sorted[middle - 1] + sorted[middle]) / 2.0
                : sorted[middle];
        return new MetricStatistics(
                sorted[0],
                sorted[sorted.length - 1],
                average,
                median,
                Math.sqrt(squares / sorted.length),
                sorted.length);
    }
}
