package com.safepocket.anomaly.model;

import java.util.Arrays;

/**
 * Summary statistics over plain {@code double[]} samples. Standard deviation is the sample
 * (n - 1) estimator unless stated otherwise; quantiles interpolate linearly between ranks.
 */
public final class SeriesStatistics {

    private SeriesStatistics() {
    }

    public static double mean(double[] values) {
        if (values.length == 0) {
            return Double.NaN;
        }
        double sum = 0d;
        for (double value : values) {
            sum += value;
        }
        return sum / values.length;
    }

    public static double sampleStandardDeviation(double[] values) {
        if (values.length < 2) {
            return Double.NaN;
        }
        return Math.sqrt(sumOfSquaredDeviations(values) / (values.length - 1));
    }

    public static double populationStandardDeviation(double[] values) {
        if (values.length == 0) {
            return Double.NaN;
        }
        return Math.sqrt(sumOfSquaredDeviations(values) / values.length);
    }

    public static double median(double[] values) {
        return quantile(values, 0.5);
    }

    /**
     * @param q quantile in [0, 1]
     */
    public static double quantile(double[] values, double q) {
        if (values.length == 0) {
            return Double.NaN;
        }
        double[] sorted = Arrays.copyOf(values, values.length);
        Arrays.sort(sorted);
        return percentileOfSorted(sorted, q * 100d);
    }

    public static double percentileOfSorted(double[] sortedValues, double percentile) {
        if (sortedValues.length == 0) {
            return Double.NaN;
        }
        double index = percentile / 100.0 * (sortedValues.length - 1);
        int lower = (int) Math.floor(index);
        int upper = (int) Math.ceil(index);
        if (lower == upper) {
            return sortedValues[lower];
        }
        double weight = index - lower;
        // exact when both neighbours are equal; outlier cut-offs compare against this strictly
        return sortedValues[lower] + (sortedValues[upper] - sortedValues[lower]) * weight;
    }

    private static double sumOfSquaredDeviations(double[] values) {
        double mean = mean(values);
        double sum = 0d;
        for (double value : values) {
            double diff = value - mean;
            sum += diff * diff;
        }
        return sum;
    }
}
