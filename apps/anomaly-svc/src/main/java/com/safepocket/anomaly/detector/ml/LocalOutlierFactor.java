package com.safepocket.anomaly.detector.ml;

import java.util.Arrays;
import java.util.Comparator;

/**
 * Local outlier factor over one-dimensional samples. A factor near 1 means the point is as
 * dense as its neighbours; larger values mean it sits in a sparser region.
 */
public final class LocalOutlierFactor {

    private static final double DENSITY_EPSILON = 1e-10d;

    private LocalOutlierFactor() {
    }

    /**
     * Computes the outlier factor of every sample against the rest of the sample.
     * Each point's neighbourhood excludes the point itself; ties in distance are broken by
     * position.
     *
     * @param neighbors neighbourhood size, capped at {@code data.length - 1}
     */
    public static double[] factors(double[] data, int neighbors) {
        int n = data.length;
        if (n < 2) {
            throw new IllegalArgumentException("local outlier factor needs at least two samples");
        }
        int k = Math.max(1, Math.min(neighbors, n - 1));

        int[][] neighborIndex = new int[n][];
        double[] kDistance = new double[n];
        for (int p = 0; p < n; p++) {
            final int point = p;
            Integer[] others = new Integer[n - 1];
            int idx = 0;
            for (int o = 0; o < n; o++) {
                if (o != point) {
                    others[idx++] = o;
                }
            }
            Arrays.sort(others, Comparator
                    .comparingDouble((Integer o) -> Math.abs(data[o] - data[point]))
                    .thenComparingInt(o -> o));
            neighborIndex[p] = new int[k];
            for (int i = 0; i < k; i++) {
                neighborIndex[p][i] = others[i];
            }
            kDistance[p] = Math.abs(data[others[k - 1]] - data[p]);
        }

        double[] density = new double[n];
        for (int p = 0; p < n; p++) {
            double reachSum = 0d;
            for (int o : neighborIndex[p]) {
                reachSum += Math.max(kDistance[o], Math.abs(data[p] - data[o]));
            }
            density[p] = 1d / (reachSum / k + DENSITY_EPSILON);
        }

        double[] factors = new double[n];
        for (int p = 0; p < n; p++) {
            double neighborDensity = 0d;
            for (int o : neighborIndex[p]) {
                neighborDensity += density[o];
            }
            factors[p] = neighborDensity / k / density[p];
        }
        return factors;
    }
}
