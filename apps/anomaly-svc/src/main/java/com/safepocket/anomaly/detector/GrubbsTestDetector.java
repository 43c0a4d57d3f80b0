package com.safepocket.anomaly.detector;

import com.safepocket.anomaly.model.MetricSeries;
import com.safepocket.anomaly.model.SeriesStatistics;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.apache.commons.math3.distribution.TDistribution;

/**
 * Iterative two-sided Grubbs test at {@code alpha = 0.05}: up to {@code min(5, n / 10)} rounds,
 * each removing the most extreme value while it exceeds the critical value.
 */
public class GrubbsTestDetector extends AbstractDetector {

    public static final String NAME = "grubbs_test";

    static final double ALPHA = 0.05d;
    static final int MAX_ROUNDS = 5;

    public GrubbsTestDetector(int minPoints) {
        super(NAME, "grubbs", minPoints);
    }

    @Override
    protected DetectorOutcome analyze(MetricSeries series) {
        double[] values = series.values();
        int rounds = Math.min(MAX_ROUNDS, values.length / 10);
        if (rounds == 0) {
            return skipped("needs at least 10 points for one test round, got " + values.length);
        }

        List<Integer> working = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            working.add(i);
        }
        boolean[] flagged = new boolean[values.length];
        for (int round = 0; round < rounds; round++) {
            if (working.size() < minPoints()) {
                break;
            }
            double[] sample = working.stream().mapToDouble(i -> values[i]).toArray();
            double mean = SeriesStatistics.mean(sample);
            double std = SeriesStatistics.sampleStandardDeviation(sample);
            if (std == 0) {
                break;
            }
            int extremePosition = 0;
            double maxZ = -1d;
            for (int i = 0; i < sample.length; i++) {
                double z = Math.abs(sample[i] - mean) / std;
                if (z > maxZ) {
                    maxZ = z;
                    extremePosition = i;
                }
            }
            if (maxZ > criticalValue(sample.length, ALPHA)) {
                flagged[working.remove(extremePosition)] = true;
            } else {
                break;
            }
        }
        return DetectorOutcome.completed(NAME, FindingFactory.findings(
                series, flagged, NAME, SeriesStatistics.mean(values), SeriesStatistics.median(values),
                Map.of("alpha", ALPHA, "test", "grubbs")));
    }

    /**
     * Two-sided Grubbs critical value for a sample of size {@code n}.
     */
    static double criticalValue(int n, double alpha) {
        double t = new TDistribution(n - 2).inverseCumulativeProbability(1 - alpha / (2 * n));
        return ((n - 1) / Math.sqrt(n)) * Math.sqrt(t * t / (n - 2 + t * t));
    }
}
