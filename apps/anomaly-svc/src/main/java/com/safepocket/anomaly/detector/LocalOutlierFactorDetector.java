package com.safepocket.anomaly.detector;

import com.safepocket.anomaly.detector.ml.LocalOutlierFactor;
import com.safepocket.anomaly.model.MetricSeries;
import com.safepocket.anomaly.model.SeriesStatistics;
import java.util.Arrays;
import java.util.Map;

/**
 * Density-based detection: neighbourhood size {@code clamp(n / 5, 5, 20)}, the least dense
 * 10% of points are outliers.
 */
public class LocalOutlierFactorDetector extends AbstractDetector {

    public static final String NAME = "lof";

    static final double CONTAMINATION = 0.1d;

    public LocalOutlierFactorDetector(int minPoints) {
        super(NAME, NAME, minPoints);
    }

    @Override
    protected DetectorOutcome analyze(MetricSeries series) {
        double[] values = series.values();
        int neighbors = Math.min(20, Math.max(5, values.length / 5));
        double[] factors = LocalOutlierFactor.factors(values, neighbors);

        double[] negated = new double[factors.length];
        for (int i = 0; i < factors.length; i++) {
            negated[i] = -factors[i];
        }
        double[] sorted = Arrays.copyOf(negated, negated.length);
        Arrays.sort(sorted);
        double offset = SeriesStatistics.percentileOfSorted(sorted, CONTAMINATION * 100);

        boolean[] flagged = new boolean[values.length];
        for (int i = 0; i < values.length; i++) {
            flagged[i] = negated[i] < offset;
        }
        return DetectorOutcome.completed(NAME, FindingFactory.findings(
                series, flagged, NAME, SeriesStatistics.mean(values), SeriesStatistics.median(values),
                Map.of("n_neighbors", neighbors)));
    }
}
