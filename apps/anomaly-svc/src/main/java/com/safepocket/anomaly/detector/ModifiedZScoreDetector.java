package com.safepocket.anomaly.detector;

import com.safepocket.anomaly.model.MetricSeries;
import com.safepocket.anomaly.model.SeriesStatistics;
import java.util.List;
import java.util.Map;

/**
 * Robust z-score around the median: {@code 0.6745 * |x - median| / MAD}. When MAD is zero the
 * score becomes {@code |x - median| / std}; a constant series yields nothing.
 */
public class ModifiedZScoreDetector extends AbstractDetector {

    public static final String NAME = "modified_zscore";

    static final double CONSISTENCY_CONSTANT = 0.6745d;
    static final double THRESHOLD = 3.5d;

    public ModifiedZScoreDetector(int minPoints) {
        super(NAME, "zscore", minPoints);
    }

    @Override
    protected DetectorOutcome analyze(MetricSeries series) {
        double[] values = series.values();
        double median = SeriesStatistics.median(values);
        double[] absoluteDeviations = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            absoluteDeviations[i] = Math.abs(values[i] - median);
        }
        double mad = SeriesStatistics.median(absoluteDeviations);

        double scale;
        double factor;
        if (mad == 0) {
            double std = SeriesStatistics.sampleStandardDeviation(values);
            if (std == 0 || Double.isNaN(std)) {
                return DetectorOutcome.completed(NAME, List.of());
            }
            scale = std;
            factor = 1d;
        } else {
            scale = mad;
            factor = CONSISTENCY_CONSTANT;
        }

        boolean[] flagged = new boolean[values.length];
        for (int i = 0; i < values.length; i++) {
            flagged[i] = factor * absoluteDeviations[i] / scale > THRESHOLD;
        }
        return DetectorOutcome.completed(NAME, FindingFactory.findings(
                series, flagged, NAME, SeriesStatistics.mean(values), median,
                Map.of("mad", mad, "threshold", THRESHOLD)));
    }
}
