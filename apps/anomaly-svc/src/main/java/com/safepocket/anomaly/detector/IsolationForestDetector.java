package com.safepocket.anomaly.detector;

import com.safepocket.anomaly.detector.ml.IsolationForest;
import com.safepocket.anomaly.model.MetricSeries;
import com.safepocket.anomaly.model.SeriesStatistics;
import java.util.Arrays;
import java.util.Map;

/**
 * Flags the values an isolation forest isolates fastest. The expected outlier share
 * ("contamination") is {@code clamp(5 / n, 0.01, 0.15)}.
 */
public class IsolationForestDetector extends AbstractDetector {

    public static final String NAME = "isolation_forest";

    private final int trees;
    private final int maxSamples;
    private final long seed;

    public IsolationForestDetector(int minPoints, int trees, int maxSamples, long seed) {
        super(NAME, NAME, minPoints);
        this.trees = trees;
        this.maxSamples = maxSamples;
        this.seed = seed;
    }

    @Override
    protected DetectorOutcome analyze(MetricSeries series) {
        double[] values = series.values();
        double contamination = clamp(5.0 / values.length, 0.01, 0.15);
        IsolationForest forest = IsolationForest.fit(values, trees, maxSamples, seed);

        // negated so that lower means more anomalous
        double[] scores = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            scores[i] = -forest.anomalyScore(values[i]);
        }
        double[] sorted = Arrays.copyOf(scores, scores.length);
        Arrays.sort(sorted);
        double offset = SeriesStatistics.percentileOfSorted(sorted, contamination * 100);

        boolean[] flagged = new boolean[values.length];
        for (int i = 0; i < values.length; i++) {
            flagged[i] = scores[i] < offset;
        }
        return DetectorOutcome.completed(NAME, FindingFactory.findings(
                series, flagged, NAME, SeriesStatistics.mean(values), SeriesStatistics.median(values),
                Map.of("contamination", contamination, "n_estimators", trees)));
    }
}
