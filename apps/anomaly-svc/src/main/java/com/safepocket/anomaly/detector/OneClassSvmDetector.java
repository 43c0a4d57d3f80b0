package com.safepocket.anomaly.detector;

import com.safepocket.anomaly.detector.ml.OneClassSvm;
import com.safepocket.anomaly.model.MetricSeries;
import com.safepocket.anomaly.model.SeriesStatistics;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Learns a boundary around the standardized values with an RBF one-class SVM
 * ({@code nu = clamp(5 / n, 0.01, 0.2)}, gamma 1) and flags the values outside it.
 */
public class OneClassSvmDetector extends AbstractDetector {

    private static final Logger log = LoggerFactory.getLogger(OneClassSvmDetector.class);

    public static final String NAME = "one_class_svm";

    static final double GAMMA = 1.0d;
    static final double TOLERANCE = 1e-3d;
    static final double BOUNDARY_TOLERANCE = 1e-9d;

    public OneClassSvmDetector(int minPoints) {
        super(NAME, "svm", minPoints);
    }

    @Override
    protected DetectorOutcome analyze(MetricSeries series) {
        double[] values = series.values();
        double mean = SeriesStatistics.mean(values);
        double scale = SeriesStatistics.populationStandardDeviation(values);
        if (scale == 0) {
            return DetectorOutcome.completed(NAME, List.of());
        }
        double[] standardized = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            standardized[i] = (values[i] - mean) / scale;
        }
        double nu = clamp(5.0 / values.length, 0.01, 0.2);
        OneClassSvm model = OneClassSvm.fit(standardized, nu, GAMMA, TOLERANCE, Math.max(10_000, 100 * values.length));
        if (!model.converged()) {
            log.debug("one-class SVM for {} stopped after {} iterations without converging", series.metric(), model.iterations());
        }

        boolean[] flagged = new boolean[values.length];
        for (int i = 0; i < values.length; i++) {
            flagged[i] = model.decision(standardized[i]) < -BOUNDARY_TOLERANCE;
        }
        return DetectorOutcome.completed(NAME, FindingFactory.findings(
                series, flagged, NAME, mean, SeriesStatistics.median(values),
                Map.of("nu", nu, "kernel", "rbf")));
    }
}
