package com.safepocket.anomaly.detector;

import com.safepocket.anomaly.model.MetricSeries;

/**
 * One unsupervised outlier strategy over a single metric series.
 * Implementations are stateless and must report problems through the returned
 * {@link DetectorOutcome} instead of throwing.
 */
public interface Detector {

    /**
     * Name recorded on findings and in ensemble votes, e.g. {@code dynamic_iqr}.
     */
    String name();

    /**
     * Short method name accepted by the single-method mode, e.g. {@code iqr}.
     */
    default String alias() {
        return name();
    }

    DetectorOutcome detect(MetricSeries series);
}
