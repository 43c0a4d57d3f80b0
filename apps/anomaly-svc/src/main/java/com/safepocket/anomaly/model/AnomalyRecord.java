package com.safepocket.anomaly.model;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Final output unit. {@code confidence}, {@code algorithmsAgreed} and {@code detectionMethods}
 * are only set for ensemble results and are {@code null} for single-method runs.
 */
public record AnomalyRecord(
        LocalDate date,
        String metric,
        double value,
        double expectedValueMean,
        double expectedValueMedian,
        double deviationPct,
        double deviationFromMedianPct,
        FindingSeverity severity,
        SeverityLevel severityLevel,
        Direction direction,
        String method,
        List<String> detectionMethods,
        String algorithmsAgreed,
        Double confidence,
        String reason,
        Map<String, Object> context
) {
    public AnomalyRecord {
        detectionMethods = detectionMethods == null ? null : List.copyOf(detectionMethods);
        context = context == null ? Map.of() : Map.copyOf(context);
    }

    public boolean isEnsembleResult() {
        return detectionMethods != null;
    }
}
