package com.safepocket.anomaly.model;

import java.time.LocalDate;
import java.util.Map;

/**
 * One candidate anomaly reported by exactly one detector. Deviations are kept unrounded;
 * rounding happens when the finding is turned into an {@link AnomalyRecord}.
 */
public record DetectorFinding(
        LocalDate date,
        String metric,
        double value,
        double expectedMean,
        double expectedMedian,
        double deviationPct,
        double deviationFromMedianPct,
        FindingSeverity severity,
        Direction direction,
        String method,
        Map<String, Object> context
) {
    public DetectorFinding {
        context = context == null ? Map.of() : Map.copyOf(context);
    }
}
