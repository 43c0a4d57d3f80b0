package com.safepocket.anomaly.ensemble;

import com.safepocket.anomaly.config.AnomalyProperties;
import com.safepocket.anomaly.model.SeverityLevel;
import java.util.Map;

/**
 * Maps ensemble confidence and deviation magnitude to a {@link SeverityLevel}:
 * {@code combined = 0.6 * confidence + 0.4 * min(|deviationPct| / 100, 1)}, then the most
 * severe level whose threshold does not exceed {@code combined}.
 */
public class SeverityClassifier {

    static final double CONFIDENCE_WEIGHT = 0.6d;
    static final double DEVIATION_WEIGHT = 0.4d;

    private final Map<SeverityLevel, Double> thresholds;

    public SeverityClassifier(AnomalyProperties.Severity severity) {
        this.thresholds = severity.descending();
    }

    public SeverityLevel classify(double confidence, double deviationPct) {
        double combined = combinedScore(confidence, deviationPct);
        for (Map.Entry<SeverityLevel, Double> entry : thresholds.entrySet()) {
            if (combined >= entry.getValue()) {
                return entry.getKey();
            }
        }
        return SeverityLevel.INFO;
    }

    static double combinedScore(double confidence, double deviationPct) {
        double deviationScore = Math.min(Math.abs(deviationPct) / 100, 1.0);
        return confidence * CONFIDENCE_WEIGHT + deviationScore * DEVIATION_WEIGHT;
    }
}
