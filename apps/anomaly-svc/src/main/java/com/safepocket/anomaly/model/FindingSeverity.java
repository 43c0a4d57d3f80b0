package com.safepocket.anomaly.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Single-detector severity, derived from the absolute deviation from the mean in percent.
 */
public enum FindingSeverity {
    CRITICAL("Critical"),
    HIGH("High"),
    MEDIUM("Medium"),
    LOW("Low");

    private final String label;

    FindingSeverity(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static FindingSeverity fromDeviation(double deviationPct) {
        double absolute = Math.abs(deviationPct);
        if (absolute > 100) {
            return CRITICAL;
        }
        if (absolute > 50) {
            return HIGH;
        }
        if (absolute > 25) {
            return MEDIUM;
        }
        return LOW;
    }
}
