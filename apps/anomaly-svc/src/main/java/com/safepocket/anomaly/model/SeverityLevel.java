package com.safepocket.anomaly.model;

/**
 * Ensemble-wide severity scale. {@link #rank()} orders the final report (higher first).
 */
public enum SeverityLevel {
    CRITICAL(5),
    HIGH(4),
    MEDIUM(3),
    LOW(2),
    INFO(1);

    private final int rank;

    SeverityLevel(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    public static SeverityLevel fromFindingSeverity(FindingSeverity severity) {
        return switch (severity) {
            case CRITICAL -> CRITICAL;
            case HIGH -> HIGH;
            case MEDIUM -> MEDIUM;
            case LOW -> LOW;
        };
    }
}
