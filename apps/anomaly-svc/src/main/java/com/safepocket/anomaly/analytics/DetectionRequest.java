package com.safepocket.anomaly.analytics;

import java.util.List;
import java.util.Locale;

/**
 * Normalized parameters of one detection call. {@code metrics == null} means "select metrics
 * automatically"; {@code confidenceThreshold == null} keeps the configured threshold.
 */
public record DetectionRequest(List<String> metrics, String method, Double confidenceThreshold) {

    public static final String ENSEMBLE = "ensemble";

    public DetectionRequest {
        metrics = metrics == null ? null : metrics.stream()
                .filter(metric -> metric != null && !metric.isBlank())
                .distinct()
                .toList();
        method = method == null || method.isBlank() ? ENSEMBLE : method.trim().toLowerCase(Locale.ROOT);
        if (confidenceThreshold != null && (confidenceThreshold < 0 || confidenceThreshold > 1 || confidenceThreshold.isNaN())) {
            throw new IllegalArgumentException("confidenceThreshold must be within [0, 1]");
        }
    }

    public static DetectionRequest ensemble() {
        return new DetectionRequest(null, ENSEMBLE, null);
    }

    /**
     * Accepts both the legacy single {@code metric} and the {@code metrics} list; the list wins
     * when both are given.
     */
    public static DetectionRequest of(String metric, List<String> metrics, String method, Double confidenceThreshold) {
        List<String> normalized = metrics;
        if (normalized == null && metric != null && !metric.isBlank()) {
            normalized = List.of(metric);
        }
        return new DetectionRequest(normalized, method, confidenceThreshold);
    }

    public boolean isEnsemble() {
        return ENSEMBLE.equals(method);
    }
}
