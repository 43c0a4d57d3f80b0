package com.safepocket.anomaly.controller.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import java.util.Map;

/**
 * {@code rows} are JSON objects with a {@code date} field and numeric metric fields.
 * {@code metric} is the legacy single-metric form of {@code metrics}.
 */
public record DetectAnomaliesRequestDto(
        @NotNull List<Map<String, Object>> rows,
        String metric,
        List<String> metrics,
        String method,
        @DecimalMin("0.0") @DecimalMax("1.0") Double confidenceThreshold
) {
}
