package com.safepocket.anomaly.controller.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnomalyRecordDto(
        String date,
        String metric,
        double value,
        @JsonProperty("expected_value_mean") double expectedValueMean,
        @JsonProperty("expected_value_median") double expectedValueMedian,
        @JsonProperty("deviation_pct") double deviationPct,
        @JsonProperty("deviation_from_median_pct") double deviationFromMedianPct,
        String severity,
        @JsonProperty("severity_level") String severityLevel,
        String direction,
        String method,
        @JsonProperty("detection_methods") List<String> detectionMethods,
        @JsonProperty("algorithms_agreed") String algorithmsAgreed,
        Double confidence,
        String reason,
        Map<String, Object> context
) {
}
