package com.safepocket.anomaly.controller;

import com.safepocket.anomaly.analytics.AnomalyDetectionService;
import com.safepocket.anomaly.analytics.DetectionRequest;
import com.safepocket.anomaly.controller.dto.AnomalyRecordDto;
import com.safepocket.anomaly.controller.dto.DetectAnomaliesRequestDto;
import com.safepocket.anomaly.model.AnomalyRecord;
import com.safepocket.anomaly.model.MetricTable;
import jakarta.validation.Valid;
import java.time.format.DateTimeFormatter;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/anomalies")
public class AnomalyController {

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE;

    private final AnomalyDetectionService anomalyDetectionService;

    public AnomalyController(AnomalyDetectionService anomalyDetectionService) {
        this.anomalyDetectionService = anomalyDetectionService;
    }

    @PostMapping("/detect")
    public ResponseEntity<List<AnomalyRecordDto>> detect(@Valid @RequestBody DetectAnomaliesRequestDto request) {
        MetricTable table = MetricTable.fromRows(request.rows());
        DetectionRequest detection = DetectionRequest.of(
                request.metric(),
                request.metrics(),
                request.method(),
                request.confidenceThreshold()
        );
        List<AnomalyRecordDto> response = anomalyDetectionService.detectAnomalies(table, detection).stream()
                .map(this::map)
                .toList();
        return ResponseEntity.ok(response);
    }

    @GetMapping("/methods")
    public ResponseEntity<List<String>> methods() {
        return ResponseEntity.ok(anomalyDetectionService.supportedMethods());
    }

    private AnomalyRecordDto map(AnomalyRecord record) {
        return new AnomalyRecordDto(
                DATE_FORMAT.format(record.date()),
                record.metric(),
                record.value(),
                record.expectedValueMean(),
                record.expectedValueMedian(),
                record.deviationPct(),
                record.deviationFromMedianPct(),
                record.severity().label(),
                record.severityLevel().name(),
                record.direction().label(),
                record.method(),
                record.detectionMethods(),
                record.algorithmsAgreed(),
                record.confidence(),
                record.reason(),
                record.context()
        );
    }
}
