package com.safepocket.anomaly.analytics;

import com.safepocket.anomaly.config.AnomalyProperties;
import com.safepocket.anomaly.detector.Detector;
import com.safepocket.anomaly.detector.DetectorOutcome;
import com.safepocket.anomaly.detector.DetectorRegistry;
import com.safepocket.anomaly.detector.DynamicIqrDetector;
import com.safepocket.anomaly.ensemble.AnomalyRecordAssembler;
import com.safepocket.anomaly.ensemble.EnsembleAggregator;
import com.safepocket.anomaly.explain.ExplanationFormatter;
import com.safepocket.anomaly.model.AnomalyRecord;
import com.safepocket.anomaly.model.MetricSeries;
import com.safepocket.anomaly.model.MetricTable;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point of the engine: selects metrics, runs the ensemble (or one named detector) per
 * metric and returns every anomaly ordered by severity level, then date.
 *
 * <p>Stateless between calls. A failure while analyzing one metric is logged and only drops
 * that metric's results.
 */
@Service
public class AnomalyDetectionService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetectionService.class);

    static final Comparator<AnomalyRecord> REPORT_ORDER = Comparator
            .comparingInt((AnomalyRecord record) -> record.severityLevel().rank())
            .reversed()
            .thenComparing(AnomalyRecord::date);

    private final AnomalyProperties properties;
    private final DetectorRegistry registry;
    private final MetricSelector metricSelector;
    private final AnomalyRecordAssembler assembler;
    private final EnsembleAggregator aggregator;

    public AnomalyDetectionService(
            AnomalyProperties properties,
            DetectorRegistry registry,
            MetricSelector metricSelector,
            ExplanationFormatter explanationFormatter
    ) {
        this.properties = properties;
        this.registry = registry;
        this.metricSelector = metricSelector;
        this.assembler = new AnomalyRecordAssembler(explanationFormatter);
        this.aggregator = new EnsembleAggregator(properties, assembler);
    }

    public static AnomalyDetectionService create(AnomalyProperties properties) {
        return new AnomalyDetectionService(
                properties,
                DetectorRegistry.fromProperties(properties),
                new MetricSelector(properties.metrics()),
                new ExplanationFormatter()
        );
    }

    public List<AnomalyRecord> detectAnomalies(MetricTable table) {
        return detectAnomalies(table, DetectionRequest.ensemble());
    }

    public List<AnomalyRecord> detectAnomalies(MetricTable table, List<String> metrics, String method) {
        return detectAnomalies(table, DetectionRequest.of(null, metrics, method, null));
    }

    /**
     * Single-metric form kept for older callers; equivalent to a one-element metric list.
     */
    public List<AnomalyRecord> detectAnomalies(MetricTable table, String metric, String method) {
        return detectAnomalies(table, DetectionRequest.of(metric, null, method, null));
    }

    public List<AnomalyRecord> detectAnomalies(MetricTable table, DetectionRequest request) {
        if (table == null || !table.hasDateColumn() || table.isEmpty()) {
            return List.of();
        }
        EnsembleAggregator ensemble = request.confidenceThreshold() == null
                ? aggregator
                : new EnsembleAggregator(properties.withConfidenceThreshold(request.confidenceThreshold()), assembler);
        Optional<Detector> single = Optional.empty();
        if (!request.isEnsemble()) {
            single = resolveDetector(request.method());
            if (single.isEmpty()) {
                log.warn("No detector available for method '{}'", request.method());
                return List.of();
            }
        }

        List<String> metrics = metricSelector.select(table, request.metrics());
        List<AnomalyRecord> anomalies = new ArrayList<>();
        for (String metric : metrics) {
            try {
                MetricSeries series = table.series(metric);
                if (series.isEmpty()) {
                    log.debug("Skipping metric {}: column missing or without values", metric);
                    continue;
                }
                anomalies.addAll(single
                        .map(detector -> detectWith(detector, series))
                        .orElseGet(() -> ensemble.aggregate(series, registry.ensembleDetectors())));
            } catch (RuntimeException ex) {
                log.warn("Anomaly detection failed for metric {}: {}", metric, ex.getMessage(), ex);
            }
        }
        anomalies.sort(REPORT_ORDER);
        log.info("Anomaly detection ({}) analyzed {} metrics over {} rows, {} anomalies",
                request.method(), metrics.size(), table.rowCount(), anomalies.size());
        return anomalies;
    }

    public List<String> supportedMethods() {
        List<String> methods = new ArrayList<>();
        methods.add(DetectionRequest.ENSEMBLE);
        methods.addAll(registry.aliases());
        return methods;
    }

    private List<AnomalyRecord> detectWith(Detector detector, MetricSeries series) {
        DetectorOutcome outcome = EnsembleAggregator.run(detector, series);
        return outcome.findings().stream().map(assembler::single).toList();
    }

    /**
     * Unknown methods fall back to the dynamic IQR detector instead of failing the call.
     */
    private Optional<Detector> resolveDetector(String method) {
        Optional<Detector> detector = registry.find(method);
        if (detector.isPresent()) {
            return detector;
        }
        log.warn("Unknown detection method '{}', falling back to {}", method, DynamicIqrDetector.NAME);
        return registry.find(DynamicIqrDetector.NAME);
    }
}
