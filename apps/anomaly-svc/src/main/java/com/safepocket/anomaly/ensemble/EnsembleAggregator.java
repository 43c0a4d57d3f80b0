package com.safepocket.anomaly.ensemble;

import com.safepocket.anomaly.config.AnomalyProperties;
import com.safepocket.anomaly.detector.Detector;
import com.safepocket.anomaly.detector.DetectorOutcome;
import com.safepocket.anomaly.model.AnomalyRecord;
import com.safepocket.anomaly.model.DetectorFinding;
import com.safepocket.anomaly.model.MetricSeries;
import com.safepocket.anomaly.model.SeverityLevel;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs detectors over one metric and keeps the dates enough of them agree on.
 *
 * <p>Confidence is {@code votes / executed}, where {@code executed} counts only detectors that
 * completed, including those that found nothing because the series was degenerate. Skipped
 * (too few points) and failed detectors are left out of both sides of the ratio.
 */
public class EnsembleAggregator {

    private static final Logger log = LoggerFactory.getLogger(EnsembleAggregator.class);

    private final double confidenceThreshold;
    private final SeverityClassifier severityClassifier;
    private final AnomalyRecordAssembler assembler;

    public EnsembleAggregator(AnomalyProperties properties, AnomalyRecordAssembler assembler) {
        this.confidenceThreshold = properties.confidenceThreshold();
        this.severityClassifier = new SeverityClassifier(properties.severity());
        this.assembler = assembler;
    }

    public List<AnomalyRecord> aggregate(MetricSeries series, List<Detector> detectors) {
        List<DetectorOutcome> outcomes = new ArrayList<>(detectors.size());
        for (Detector detector : detectors) {
            outcomes.add(run(detector, series));
        }
        int executed = (int) outcomes.stream().filter(DetectorOutcome::completed).count();
        if (executed == 0) {
            log.debug("{}: no detector could run on {} points", series.metric(), series.size());
            return List.of();
        }

        Map<EnsembleVoteRecord.Key, EnsembleVoteRecord> votes = new LinkedHashMap<>();
        for (DetectorOutcome outcome : outcomes) {
            if (!outcome.completed()) {
                continue;
            }
            for (DetectorFinding finding : outcome.findings()) {
                votes.computeIfAbsent(new EnsembleVoteRecord.Key(series.metric(), finding.date()), key -> new EnsembleVoteRecord())
                        .add(outcome.detector(), finding);
            }
        }

        List<AnomalyRecord> records = new ArrayList<>();
        for (EnsembleVoteRecord vote : votes.values()) {
            double confidence = (double) vote.votes() / executed;
            if (confidence < confidenceThreshold) {
                continue;
            }
            DetectorFinding template = vote.template();
            double roundedDeviation = AnomalyRecordAssembler.round(template.deviationPct(), 2);
            SeverityLevel level = severityClassifier.classify(confidence, roundedDeviation);
            records.add(assembler.ensemble(template, vote.methods(), vote.deviations(), executed, confidence, level));
        }
        log.debug("{}: {} detectors ran, {} candidate dates, {} above confidence {}",
                series.metric(), executed, votes.size(), records.size(), confidenceThreshold);
        return records;
    }

    /**
     * Runs one detector, converting anything it throws into a failed outcome.
     */
    public static DetectorOutcome run(Detector detector, MetricSeries series) {
        DetectorOutcome outcome;
        try {
            outcome = detector.detect(series);
            if (outcome == null) {
                outcome = DetectorOutcome.failed(detector.name(), "detector returned no outcome", null);
            }
        } catch (RuntimeException ex) {
            outcome = DetectorOutcome.failed(detector.name(), ex.getClass().getSimpleName() + ": " + ex.getMessage(), ex);
        }
        if (outcome.status() == DetectorOutcome.Status.FAILED) {
            log.warn("Detector {} failed on metric {}: {}", outcome.detector(), series.metric(), outcome.reason(), outcome.cause());
        } else if (outcome.status() == DetectorOutcome.Status.SKIPPED) {
            log.debug("Detector {} skipped metric {}: {}", outcome.detector(), series.metric(), outcome.reason());
        }
        return outcome;
    }
}
