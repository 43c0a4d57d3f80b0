package com.safepocket.anomaly.ensemble;

import com.safepocket.anomaly.explain.ExplanationFormatter;
import com.safepocket.anomaly.model.AnomalyRecord;
import com.safepocket.anomaly.model.DetectorFinding;
import com.safepocket.anomaly.model.SeverityLevel;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds {@link AnomalyRecord}s from detector findings. Deviations are rounded to two
 * decimals, confidence to three.
 */
public class AnomalyRecordAssembler {

    private final ExplanationFormatter formatter;

    public AnomalyRecordAssembler(ExplanationFormatter formatter) {
        this.formatter = formatter;
    }

    /**
     * Record for a finding of a single-method run; the severity level mirrors the finding's
     * own severity.
     */
    public AnomalyRecord single(DetectorFinding finding) {
        return new AnomalyRecord(
                finding.date(),
                ExplanationFormatter.displayName(finding.metric()),
                finding.value(),
                finding.expectedMean(),
                finding.expectedMedian(),
                round(finding.deviationPct(), 2),
                round(finding.deviationFromMedianPct(), 2),
                finding.severity(),
                SeverityLevel.fromFindingSeverity(finding.severity()),
                finding.direction(),
                finding.method(),
                null,
                null,
                null,
                formatter.describe(finding),
                finding.context()
        );
    }

    AnomalyRecord ensemble(
            DetectorFinding template,
            List<String> methods,
            Map<String, Double> deviations,
            int executed,
            double confidence,
            SeverityLevel level
    ) {
        Map<String, Object> context = new HashMap<>(template.context());
        Map<String, Object> scores = new HashMap<>();
        deviations.forEach((method, deviation) -> scores.put(method, round(deviation, 2)));
        context.put("algorithm_deviations", scores);
        String reason = formatter.withConsensus(formatter.describe(template), methods.size(), executed);
        return new AnomalyRecord(
                template.date(),
                ExplanationFormatter.displayName(template.metric()),
                template.value(),
                template.expectedMean(),
                template.expectedMedian(),
                round(template.deviationPct(), 2),
                round(template.deviationFromMedianPct(), 2),
                template.severity(),
                level,
                template.direction(),
                template.method(),
                methods,
                methods.size() + "/" + executed,
                round(confidence, 3),
                reason,
                context
        );
    }

    static double round(double value, int scale) {
        if (!Double.isFinite(value)) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }
}
