package com.safepocket.anomaly.detector;

import com.safepocket.anomaly.model.DetectorFinding;
import com.safepocket.anomaly.model.Direction;
import com.safepocket.anomaly.model.FindingSeverity;
import com.safepocket.anomaly.model.MetricSeries;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns flagged positions of a series into {@link DetectorFinding}s.
 */
final class FindingFactory {

    private FindingFactory() {
    }

    static List<DetectorFinding> findings(
            MetricSeries series,
            boolean[] flagged,
            String method,
            double mean,
            double median,
            Map<String, Object> context
    ) {
        List<DetectorFinding> findings = new ArrayList<>();
        List<MetricSeries.Point> points = series.points();
        for (int i = 0; i < points.size(); i++) {
            if (flagged[i]) {
                findings.add(finding(series.metric(), points.get(i), method, mean, median, context));
            }
        }
        return findings;
    }

    static DetectorFinding finding(
            String metric,
            MetricSeries.Point point,
            String method,
            double mean,
            double median,
            Map<String, Object> context
    ) {
        double value = point.value();
        double deviationFromMean = mean != 0 ? (value - mean) / Math.abs(mean) * 100 : 0d;
        double deviationFromMedian = median != 0 ? (value - median) / Math.abs(median) * 100 : 0d;
        return new DetectorFinding(
                point.date(),
                metric,
                value,
                mean,
                median,
                deviationFromMean,
                deviationFromMedian,
                FindingSeverity.fromDeviation(deviationFromMean),
                Direction.of(value, mean),
                method,
                context
        );
    }
}
