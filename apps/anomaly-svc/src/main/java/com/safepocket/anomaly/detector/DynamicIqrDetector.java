package com.safepocket.anomaly.detector;

import com.safepocket.anomaly.model.MetricSeries;
import com.safepocket.anomaly.model.SeriesStatistics;
import java.time.Month;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * IQR fences whose multiplier widens with the coefficient of variation, and widens again
 * for seasonal data (12+ points whose same-month spread is comparable to the overall spread).
 */
public class DynamicIqrDetector extends AbstractDetector {

    public static final String NAME = "dynamic_iqr";

    static final int SEASONAL_MIN_POINTS = 12;
    static final double SEASONAL_ADJUSTMENT = 1.3d;

    public DynamicIqrDetector(int minPoints) {
        super(NAME, "iqr", minPoints);
    }

    @Override
    protected DetectorOutcome analyze(MetricSeries series) {
        double[] values = series.values();
        double mean = SeriesStatistics.mean(values);
        if (mean == 0) {
            // volatility is undefined; nothing can be fenced
            return DetectorOutcome.completed(NAME, List.of());
        }
        double std = SeriesStatistics.sampleStandardDeviation(values);
        double volatility = std / Math.abs(mean);
        double multiplier = multiplierFor(volatility);
        if (values.length >= SEASONAL_MIN_POINTS && isSeasonal(series, std)) {
            multiplier *= SEASONAL_ADJUSTMENT;
        }

        double q1 = SeriesStatistics.quantile(values, 0.25);
        double q3 = SeriesStatistics.quantile(values, 0.75);
        double iqr = q3 - q1;
        if (iqr == 0) {
            return DetectorOutcome.completed(NAME, List.of());
        }
        double lowerBound = q1 - multiplier * iqr;
        double upperBound = q3 + multiplier * iqr;

        boolean[] flagged = new boolean[values.length];
        for (int i = 0; i < values.length; i++) {
            flagged[i] = values[i] < lowerBound || values[i] > upperBound;
        }
        return DetectorOutcome.completed(NAME, FindingFactory.findings(
                series, flagged, NAME, mean, SeriesStatistics.median(values),
                Map.of("volatility", volatility, "multiplier", multiplier)));
    }

    static double multiplierFor(double volatility) {
        if (volatility > 0.5) {
            return 3.0d;
        }
        if (volatility > 0.3) {
            return 2.5d;
        }
        if (volatility > 0.15) {
            return 2.0d;
        }
        return 1.5d;
    }

    /**
     * Mean of the per-calendar-month standard deviations (months with a single observation
     * contribute nothing) compared with half the overall standard deviation.
     */
    static boolean isSeasonal(MetricSeries series, double overallStd) {
        Map<Month, List<Double>> byMonth = new EnumMap<>(Month.class);
        for (MetricSeries.Point point : series.points()) {
            byMonth.computeIfAbsent(point.date().getMonth(), month -> new ArrayList<>()).add(point.value());
        }
        double sum = 0d;
        int groups = 0;
        for (List<Double> group : byMonth.values()) {
            if (group.size() < 2) {
                continue;
            }
            sum += SeriesStatistics.sampleStandardDeviation(group.stream().mapToDouble(Double::doubleValue).toArray());
            groups++;
        }
        if (groups == 0) {
            return false;
        }
        return sum / groups > overallStd * 0.5;
    }
}
