package com.safepocket.anomaly.model;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Cleaned view of one metric: finite values only, ordered by date ascending.
 * Non-finite points are dropped on construction.
 */
public record MetricSeries(String metric, List<Point> points) {

    public record Point(LocalDate date, double value) {
        public Point {
            Objects.requireNonNull(date, "date");
        }
    }

    public MetricSeries {
        Objects.requireNonNull(metric, "metric");
        points = points == null
                ? List.of()
                : points.stream()
                        .filter(Objects::nonNull)
                        .filter(point -> Double.isFinite(point.value()))
                        .sorted(Comparator.comparing(Point::date))
                        .toList();
    }

    public static MetricSeries empty(String metric) {
        return new MetricSeries(metric, List.of());
    }

    public int size() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    public double[] values() {
        return points.stream().mapToDouble(Point::value).toArray();
    }

    public double standardDeviation() {
        return SeriesStatistics.sampleStandardDeviation(values());
    }
}
