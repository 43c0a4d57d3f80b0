package com.safepocket.anomaly;

import com.safepocket.anomaly.model.MetricSeries;
import com.safepocket.anomaly.model.MetricTable;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

public final class SeriesFixtures {

    public static final LocalDate START = LocalDate.of(2023, 1, 1);
    public static final int SPIKE_INDEX = 11;

    private SeriesFixtures() {
    }

    public static List<LocalDate> monthlyDates(int count) {
        List<LocalDate> dates = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            dates.add(START.plusMonths(i));
        }
        return dates;
    }

    public static List<Double> constant(int count, double value) {
        List<Double> values = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            values.add(value);
        }
        return values;
    }

    /**
     * 24 months of 100,000 with a single 500,000 spike at {@link #SPIKE_INDEX} (December 2023).
     */
    public static List<Double> flatWithSpike() {
        List<Double> values = constant(24, 100_000d);
        values.set(SPIKE_INDEX, 500_000d);
        return values;
    }

    /**
     * 24 months cycling through 100,000..104,000 with a 500,000 spike at {@link #SPIKE_INDEX}.
     */
    public static List<Double> rippleWithSpike() {
        List<Double> values = new ArrayList<>(24);
        for (int i = 0; i < 24; i++) {
            values.add(100_000d + (i % 5) * 1_000d);
        }
        values.set(SPIKE_INDEX, 500_000d);
        return values;
    }

    public static List<Double> gaussian(int count, double mean, double std, long seed) {
        Random random = new Random(seed);
        List<Double> values = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            values.add(mean + random.nextGaussian() * std);
        }
        return values;
    }

    public static MetricSeries series(String metric, List<Double> values) {
        List<LocalDate> dates = monthlyDates(values.size());
        List<MetricSeries.Point> points = new ArrayList<>(values.size());
        for (int i = 0; i < values.size(); i++) {
            points.add(new MetricSeries.Point(dates.get(i), values.get(i)));
        }
        return new MetricSeries(metric, points);
    }

    public static MetricSeries series(String metric, double... values) {
        return series(metric, Arrays.stream(values).boxed().toList());
    }

    /**
     * Revenue with one spike; profit and expenses flat.
     */
    public static MetricTable spikeTable() {
        return MetricTable.builder()
                .dates(monthlyDates(24))
                .column("revenue", flatWithSpike())
                .column("profit", constant(24, 50_000d))
                .column("expenses", constant(24, 50_000d))
                .build();
    }
}
