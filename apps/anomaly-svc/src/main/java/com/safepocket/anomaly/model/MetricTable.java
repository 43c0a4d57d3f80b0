package com.safepocket.anomaly.model;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Column-oriented, immutable input table: an optional {@code date} column plus named numeric
 * columns holding nullable values. Non-finite numbers are stored as missing.
 */
public final class MetricTable {

    public static final String DATE_COLUMN = "date";

    private final List<LocalDate> dates;
    private final Map<String, List<Double>> columns;
    private final Set<String> nonNumericColumns;
    private final int rowCount;

    private MetricTable(List<LocalDate> dates, Map<String, List<Double>> columns, Set<String> nonNumericColumns, int rowCount) {
        this.dates = dates;
        this.columns = columns;
        this.nonNumericColumns = nonNumericColumns;
        this.rowCount = rowCount;
    }

    public static MetricTable empty() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builds a table from JSON-style rows. {@code date} accepts {@code YYYY-MM-DD} or an ISO
     * date-time (only the date part is kept); numbers may be JSON numbers or numeric strings.
     * A column holding any other non-null value is kept out of the numeric columns.
     *
     * @throws IllegalArgumentException when a row carries an unparseable date
     */
    public static MetricTable fromRows(List<Map<String, Object>> rows) {
        if (rows == null || rows.isEmpty()) {
            return empty();
        }
        Set<String> names = new LinkedHashSet<>();
        for (Map<String, Object> row : rows) {
            if (row != null) {
                names.addAll(row.keySet());
            }
        }
        Builder builder = builder();
        if (names.remove(DATE_COLUMN)) {
            List<LocalDate> dates = new ArrayList<>(rows.size());
            for (int i = 0; i < rows.size(); i++) {
                Object raw = rows.get(i) == null ? null : rows.get(i).get(DATE_COLUMN);
                dates.add(parseDate(raw, i));
            }
            builder.dates(dates);
        }
        for (String name : names) {
            List<Double> values = new ArrayList<>(rows.size());
            boolean numeric = true;
            for (Map<String, Object> row : rows) {
                Object raw = row == null ? null : row.get(name);
                Optional<Double> parsed = parseNumber(raw);
                if (raw != null && parsed.isEmpty()) {
                    numeric = false;
                }
                values.add(parsed.orElse(null));
            }
            if (numeric) {
                builder.column(name, values);
            } else {
                builder.nonNumericColumn(name);
            }
        }
        return builder.build();
    }

    public boolean hasDateColumn() {
        return dates != null;
    }

    public boolean hasColumn(String name) {
        return columns.containsKey(name) || nonNumericColumns.contains(name);
    }

    public int rowCount() {
        return rowCount;
    }

    public boolean isEmpty() {
        return rowCount == 0;
    }

    /**
     * Numeric column names in insertion order; never includes the date column.
     */
    public List<String> numericColumns() {
        return List.copyOf(columns.keySet());
    }

    /**
     * Non-null {@code (date, value)} pairs for {@code metric}, sorted by date. Empty when the
     * column is missing, non-numeric, entirely null, or the table has no date column.
     */
    public MetricSeries series(String metric) {
        List<Double> values = columns.get(metric);
        if (values == null || dates == null) {
            return MetricSeries.empty(metric);
        }
        List<MetricSeries.Point> points = new ArrayList<>(values.size());
        for (int i = 0; i < values.size(); i++) {
            Double value = values.get(i);
            LocalDate date = dates.get(i);
            if (value != null && date != null) {
                points.add(new MetricSeries.Point(date, value));
            }
        }
        return new MetricSeries(metric, points);
    }

    private static LocalDate parseDate(Object raw, int rowIndex) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof LocalDate date) {
            return date;
        }
        String text = raw.toString().trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            return LocalDate.parse(text.length() > 10 ? text.substring(0, 10) : text);
        } catch (DateTimeParseException ex) {
            throw new IllegalArgumentException("row " + rowIndex + ": invalid date '" + text + "'", ex);
        }
    }

    private static Optional<Double> parseNumber(Object raw) {
        if (raw instanceof Number number) {
            return Optional.of(number.doubleValue());
        }
        if (raw instanceof String text && !text.isBlank()) {
            try {
                return Optional.of(Double.parseDouble(text.trim()));
            } catch (NumberFormatException ex) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    public static final class Builder {
        private List<LocalDate> dates;
        private final Map<String, List<Double>> columns = new LinkedHashMap<>();
        private final Set<String> nonNumericColumns = new LinkedHashSet<>();

        public Builder dates(List<LocalDate> dates) {
            this.dates = dates == null ? null : Collections.unmodifiableList(new ArrayList<>(dates));
            return this;
        }

        public Builder column(String name, List<Double> values) {
            Objects.requireNonNull(name, "name");
            if (DATE_COLUMN.equals(name)) {
                throw new IllegalArgumentException("'" + DATE_COLUMN + "' is reserved for the timestamp column");
            }
            List<Double> copy = new ArrayList<>(values.size());
            for (Double value : values) {
                copy.add(value == null || !Double.isFinite(value) ? null : value);
            }
            columns.put(name, Collections.unmodifiableList(copy));
            return this;
        }

        Builder nonNumericColumn(String name) {
            nonNumericColumns.add(name);
            return this;
        }

        public MetricTable build() {
            int rows = dates != null ? dates.size() : columns.values().stream().mapToInt(List::size).max().orElse(0);
            for (Map.Entry<String, List<Double>> entry : columns.entrySet()) {
                if (entry.getValue().size() != rows) {
                    throw new IllegalArgumentException("column '" + entry.getKey() + "' has " + entry.getValue().size()
                            + " values, expected " + rows);
                }
            }
            return new MetricTable(dates, Collections.unmodifiableMap(new LinkedHashMap<>(columns)),
                    Collections.unmodifiableSet(new LinkedHashSet<>(nonNumericColumns)), rows);
        }
    }
}
