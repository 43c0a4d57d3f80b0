package com.safepocket.anomaly.analytics;

import com.safepocket.anomaly.config.AnomalyProperties;
import com.safepocket.anomaly.model.MetricTable;
import java.util.ArrayList;
import java.util.List;

/**
 * Picks the metrics to analyze when the caller names none: the priority financial metrics
 * present in the table, topped up with other numeric columns when fewer than
 * {@code minPriority} of them exist.
 */
public class MetricSelector {

    private final AnomalyProperties.Metrics settings;

    public MetricSelector(AnomalyProperties.Metrics settings) {
        this.settings = settings;
    }

    public List<String> select(MetricTable table, List<String> requested) {
        if (requested != null) {
            return requested;
        }
        List<String> numeric = table.numericColumns();
        List<String> selected = new ArrayList<>();
        for (String candidate : settings.priority()) {
            if (numeric.contains(candidate)) {
                selected.add(candidate);
            }
        }
        if (selected.size() < settings.minPriority()) {
            for (String column : numeric) {
                if (selected.size() >= settings.maxAuto()) {
                    break;
                }
                if (!selected.contains(column) && !MetricTable.DATE_COLUMN.equals(column)) {
                    selected.add(column);
                }
            }
        }
        return selected;
    }
}
