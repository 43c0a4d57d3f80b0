package com.safepocket.anomaly.ensemble;

import com.safepocket.anomaly.model.DetectorFinding;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Votes collected for one {@code (metric, date)} during a single aggregation call.
 * Not thread-safe; each aggregation owns its own instances.
 */
final class EnsembleVoteRecord {

    record Key(String metric, LocalDate date) {
    }

    private final List<String> methods = new ArrayList<>();
    private final Map<String, Double> deviations = new LinkedHashMap<>();
    private DetectorFinding template;

    void add(String detector, DetectorFinding finding) {
        if (!methods.contains(detector)) {
            methods.add(detector);
        }
        deviations.put(detector, finding.deviationPct());
        template = finding;
    }

    int votes() {
        return methods.size();
    }

    List<String> methods() {
        return List.copyOf(methods);
    }

    Map<String, Double> deviations() {
        return Map.copyOf(deviations);
    }

    DetectorFinding template() {
        return template;
    }
}
