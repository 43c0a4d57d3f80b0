package com.safepocket.anomaly.detector;

import com.safepocket.anomaly.config.AnomalyProperties;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Detectors by name, in registration order. The ensemble runs {@link #ensembleDetectors()};
 * single-method runs look a detector up by name or alias.
 */
public class DetectorRegistry {

    private final Map<String, Detector> byName;
    private final List<String> ensembleNames;

    public DetectorRegistry(List<? extends Detector> detectors, List<String> ensembleNames) {
        Map<String, Detector> map = new LinkedHashMap<>();
        for (Detector detector : detectors) {
            if (map.putIfAbsent(detector.name(), detector) != null) {
                throw new IllegalArgumentException("duplicate detector name '" + detector.name() + "'");
            }
        }
        for (String name : ensembleNames) {
            if (!map.containsKey(name)) {
                throw new IllegalArgumentException("ensemble references unregistered detector '" + name + "'");
            }
        }
        this.byName = Collections.unmodifiableMap(map);
        this.ensembleNames = List.copyOf(ensembleNames);
    }

    public DetectorRegistry(List<? extends Detector> detectors) {
        this(detectors, detectors.stream().map(Detector::name).toList());
    }

    public static DetectorRegistry fromProperties(AnomalyProperties properties) {
        AnomalyProperties.Detectors settings = properties.detectors();
        AnomalyProperties.IsolationForest forest = properties.isolationForest();
        List<Detector> detectors = List.of(
                new DynamicIqrDetector(settings.iqrMinPoints()),
                new ModifiedZScoreDetector(settings.zscoreMinPoints()),
                new IsolationForestDetector(settings.isolationForestMinPoints(), forest.trees(), forest.maxSamples(), forest.seed()),
                new LocalOutlierFactorDetector(settings.lofMinPoints()),
                new OneClassSvmDetector(settings.svmMinPoints()),
                new GrubbsTestDetector(settings.grubbsMinPoints())
        );
        return new DetectorRegistry(detectors, settings.enabled());
    }

    public List<Detector> ensembleDetectors() {
        List<Detector> detectors = new ArrayList<>(ensembleNames.size());
        for (String name : ensembleNames) {
            detectors.add(byName.get(name));
        }
        return detectors;
    }

    /**
     * Finds a detector by its name ({@code dynamic_iqr}) or alias ({@code iqr}).
     */
    public Optional<Detector> find(String nameOrAlias) {
        if (nameOrAlias == null) {
            return Optional.empty();
        }
        Detector direct = byName.get(nameOrAlias);
        if (direct != null) {
            return Optional.of(direct);
        }
        return byName.values().stream()
                .filter(detector -> nameOrAlias.equals(detector.alias()))
                .findFirst();
    }

    public List<String> aliases() {
        return byName.values().stream().map(Detector::alias).toList();
    }

    public int size() {
        return byName.size();
    }
}
