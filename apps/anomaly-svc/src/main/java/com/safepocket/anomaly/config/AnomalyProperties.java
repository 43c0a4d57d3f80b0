package com.safepocket.anomaly.config;

import com.safepocket.anomaly.detector.DynamicIqrDetector;
import com.safepocket.anomaly.detector.GrubbsTestDetector;
import com.safepocket.anomaly.detector.IsolationForestDetector;
import com.safepocket.anomaly.detector.LocalOutlierFactorDetector;
import com.safepocket.anomaly.detector.ModifiedZScoreDetector;
import com.safepocket.anomaly.detector.OneClassSvmDetector;
import com.safepocket.anomaly.model.SeverityLevel;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

/**
 * Engine configuration. Every section is optional; omitted values fall back to the defaults
 * below. Instances are immutable, use the {@code with*} methods to derive a variant.
 */
@ConfigurationProperties(prefix = "anomaly")
public record AnomalyProperties(
        Double confidenceThreshold,
        Severity severity,
        Detectors detectors,
        IsolationForest isolationForest,
        Metrics metrics
) {

    public static final double DEFAULT_CONFIDENCE_THRESHOLD = 0.5d;

    @ConstructorBinding
    public AnomalyProperties {
        if (confidenceThreshold == null) {
            confidenceThreshold = DEFAULT_CONFIDENCE_THRESHOLD;
        }
        if (confidenceThreshold < 0 || confidenceThreshold > 1 || confidenceThreshold.isNaN()) {
            throw new IllegalArgumentException("confidenceThreshold must be within [0, 1]");
        }
        if (severity == null) {
            severity = new Severity(null, null, null, null);
        }
        if (detectors == null) {
            detectors = new Detectors(null, null, null, null, null, null, null);
        }
        if (isolationForest == null) {
            isolationForest = new IsolationForest(null, null, null);
        }
        if (metrics == null) {
            metrics = new Metrics(null, null, null);
        }
    }

    public static AnomalyProperties defaults() {
        return new AnomalyProperties(null, null, null, null, null);
    }

    public AnomalyProperties withConfidenceThreshold(double threshold) {
        return new AnomalyProperties(threshold, severity, detectors, isolationForest, metrics);
    }

    /**
     * Lower bounds of the combined confidence/deviation score for each ensemble severity level.
     * INFO always starts at 0.
     */
    public record Severity(Double critical, Double high, Double medium, Double low) {
        public Severity {
            critical = critical == null ? 0.85d : critical;
            high = high == null ? 0.70d : high;
            medium = medium == null ? 0.55d : medium;
            low = low == null ? 0.40d : low;
            if (critical > 1 || !(critical > high && high > medium && medium > low && low > 0)) {
                throw new IllegalArgumentException("severity thresholds must satisfy 1 >= critical > high > medium > low > 0");
            }
        }

        /**
         * Thresholds ordered from the most to the least severe level.
         */
        public Map<SeverityLevel, Double> descending() {
            Map<SeverityLevel, Double> ordered = new LinkedHashMap<>();
            ordered.put(SeverityLevel.CRITICAL, critical);
            ordered.put(SeverityLevel.HIGH, high);
            ordered.put(SeverityLevel.MEDIUM, medium);
            ordered.put(SeverityLevel.LOW, low);
            ordered.put(SeverityLevel.INFO, 0d);
            return ordered;
        }
    }

    /**
     * Minimum sample sizes per detector and the detectors that take part in ensemble voting.
     * Minimums are empirical defaults and may be tuned.
     */
    public record Detectors(
            List<String> enabled,
            Integer iqrMinPoints,
            Integer zscoreMinPoints,
            Integer isolationForestMinPoints,
            Integer lofMinPoints,
            Integer svmMinPoints,
            Integer grubbsMinPoints
    ) {
        public static final List<String> ALL = List.of(
                DynamicIqrDetector.NAME,
                ModifiedZScoreDetector.NAME,
                IsolationForestDetector.NAME,
                LocalOutlierFactorDetector.NAME,
                OneClassSvmDetector.NAME,
                GrubbsTestDetector.NAME
        );

        public Detectors {
            enabled = enabled == null || enabled.isEmpty() ? ALL : List.copyOf(enabled);
            for (String name : enabled) {
                if (!ALL.contains(name)) {
                    throw new IllegalArgumentException("unknown detector '" + name + "', expected one of " + ALL);
                }
            }
            iqrMinPoints = positiveOrDefault(iqrMinPoints, 4, "iqrMinPoints");
            zscoreMinPoints = positiveOrDefault(zscoreMinPoints, 3, "zscoreMinPoints");
            isolationForestMinPoints = positiveOrDefault(isolationForestMinPoints, 10, "isolationForestMinPoints");
            lofMinPoints = positiveOrDefault(lofMinPoints, 10, "lofMinPoints");
            svmMinPoints = positiveOrDefault(svmMinPoints, 10, "svmMinPoints");
            grubbsMinPoints = positiveOrDefault(grubbsMinPoints, 7, "grubbsMinPoints");
            if (lofMinPoints < 2) {
                throw new IllegalArgumentException("lofMinPoints must be at least 2");
            }
            if (grubbsMinPoints < 3) {
                throw new IllegalArgumentException("grubbsMinPoints must be at least 3");
            }
        }
    }

    public record IsolationForest(Integer trees, Integer maxSamples, Long seed) {
        public IsolationForest {
            trees = positiveOrDefault(trees, 100, "trees");
            maxSamples = positiveOrDefault(maxSamples, 256, "maxSamples");
            seed = seed == null ? 42L : seed;
        }
    }

    /**
     * Automatic metric selection used when a request names no metrics.
     */
    public record Metrics(List<String> priority, Integer maxAuto, Integer minPriority) {
        public static final List<String> DEFAULT_PRIORITY = List.of(
                "revenue", "profit", "expenses", "cashflow",
                "profit_margin", "working_capital", "ar", "ap"
        );

        public Metrics {
            priority = priority == null || priority.isEmpty() ? DEFAULT_PRIORITY : List.copyOf(priority);
            maxAuto = positiveOrDefault(maxAuto, 10, "maxAuto");
            minPriority = positiveOrDefault(minPriority, 5, "minPriority");
        }
    }

    private static Integer positiveOrDefault(Integer value, int fallback, String name) {
        if (value == null) {
            return fallback;
        }
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive");
        }
        return value;
    }
}
