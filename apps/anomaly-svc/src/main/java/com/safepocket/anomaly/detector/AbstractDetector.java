package com.safepocket.anomaly.detector;

import com.safepocket.anomaly.model.MetricSeries;

/**
 * Enforces the minimum sample size and turns runtime failures of {@link #analyze} into
 * {@link DetectorOutcome.Status#FAILED} outcomes.
 */
public abstract class AbstractDetector implements Detector {

    private final String name;
    private final String alias;
    private final int minPoints;

    protected AbstractDetector(String name, String alias, int minPoints) {
        if (minPoints < 1) {
            throw new IllegalArgumentException(name + ": minPoints must be positive");
        }
        this.name = name;
        this.alias = alias;
        this.minPoints = minPoints;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String alias() {
        return alias;
    }

    public int minPoints() {
        return minPoints;
    }

    @Override
    public final DetectorOutcome detect(MetricSeries series) {
        if (series == null || series.size() < minPoints) {
            int size = series == null ? 0 : series.size();
            return skipped("requires at least " + minPoints + " points, got " + size);
        }
        try {
            return analyze(series);
        } catch (RuntimeException ex) {
            return DetectorOutcome.failed(name, ex.getClass().getSimpleName() + ": " + ex.getMessage(), ex);
        }
    }

    /**
     * Called only when the series holds at least {@link #minPoints()} values.
     */
    protected abstract DetectorOutcome analyze(MetricSeries series);

    protected DetectorOutcome skipped(String reason) {
        return DetectorOutcome.skipped(name, reason);
    }

    protected static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
