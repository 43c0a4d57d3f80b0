package com.safepocket.anomaly.detector;

import static org.assertj.core.api.Assertions.assertThat;

import com.safepocket.anomaly.SeriesFixtures;
import com.safepocket.anomaly.model.DetectorFinding;
import com.safepocket.anomaly.model.Direction;
import com.safepocket.anomaly.model.MetricSeries;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class DynamicIqrDetectorTest {

    private final DynamicIqrDetector detector = new DynamicIqrDetector(4);

    @Test
    void flagsSpikeOutsideWidenedFences() {
        MetricSeries series = SeriesFixtures.series("revenue", SeriesFixtures.rippleWithSpike());

        DetectorOutcome outcome = detector.detect(series);

        assertThat(outcome.status()).isEqualTo(DetectorOutcome.Status.COMPLETED);
        assertThat(outcome.findings()).hasSize(1);
        DetectorFinding finding = outcome.findings().get(0);
        assertThat(finding.date()).isEqualTo(SeriesFixtures.START.plusMonths(SeriesFixtures.SPIKE_INDEX));
        assertThat(finding.value()).isEqualTo(500_000d);
        assertThat(finding.direction()).isEqualTo(Direction.SPIKE);
        assertThat(finding.method()).isEqualTo(DynamicIqrDetector.NAME);
        assertThat(finding.context()).containsEntry("multiplier", 3.0d);
    }

    @Test
    void zeroInterquartileRangeCompletesWithoutFindings() {
        DetectorOutcome outcome = detector.detect(SeriesFixtures.series("revenue", SeriesFixtures.flatWithSpike()));

        assertThat(outcome.status()).isEqualTo(DetectorOutcome.Status.COMPLETED);
        assertThat(outcome.findings()).isEmpty();
    }

    @Test
    void zeroMeanCompletesWithoutFindings() {
        DetectorOutcome outcome = detector.detect(SeriesFixtures.series("cashflow", -2, -1, 1, 2));

        assertThat(outcome.status()).isEqualTo(DetectorOutcome.Status.COMPLETED);
        assertThat(outcome.findings()).isEmpty();
    }

    @Test
    void skipsShortSeries() {
        DetectorOutcome outcome = detector.detect(SeriesFixtures.series("revenue", 1, 2, 3));

        assertThat(outcome.status()).isEqualTo(DetectorOutcome.Status.SKIPPED);
        assertThat(outcome.reason()).contains("at least 4");
    }

    @Test
    void multiplierWidensWithVolatility() {
        assertThat(DynamicIqrDetector.multiplierFor(0.1)).isEqualTo(1.5);
        assertThat(DynamicIqrDetector.multiplierFor(0.2)).isEqualTo(2.0);
        assertThat(DynamicIqrDetector.multiplierFor(0.4)).isEqualTo(2.5);
        assertThat(DynamicIqrDetector.multiplierFor(0.9)).isEqualTo(3.0);
    }

    @Test
    void seasonalityComparesSameMonthSpreadWithOverallSpread() {
        List<Double> yearOverYearShift = new ArrayList<>(SeriesFixtures.constant(12, 100d));
        yearOverYearShift.addAll(SeriesFixtures.constant(12, 200d));
        MetricSeries shifted = SeriesFixtures.series("revenue", yearOverYearShift);

        List<Double> repeatingPattern = new ArrayList<>();
        for (int i = 0; i < 24; i++) {
            repeatingPattern.add(100d + (i % 12) * 10d);
        }
        MetricSeries repeating = SeriesFixtures.series("revenue", repeatingPattern);

        assertThat(DynamicIqrDetector.isSeasonal(shifted, shifted.standardDeviation())).isTrue();
        assertThat(DynamicIqrDetector.isSeasonal(repeating, repeating.standardDeviation())).isFalse();
    }
}
