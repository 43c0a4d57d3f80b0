package com.safepocket.anomaly.detector;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.safepocket.anomaly.SeriesFixtures;
import com.safepocket.anomaly.model.DetectorFinding;
import org.junit.jupiter.api.Test;

class GrubbsTestDetectorTest {

    private final GrubbsTestDetector detector = new GrubbsTestDetector(7);

    @Test
    void criticalValuesMatchPublishedTable() {
        assertThat(GrubbsTestDetector.criticalValue(10, 0.05)).isCloseTo(2.290, within(0.02));
        assertThat(GrubbsTestDetector.criticalValue(20, 0.05)).isCloseTo(2.709, within(0.02));
        assertThat(GrubbsTestDetector.criticalValue(24, 0.05)).isCloseTo(2.802, within(0.02));
    }

    @Test
    void removesOutlierAndStopsOnceRemainderIsNormal() {
        DetectorOutcome outcome = detector.detect(SeriesFixtures.series("revenue", SeriesFixtures.rippleWithSpike()));

        assertThat(outcome.completed()).isTrue();
        assertThat(outcome.findings()).extracting(DetectorFinding::value).containsExactly(500_000.0);
        assertThat(outcome.findings().get(0).context()).containsEntry("alpha", 0.05);
    }

    @Test
    void stopsWhenRemainderIsConstant() {
        DetectorOutcome outcome = detector.detect(SeriesFixtures.series("revenue", SeriesFixtures.flatWithSpike()));

        assertThat(outcome.findings()).extracting(DetectorFinding::value).containsExactly(500_000.0);
    }

    @Test
    void skipsWhenTooShortForOneRound() {
        DetectorOutcome outcome = detector.detect(SeriesFixtures.series("revenue", 1, 2, 3, 4, 5, 6, 7, 8, 90));

        assertThat(outcome.status()).isEqualTo(DetectorOutcome.Status.SKIPPED);
    }
}
