package com.safepocket.anomaly.ensemble;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.safepocket.anomaly.config.AnomalyProperties;
import com.safepocket.anomaly.model.SeverityLevel;
import org.junit.jupiter.api.Test;

class SeverityClassifierTest {

    private final SeverityClassifier classifier = new SeverityClassifier(AnomalyProperties.defaults().severity());

    @Test
    void combinesConfidenceWithCappedDeviation() {
        assertThat(SeverityClassifier.combinedScore(1.0, 328.57)).isCloseTo(1.0, within(1e-12));
        assertThat(SeverityClassifier.combinedScore(0.5, -80)).isCloseTo(0.62, within(1e-12));
    }

    @Test
    void mapsCombinedScoreToLevels() {
        assertThat(classifier.classify(1.0, 328.57)).isEqualTo(SeverityLevel.CRITICAL);
        assertThat(classifier.classify(0.8, 60)).isEqualTo(SeverityLevel.HIGH);
        assertThat(classifier.classify(0.5, 80)).isEqualTo(SeverityLevel.MEDIUM);
        assertThat(classifier.classify(0.4, -50)).isEqualTo(SeverityLevel.LOW);
        assertThat(classifier.classify(0.5, 10)).isEqualTo(SeverityLevel.INFO);
    }

    @Test
    void honoursConfiguredThresholds() {
        SeverityClassifier strict = new SeverityClassifier(new AnomalyProperties.Severity(0.99, 0.95, 0.9, 0.8));

        assertThat(strict.classify(0.8, 60)).isEqualTo(SeverityLevel.INFO);
        assertThat(strict.classify(1.0, 200)).isEqualTo(SeverityLevel.CRITICAL);
    }
}
