package com.safepocket.anomaly.detector.ml;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class IsolationForestTest {

    private static final double[] CLUSTER_WITH_OUTLIER = {10, 11, 9, 10.5, 9.5, 10.2, 9.8, 10.1, 9.9, 10.3, 80};

    @Test
    void averagePathLengthMatchesHarmonicApproximation() {
        assertThat(IsolationForest.averagePathLength(1)).isZero();
        assertThat(IsolationForest.averagePathLength(2)).isEqualTo(1.0);
        assertThat(IsolationForest.averagePathLength(256)).isCloseTo(10.245, within(0.01));
    }

    @Test
    void outlierScoresHigherThanClusterMembers() {
        IsolationForest forest = IsolationForest.fit(CLUSTER_WITH_OUTLIER, 100, 256, 42L);

        double outlier = forest.anomalyScore(80);
        for (int i = 0; i < CLUSTER_WITH_OUTLIER.length - 1; i++) {
            assertThat(outlier).isGreaterThan(forest.anomalyScore(CLUSTER_WITH_OUTLIER[i]));
        }
        assertThat(forest.size()).isEqualTo(100);
    }

    @Test
    void sameSeedBuildsSameForest() {
        IsolationForest first = IsolationForest.fit(CLUSTER_WITH_OUTLIER, 50, 8, 7L);
        IsolationForest second = IsolationForest.fit(CLUSTER_WITH_OUTLIER, 50, 8, 7L);

        for (double value : CLUSTER_WITH_OUTLIER) {
            assertThat(first.anomalyScore(value)).isEqualTo(second.anomalyScore(value));
        }
    }

    @Test
    void rejectsEmptySample() {
        assertThatThrownBy(() -> IsolationForest.fit(new double[0], 10, 256, 42L))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
