package com.safepocket.anomaly.detector.ml;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class LocalOutlierFactorTest {

    @Test
    void isolatedPointHasLargeFactor() {
        double[] data = {1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 100};

        double[] factors = LocalOutlierFactor.factors(data, 3);

        assertThat(factors[10]).isGreaterThan(5.0);
        for (int i = 0; i < 10; i++) {
            assertThat(factors[i]).isLessThan(2.0);
        }
    }

    @Test
    void identicalPointsHaveUnitFactor() {
        double[] factors = LocalOutlierFactor.factors(new double[]{4, 4, 4, 4, 4, 4}, 3);

        for (double factor : factors) {
            assertThat(factor).isCloseTo(1.0, within(1e-9));
        }
    }

    @Test
    void neighbourhoodIsCappedBySampleSize() {
        double[] factors = LocalOutlierFactor.factors(new double[]{1, 2, 3}, 20);

        assertThat(factors).hasSize(3);
    }

    @Test
    void needsTwoSamples() {
        assertThatThrownBy(() -> LocalOutlierFactor.factors(new double[]{1}, 5))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
