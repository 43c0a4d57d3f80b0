package com.safepocket.anomaly.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class SeriesStatisticsTest {

    @Test
    void computesMeanAndStandardDeviations() {
        double[] values = {2, 4, 4, 4, 5, 5, 7, 9};

        assertThat(SeriesStatistics.mean(values)).isEqualTo(5.0);
        assertThat(SeriesStatistics.populationStandardDeviation(values)).isEqualTo(2.0);
        assertThat(SeriesStatistics.sampleStandardDeviation(values)).isCloseTo(Math.sqrt(32.0 / 7.0), within(1e-12));
    }

    @Test
    void quantilesInterpolateBetweenRanks() {
        double[] values = {4, 1, 3, 2};

        assertThat(SeriesStatistics.quantile(values, 0.25)).isEqualTo(1.75);
        assertThat(SeriesStatistics.quantile(values, 0.75)).isEqualTo(3.25);
        assertThat(SeriesStatistics.median(values)).isEqualTo(2.5);
        assertThat(SeriesStatistics.median(new double[]{3, 1, 2})).isEqualTo(2.0);
    }

    @Test
    void percentileBetweenEqualNeighboursIsExact() {
        double tied = -0.1 / 3;
        double[] sorted = {-5.0, tied, tied, tied, tied};

        assertThat(SeriesStatistics.percentileOfSorted(sorted, 45.0)).isEqualTo(tied);
    }

    @Test
    void emptyAndSingletonSamplesYieldNaN() {
        assertThat(SeriesStatistics.mean(new double[0])).isNaN();
        assertThat(SeriesStatistics.quantile(new double[0], 0.5)).isNaN();
        assertThat(SeriesStatistics.sampleStandardDeviation(new double[]{1.0})).isNaN();
        assertThat(SeriesStatistics.populationStandardDeviation(new double[]{1.0})).isZero();
    }
}
