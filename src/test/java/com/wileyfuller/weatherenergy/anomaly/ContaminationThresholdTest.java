package com.wileyfuller.weatherenergy.anomaly;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ContaminationThresholdTest {

    @Test
    void testPercentileInterpolatesLinearly() {
        double[] values = {4.0, 1.0, 3.0, 2.0, 5.0};

        assertThat(ContaminationThreshold.percentile(values, 50.0)).isEqualTo(3.0);
        assertThat(ContaminationThreshold.percentile(values, 100.0)).isEqualTo(5.0);
        assertThat(ContaminationThreshold.percentile(values, 90.0)).isCloseTo(4.6, within(1e-9));
    }

    @Test
    void testOnlyScoresStrictlyAboveAreFlagged() {
        double[] scores = {0.4, 0.5, 0.6};

        assertThat(ContaminationThreshold.above(scores, 0.5)).containsExactly(false, false, true);
    }

    @Test
    void testThresholdForTwoPercentOfSixteen() {
        double[] scores = new double[16];
        for (int i = 0; i < scores.length; i++) {
            scores[i] = i;
        }
        // position 0.98 * 15 = 14.7
        assertThat(ContaminationThreshold.of(scores, 0.02)).isCloseTo(14.7, within(1e-9));
    }
}
