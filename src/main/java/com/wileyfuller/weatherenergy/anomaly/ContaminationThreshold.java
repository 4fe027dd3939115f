package com.wileyfuller.weatherenergy.anomaly;

import java.util.Arrays;

/**
 * Turns an expected outlier fraction into a score cut-off over the training scores.
 */
final class ContaminationThreshold {

    private ContaminationThreshold() {}

    /**
     * The {@code (1 - contamination)} percentile of the scores, linearly interpolated between ranks.
     */
    static double of(double[] scores, double contamination) {
        if (scores.length == 0) {
            throw new IllegalArgumentException("no scores");
        }
        return percentile(scores, 100.0 * (1.0 - contamination));
    }

    static double percentile(double[] values, double percent) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double pos = percent / 100.0 * (sorted.length - 1);
        int lo = (int) Math.floor(pos);
        int hi = (int) Math.ceil(pos);
        return sorted[lo] + (sorted[hi] - sorted[lo]) * (pos - lo);
    }

    static boolean[] above(double[] scores, double threshold) {
        boolean[] out = new boolean[scores.length];
        for (int i = 0; i < scores.length; i++) {
            out[i] = scores[i] > threshold;
        }
        return out;
    }
}
