package com.wileyfuller.weatherenergy.anomaly;

import java.util.Arrays;
import java.util.List;

/**
 * Scores a row by its largest per-feature robust z-score, {@code |x - median| / (1.4826 * MAD)}.
 * Features with zero MAD only score when a value differs from the median.
 */
public class RobustZScoreModel implements OutlierModel {

    private static final double MAD_TO_SIGMA = 1.4826;

    private final double contamination;

    private double[] medians;
    private double[] scales;
    private double threshold;

    public RobustZScoreModel(double contamination) {
        if (contamination <= 0 || contamination >= 0.5) {
            throw new IllegalArgumentException("contamination must be in (0, 0.5), was " + contamination);
        }
        this.contamination = contamination;
    }

    @Override
    public void fit(List<double[]> rows) {
        if (rows.isEmpty()) {
            throw new IllegalArgumentException("cannot fit on zero rows");
        }
        int features = rows.get(0).length;
        medians = new double[features];
        scales = new double[features];
        for (int f = 0; f < features; f++) {
            double[] column = new double[rows.size()];
            for (int i = 0; i < column.length; i++) {
                column[i] = rows.get(i)[f];
            }
            medians[f] = median(column);
            double[] deviations = new double[column.length];
            for (int i = 0; i < column.length; i++) {
                deviations[i] = Math.abs(column[i] - medians[f]);
            }
            scales[f] = MAD_TO_SIGMA * median(deviations);
        }
        threshold = ContaminationThreshold.of(score(rows), contamination);
    }

    @Override
    public double[] score(List<double[]> rows) {
        if (medians == null) {
            throw new IllegalStateException("model is not fitted");
        }
        double[] scores = new double[rows.size()];
        for (int i = 0; i < scores.length; i++) {
            double[] x = rows.get(i);
            double worst = 0;
            for (int f = 0; f < medians.length; f++) {
                double deviation = Math.abs(x[f] - medians[f]);
                double z;
                if (scales[f] > 0) {
                    z = deviation / scales[f];
                } else {
                    z = deviation > 0 ? Double.MAX_VALUE : 0;
                }
                worst = Math.max(worst, z);
            }
            scores[i] = worst;
        }
        return scores;
    }

    @Override
    public boolean[] labels(List<double[]> rows) {
        return ContaminationThreshold.above(score(rows), threshold);
    }

    private static double median(double[] values) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        int mid = sorted.length / 2;
        return sorted.length % 2 == 1 ? sorted[mid] : (sorted[mid - 1] + sorted[mid]) / 2;
    }
}
