package com.wileyfuller.weatherenergy.anomaly;

import java.util.List;

/**
 * An unsupervised outlier model over fixed-width feature vectors.
 * <p>
 * Implementations flag roughly their contamination fraction of the training rows and must be
 * deterministic for a given seed and input.
 */
public interface OutlierModel {

    void fit(List<double[]> rows);

    /**
     * Anomaly score per row, higher meaning more anomalous.
     */
    double[] score(List<double[]> rows);

    /**
     * True for rows scored above the threshold learned in {@link #fit}.
     */
    boolean[] labels(List<double[]> rows);
}
