package com.wileyfuller.weatherenergy.anomaly;

import java.util.Locale;
import java.util.function.Supplier;

/**
 * Named model choices for configuration. Each call to the returned supplier yields a fresh, unfitted model.
 */
public final class OutlierModels {

    public static final double DEFAULT_CONTAMINATION = 0.02;
    public static final long DEFAULT_SEED = 42L;

    private OutlierModels() {}

    public static Supplier<OutlierModel> forName(String name) {
        switch (name == null ? "" : name.trim().toLowerCase(Locale.ROOT)) {
            case "isolation_forest":
            case "":
                return () -> new IsolationForest(DEFAULT_CONTAMINATION, DEFAULT_SEED);
            case "robust_zscore":
                return () -> new RobustZScoreModel(DEFAULT_CONTAMINATION);
            default:
                throw new IllegalArgumentException("Unknown anomaly model '" + name
                        + "', expected isolation_forest or robust_zscore");
        }
    }
}
