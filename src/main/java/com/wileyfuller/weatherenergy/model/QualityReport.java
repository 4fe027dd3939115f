package com.wileyfuller.weatherenergy.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Data quality summary of the merged dataset, serialized as quality_report.json.
 */
@JsonPropertyOrder({"missing_values", "outliers", "freshness"})
public final class QualityReport {

    @JsonProperty("missing_values")
    private final Map<String, Long> missingValues;

    @JsonProperty("outliers")
    private final Outliers outliers;

    @JsonProperty("freshness")
    private final Freshness freshness;

    public QualityReport(Map<String, Long> missingValues, Outliers outliers, Freshness freshness) {
        this.missingValues = Collections.unmodifiableMap(new LinkedHashMap<>(missingValues));
        this.outliers = outliers;
        this.freshness = freshness;
    }

    public Map<String, Long> getMissingValues() {
        return missingValues;
    }

    public Outliers getOutliers() {
        return outliers;
    }

    public Freshness getFreshness() {
        return freshness;
    }

    @JsonIgnore
    public long getTotalMissing() {
        return missingValues.values().stream().mapToLong(Long::longValue).sum();
    }

    @JsonPropertyOrder({"temperature_outliers", "negative_energy_readings"})
    public static final class Outliers {

        @JsonProperty("temperature_outliers")
        private final long temperatureOutliers;

        @JsonProperty("negative_energy_readings")
        private final long negativeEnergyReadings;

        public Outliers(long temperatureOutliers, long negativeEnergyReadings) {
            this.temperatureOutliers = temperatureOutliers;
            this.negativeEnergyReadings = negativeEnergyReadings;
        }

        public long getTemperatureOutliers() {
            return temperatureOutliers;
        }

        public long getNegativeEnergyReadings() {
            return negativeEnergyReadings;
        }

        @Override
        public String toString() {
            return "{temperature_outliers=" + temperatureOutliers
                    + ", negative_energy_readings=" + negativeEnergyReadings + "}";
        }
    }

    /**
     * Age of the newest record. Date and age are null for an empty dataset.
     */
    @JsonPropertyOrder({"latest_date", "is_fresh", "days_old"})
    public static final class Freshness {

        @JsonProperty("latest_date")
        private final LocalDate latestDate;

        @JsonProperty("is_fresh")
        private final boolean fresh;

        @JsonProperty("days_old")
        private final Long daysOld;

        public Freshness(LocalDate latestDate, boolean fresh, Long daysOld) {
            this.latestDate = latestDate;
            this.fresh = fresh;
            this.daysOld = daysOld;
        }

        public LocalDate getLatestDate() {
            return latestDate;
        }

        public boolean isFresh() {
            return fresh;
        }

        public Long getDaysOld() {
            return daysOld;
        }
    }
}
