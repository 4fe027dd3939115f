package com.wileyfuller.weatherenergy.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.wileyfuller.weatherenergy.model.CityDescriptor;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Typed form of config.yaml.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PipelineConfig {

    @JsonProperty("general")
    private General general = new General();

    @JsonProperty("cities")
    private List<CityDescriptor> cities = new ArrayList<>();

    public PipelineConfig() {
    }

    public PipelineConfig(General general, List<CityDescriptor> cities) {
        this.general = general;
        this.cities = new ArrayList<>(cities);
    }

    public General getGeneral() {
        return general;
    }

    public List<CityDescriptor> getCities() {
        return cities == null ? Collections.emptyList() : Collections.unmodifiableList(cities);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class General {

        @JsonProperty("fetch_days")
        private int fetchDays = 90;

        @JsonProperty("data_dir")
        private String dataDir = "data";

        @JsonProperty("fetch_workers")
        private int fetchWorkers = 4;

        @JsonProperty("cache_ttl_hours")
        private long cacheTtlHours = 12;

        @JsonProperty("energy_fallback_to_all_rows")
        private boolean energyFallbackToAllRows = true;

        @JsonProperty("anomaly_model")
        private String anomalyModel = "isolation_forest";

        public int getFetchDays() {
            return fetchDays;
        }

        public void setFetchDays(int fetchDays) {
            this.fetchDays = fetchDays;
        }

        public String getDataDir() {
            return dataDir;
        }

        public void setDataDir(String dataDir) {
            this.dataDir = dataDir;
        }

        public Path getDataPath() {
            return Paths.get(dataDir);
        }

        public int getFetchWorkers() {
            return fetchWorkers;
        }

        public void setFetchWorkers(int fetchWorkers) {
            this.fetchWorkers = fetchWorkers;
        }

        public long getCacheTtlHours() {
            return cacheTtlHours;
        }

        public void setCacheTtlHours(long cacheTtlHours) {
            this.cacheTtlHours = cacheTtlHours;
        }

        public boolean isEnergyFallbackToAllRows() {
            return energyFallbackToAllRows;
        }

        public void setEnergyFallbackToAllRows(boolean energyFallbackToAllRows) {
            this.energyFallbackToAllRows = energyFallbackToAllRows;
        }

        public String getAnomalyModel() {
            return anomalyModel;
        }

        public void setAnomalyModel(String anomalyModel) {
            this.anomalyModel = anomalyModel;
        }
    }
}
