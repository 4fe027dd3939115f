package com.wileyfuller.weatherenergy.store;

import com.wileyfuller.weatherenergy.model.CityDescriptor;

import java.nio.file.Path;

/**
 * Where every artifact lives under the data directory.
 */
public final class DataLayout {

    private final Path dataDir;

    public DataLayout(Path dataDir) {
        this.dataDir = dataDir;
    }

    public Path getDataDir() {
        return dataDir;
    }

    public Path rawDir() {
        return dataDir.resolve("raw");
    }

    public Path weatherFile(CityDescriptor city) {
        return rawDir().resolve("weather_" + city.getFileKey() + ".csv");
    }

    public Path energyFile(CityDescriptor city) {
        return rawDir().resolve("energy_" + city.getFileKey() + ".csv");
    }

    public Path weatherAll() {
        return rawDir().resolve("weather_all.csv");
    }

    public Path energyAll() {
        return rawDir().resolve("energy_all.csv");
    }

    public Path mergedData() {
        return dataDir.resolve("merged_data.csv");
    }

    public Path qualityReport() {
        return dataDir.resolve("quality_report.json");
    }

    public Path anomalies() {
        return dataDir.resolve("anomalies.csv");
    }

    public Path fetchCache() {
        return dataDir.resolve("cache").resolve("fetch-cache.db");
    }
}
