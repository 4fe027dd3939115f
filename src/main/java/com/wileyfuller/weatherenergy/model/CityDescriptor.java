package com.wileyfuller.weatherenergy.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A configured city: where its weather comes from and which grid region reports its demand.
 */
public final class CityDescriptor {

    public static final String DEFAULT_TIMEZONE = "Eastern";

    private final String name;
    private final String state;
    private final String weatherStationId;
    private final String energyRegionId;
    private final String energyTimezone;

    @JsonCreator
    public CityDescriptor(@JsonProperty("name") String name,
                          @JsonProperty("state") String state,
                          @JsonProperty("noaa_station_id") String weatherStationId,
                          @JsonProperty("eia_region_code") String energyRegionId,
                          @JsonProperty("eia_timezone") String energyTimezone) {
        this.name = name;
        this.state = state;
        this.weatherStationId = weatherStationId;
        this.energyRegionId = energyRegionId;
        this.energyTimezone = energyTimezone != null ? energyTimezone : DEFAULT_TIMEZONE;
    }

    public CityDescriptor(String name, String state, String weatherStationId, String energyRegionId) {
        this(name, state, weatherStationId, energyRegionId, DEFAULT_TIMEZONE);
    }

    public String getName() {
        return name;
    }

    public String getState() {
        return state;
    }

    public String getWeatherStationId() {
        return weatherStationId;
    }

    public String getEnergyRegionId() {
        return energyRegionId;
    }

    public String getEnergyTimezone() {
        return energyTimezone;
    }

    // "New York" -> "New_York"
    public String getFileKey() {
        return name.replace(' ', '_');
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CityDescriptor)) return false;
        CityDescriptor that = (CityDescriptor) o;
        return name.equals(that.name)
                && Objects.equals(state, that.state)
                && Objects.equals(weatherStationId, that.weatherStationId)
                && Objects.equals(energyRegionId, that.energyRegionId)
                && energyTimezone.equals(that.energyTimezone);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, state, weatherStationId, energyRegionId, energyTimezone);
    }

    @Override
    public String toString() {
        return String.format("%s, %s (station=%s, region=%s)", name, state, weatherStationId, energyRegionId);
    }
}
