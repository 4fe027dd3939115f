package com.wileyfuller.weatherenergy;

import com.wileyfuller.weatherenergy.model.EnergyObservation;
import com.wileyfuller.weatherenergy.model.WeatherObservation;

import java.util.Collections;
import java.util.List;

/**
 * What one fetch run produced and which cities came back empty-handed.
 */
public final class FetchSummary {

    private final List<WeatherObservation> weather;
    private final List<EnergyObservation> energy;
    private final List<String> failedWeatherCities;
    private final List<String> failedEnergyCities;

    public FetchSummary(List<WeatherObservation> weather, List<EnergyObservation> energy,
                        List<String> failedWeatherCities, List<String> failedEnergyCities) {
        this.weather = Collections.unmodifiableList(weather);
        this.energy = Collections.unmodifiableList(energy);
        this.failedWeatherCities = Collections.unmodifiableList(failedWeatherCities);
        this.failedEnergyCities = Collections.unmodifiableList(failedEnergyCities);
    }

    public List<WeatherObservation> getWeather() {
        return weather;
    }

    public List<EnergyObservation> getEnergy() {
        return energy;
    }

    public List<String> getFailedWeatherCities() {
        return failedWeatherCities;
    }

    public List<String> getFailedEnergyCities() {
        return failedEnergyCities;
    }
}
