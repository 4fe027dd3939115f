package com.wileyfuller.weatherenergy.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * One day of temperature readings for a city, in Fahrenheit.
 * Either reading can be missing when the station did not report it.
 */
public final class WeatherObservation {

    private final LocalDate date;
    private final String city;
    private final Double tmaxF;
    private final Double tminF;

    public WeatherObservation(LocalDate date, String city, Double tmaxF, Double tminF) {
        this.date = Objects.requireNonNull(date, "date");
        this.city = Objects.requireNonNull(city, "city");
        this.tmaxF = tmaxF;
        this.tminF = tminF;
    }

    public LocalDate getDate() {
        return date;
    }

    public String getCity() {
        return city;
    }

    public Double getTmaxF() {
        return tmaxF;
    }

    public Double getTminF() {
        return tminF;
    }

    public Double getAvgTempF() {
        if (tmaxF == null || tminF == null) {
            return null;
        }
        return (tmaxF + tminF) / 2;
    }

    public Double getTempDeltaF() {
        if (tmaxF == null || tminF == null) {
            return null;
        }
        return tmaxF - tminF;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WeatherObservation)) return false;
        WeatherObservation that = (WeatherObservation) o;
        return date.equals(that.date) && city.equals(that.city)
                && Objects.equals(tmaxF, that.tmaxF) && Objects.equals(tminF, that.tminF);
    }

    @Override
    public int hashCode() {
        return Objects.hash(date, city, tmaxF, tminF);
    }

    @Override
    public String toString() {
        return String.format("WeatherObservation{city='%s', date=%s, tmax=%s, tmin=%s}", city, date, tmaxF, tminF);
    }
}
