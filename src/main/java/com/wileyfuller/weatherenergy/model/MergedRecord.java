package com.wileyfuller.weatherenergy.model;

import java.time.LocalDate;
import java.util.Objects;

public final class MergedRecord {

    private final LocalDate date;
    private final String city;
    private final Double avgTempF;
    private final Double tempDeltaF;
    private final Double energyConsumption;

    public MergedRecord(LocalDate date, String city, Double avgTempF, Double tempDeltaF, Double energyConsumption) {
        this.date = date;
        this.city = city;
        this.avgTempF = avgTempF;
        this.tempDeltaF = tempDeltaF;
        this.energyConsumption = energyConsumption;
    }

    public LocalDate getDate() {
        return date;
    }

    public String getCity() {
        return city;
    }

    public Double getAvgTempF() {
        return avgTempF;
    }

    public Double getTempDeltaF() {
        return tempDeltaF;
    }

    public Double getEnergyConsumption() {
        return energyConsumption;
    }

    /**
     * @return the anomaly feature vector, or null when any feature is missing
     */
    public double[] features() {
        if (avgTempF == null || tempDeltaF == null || energyConsumption == null) {
            return null;
        }
        return new double[]{avgTempF, tempDeltaF, energyConsumption};
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MergedRecord)) return false;
        MergedRecord that = (MergedRecord) o;
        return Objects.equals(date, that.date) && Objects.equals(city, that.city)
                && Objects.equals(avgTempF, that.avgTempF)
                && Objects.equals(tempDeltaF, that.tempDeltaF)
                && Objects.equals(energyConsumption, that.energyConsumption);
    }

    @Override
    public int hashCode() {
        return Objects.hash(date, city, avgTempF, tempDeltaF, energyConsumption);
    }

    @Override
    public String toString() {
        return String.format("MergedRecord{city='%s', date=%s, avg=%s, delta=%s, energy=%s}",
                city, date, avgTempF, tempDeltaF, energyConsumption);
    }
}
