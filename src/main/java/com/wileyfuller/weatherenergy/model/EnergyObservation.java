package com.wileyfuller.weatherenergy.model;

import java.time.LocalDate;
import java.util.Objects;

public final class EnergyObservation {

    private final LocalDate date;
    private final String city;
    private final String respondent;
    private final ReadingType type;
    private final Double energyMwh;

    public EnergyObservation(LocalDate date, String city, String respondent, ReadingType type, Double energyMwh) {
        this.date = Objects.requireNonNull(date, "date");
        this.city = Objects.requireNonNull(city, "city");
        this.respondent = respondent;
        this.type = Objects.requireNonNull(type, "type");
        this.energyMwh = energyMwh;
    }

    public LocalDate getDate() {
        return date;
    }

    public String getCity() {
        return city;
    }

    public String getRespondent() {
        return respondent;
    }

    public ReadingType getType() {
        return type;
    }

    public Double getEnergyMwh() {
        return energyMwh;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EnergyObservation)) return false;
        EnergyObservation that = (EnergyObservation) o;
        return date.equals(that.date) && city.equals(that.city)
                && Objects.equals(respondent, that.respondent)
                && type == that.type && Objects.equals(energyMwh, that.energyMwh);
    }

    @Override
    public int hashCode() {
        return Objects.hash(date, city, respondent, type, energyMwh);
    }

    @Override
    public String toString() {
        return String.format("EnergyObservation{city='%s', date=%s, type=%s, mwh=%s}", city, date, type, energyMwh);
    }

    public enum ReadingType {
        DEMAND("D"), DEMAND_FORECAST("DF"), NET_GENERATION("NG"), TOTAL_INTERCHANGE("TI"), OTHER("");

        private final String code;

        ReadingType(String code) {
            this.code = code;
        }

        public String getCode() {
            return code;
        }

        public static ReadingType fromCode(String code) {
            if (code != null) {
                for (ReadingType t : values()) {
                    if (t != OTHER && t.code.equalsIgnoreCase(code.trim())) {
                        return t;
                    }
                }
            }
            return OTHER;
        }

        /**
         * Resolves either the short code ("D") or the display name ("Demand").
         */
        public static ReadingType resolve(String code, String typeName) {
            ReadingType byCode = fromCode(code);
            if (byCode != OTHER) {
                return byCode;
            }
            if (typeName == null) {
                return OTHER;
            }
            switch (typeName.trim().toLowerCase()) {
                case "demand":
                    return DEMAND;
                case "day-ahead demand forecast":
                    return DEMAND_FORECAST;
                case "net generation":
                    return NET_GENERATION;
                case "total interchange":
                    return TOTAL_INTERCHANGE;
                default:
                    return OTHER;
            }
        }
    }
}
