package com.wileyfuller.weatherenergy.config;

public final class ApiKeys {

    public static final String NOAA_ENV = "NOAA_API_KEY";
    public static final String EIA_ENV = "EIA_API_KEY";

    private final String noaa;
    private final String eia;

    public ApiKeys(String noaa, String eia) {
        this.noaa = noaa;
        this.eia = eia;
    }

    public String getNoaa() {
        return noaa;
    }

    public String getEia() {
        return eia;
    }

    @Override
    public String toString() {
        // never print the tokens themselves
        return "ApiKeys{noaa=" + (noaa != null) + ", eia=" + (eia != null) + "}";
    }
}
