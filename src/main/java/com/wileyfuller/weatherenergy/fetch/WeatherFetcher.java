package com.wileyfuller.weatherenergy.fetch;

import com.fasterxml.jackson.databind.JsonNode;
import com.wileyfuller.weatherenergy.model.CityDescriptor;
import com.wileyfuller.weatherenergy.model.WeatherObservation;
import org.apache.http.client.utils.URIBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Daily TMAX/TMIN from NOAA Climate Data Online (GHCND), pivoted to one row per date in Fahrenheit.
 */
public class WeatherFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(WeatherFetcher.class);

    public static final String SOURCE = "noaa";
    public static final String BASE_URL = "https://www.ncei.noaa.gov/cdo-web/api/v2/data";
    static final int PAGE_LIMIT = 1000;

    private final ApiClient client;
    private final String token;
    private final String baseUrl;
    private final int pageLimit;

    public WeatherFetcher(ApiClient client, String token) {
        this(client, token, BASE_URL, PAGE_LIMIT);
    }

    public WeatherFetcher(ApiClient client, String token, String baseUrl, int pageLimit) {
        this.client = client;
        this.token = token;
        this.baseUrl = baseUrl;
        this.pageLimit = pageLimit;
    }

    /**
     * @return one observation per reported date in {@code [startDate, endDate]}; empty when the station
     * reported nothing
     * @throws FetchException when every attempt failed or the response could not be understood
     */
    public List<WeatherObservation> fetchWeather(CityDescriptor city, LocalDate startDate, LocalDate endDate)
            throws FetchException {
        LOG.info("Fetching weather data for {} ({})", city.getName(), city.getWeatherStationId());

        // date -> [TMAX_F, TMIN_F]
        Map<LocalDate, Double[]> byDate = new TreeMap<>();
        int offset = 1;
        int total;
        do {
            URI uri = buildUri(city, startDate, endDate, offset);
            String fingerprint = FetchCache.fingerprint(SOURCE, city.getWeatherStationId(),
                    startDate.toString(), endDate.toString(), String.valueOf(offset), String.valueOf(pageLimit));
            JsonNode root = client.getJson(SOURCE, uri, Collections.singletonMap("token", token), fingerprint,
                    body -> body.path("results").size() > 0);

            JsonNode results = root.path("results");
            if (results.isMissingNode() || results.isNull()) {
                // CDO answers {} when the station has nothing for the range
                break;
            }
            if (!results.isArray()) {
                throw new FetchException("NOAA response for " + city.getName() + " has a non-array 'results'");
            }
            for (JsonNode result : results) {
                pivot(city, result, byDate);
            }
            total = root.path("metadata").path("resultset").path("count").asInt(results.size());
            offset += pageLimit;
            if (results.size() == 0) {
                break;
            }
        } while (offset <= total);

        List<WeatherObservation> observations = new ArrayList<>(byDate.size());
        for (Map.Entry<LocalDate, Double[]> e : byDate.entrySet()) {
            observations.add(new WeatherObservation(e.getKey(), city.getName(), e.getValue()[0], e.getValue()[1]));
        }
        LOG.info("Fetched {} weather days for {}", observations.size(), city.getName());
        return observations;
    }

    private void pivot(CityDescriptor city, JsonNode result, Map<LocalDate, Double[]> byDate) throws FetchException {
        JsonNode date = result.get("date");
        JsonNode datatype = result.get("datatype");
        JsonNode value = result.get("value");
        if (date == null || datatype == null || value == null || !value.isNumber()) {
            throw new FetchException("NOAA result for " + city.getName() + " is missing date, datatype or value: "
                    + result);
        }
        int column;
        switch (datatype.asText()) {
            case "TMAX":
                column = 0;
                break;
            case "TMIN":
                column = 1;
                break;
            default:
                return;
        }
        LocalDate day = parseDate(city, date.asText());
        Double[] row = byDate.computeIfAbsent(day, d -> new Double[2]);
        // first reading wins, like a pivot with aggfunc=first
        if (row[column] == null) {
            row[column] = celsiusToFahrenheit(value.asDouble());
        }
    }

    private static LocalDate parseDate(CityDescriptor city, String text) throws FetchException {
        try {
            // "2024-01-15T00:00:00"
            return LocalDate.parse(text.length() > 10 ? text.substring(0, 10) : text);
        } catch (DateTimeParseException e) {
            throw new FetchException("Bad NOAA date '" + text + "' for " + city.getName(), e);
        }
    }

    public static double celsiusToFahrenheit(double celsius) {
        return celsius * 9.0 / 5.0 + 32.0;
    }

    private URI buildUri(CityDescriptor city, LocalDate startDate, LocalDate endDate, int offset)
            throws FetchException {
        try {
            return new URIBuilder(baseUrl)
                    .addParameter("datasetid", "GHCND")
                    .addParameter("stationid", city.getWeatherStationId())
                    .addParameter("datatypeid", "TMAX,TMIN")
                    .addParameter("startdate", startDate.toString())
                    .addParameter("enddate", endDate.toString())
                    .addParameter("units", "metric")
                    .addParameter("limit", String.valueOf(pageLimit))
                    .addParameter("offset", String.valueOf(offset))
                    .build();
        } catch (URISyntaxException e) {
            throw new FetchException("Bad NOAA base URL " + baseUrl, e);
        }
    }
}
