package com.wileyfuller.weatherenergy.fetch;

import com.fasterxml.jackson.databind.JsonNode;
import com.wileyfuller.weatherenergy.model.CityDescriptor;
import com.wileyfuller.weatherenergy.model.EnergyObservation;
import com.wileyfuller.weatherenergy.model.EnergyObservation.ReadingType;
import org.apache.http.client.utils.URIBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.util.stream.Collectors.toList;

/**
 * Daily region data from the EIA v2 API, narrowed to Demand readings.
 */
public class EnergyFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(EnergyFetcher.class);

    public static final String SOURCE = "eia";
    public static final String BASE_URL = "https://api.eia.gov/v2/electricity/rto/daily-region-data/data/";
    static final int PAGE_LENGTH = 5000;

    private final ApiClient client;
    private final String apiKey;
    private final String baseUrl;
    private final int pageLength;
    private final boolean fallbackToAllRows;

    public EnergyFetcher(ApiClient client, String apiKey, boolean fallbackToAllRows) {
        this(client, apiKey, BASE_URL, PAGE_LENGTH, fallbackToAllRows);
    }

    /**
     * @param fallbackToAllRows keep every series when the region reports no Demand rows at all. The values
     *                          then may include interchange or generation, which can legitimately be negative.
     */
    public EnergyFetcher(ApiClient client, String apiKey, String baseUrl, int pageLength, boolean fallbackToAllRows) {
        this.client = client;
        this.apiKey = apiKey;
        this.baseUrl = baseUrl;
        this.pageLength = pageLength;
        this.fallbackToAllRows = fallbackToAllRows;
    }

    public List<EnergyObservation> fetchEnergy(CityDescriptor city, LocalDate startDate, LocalDate endDate)
            throws FetchException {
        LOG.info("Fetching energy data for {} ({})", city.getName(), city.getEnergyRegionId());

        List<EnergyObservation> rows = new ArrayList<>();
        int offset = 0;
        int total;
        do {
            URI uri = buildUri(city, startDate, endDate, offset);
            String fingerprint = FetchCache.fingerprint(SOURCE, city.getEnergyRegionId(), city.getEnergyTimezone(),
                    startDate.toString(), endDate.toString(), String.valueOf(offset), String.valueOf(pageLength));
            JsonNode root = client.getJson(SOURCE, uri, Collections.emptyMap(), fingerprint,
                    body -> body.path("response").path("data").size() > 0);

            JsonNode response = root.get("response");
            if (response == null) {
                String error = root.path("error").asText("no 'response' element");
                throw new FetchException("EIA request for " + city.getName() + " failed: " + error);
            }
            JsonNode data = response.path("data");
            if (!data.isArray()) {
                throw new FetchException("EIA response for " + city.getName() + " has no 'data' array");
            }
            for (JsonNode item : data) {
                rows.add(mapItem(city, item));
            }
            total = response.path("total").asInt(rows.size());
            offset += pageLength;
            if (data.size() == 0) {
                break;
            }
        } while (offset < total);

        List<EnergyObservation> demand = filterDemand(city, rows);
        LOG.info("Fetched {} energy days for {} ({} raw rows)", demand.size(), city.getName(), rows.size());
        return demand;
    }

    List<EnergyObservation> filterDemand(CityDescriptor city, List<EnergyObservation> rows) {
        List<EnergyObservation> selected = rows.stream()
                .filter(r -> r.getType() == ReadingType.DEMAND)
                .collect(toList());
        if (selected.isEmpty() && !rows.isEmpty()) {
            if (fallbackToAllRows) {
                LOG.warn("No Demand rows for {}, falling back to all {} rows", city.getName(), rows.size());
                selected = rows;
            } else {
                LOG.warn("No Demand rows for {}, dropping {} non-demand rows", city.getName(), rows.size());
                return Collections.emptyList();
            }
        }

        Map<LocalDate, EnergyObservation> byDate = new LinkedHashMap<>();
        int duplicates = 0;
        for (EnergyObservation row : selected) {
            if (byDate.putIfAbsent(row.getDate(), row) != null) {
                duplicates++;
            }
        }
        if (duplicates > 0) {
            LOG.warn("Dropped {} duplicate energy rows for {}", duplicates, city.getName());
        }
        return new ArrayList<>(byDate.values());
    }

    private EnergyObservation mapItem(CityDescriptor city, JsonNode item) throws FetchException {
        JsonNode period = item.get("period");
        if (period == null || period.isNull()) {
            throw new FetchException("EIA row for " + city.getName() + " has no period: " + item);
        }
        LocalDate date;
        try {
            String text = period.asText();
            date = LocalDate.parse(text.length() > 10 ? text.substring(0, 10) : text);
        } catch (DateTimeParseException e) {
            throw new FetchException("Bad EIA period '" + period.asText() + "' for " + city.getName(), e);
        }
        ReadingType type = ReadingType.resolve(item.path("type").asText(null), item.path("type-name").asText(null));
        return new EnergyObservation(date, city.getName(), item.path("respondent").asText(city.getEnergyRegionId()),
                type, parseValue(city, item.get("value")));
    }

    private static Double parseValue(CityDescriptor city, JsonNode value) throws FetchException {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return value.asDouble();
        }
        String text = value.asText().trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new FetchException("Bad EIA value '" + text + "' for " + city.getName(), e);
        }
    }

    private URI buildUri(CityDescriptor city, LocalDate startDate, LocalDate endDate, int offset)
            throws FetchException {
        try {
            return new URIBuilder(baseUrl)
                    .addParameter("api_key", apiKey)
                    .addParameter("frequency", "daily")
                    .addParameter("data[0]", "value")
                    .addParameter("facets[respondent][]", city.getEnergyRegionId())
                    .addParameter("facets[timezone][]", city.getEnergyTimezone())
                    .addParameter("start", startDate.toString())
                    .addParameter("end", endDate.toString())
                    .addParameter("sort[0][column]", "period")
                    .addParameter("sort[0][direction]", "asc")
                    .addParameter("offset", String.valueOf(offset))
                    .addParameter("length", String.valueOf(pageLength))
                    .build();
        } catch (URISyntaxException e) {
            throw new FetchException("Bad EIA base URL " + baseUrl, e);
        }
    }
}
