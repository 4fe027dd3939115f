package com.wileyfuller.weatherenergy.fetch;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wileyfuller.weatherenergy.model.CityDescriptor;
import com.wileyfuller.weatherenergy.model.EnergyObservation;
import com.wileyfuller.weatherenergy.model.EnergyObservation.ReadingType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EnergyFetcherTest {

    private static final CityDescriptor CITY =
            new CityDescriptor("Beta", "BB", "GHCND:TEST0002", "BBB", "Pacific");
    private static final LocalDate START = LocalDate.of(2024, 1, 1);
    private static final LocalDate END = LocalDate.of(2024, 1, 31);

    private StubServer server;
    private ApiClient client;

    @BeforeEach
    void setUp() throws Exception {
        server = new StubServer();
        client = new ApiClient(ApiClient.createHttpClient(2000), RetryPolicy.standard(new RecordingSleeper()),
                null, false, new ObjectMapper());
    }

    @AfterEach
    void tearDown() throws Exception {
        client.close();
        server.close();
    }

    private EnergyFetcher fetcher(int pageLength, boolean fallback) {
        return new EnergyFetcher(client, "eia-key", server.url("/eia"), pageLength, fallback);
    }

    private static String row(String period, String type, String typeName, String value) {
        StringBuilder sb = new StringBuilder("{\"period\":\"").append(period).append("\",\"respondent\":\"BBB\"");
        if (type != null) {
            sb.append(",\"type\":\"").append(type).append('"');
        }
        if (typeName != null) {
            sb.append(",\"type-name\":\"").append(typeName).append('"');
        }
        sb.append(",\"timezone\":\"Pacific\",\"value\":").append(value).append(",\"value-units\":\"megawatthours\"}");
        return sb.toString();
    }

    private static String page(int total, String... rows) {
        return "{\"response\":{\"total\":" + total + ",\"dateFormat\":\"YYYY-MM-DD\",\"frequency\":\"daily\","
                + "\"data\":[" + String.join(",", rows) + "]}}";
    }

    @Test
    void testKeepsOnlyDemandRows() throws Exception {
        server.enqueue(200, page(5,
                row("2024-01-01", "D", "Demand", "1200"),
                row("2024-01-01", "NG", "Net generation", "1500"),
                row("2024-01-01", "TI", "Total interchange", "-300"),
                row("2024-01-02", "D", "Demand", "1250"),
                row("2024-01-02", "DF", "Day-ahead demand forecast", "1230")));

        List<EnergyObservation> rows = fetcher(5000, true).fetchEnergy(CITY, START, END);

        assertThat(rows).hasSize(2);
        assertThat(rows).extracting(EnergyObservation::getType).containsOnly(ReadingType.DEMAND);
        assertThat(rows).extracting(EnergyObservation::getEnergyMwh).containsExactly(1200.0, 1250.0);
        assertThat(rows.get(0).getCity()).isEqualTo("Beta");
        assertThat(rows.get(0).getRespondent()).isEqualTo("BBB");
    }

    @Test
    void testRecognisesDemandByTypeName() throws Exception {
        server.enqueue(200, page(2,
                row("2024-01-01", null, "Demand", "900"),
                row("2024-01-01", null, "Net generation", "950")));

        List<EnergyObservation> rows = fetcher(5000, false).fetchEnergy(CITY, START, END);

        assertThat(rows).hasSize(1);
        assertThat(rows.get(0).getEnergyMwh()).isEqualTo(900.0);
    }

    @Test
    void testParsesStringAndNullValues() throws Exception {
        server.enqueue(200, page(2,
                row("2024-01-01", "D", "Demand", "\"1234.5\""),
                row("2024-01-02", "D", "Demand", "null")));

        List<EnergyObservation> rows = fetcher(5000, false).fetchEnergy(CITY, START, END);

        assertThat(rows).extracting(EnergyObservation::getEnergyMwh).containsExactly(1234.5, null);
    }

    @Test
    void testSendsFacetsAndPaging() throws Exception {
        server.enqueue(200, page(1, row("2024-01-01", "D", "Demand", "1")));

        fetcher(5000, false).fetchEnergy(CITY, START, END);

        assertThat(server.getQueries().get(0))
                .contains("api_key=eia-key")
                .contains("frequency=daily")
                .contains("data[0]=value")
                .contains("facets[respondent][]=BBB")
                .contains("facets[timezone][]=Pacific")
                .contains("start=2024-01-01")
                .contains("end=2024-01-31")
                .contains("offset=0")
                .contains("length=5000");
    }

    @Test
    void testFollowsPagination() throws Exception {
        server.enqueue(200, page(3,
                        row("2024-01-01", "D", "Demand", "1"),
                        row("2024-01-02", "D", "Demand", "2")))
                .enqueue(200, page(3, row("2024-01-03", "D", "Demand", "3")));

        List<EnergyObservation> rows = fetcher(2, false).fetchEnergy(CITY, START, END);

        assertThat(rows).extracting(EnergyObservation::getEnergyMwh).containsExactly(1.0, 2.0, 3.0);
        assertThat(server.getQueries()).hasSize(2);
        assertThat(server.getQueries().get(1)).contains("offset=2");
    }

    @Test
    void testErrorPayloadIsPermanentFailure() {
        server.otherwise(200, "{\"error\":\"API_KEY_INVALID\",\"code\":403}");

        assertThatThrownBy(() -> fetcher(5000, true).fetchEnergy(CITY, START, END))
                .isInstanceOf(FetchException.class)
                .hasMessageContaining("API_KEY_INVALID");
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void testEmptyDataIsNoRows() throws Exception {
        server.enqueue(200, page(0));

        assertThat(fetcher(5000, true).fetchEnergy(CITY, START, END)).isEmpty();
    }

    @Test
    void testFallbackKeepsAllRowsWithOnePerDate() {
        EnergyFetcher fetcher = fetcher(5000, true);
        List<EnergyObservation> raw = Arrays.asList(
                new EnergyObservation(START, "Beta", "BBB", ReadingType.NET_GENERATION, 1500.0),
                new EnergyObservation(START, "Beta", "BBB", ReadingType.TOTAL_INTERCHANGE, -300.0),
                new EnergyObservation(START.plusDays(1), "Beta", "BBB", ReadingType.TOTAL_INTERCHANGE, -250.0));

        List<EnergyObservation> rows = fetcher.filterDemand(CITY, raw);

        assertThat(rows).extracting(EnergyObservation::getEnergyMwh).containsExactly(1500.0, -250.0);
    }

    @Test
    void testNoFallbackDropsNonDemandRows() {
        EnergyFetcher fetcher = fetcher(5000, false);
        List<EnergyObservation> raw = Arrays.asList(
                new EnergyObservation(START, "Beta", "BBB", ReadingType.NET_GENERATION, 1500.0));

        assertThat(fetcher.filterDemand(CITY, raw)).isEmpty();
    }
}
