package com.wileyfuller.weatherenergy.store;

import com.wileyfuller.weatherenergy.MissingArtifactException;
import com.wileyfuller.weatherenergy.model.CityDescriptor;
import com.wileyfuller.weatherenergy.model.EnergyObservation;
import com.wileyfuller.weatherenergy.model.EnergyObservation.ReadingType;
import com.wileyfuller.weatherenergy.model.WeatherObservation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RawStoreTest {

    private static final CityDescriptor NEW_YORK =
            new CityDescriptor("New York", "New York", "GHCND:USW00094728", "NYIS");

    @TempDir
    Path tempDir;

    private DataLayout layout;
    private RawStore store;

    @BeforeEach
    void setUp() {
        layout = new DataLayout(tempDir);
        store = new RawStore(layout);
    }

    @Test
    void testPerCityFileUsesFileKey() throws Exception {
        store.writeWeather(NEW_YORK, Collections.singletonList(
                new WeatherObservation(LocalDate.of(2024, 1, 1), "New York", 50.0, 32.0)));

        Path file = layout.rawDir().resolve("weather_New_York.csv");
        assertThat(layout.weatherFile(NEW_YORK)).isEqualTo(file);
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertThat(lines).containsExactly("date,city,TMAX_F,TMIN_F", "2024-01-01,New York,50.0,32.0");
    }

    @Test
    void testWeatherGapsSurviveAsNulls() throws Exception {
        List<WeatherObservation> rows = Arrays.asList(
                new WeatherObservation(LocalDate.of(2024, 1, 1), "New York", 50.0, null),
                new WeatherObservation(LocalDate.of(2024, 1, 2), "New York", 48.2, 30.1));
        store.writeAllWeather(rows);

        assertThat(store.readAllWeather()).containsExactlyElementsOf(rows);
    }

    @Test
    void testEnergyKeepsReadingType() throws Exception {
        List<EnergyObservation> rows = Arrays.asList(
                new EnergyObservation(LocalDate.of(2024, 1, 1), "New York", "NYIS", ReadingType.DEMAND, 410000.0),
                new EnergyObservation(LocalDate.of(2024, 1, 2), "New York", "NYIS", ReadingType.TOTAL_INTERCHANGE,
                        -1200.0));
        store.writeAllEnergy(rows);

        List<EnergyObservation> read = store.readAllEnergy();
        assertThat(read).extracting(EnergyObservation::getType)
                .containsExactly(ReadingType.DEMAND, ReadingType.TOTAL_INTERCHANGE);
        assertThat(read).extracting(EnergyObservation::getEnergyMwh).containsExactly(410000.0, -1200.0);
    }

    @Test
    void testOverwritesPreviousFile() throws Exception {
        store.writeAllWeather(Collections.singletonList(
                new WeatherObservation(LocalDate.of(2024, 1, 1), "New York", 50.0, 32.0)));
        store.writeAllWeather(Collections.emptyList());

        assertThat(store.readAllWeather()).isEmpty();
        assertThat(Files.readAllLines(layout.weatherAll(), StandardCharsets.UTF_8))
                .containsExactly("date,city,TMAX_F,TMIN_F");
    }

    @Test
    void testReadingMissingFileFails() {
        assertThatThrownBy(() -> store.readAllEnergy())
                .isInstanceOf(MissingArtifactException.class)
                .hasMessageContaining("energy_all.csv");
    }

    @Test
    void testLegacyTypeCodesAreResolved() throws Exception {
        Files.createDirectories(layout.rawDir());
        Files.write(layout.energyAll(), Arrays.asList(
                "date,city,respondent,type,energy_mwh",
                "2024-01-01,Chicago,PJM,D,2100000",
                "2024-01-02,Chicago,PJM,Demand,2150000",
                "2024-01-03,Chicago,PJM,,"), StandardCharsets.UTF_8);

        List<EnergyObservation> read = store.readAllEnergy();

        assertThat(read).extracting(EnergyObservation::getType)
                .containsExactly(ReadingType.DEMAND, ReadingType.DEMAND, ReadingType.OTHER);
        assertThat(read.get(2).getEnergyMwh()).isNull();
    }
}
