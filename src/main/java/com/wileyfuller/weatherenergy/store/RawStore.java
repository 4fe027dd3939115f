package com.wileyfuller.weatherenergy.store;

import com.wileyfuller.weatherenergy.MissingArtifactException;
import com.wileyfuller.weatherenergy.model.CityDescriptor;
import com.wileyfuller.weatherenergy.model.EnergyObservation;
import com.wileyfuller.weatherenergy.model.WeatherObservation;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Raw per-city fetch results and their all-city concatenations, as CSV.
 */
public class RawStore {

    private static final Logger LOG = LoggerFactory.getLogger(RawStore.class);

    static final String[] WEATHER_HEADER = {"date", "city", "TMAX_F", "TMIN_F"};
    static final String[] ENERGY_HEADER = {"date", "city", "respondent", "type", "energy_mwh"};

    private final DataLayout layout;

    public RawStore(DataLayout layout) {
        this.layout = layout;
    }

    public void writeWeather(CityDescriptor city, List<WeatherObservation> rows) throws IOException {
        writeWeatherFile(layout.weatherFile(city), rows);
    }

    public void writeAllWeather(List<WeatherObservation> rows) throws IOException {
        writeWeatherFile(layout.weatherAll(), rows);
    }

    public void writeEnergy(CityDescriptor city, List<EnergyObservation> rows) throws IOException {
        writeEnergyFile(layout.energyFile(city), rows);
    }

    public void writeAllEnergy(List<EnergyObservation> rows) throws IOException {
        writeEnergyFile(layout.energyAll(), rows);
    }

    /**
     * Removes a city's file left by an earlier run, so a failed city has no stale per-city artifact.
     */
    public void deleteWeather(CityDescriptor city) throws IOException {
        deleteStale(layout.weatherFile(city));
    }

    public void deleteEnergy(CityDescriptor city) throws IOException {
        deleteStale(layout.energyFile(city));
    }

    private static void deleteStale(Path file) throws IOException {
        if (Files.deleteIfExists(file)) {
            LOG.info("Removed stale {}", file);
        }
    }

    public List<WeatherObservation> readAllWeather() throws IOException, MissingArtifactException {
        return readWeatherFile(layout.weatherAll());
    }

    public List<EnergyObservation> readAllEnergy() throws IOException, MissingArtifactException {
        return readEnergyFile(layout.energyAll());
    }

    private void writeWeatherFile(Path file, List<WeatherObservation> rows) throws IOException {
        AtomicFiles.write(file, writer -> {
            try (CSVPrinter printer = new CSVPrinter(writer, CsvSupport.writeFormat(WEATHER_HEADER))) {
                for (WeatherObservation row : rows) {
                    printer.printRecord(row.getDate(), row.getCity(),
                            CsvSupport.cell(row.getTmaxF()), CsvSupport.cell(row.getTminF()));
                }
            }
        });
        LOG.debug("Wrote {} weather rows to {}", rows.size(), file);
    }

    private void writeEnergyFile(Path file, List<EnergyObservation> rows) throws IOException {
        AtomicFiles.write(file, writer -> {
            try (CSVPrinter printer = new CSVPrinter(writer, CsvSupport.writeFormat(ENERGY_HEADER))) {
                for (EnergyObservation row : rows) {
                    printer.printRecord(row.getDate(), row.getCity(), row.getRespondent(),
                            row.getType().name(), CsvSupport.cell(row.getEnergyMwh()));
                }
            }
        });
        LOG.debug("Wrote {} energy rows to {}", rows.size(), file);
    }

    List<WeatherObservation> readWeatherFile(Path file) throws IOException, MissingArtifactException {
        if (!Files.isRegularFile(file)) {
            throw new MissingArtifactException("Raw weather data", file);
        }
        List<WeatherObservation> rows = new ArrayList<>();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             CSVParser parser = CsvSupport.READ_FORMAT.parse(reader)) {
            for (CSVRecord record : parser) {
                LocalDate date = CsvSupport.parseDate(record, "date");
                String city = CsvSupport.parseString(record, "city");
                if (date == null || city == null) {
                    LOG.warn("Skipping weather row {} without date or city in {}", record.getRecordNumber(), file);
                    continue;
                }
                rows.add(new WeatherObservation(date, city,
                        CsvSupport.parseDouble(record, "TMAX_F"), CsvSupport.parseDouble(record, "TMIN_F")));
            }
        }
        return rows;
    }

    List<EnergyObservation> readEnergyFile(Path file) throws IOException, MissingArtifactException {
        if (!Files.isRegularFile(file)) {
            throw new MissingArtifactException("Raw energy data", file);
        }
        List<EnergyObservation> rows = new ArrayList<>();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             CSVParser parser = CsvSupport.READ_FORMAT.parse(reader)) {
            for (CSVRecord record : parser) {
                LocalDate date = CsvSupport.parseDate(record, "date");
                String city = CsvSupport.parseString(record, "city");
                if (date == null || city == null) {
                    LOG.warn("Skipping energy row {} without date or city in {}", record.getRecordNumber(), file);
                    continue;
                }
                rows.add(new EnergyObservation(date, city, CsvSupport.parseString(record, "respondent"),
                        parseType(record.get("type")), CsvSupport.parseDouble(record, "energy_mwh")));
            }
        }
        return rows;
    }

    private static EnergyObservation.ReadingType parseType(String text) {
        if (text == null || text.isEmpty()) {
            return EnergyObservation.ReadingType.OTHER;
        }
        try {
            return EnergyObservation.ReadingType.valueOf(text);
        } catch (IllegalArgumentException e) {
            // older files carry the EIA code or display name
            return EnergyObservation.ReadingType.resolve(text, text);
        }
    }
}
