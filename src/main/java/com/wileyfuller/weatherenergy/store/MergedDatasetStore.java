package com.wileyfuller.weatherenergy.store;

import com.wileyfuller.weatherenergy.MissingArtifactException;
import com.wileyfuller.weatherenergy.model.MergedRecord;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads and writes tables in the merged schema: the merged dataset itself and the anomaly list.
 */
public class MergedDatasetStore {

    public static final String[] HEADER = {"date", "city", "avg_temp_f", "temp_delta_f", "energy_consumption"};

    public void write(Path file, List<MergedRecord> records) throws IOException {
        AtomicFiles.write(file, writer -> {
            try (CSVPrinter printer = new CSVPrinter(writer, CsvSupport.writeFormat(HEADER))) {
                for (MergedRecord r : records) {
                    printer.printRecord(r.getDate() != null ? r.getDate() : "",
                            r.getCity() != null ? r.getCity() : "",
                            CsvSupport.cell(r.getAvgTempF()),
                            CsvSupport.cell(r.getTempDeltaF()),
                            CsvSupport.cell(r.getEnergyConsumption()));
                }
            }
        });
    }

    /**
     * @throws MissingArtifactException when the file does not exist
     */
    public List<MergedRecord> read(Path file) throws IOException, MissingArtifactException {
        if (!Files.isRegularFile(file)) {
            throw new MissingArtifactException("Merged data file", file);
        }
        List<MergedRecord> records = new ArrayList<>();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             CSVParser parser = CsvSupport.READ_FORMAT.parse(reader)) {
            for (CSVRecord record : parser) {
                records.add(new MergedRecord(
                        CsvSupport.parseDate(record, "date"),
                        CsvSupport.parseString(record, "city"),
                        CsvSupport.parseDouble(record, "avg_temp_f"),
                        CsvSupport.parseDouble(record, "temp_delta_f"),
                        CsvSupport.parseDouble(record, "energy_consumption")));
            }
        }
        return records;
    }
}
