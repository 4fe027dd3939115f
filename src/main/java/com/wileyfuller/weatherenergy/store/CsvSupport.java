package com.wileyfuller.weatherenergy.store;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * Shared CSV dialect and cell conversions. Empty cells stand for missing values.
 */
final class CsvSupport {

    static final CSVFormat READ_FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .build();

    private CsvSupport() {}

    static CSVFormat writeFormat(String... header) {
        return CSVFormat.DEFAULT.builder()
                .setHeader(header)
                .build();
    }

    static String cell(Double value) {
        return value != null ? value.toString() : "";
    }

    static Double parseDouble(CSVRecord record, String column) throws IOException {
        String text = record.get(column);
        if (text == null || text.trim().isEmpty()) {
            return null;
        }
        try {
            return Double.valueOf(text.trim());
        } catch (NumberFormatException e) {
            throw new IOException("Bad number '" + text + "' in column " + column
                    + " at line " + record.getRecordNumber(), e);
        }
    }

    static LocalDate parseDate(CSVRecord record, String column) throws IOException {
        String text = record.get(column);
        if (text == null || text.trim().isEmpty()) {
            return null;
        }
        try {
            return LocalDate.parse(text.trim());
        } catch (DateTimeParseException e) {
            throw new IOException("Bad date '" + text + "' at line " + record.getRecordNumber(), e);
        }
    }

    static String parseString(CSVRecord record, String column) {
        String text = record.get(column);
        return text == null || text.isEmpty() ? null : text;
    }
}
