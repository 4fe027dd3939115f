package com.wileyfuller.weatherenergy.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.wileyfuller.weatherenergy.model.QualityReport;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Writes the quality report as indented JSON.
 */
public class ReportStore {

    private final ObjectMapper mapper;

    public ReportStore() {
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public void write(Path file, QualityReport report) throws IOException {
        String json = mapper.writeValueAsString(report);
        AtomicFiles.write(file, writer -> writer.write(json));
    }

    ObjectMapper getMapper() {
        return mapper;
    }
}
