package com.mlops.cleanup.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.mlops.cleanup.service.RunReport;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes a run report as indented JSON for pipelines and audit trails.
 */
@Slf4j
public class JsonReportExporter {

    private final ObjectMapper objectMapper;

    public JsonReportExporter() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public void export(RunReport report, Path outputFile) throws IOException {
        log.info("Exporting run report to JSON: {}", outputFile.toAbsolutePath());
        Path parent = outputFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        objectMapper.writeValue(outputFile.toFile(), report);
    }

    public String toJson(RunReport report) throws IOException {
        return objectMapper.writeValueAsString(report);
    }
}
