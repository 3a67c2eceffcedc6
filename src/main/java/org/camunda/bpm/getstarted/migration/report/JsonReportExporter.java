package org.camunda.bpm.getstarted.migration.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.camunda.bpm.getstarted.migration.analysis.models.AnalysisReport;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Writes the full report as pretty-printed JSON with snake_case keys and an ISO-8601 timestamp.
 */
@Slf4j
public class JsonReportExporter {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    public void export(AnalysisReport report, Path outputFile) {
        try {
            OBJECT_MAPPER.writeValue(outputFile.toFile(), report);
            log.info("JSON report written to {}", outputFile);
        } catch (IOException e) {
            throw new ReportExportException("Failed to write JSON report: " + outputFile, e);
        }
    }

    public String toJson(AnalysisReport report) {
        try {
            return OBJECT_MAPPER.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new ReportExportException("Failed to serialize report for " + report.file(), e);
        }
    }
}
