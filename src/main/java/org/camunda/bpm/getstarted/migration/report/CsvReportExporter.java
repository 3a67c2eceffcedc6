package org.camunda.bpm.getstarted.migration.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.extern.slf4j.Slf4j;
import org.camunda.bpm.getstarted.migration.analysis.models.AnalysisReport;
import org.camunda.bpm.getstarted.migration.analysis.models.MigrationIssue;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes one CSV row per issue, in report order, below a fixed header row.
 */
@Slf4j
public class CsvReportExporter {
    // quote only values containing a separator, quote or line break
    private static final CsvMapper CSV_MAPPER = CsvMapper.builder()
            .enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING)
            .build();
    private static final CsvSchema SCHEMA = CSV_MAPPER.schemaFor(IssueRow.class).withHeader();

    public void export(AnalysisReport report, Path outputFile) {
        List<IssueRow> rows = report.issues().stream()
                .map(IssueRow::new)
                .toList();
        try {
            CSV_MAPPER.writer(SCHEMA).writeValue(outputFile.toFile(), rows);
            log.info("CSV report written to {} ({} rows)", outputFile, rows.size());
        } catch (IOException e) {
            throw new ReportExportException("Failed to write CSV report: " + outputFile, e);
        }
    }

    @JsonPropertyOrder({"Severity", "Category", "Element ID", "Element Name", "Message", "Details"})
    static class IssueRow {
        @JsonProperty("Severity")
        public final String severity;
        @JsonProperty("Category")
        public final String category;
        @JsonProperty("Element ID")
        public final String elementId;
        @JsonProperty("Element Name")
        public final String elementName;
        @JsonProperty("Message")
        public final String message;
        @JsonProperty("Details")
        public final String details;

        IssueRow(MigrationIssue issue) {
            this.severity = issue.severity().name();
            this.category = issue.category();
            this.elementId = issue.elementId();
            this.elementName = issue.elementName();
            this.message = issue.message();
            this.details = issue.details();
        }
    }
}
