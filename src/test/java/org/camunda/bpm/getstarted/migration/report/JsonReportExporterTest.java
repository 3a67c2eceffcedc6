package org.camunda.bpm.getstarted.migration.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.camunda.bpm.getstarted.migration.analysis.BpmnMigrationAnalyzer;
import org.camunda.bpm.getstarted.migration.analysis.models.AnalysisReport;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.camunda.bpm.getstarted.migration.analysis.BpmnSamples.LEGACY_BPMN;
import static org.junit.jupiter.api.Assertions.*;

class JsonReportExporterTest {
    private static final ObjectMapper mapper = new ObjectMapper();

    @TempDir
    Path tempDir;

    @Test
    void shouldWriteReportWithSnakeCaseKeys() throws IOException {
        AnalysisReport report = new BpmnMigrationAnalyzer().analyze(Path.of(LEGACY_BPMN));
        Path target = tempDir.resolve("report.json");

        new JsonReportExporter().export(report, target);

        JsonNode json = mapper.readTree(Files.readString(target));
        List<String> fields = new ArrayList<>();
        json.fieldNames().forEachRemaining(fields::add);
        assertEquals(List.of("file", "timestamp", "statistics", "issues", "process_variables"), fields);
        assertTrue(json.get("timestamp").isTextual());

        JsonNode statistics = json.get("statistics");
        assertEquals(10, statistics.get("total_issues").asInt());
        assertEquals(7, statistics.get("issue_counts_by_severity").get("CRITICAL").asInt());
        assertEquals(2, statistics.get("issue_counts_by_severity").get("INFO").asInt());
        assertEquals(0, statistics.get("element_counts").get("complexGateway").asInt());
        assertEquals(4, statistics.get("total_variables_detected").asInt());

        JsonNode firstIssue = json.get("issues").get(0);
        assertEquals("CRITICAL", firstIssue.get("severity").asText());
        assertEquals("ApproveOrder", firstIssue.get("element_id").asText());
        assertEquals("Approve order", firstIssue.get("element_name").asText());
        assertEquals("order", json.get("process_variables").get(1).asText());
    }

    @Test
    void shouldFailOnUnwritableTarget() {
        AnalysisReport report = new BpmnMigrationAnalyzer().analyze(Path.of(LEGACY_BPMN));
        Path target = tempDir.resolve("missing-dir").resolve("report.json");

        assertThrows(ReportExportException.class, () -> new JsonReportExporter().export(report, target));
    }
}
