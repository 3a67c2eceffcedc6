package org.camunda.bpm.getstarted.migration.analysis.models;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Result of one analysis run. Built once, then only read by the exporters.
 *
 * @param file             source the document was read from
 * @param timestamp        when the analysis finished
 * @param statistics       aggregate counts
 * @param issues           findings in report order
 * @param processVariables variable names referenced by legacy expressions, sorted
 */
@JsonPropertyOrder({"file", "timestamp", "statistics", "issues", "process_variables"})
public record AnalysisReport(
        @JsonProperty("file") String file,
        @JsonProperty("timestamp") LocalDateTime timestamp,
        @JsonProperty("statistics") Statistics statistics,
        @JsonProperty("issues") List<MigrationIssue> issues,
        @JsonProperty("process_variables") List<String> processVariables
) {
    public AnalysisReport {
        issues = List.copyOf(issues);
        processVariables = List.copyOf(processVariables);
    }

    public List<MigrationIssue> issuesWithSeverity(Severity severity) {
        return issues.stream()
                .filter(issue -> issue.severity() == severity)
                .toList();
    }
}
