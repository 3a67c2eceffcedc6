package org.camunda.bpm.getstarted.migration.analysis.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Counts derived once at the end of a run.
 * <p>
 * The severity counts always hold all three severities, and add up to {@code totalIssues};
 * the element counts add up to {@code totalElements}.
 */
@JsonPropertyOrder({"total_elements", "element_counts", "total_issues", "issue_counts_by_severity",
        "issue_counts_by_category", "total_variables_detected"})
public record Statistics(
        @JsonProperty("total_elements") int totalElements,
        @JsonProperty("element_counts") Map<String, Integer> elementCounts,
        @JsonProperty("total_issues") int totalIssues,
        @JsonProperty("issue_counts_by_severity") Map<Severity, Integer> issueCountsBySeverity,
        @JsonProperty("issue_counts_by_category") Map<String, Integer> issueCountsByCategory,
        @JsonProperty("total_variables_detected") int totalVariablesDetected
) {
    public Statistics {
        elementCounts = Collections.unmodifiableMap(new LinkedHashMap<>(elementCounts));
        EnumMap<Severity, Integer> bySeverity = new EnumMap<>(Severity.class);
        bySeverity.putAll(issueCountsBySeverity);
        issueCountsBySeverity = Collections.unmodifiableMap(bySeverity);
        issueCountsByCategory = Collections.unmodifiableMap(new TreeMap<>(issueCountsByCategory));
    }

    public int issueCount(Severity severity) {
        return issueCountsBySeverity.getOrDefault(severity, 0);
    }

    public ComplexityLevel complexity() {
        return ComplexityLevel.assess(issueCount(Severity.CRITICAL), issueCount(Severity.WARNING));
    }
}
