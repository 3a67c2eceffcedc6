package org.camunda.bpm.getstarted.migration.analysis.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;

import java.util.Comparator;
import java.util.Objects;

/**
 * One finding of a migration rule.
 *
 * @param severity    how much work the finding implies
 * @param category    short label, e.g. "Service Task", "Expression"
 * @param elementId   id of the element the finding is about
 * @param elementName name of that element
 * @param message     one-line summary
 * @param details     optional longer explanation, never null
 */
@Builder
@JsonPropertyOrder({"severity", "category", "element_id", "element_name", "message", "details"})
public record MigrationIssue(
        @JsonProperty("severity") Severity severity,
        @JsonProperty("category") String category,
        @JsonProperty("element_id") String elementId,
        @JsonProperty("element_name") String elementName,
        @JsonProperty("message") String message,
        @JsonProperty("details") String details
) {
    /**
     * Report order: severity (most severe first), then category, then element id.
     */
    public static final Comparator<MigrationIssue> REPORT_ORDER = Comparator
            .comparing(MigrationIssue::severity, Severity.MOST_SEVERE_FIRST)
            .thenComparing(MigrationIssue::category)
            .thenComparing(MigrationIssue::elementId);

    public MigrationIssue {
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(message, "message");
        if (elementId == null) {
            elementId = "unknown";
        }
        if (elementName == null) {
            elementName = "Unnamed";
        }
        if (details == null) {
            details = "";
        }
    }
}
