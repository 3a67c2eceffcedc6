package org.camunda.bpm.getstarted.migration.analysis;

import org.camunda.bpm.getstarted.migration.analysis.bpmn.ElementModel;
import org.camunda.bpm.getstarted.migration.analysis.models.MigrationIssue;
import org.camunda.bpm.getstarted.migration.analysis.models.Severity;
import org.camunda.bpm.getstarted.migration.analysis.models.Statistics;

import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Derives the report statistics from the model and the finished run.
 */
public class StatisticsAggregator {

    static final List<String> TRACKED_ELEMENT_TYPES = List.of(
            "serviceTask", "userTask", "scriptTask", "businessRuleTask", "callActivity",
            "startEvent", "endEvent", "intermediateCatchEvent", "intermediateThrowEvent", "boundaryEvent",
            "exclusiveGateway", "parallelGateway", "inclusiveGateway", "eventBasedGateway", "complexGateway",
            "subProcess");

    public static Statistics aggregate(ElementModel model, Collection<MigrationIssue> issues, int variableCount) {
        Map<String, Integer> elementCounts = new LinkedHashMap<>();
        int totalElements = 0;
        for (String type : TRACKED_ELEMENT_TYPES) {
            int count = model.count(type);
            elementCounts.put(type, count);
            totalElements += count;
        }

        Map<Severity, Integer> bySeverity = new EnumMap<>(Severity.class);
        for (Severity severity : Severity.values()) {
            bySeverity.put(severity, 0);
        }
        Map<String, Integer> byCategory = new TreeMap<>();
        for (MigrationIssue issue : issues) {
            bySeverity.merge(issue.severity(), 1, Integer::sum);
            byCategory.merge(issue.category(), 1, Integer::sum);
        }

        return new Statistics(totalElements, elementCounts, issues.size(), bySeverity, byCategory, variableCount);
    }
}
