package org.camunda.bpm.getstarted.migration.analysis;

import org.camunda.bpm.getstarted.migration.analysis.bpmn.ElementRef;
import org.camunda.bpm.getstarted.migration.analysis.models.MigrationIssue;
import org.camunda.bpm.getstarted.migration.analysis.models.Severity;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Mutable state of a single analysis run: the issues found so far and every process variable
 * seen in an expression. Each run creates its own context and hands it to every rule, so runs
 * never share state. Not thread-safe.
 */
public class AnalysisContext {

    private final List<MigrationIssue> issues = new ArrayList<>();
    private final SortedSet<String> variables = new TreeSet<>();

    public void addIssue(MigrationIssue issue) {
        issues.add(issue);
    }

    /**
     * Records an issue about an element.
     *
     * @param severity the severity
     * @param category short label, e.g. "Gateway"
     * @param element  the element the issue is about
     * @param message  one-line summary
     * @param details  longer explanation, may be empty
     */
    public void addIssue(Severity severity, String category, ElementRef element, String message, String details) {
        addIssue(severity, category, element.id(), element.name(), message, details);
    }

    public void addIssue(Severity severity, String category, String elementId, String elementName,
                         String message, String details) {
        issues.add(MigrationIssue.builder()
                .severity(severity)
                .category(category)
                .elementId(elementId)
                .elementName(elementName)
                .message(message)
                .details(details)
                .build());
    }

    public void addVariables(Collection<String> names) {
        variables.addAll(names);
    }

    /**
     * Issues in the order they were reported.
     */
    public List<MigrationIssue> issues() {
        return Collections.unmodifiableList(issues);
    }

    /**
     * Distinct variable names, sorted.
     */
    public SortedSet<String> variables() {
        return Collections.unmodifiableSortedSet(variables);
    }
}
