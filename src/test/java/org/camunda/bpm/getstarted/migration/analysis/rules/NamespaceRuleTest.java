package org.camunda.bpm.getstarted.migration.analysis.rules;

import org.camunda.bpm.getstarted.migration.analysis.AnalysisContext;
import org.camunda.bpm.getstarted.migration.analysis.models.MigrationIssue;
import org.camunda.bpm.getstarted.migration.analysis.models.Severity;
import org.junit.jupiter.api.Test;

import static org.camunda.bpm.getstarted.migration.analysis.BpmnSamples.apply;
import static org.camunda.bpm.getstarted.migration.analysis.BpmnSamples.applyToDocument;
import static org.junit.jupiter.api.Assertions.*;

class NamespaceRuleTest {
    private final NamespaceRule rule = new NamespaceRule();

    @Test
    void shouldAcceptBpmn20SchemaLocation() {
        assertTrue(apply(rule, "").issues().isEmpty());
    }

    @Test
    void shouldWarnWhenSchemaLocationIsMissing() {
        AnalysisContext context = applyToDocument(rule,
                "<definitions xmlns=\"http://www.omg.org/spec/BPMN/20100524/MODEL\" id=\"Defs\" />");

        assertEquals(1, context.issues().size());
        MigrationIssue issue = context.issues().get(0);
        assertEquals(Severity.WARNING, issue.severity());
        assertEquals(NamespaceRule.CATEGORY, issue.category());
        assertEquals("root", issue.elementId());
        assertEquals("BPMN Document", issue.elementName());
    }

    @Test
    void shouldWarnAboutOtherSchemaLocation() {
        AnalysisContext context = applyToDocument(rule, """
                <definitions xmlns="http://www.omg.org/spec/BPMN/20100524/MODEL"
                             xmlns:xsi="http://www.w3.org/2001/XMLSchema-instance"
                             xsi:schemaLocation="http://example.com/legacy legacy.xsd" />
                """);

        assertEquals(1, context.issues().size());
    }
}
