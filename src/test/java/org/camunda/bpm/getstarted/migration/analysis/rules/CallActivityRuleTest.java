package org.camunda.bpm.getstarted.migration.analysis.rules;

import org.camunda.bpm.getstarted.migration.analysis.AnalysisContext;
import org.camunda.bpm.getstarted.migration.analysis.models.Severity;
import org.junit.jupiter.api.Test;

import static org.camunda.bpm.getstarted.migration.analysis.BpmnSamples.apply;
import static org.junit.jupiter.api.Assertions.*;

class CallActivityRuleTest {
    private final CallActivityRule rule = new CallActivityRule();

    @Test
    void shouldWarnAboutCalledElementAndMappings() {
        AnalysisContext context = apply(rule, """
                <bpmn:callActivity id="Call_1" calledElement="billing-process">
                  <bpmn:extensionElements>
                    <camunda:in source="orderId" target="orderId" />
                    <camunda:in businessKey="#{execution.processBusinessKey}" />
                    <camunda:out source="invoiceId" target="invoiceId" />
                  </bpmn:extensionElements>
                </bpmn:callActivity>
                """);

        assertEquals(2, context.issues().size());
        assertTrue(context.issues().stream().allMatch(issue -> issue.severity() == Severity.WARNING));
        assertEquals("Called element: billing-process. Ensure called process exists in Camunda 8.",
                context.issues().get(0).details());
        assertEquals("Found 2 input and 1 output mappings.", context.issues().get(1).details());
    }

    @Test
    void shouldValidateDynamicCalledElement() {
        AnalysisContext context = apply(rule, "<bpmn:callActivity id=\"Call_1\" calledElement=\"${subProcessKey}\" />");

        assertEquals(2, context.issues().size());
        assertEquals("Expression", context.issues().get(0).category());
        assertEquals(CallActivityRule.CATEGORY, context.issues().get(1).category());
    }

    @Test
    void shouldIgnoreCallActivityWithoutConfiguration() {
        assertTrue(apply(rule, "<bpmn:callActivity id=\"Call_1\" />").issues().isEmpty());
    }
}
