package org.camunda.bpm.getstarted.migration.analysis.rules;

import org.camunda.bpm.getstarted.migration.analysis.AnalysisContext;
import org.camunda.bpm.getstarted.migration.analysis.models.Severity;
import org.junit.jupiter.api.Test;

import static org.camunda.bpm.getstarted.migration.analysis.BpmnSamples.apply;
import static org.junit.jupiter.api.Assertions.*;

class BusinessRuleTaskRuleTest {
    private final BusinessRuleTaskRule rule = new BusinessRuleTaskRule();

    @Test
    void shouldWarnAboutDecisionReference() {
        AnalysisContext context = apply(rule,
                "<bpmn:businessRuleTask id=\"Rule_1\" camunda:decisionRef=\"approve-order\" />");

        assertEquals(1, context.issues().size());
        assertEquals(Severity.WARNING, context.issues().get(0).severity());
        assertEquals(BusinessRuleTaskRule.CATEGORY, context.issues().get(0).category());
    }

    @Test
    void shouldIgnoreTaskWithoutDecision() {
        assertTrue(apply(rule, "<bpmn:businessRuleTask id=\"Rule_1\" />").issues().isEmpty());
    }
}
