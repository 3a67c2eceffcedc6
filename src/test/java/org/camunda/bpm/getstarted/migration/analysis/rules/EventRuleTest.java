package org.camunda.bpm.getstarted.migration.analysis.rules;

import org.camunda.bpm.getstarted.migration.analysis.AnalysisContext;
import org.camunda.bpm.getstarted.migration.analysis.models.MigrationIssue;
import org.camunda.bpm.getstarted.migration.analysis.models.Severity;
import org.junit.jupiter.api.Test;

import static org.camunda.bpm.getstarted.migration.analysis.BpmnSamples.apply;
import static org.camunda.bpm.getstarted.migration.analysis.BpmnSamples.applyToDocument;
import static org.camunda.bpm.getstarted.migration.analysis.BpmnSamples.definitions;
import static org.junit.jupiter.api.Assertions.*;

class EventRuleTest {
    private final EventRule rule = new EventRule();

    @Test
    void shouldAcceptIsoDuration() {
        AnalysisContext context = apply(rule, """
                <bpmn:intermediateCatchEvent id="Wait_1">
                  <bpmn:timerEventDefinition>
                    <bpmn:timeDuration xsi:type="bpmn:tFormalExpression">PT10M</bpmn:timeDuration>
                  </bpmn:timerEventDefinition>
                </bpmn:intermediateCatchEvent>
                """);

        assertTrue(context.issues().isEmpty());
    }

    @Test
    void shouldWarnAboutNonIsoTimer() {
        AnalysisContext context = apply(rule, """
                <bpmn:boundaryEvent id="Timeout_1" name="Timeout" attachedToRef="Task_1">
                  <bpmn:timerEventDefinition>
                    <bpmn:timeDuration xsi:type="bpmn:tFormalExpression">10M</bpmn:timeDuration>
                  </bpmn:timerEventDefinition>
                </bpmn:boundaryEvent>
                """);

        assertEquals(1, context.issues().size());
        MigrationIssue issue = context.issues().get(0);
        assertEquals(Severity.WARNING, issue.severity());
        assertEquals(EventRule.TIMER_CATEGORY, issue.category());
        assertEquals("Timer timeDuration should use ISO 8601 format", issue.message());
        assertEquals("Timeout_1", issue.elementId());
    }

    @Test
    void shouldReportExpressionTimerTwice() {
        AnalysisContext context = apply(rule, """
                <bpmn:startEvent id="Start_1">
                  <bpmn:timerEventDefinition>
                    <bpmn:timeCycle xsi:type="bpmn:tFormalExpression">${cycle}</bpmn:timeCycle>
                  </bpmn:timerEventDefinition>
                </bpmn:startEvent>
                """);

        assertEquals(2, context.issues().size());
        assertEquals("Expression", context.issues().get(0).category());
        assertEquals(EventRule.TIMER_CATEGORY, context.issues().get(1).category());
    }

    @Test
    void shouldWarnAboutMessageWithExtensions() {
        AnalysisContext context = applyToDocument(rule, definitions("""
                <bpmn:message id="Message_1" name="OrderPaid">
                  <bpmn:extensionElements>
                    <camunda:properties><camunda:property name="key" value="orderId" /></camunda:properties>
                  </bpmn:extensionElements>
                </bpmn:message>
                <bpmn:message id="Message_2" name="Plain" />
                <bpmn:process id="Process_1" isExecutable="true">
                  <bpmn:startEvent id="Start_1">
                    <bpmn:messageEventDefinition messageRef="Message_1" />
                  </bpmn:startEvent>
                  <bpmn:startEvent id="Start_2">
                    <bpmn:messageEventDefinition messageRef="Message_2" />
                  </bpmn:startEvent>
                  <bpmn:startEvent id="Start_3">
                    <bpmn:messageEventDefinition messageRef="Message_unknown" />
                  </bpmn:startEvent>
                </bpmn:process>
                """));

        assertEquals(1, context.issues().size());
        MigrationIssue issue = context.issues().get(0);
        assertEquals(EventRule.MESSAGE_CATEGORY, issue.category());
        assertEquals("Start_1", issue.elementId());
        assertTrue(issue.details().startsWith("Message: OrderPaid."));
    }

    @Test
    void shouldReportSignalErrorAndEscalation() {
        AnalysisContext context = applyToDocument(rule, definitions("""
                <bpmn:error id="Error_1" name="PaymentFailed" errorCode="PAY-01" />
                <bpmn:process id="Process_1" isExecutable="true">
                  <bpmn:intermediateThrowEvent id="Signal_1">
                    <bpmn:signalEventDefinition signalRef="Signal_abc" />
                  </bpmn:intermediateThrowEvent>
                  <bpmn:endEvent id="Error_end">
                    <bpmn:errorEventDefinition errorRef="Error_1" />
                  </bpmn:endEvent>
                  <bpmn:endEvent id="Escalate_end">
                    <bpmn:escalationEventDefinition />
                  </bpmn:endEvent>
                </bpmn:process>
                """));

        assertEquals(3, context.issues().size());
        MigrationIssue signal = context.issues().get(0);
        MigrationIssue error = context.issues().get(1);
        MigrationIssue escalation = context.issues().get(2);
        assertEquals(EventRule.SIGNAL_CATEGORY, signal.category());
        assertEquals(Severity.WARNING, signal.severity());
        assertEquals(EventRule.ERROR_CATEGORY, error.category());
        assertEquals(Severity.INFO, error.severity());
        assertEquals("Error: PaymentFailed, Code: PAY-01", error.details());
        assertEquals(EventRule.EVENT_CATEGORY, escalation.category());
        assertEquals(Severity.WARNING, escalation.severity());
    }

    @Test
    void shouldIgnoreUnresolvedErrorReference() {
        AnalysisContext context = apply(rule, """
                <bpmn:endEvent id="End_1">
                  <bpmn:errorEventDefinition errorRef="Error_missing" />
                </bpmn:endEvent>
                """);

        assertTrue(context.issues().isEmpty());
    }
}
