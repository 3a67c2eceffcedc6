package org.camunda.bpm.getstarted.migration.analysis.rules;

import org.camunda.bpm.getstarted.migration.analysis.AnalysisContext;
import org.camunda.bpm.getstarted.migration.analysis.bpmn.ElementModel;
import org.camunda.bpm.getstarted.migration.analysis.bpmn.ElementRef;
import org.camunda.bpm.getstarted.migration.analysis.expression.ExpressionSyntaxValidator;
import org.camunda.bpm.getstarted.migration.analysis.models.Severity;

import java.util.List;

/**
 * Events: timer expressions and formats, message correlation, signals, errors and escalations.
 */
public class EventRule implements MigrationRule {
    static final String TIMER_CATEGORY = "Timer";
    static final String MESSAGE_CATEGORY = "Message Event";
    static final String SIGNAL_CATEGORY = "Signal Event";
    static final String ERROR_CATEGORY = "Error Event";
    static final String EVENT_CATEGORY = "Event";

    static final List<String> EVENT_TYPES = List.of(
            "startEvent", "endEvent", "intermediateCatchEvent", "intermediateThrowEvent", "boundaryEvent");

    private static final List<String> TIMER_VALUES = List.of("timeDate", "timeDuration", "timeCycle");
    private static final String ISO_8601_PREFIX = "P";
    private static final String FEEL_PREFIX = "=";

    @Override
    public void apply(ElementModel model, AnalysisContext context) {
        for (String eventType : EVENT_TYPES) {
            for (ElementRef event : model.findAll(eventType)) {
                event.child("timerEventDefinition")
                        .ifPresent(timer -> checkTimer(event, timer, context));
                event.child("messageEventDefinition")
                        .ifPresent(message -> checkMessage(model, event, message, context));
                event.child("signalEventDefinition")
                        .ifPresent(signal -> checkSignal(event, signal, context));
                event.child("errorEventDefinition")
                        .ifPresent(error -> checkError(model, event, error, context));
                event.child("escalationEventDefinition")
                        .ifPresent(escalation -> context.addIssue(Severity.WARNING, EVENT_CATEGORY, event,
                                "Escalation event behavior may differ in Camunda 8",
                                "Review escalation handling and consider alternatives."));
            }
        }
    }

    private void checkTimer(ElementRef event, ElementRef timer, AnalysisContext context) {
        for (String valueType : TIMER_VALUES) {
            timer.child(valueType).flatMap(ElementRef::text).ifPresent(expression -> {
                ExpressionSyntaxValidator.validate(expression, event, "timer " + valueType, context);

                if (!expression.startsWith(ISO_8601_PREFIX) && !expression.startsWith(FEEL_PREFIX)) {
                    context.addIssue(Severity.WARNING, TIMER_CATEGORY, event,
                            "Timer " + valueType + " should use ISO 8601 format",
                            "Expression: " + expression + ". Ensure compatibility with Camunda 8.");
                }
            });
        }
    }

    private void checkMessage(ElementModel model, ElementRef event, ElementRef definition, AnalysisContext context) {
        definition.attribute("messageRef")
                .flatMap(ref -> model.findById("message", ref))
                .filter(message -> message.extensionElements().isPresent())
                .ifPresent(message -> context.addIssue(Severity.WARNING, MESSAGE_CATEGORY, event,
                        "Message correlation may need adjustment",
                        "Message: " + message.attribute("name").orElse("none")
                                + ". Review correlation keys for Camunda 8."));
    }

    private void checkSignal(ElementRef event, ElementRef definition, AnalysisContext context) {
        definition.attribute("signalRef").ifPresent(ref -> context.addIssue(Severity.WARNING, SIGNAL_CATEGORY, event,
                "Signal event behavior may differ in Camunda 8",
                "Signal reference: " + ref + ". Verify signal scope and propagation."));
    }

    private void checkError(ElementModel model, ElementRef event, ElementRef definition, AnalysisContext context) {
        definition.attribute("errorRef")
                .flatMap(ref -> model.findById("error", ref))
                .ifPresent(error -> context.addIssue(Severity.INFO, ERROR_CATEGORY, event,
                        "Error handling is compatible but verify error codes",
                        "Error: " + error.attribute("name").orElse("none")
                                + ", Code: " + error.attribute("errorCode").orElse("none")));
    }

    @Override
    public String name() {
        return "events";
    }
}
