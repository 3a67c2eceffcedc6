package org.camunda.bpm.getstarted.migration.analysis.rules;

import org.camunda.bpm.getstarted.migration.analysis.AnalysisContext;
import org.camunda.bpm.getstarted.migration.analysis.bpmn.ElementModel;
import org.camunda.bpm.getstarted.migration.analysis.bpmn.ElementRef;
import org.camunda.bpm.getstarted.migration.analysis.expression.ExpressionSyntaxValidator;
import org.camunda.bpm.getstarted.migration.analysis.models.Severity;

import java.util.Optional;

/**
 * Task and execution listeners declared on any element. Camunda 8 has no listener concept,
 * so every listener with an implementation is critical.
 */
public class ListenerRule implements MigrationRule {
    static final String TASK_LISTENER = "Task Listener";
    static final String EXECUTION_LISTENER = "Execution Listener";

    @Override
    public void apply(ElementModel model, AnalysisContext context) {
        for (ElementRef element : model.allElements()) {
            for (ElementRef listener : element.extensionChildren("taskListener")) {
                checkListener(element, listener, TASK_LISTENER, context);
            }
            for (ElementRef listener : element.extensionChildren("executionListener")) {
                checkListener(element, listener, EXECUTION_LISTENER, context);
            }
        }
    }

    private void checkListener(ElementRef owner, ElementRef listener, String listenerType, AnalysisContext context) {
        Optional<String> delegateExpression = listener.attribute("delegateExpression");
        Optional<String> className = listener.attribute("class");
        Optional<String> expression = listener.attribute("expression");

        if (delegateExpression.isEmpty() && className.isEmpty() && expression.isEmpty()) {
            return;
        }

        String event = listener.attribute("event").orElse("none");
        context.addIssue(Severity.CRITICAL, listenerType, owner,
                listenerType + " not supported in Camunda 8",
                "Event: " + event + ". Convert listener logic to Job Worker or process redesign.");

        delegateExpression.ifPresent(value ->
                ExpressionSyntaxValidator.validate(value, owner, listenerType, context));
        expression.ifPresent(value ->
                ExpressionSyntaxValidator.validate(value, owner, listenerType, context));
    }

    @Override
    public String name() {
        return "listeners";
    }
}
