package org.camunda.bpm.getstarted.migration.analysis.rules;

import org.camunda.bpm.getstarted.migration.analysis.AnalysisContext;
import org.camunda.bpm.getstarted.migration.analysis.bpmn.ElementModel;
import org.camunda.bpm.getstarted.migration.analysis.bpmn.ElementRef;
import org.camunda.bpm.getstarted.migration.analysis.bpmn.XmlNamespace;
import org.camunda.bpm.getstarted.migration.analysis.expression.ExpressionSyntaxValidator;
import org.camunda.bpm.getstarted.migration.analysis.models.Severity;

import java.util.Optional;

/**
 * Service tasks: Java delegates and expressions become job workers, connectors need replacing,
 * async and retry settings change meaning.
 */
public class ServiceTaskRule implements MigrationRule {
    static final String CATEGORY = "Service Task";
    static final String CONNECTOR_CATEGORY = "Connector";
    static final String CONFIGURATION_CATEGORY = "Configuration";

    @Override
    public void apply(ElementModel model, AnalysisContext context) {
        for (ElementRef task : model.findAll("serviceTask")) {
            checkExternalTask(task, context);
            checkDelegates(task, context);
            checkConnector(task, context);
            checkAsyncAndRetry(task, context);
        }
    }

    private void checkExternalTask(ElementRef task, AnalysisContext context) {
        if (task.camundaAttribute("type").map("external"::equals).orElse(false)) {
            String topic = task.camundaAttribute("topic").orElse("not set");
            context.addIssue(Severity.INFO, CATEGORY, task,
                    "External task pattern already compatible",
                    "Topic: " + topic + ". Ensure workers are updated to use Camunda 8 client.");
        }
    }

    private void checkDelegates(ElementRef task, AnalysisContext context) {
        Optional<String> delegateExpression = task.camundaAttribute("delegateExpression");
        delegateExpression.ifPresent(delegate -> {
            ExpressionSyntaxValidator.validate(delegate, task, "delegateExpression", context);
            context.addIssue(Severity.CRITICAL, CATEGORY, task,
                    "Delegate expression must be converted to Job Worker",
                    "Delegate: " + delegate + ". Implement as external task worker in Camunda 8.");
        });

        task.camundaAttribute("class").ifPresent(className -> {
            ExpressionSyntaxValidator.validate(className, task, "class", context);
            context.addIssue(Severity.CRITICAL, CATEGORY, task,
                    "Java delegate class must be converted to Job Worker",
                    "Class: " + className + ". Implement as external task worker in Camunda 8.");
        });

        task.camundaAttribute("expression").ifPresent(expression ->
                ExpressionSyntaxValidator.validate(expression, task, "expression attribute", context));
    }

    private void checkConnector(ElementRef task, AnalysisContext context) {
        // attribute form first, then <camunda:connector><camunda:connectorId>
        Optional<String> connectorId = task.camundaAttribute("connectorId")
                .or(() -> task.extensionChild("connector")
                        .flatMap(connector -> connector.children(XmlNamespace.CAMUNDA, "connectorId")
                                .stream().findFirst())
                        .flatMap(ElementRef::text));

        connectorId.ifPresent(id -> context.addIssue(Severity.CRITICAL, CONNECTOR_CATEGORY, task,
                "Camunda Connector must be migrated",
                "Connector ID: " + id + ". Convert to Camunda 8 Connector Template or Job Worker."));
    }

    private void checkAsyncAndRetry(ElementRef task, AnalysisContext context) {
        if (task.isTrue(XmlNamespace.CAMUNDA, "asyncBefore")
                || task.isTrue(XmlNamespace.CAMUNDA, "asyncAfter")) {
            context.addIssue(Severity.INFO, CONFIGURATION_CATEGORY, task,
                    "Async configuration not needed in Camunda 8",
                    "All service tasks are asynchronous by default in Camunda 8.");
        }

        Optional<String> retryCycle = task.camundaAttribute("failedJobRetryTimeCycle")
                .or(() -> task.extensionChild("failedJobRetryTimeCycle").flatMap(ElementRef::text));
        retryCycle.ifPresent(retry ->
                context.addIssue(Severity.WARNING, CONFIGURATION_CATEGORY, task,
                        "Retry configuration uses different syntax",
                        "Current: " + retry + ". Use Zeebe retry headers in Camunda 8."));
    }

    @Override
    public String name() {
        return "service tasks";
    }
}
