package org.camunda.bpm.getstarted.migration.analysis.rules;

import org.camunda.bpm.getstarted.migration.analysis.AnalysisContext;
import org.camunda.bpm.getstarted.migration.analysis.bpmn.ElementModel;
import org.camunda.bpm.getstarted.migration.analysis.bpmn.ElementRef;
import org.camunda.bpm.getstarted.migration.analysis.bpmn.XmlNamespace;
import org.camunda.bpm.getstarted.migration.analysis.expression.ExpressionSyntaxValidator;
import org.camunda.bpm.getstarted.migration.analysis.models.Severity;

import java.util.List;

/**
 * User tasks: embedded and external forms, generated form fields and assignment expressions.
 */
public class UserTaskRule implements MigrationRule {
    static final String CATEGORY = "User Task";

    private static final List<String> EMBEDDED_FORM_PREFIXES = List.of("embedded:", "camunda-forms:");
    private static final List<String> ASSIGNMENT_ATTRIBUTES = List.of("assignee", "candidateUsers", "candidateGroups");

    @Override
    public void apply(ElementModel model, AnalysisContext context) {
        for (ElementRef task : model.findAll("userTask")) {
            task.camundaAttribute("formKey").ifPresent(formKey -> checkFormKey(task, formKey, context));

            task.camundaAttribute("formRef").ifPresent(formRef ->
                    context.addIssue(Severity.WARNING, CATEGORY, task,
                            "Form reference needs verification",
                            "Form ref: " + formRef));

            checkFormFields(task, context);

            for (String attribute : ASSIGNMENT_ATTRIBUTES) {
                task.camundaAttribute(attribute).ifPresent(value ->
                        ExpressionSyntaxValidator.validate(value, task, attribute, context));
            }
        }
    }

    private void checkFormKey(ElementRef task, String formKey, AnalysisContext context) {
        boolean embedded = EMBEDDED_FORM_PREFIXES.stream().anyMatch(formKey::startsWith);
        if (embedded) {
            context.addIssue(Severity.CRITICAL, CATEGORY, task,
                    "Embedded form must be converted to Camunda 8 Forms",
                    "Form key: " + formKey + ". Migrate to Camunda Forms JSON schema.");
        } else {
            context.addIssue(Severity.WARNING, CATEGORY, task,
                    "External form reference needs review",
                    "Form key: " + formKey + ". Ensure form is accessible in Camunda 8.");
        }
    }

    private void checkFormFields(ElementRef task, AnalysisContext context) {
        task.extensionChild("formData").ifPresent(formData -> {
            int fieldCount = formData.children(XmlNamespace.CAMUNDA, "formField").size();
            if (fieldCount > 0) {
                context.addIssue(Severity.CRITICAL, CATEGORY, task,
                        "Embedded form with " + fieldCount + " fields must be migrated",
                        "Convert form fields to Camunda 8 Forms JSON schema.");
            }
        });
    }

    @Override
    public String name() {
        return "user tasks";
    }
}
