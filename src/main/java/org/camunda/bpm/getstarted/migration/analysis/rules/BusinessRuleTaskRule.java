package org.camunda.bpm.getstarted.migration.analysis.rules;

import org.camunda.bpm.getstarted.migration.analysis.AnalysisContext;
import org.camunda.bpm.getstarted.migration.analysis.bpmn.ElementModel;
import org.camunda.bpm.getstarted.migration.analysis.bpmn.ElementRef;
import org.camunda.bpm.getstarted.migration.analysis.expression.ExpressionSyntaxValidator;
import org.camunda.bpm.getstarted.migration.analysis.models.Severity;

public class BusinessRuleTaskRule implements MigrationRule {
    static final String CATEGORY = "Business Rule Task";

    @Override
    public void apply(ElementModel model, AnalysisContext context) {
        for (ElementRef task : model.findAll("businessRuleTask")) {
            task.camundaAttribute("decisionRef").ifPresent(decisionRef -> {
                ExpressionSyntaxValidator.validate(decisionRef, task, "decisionRef", context);
                context.addIssue(Severity.WARNING, CATEGORY, task,
                        "DMN decision reference needs verification",
                        "Decision: " + decisionRef + ". Ensure DMN is deployed and compatible with Camunda 8.");
            });
        }
    }

    @Override
    public String name() {
        return "business rule tasks";
    }
}
