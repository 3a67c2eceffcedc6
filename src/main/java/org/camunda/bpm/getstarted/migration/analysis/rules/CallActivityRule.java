package org.camunda.bpm.getstarted.migration.analysis.rules;

import org.camunda.bpm.getstarted.migration.analysis.AnalysisContext;
import org.camunda.bpm.getstarted.migration.analysis.bpmn.ElementModel;
import org.camunda.bpm.getstarted.migration.analysis.bpmn.ElementRef;
import org.camunda.bpm.getstarted.migration.analysis.expression.ExpressionSyntaxValidator;
import org.camunda.bpm.getstarted.migration.analysis.models.Severity;

public class CallActivityRule implements MigrationRule {
    static final String CATEGORY = "Call Activity";

    @Override
    public void apply(ElementModel model, AnalysisContext context) {
        for (ElementRef activity : model.findAll("callActivity")) {
            activity.attribute("calledElement").ifPresent(calledElement -> {
                ExpressionSyntaxValidator.validate(calledElement, activity, "calledElement", context);
                context.addIssue(Severity.WARNING, CATEGORY, activity,
                        "Call activity requires verification",
                        "Called element: " + calledElement + ". Ensure called process exists in Camunda 8.");
            });

            int inputs = activity.extensionChildren("in").size();
            int outputs = activity.extensionChildren("out").size();
            if (inputs > 0 || outputs > 0) {
                context.addIssue(Severity.WARNING, CATEGORY, activity,
                        "Variable mapping syntax differs in Camunda 8",
                        "Found " + inputs + " input and " + outputs + " output mappings.");
            }
        }
    }

    @Override
    public String name() {
        return "call activities";
    }
}
