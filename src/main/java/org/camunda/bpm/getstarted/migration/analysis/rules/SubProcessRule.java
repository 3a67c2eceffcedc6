package org.camunda.bpm.getstarted.migration.analysis.rules;

import org.camunda.bpm.getstarted.migration.analysis.AnalysisContext;
import org.camunda.bpm.getstarted.migration.analysis.bpmn.ElementModel;
import org.camunda.bpm.getstarted.migration.analysis.bpmn.ElementRef;
import org.camunda.bpm.getstarted.migration.analysis.models.Severity;

public class SubProcessRule implements MigrationRule {
    static final String CATEGORY = "Subprocess";

    @Override
    public void apply(ElementModel model, AnalysisContext context) {
        for (ElementRef subProcess : model.findAll("subProcess")) {
            if (subProcess.isTrue("triggeredByEvent")) {
                context.addIssue(Severity.WARNING, CATEGORY, subProcess,
                        "Event subprocess behavior may differ in Camunda 8",
                        "Review event subprocess triggering and variable scope.");
            }
        }
    }

    @Override
    public String name() {
        return "subprocesses";
    }
}
