package org.camunda.bpm.getstarted.migration.analysis.rules;

import org.camunda.bpm.getstarted.migration.analysis.AnalysisContext;
import org.camunda.bpm.getstarted.migration.analysis.bpmn.ElementModel;
import org.camunda.bpm.getstarted.migration.analysis.bpmn.ElementRef;
import org.camunda.bpm.getstarted.migration.analysis.models.Severity;

/**
 * Engine settings with no Camunda 8 equivalent, on any element.
 */
public class EngineConfigurationRule implements MigrationRule {
    static final String CATEGORY = "Configuration";

    @Override
    public void apply(ElementModel model, AnalysisContext context) {
        for (ElementRef element : model.allElements()) {
            element.camundaAttribute("historyTimeToLive").ifPresent(ttl ->
                    context.addIssue(Severity.INFO, CATEGORY, element,
                            "History TTL configuration not applicable in Camunda 8",
                            "TTL: " + ttl + ". Camunda 8 has different data retention mechanisms."));

            element.camundaAttribute("jobPriority").ifPresent(priority ->
                    context.addIssue(Severity.INFO, CATEGORY, element,
                            "Job priority not supported in Camunda 8",
                            "Priority: " + priority));
        }
    }

    @Override
    public String name() {
        return "engine configuration";
    }
}
