package org.camunda.bpm.getstarted.migration.analysis.rules;

import org.camunda.bpm.getstarted.migration.analysis.AnalysisContext;
import org.camunda.bpm.getstarted.migration.analysis.bpmn.ElementModel;

/**
 * One group of Camunda 7 to Camunda 8 compatibility checks.
 * <p>
 * A rule only reads the model and only appends to the context. Rules do not depend on each
 * other, so their order changes nothing but the insertion order of issues.
 */
public interface MigrationRule {

    /**
     * Inspects the model and reports findings to the context.
     *
     * @param model   the parsed process
     * @param context issue and variable collector of the current run
     */
    void apply(ElementModel model, AnalysisContext context);

    /**
     * Name used in log output, e.g. "service tasks".
     */
    String name();
}
