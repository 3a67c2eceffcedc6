package org.camunda.bpm.getstarted.migration.analysis.rules;

import org.camunda.bpm.getstarted.migration.analysis.AnalysisContext;
import org.camunda.bpm.getstarted.migration.analysis.bpmn.ElementModel;
import org.camunda.bpm.getstarted.migration.analysis.bpmn.XmlNamespace;
import org.camunda.bpm.getstarted.migration.analysis.models.Severity;

/**
 * Checks that the root declares a BPMN 2.0 schema location.
 */
public class NamespaceRule implements MigrationRule {
    static final String CATEGORY = "BPMN";
    static final String ROOT_ID = "root";
    static final String ROOT_NAME = "BPMN Document";

    private static final String BPMN_20_MARKER = "BPMN/20100524";

    @Override
    public void apply(ElementModel model, AnalysisContext context) {
        boolean declared = model.root().attribute(XmlNamespace.XSI, "schemaLocation")
                .map(location -> location.contains(BPMN_20_MARKER))
                .orElse(false);

        if (!declared) {
            context.addIssue(Severity.WARNING, CATEGORY, ROOT_ID, ROOT_NAME,
                    "BPMN 2.0 namespace may be incorrect or missing",
                    "Ensure BPMN uses correct BPMN 2.0 namespace.");
        }
    }

    @Override
    public String name() {
        return "namespaces";
    }
}
