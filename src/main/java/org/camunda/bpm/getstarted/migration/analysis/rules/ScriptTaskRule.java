package org.camunda.bpm.getstarted.migration.analysis.rules;

import org.camunda.bpm.getstarted.migration.analysis.AnalysisContext;
import org.camunda.bpm.getstarted.migration.analysis.bpmn.ElementModel;
import org.camunda.bpm.getstarted.migration.analysis.bpmn.ElementRef;
import org.camunda.bpm.getstarted.migration.analysis.expression.ExpressionVariableExtractor;
import org.camunda.bpm.getstarted.migration.analysis.models.Severity;

import java.util.Locale;
import java.util.Set;

/**
 * Script tasks: Camunda 8 runs FEEL natively and only has limited Groovy/JavaScript support.
 */
public class ScriptTaskRule implements MigrationRule {
    static final String CATEGORY = "Script Task";

    private static final Set<String> SUPPORTED_FORMATS = Set.of("feel", "javascript", "groovy");
    private static final Set<String> LIMITED_FORMATS = Set.of("groovy", "javascript");

    @Override
    public void apply(ElementModel model, AnalysisContext context) {
        for (ElementRef task : model.findAll("scriptTask")) {
            // scriptFormat is a plain BPMN attribute; some modelers write it with the camunda prefix
            task.attribute("scriptFormat")
                    .or(() -> task.camundaAttribute("scriptFormat"))
                    .ifPresent(format -> checkFormat(task, format, context));

            task.child("script")
                    .flatMap(ElementRef::text)
                    .ifPresent(body -> context.addVariables(ExpressionVariableExtractor.extract(body)));
        }
    }

    private void checkFormat(ElementRef task, String format, AnalysisContext context) {
        String normalized = format.toLowerCase(Locale.ROOT);
        if (!SUPPORTED_FORMATS.contains(normalized)) {
            context.addIssue(Severity.CRITICAL, CATEGORY, task,
                    "Script format '" + format + "' not supported in Camunda 8",
                    "Consider converting to FEEL or implementing as Job Worker.");
        } else if (LIMITED_FORMATS.contains(normalized)) {
            context.addIssue(Severity.WARNING, CATEGORY, task,
                    "Script format '" + format + "' support is limited",
                    "Groovy and JavaScript support may differ. Test thoroughly or convert to FEEL.");
        }
    }

    @Override
    public String name() {
        return "script tasks";
    }
}
