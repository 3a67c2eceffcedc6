package org.camunda.bpm.getstarted.migration.analysis.rules;

import org.camunda.bpm.getstarted.migration.analysis.AnalysisContext;
import org.camunda.bpm.getstarted.migration.analysis.bpmn.ElementModel;
import org.camunda.bpm.getstarted.migration.analysis.bpmn.ElementRef;
import org.camunda.bpm.getstarted.migration.analysis.bpmn.XmlNamespace;
import org.camunda.bpm.getstarted.migration.analysis.expression.ExpressionSyntaxValidator;
import org.camunda.bpm.getstarted.migration.analysis.models.Severity;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code camunda:inputOutput} parameters on any element: expressions are validated and
 * scripted parameters are flagged.
 */
public class InputOutputMappingRule implements MigrationRule {
    static final String CATEGORY = "I/O Mapping";

    @Override
    public void apply(ElementModel model, AnalysisContext context) {
        for (ElementRef element : model.allElements()) {
            element.extensionChild("inputOutput").ifPresent(mapping -> checkParameters(element, mapping, context));
        }
    }

    private void checkParameters(ElementRef element, ElementRef mapping, AnalysisContext context) {
        List<ElementRef> parameters = new ArrayList<>(mapping.children(XmlNamespace.CAMUNDA, "inputParameter"));
        parameters.addAll(mapping.children(XmlNamespace.CAMUNDA, "outputParameter"));

        for (ElementRef parameter : parameters) {
            String parameterName = parameter.attribute("name").orElse("none");

            parameter.text().ifPresent(value ->
                    ExpressionSyntaxValidator.validate(value, element, "I/O parameter " + parameterName, context));

            if (!parameter.children(XmlNamespace.CAMUNDA, "script").isEmpty()) {
                context.addIssue(Severity.CRITICAL, CATEGORY, element,
                        "Script in I/O parameter not supported",
                        "Parameter: " + parameterName + ". Convert to FEEL expression or Job Worker.");
            }
        }
    }

    @Override
    public String name() {
        return "input/output mappings";
    }
}
