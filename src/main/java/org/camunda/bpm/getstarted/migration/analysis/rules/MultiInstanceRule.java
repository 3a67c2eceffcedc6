package org.camunda.bpm.getstarted.migration.analysis.rules;

import org.camunda.bpm.getstarted.migration.analysis.AnalysisContext;
import org.camunda.bpm.getstarted.migration.analysis.bpmn.ElementModel;
import org.camunda.bpm.getstarted.migration.analysis.bpmn.ElementRef;
import org.camunda.bpm.getstarted.migration.analysis.expression.ExpressionSyntaxValidator;

/**
 * Multi-instance loop characteristics. Findings are reported against the activity that carries them.
 */
public class MultiInstanceRule implements MigrationRule {

    @Override
    public void apply(ElementModel model, AnalysisContext context) {
        for (ElementRef loop : model.findAll("multiInstanceLoopCharacteristics")) {
            model.parentOf(loop).ifPresent(activity -> checkLoop(activity, loop, context));
        }
    }

    private void checkLoop(ElementRef activity, ElementRef loop, AnalysisContext context) {
        loop.camundaAttribute("collection").ifPresent(collection ->
                ExpressionSyntaxValidator.validate(collection, activity, "multi-instance collection", context));

        loop.child("loopCardinality").flatMap(ElementRef::text).ifPresent(cardinality ->
                ExpressionSyntaxValidator.validate(cardinality, activity, "multi-instance loop cardinality", context));

        loop.child("completionCondition").flatMap(ElementRef::text).ifPresent(condition ->
                ExpressionSyntaxValidator.validate(condition, activity, "multi-instance completion condition", context));
    }

    @Override
    public String name() {
        return "multi-instance";
    }
}
