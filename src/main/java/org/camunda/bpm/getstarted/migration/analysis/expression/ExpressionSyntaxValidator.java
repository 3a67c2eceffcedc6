package org.camunda.bpm.getstarted.migration.analysis.expression;

import org.camunda.bpm.getstarted.migration.analysis.AnalysisContext;
import org.camunda.bpm.getstarted.migration.analysis.bpmn.ElementRef;
import org.camunda.bpm.getstarted.migration.analysis.models.Severity;

/**
 * Checks a user-authored expression for legacy JUEL/UEL syntax.
 * Used by every rule that reads an expression out of the document.
 */
public class ExpressionSyntaxValidator {
    public static final String CATEGORY = "Expression";

    private static final String DOLLAR_MARKER = "${";
    private static final String HASH_MARKER = "#{";

    /**
     * Validates an expression owned by a document element. See
     * {@link #validate(String, String, String, String, AnalysisContext)}.
     */
    public static void validate(String expression, ElementRef owner, String context, AnalysisContext analysis) {
        validate(expression, owner.id(), owner.name(), context, analysis);
    }

    /**
     * Records the expression's variables and reports legacy syntax.
     * <ul>
     *     <li>variables are always merged into the run's variable set;</li>
     *     <li>any <code>${</code> or <code>#{</code> marker gives a CRITICAL issue: the expression has to be rewritten in FEEL;</li>
     *     <li>a marker in a string without any <code>}</code> gives a second CRITICAL issue for the malformed expression.</li>
     * </ul>
     * A closing brace anywhere in the string counts as terminating the marker, even if it belongs
     * to another expression.
     *
     * @param expression  the raw expression, null or empty is ignored
     * @param elementId   id of the owning element
     * @param elementName name of the owning element
     * @param context     where the expression was found, e.g. "delegateExpression"
     * @param analysis    the run collecting issues and variables
     */
    public static void validate(String expression, String elementId, String elementName, String context,
                                AnalysisContext analysis) {
        if (expression == null || expression.isEmpty()) {
            return;
        }

        analysis.addVariables(ExpressionVariableExtractor.extract(expression));

        if (hasLegacyMarker(expression)) {
            analysis.addIssue(Severity.CRITICAL, CATEGORY, elementId, elementName,
                    "JUEL/UEL expression detected in " + context,
                    String.format("Expression '%s' uses Camunda 7 syntax. Must be converted to FEEL in Camunda 8. "
                            + "Example: %s", expression, JuelToFeelConverter.example(expression)));
        }

        if (isUnterminated(expression)) {
            analysis.addIssue(Severity.CRITICAL, CATEGORY, elementId, elementName,
                    "Malformed expression in " + context,
                    String.format("Expression '%s' appears to be incomplete", expression));
        }
    }

    public static boolean hasLegacyMarker(String expression) {
        return expression.contains(DOLLAR_MARKER) || expression.contains(HASH_MARKER);
    }

    static boolean isUnterminated(String expression) {
        return hasLegacyMarker(expression) && !expression.contains("}");
    }
}
