package org.camunda.bpm.getstarted.migration.analysis.expression;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Suggests a FEEL rewrite for a JUEL expression. Only meant as an illustration in issue details,
 * not as a converter that preserves semantics.
 */
public class JuelToFeelConverter {

    private static final Pattern JUEL_PATTERN = Pattern.compile("^[$#]\\{([^}]*)}$");
    private static final String GENERIC_EXAMPLE = "'${myVar}' -> '=myVar'";

    /**
     * Converts a single-wrapper JUEL expression such as {@code ${a == 1 && b}} into
     * {@code =a = 1 and b}.
     *
     * @param expression the JUEL expression
     * @return the FEEL form, or null if the text is not exactly one {@code ${...}} / {@code #{...}}
     */
    public static String toFeel(String expression) {
        if (expression == null || expression.isBlank()) {
            return null;
        }

        Matcher matcher = JUEL_PATTERN.matcher(expression.trim());
        if (!matcher.find()) {
            return null;
        }

        String content = matcher.group(1).trim();
        if (content.isEmpty()) {
            return null;
        }

        content = content
                .replace("&&", "and")
                .replace("||", "or")
                .replace("==", "=")
                .replaceAll("\\bne\\b", "!=")
                .replaceAll("\\beq\\b", "=");
        return "=" + content;
    }

    /**
     * A one-line "before -> after" example for issue details.
     *
     * @param expression the offending expression
     * @return example derived from the expression when possible, otherwise a generic one
     */
    public static String example(String expression) {
        String feel = toFeel(expression);
        if (feel == null) {
            return GENERIC_EXAMPLE;
        }
        return "'" + expression.trim() + "' -> '" + feel + "'";
    }
}
