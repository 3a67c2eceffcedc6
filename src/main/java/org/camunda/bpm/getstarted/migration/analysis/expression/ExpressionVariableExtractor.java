package org.camunda.bpm.getstarted.migration.analysis.expression;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls top-level variable names out of JUEL/UEL snippets such as {@code ${order.total > 100}}.
 * No syntax checking happens here.
 */
public class ExpressionVariableExtractor {

    // ${...} or #{...}, up to the first closing brace
    private static final Pattern EXPRESSION_PATTERN = Pattern.compile("[$#]\\{([^}]+)}");
    // a variable name ends at the first member access, index, call or whitespace (Unicode included)
    private static final Pattern NAME_TERMINATOR = Pattern.compile("[.\\[(\\s]", Pattern.UNICODE_CHARACTER_CLASS);

    /**
     * Extracts the variable names referenced by every expression in the text.
     * E.g. {@code "${order.total}"} gives {@code {"order"}} and {@code "${myDelegate}"} gives
     * {@code {"myDelegate"}}.
     *
     * @param text arbitrary text, may be null
     * @return the variable names, empty if the text holds no expression
     */
    public static Set<String> extract(String text) {
        Set<String> variables = new LinkedHashSet<>();
        if (text == null || text.isEmpty()) {
            return variables;
        }

        Matcher matcher = EXPRESSION_PATTERN.matcher(text);
        while (matcher.find()) {
            String content = matcher.group(1);
            String name = NAME_TERMINATOR.split(content, 2)[0];
            if (!name.isEmpty()) {
                variables.add(name);
            }
        }
        return variables;
    }
}
