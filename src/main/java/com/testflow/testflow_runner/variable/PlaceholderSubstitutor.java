package com.testflow.testflow_runner.variable;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Replaces {@code ${name}} tokens with the current value of the variable.
 * Unknown names are left as written.
 */
public final class PlaceholderSubstitutor {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{\\s*([^}]+?)\\s*}");

    private PlaceholderSubstitutor() {
    }

    public static String substitute(String text, VariableTable variables) {
        if (text == null || !text.contains("${")) {
            return text;
        }
        Matcher matcher = PLACEHOLDER.matcher(text);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String replacement = variables.get(matcher.group(1))
                    .map(Variable::currentText)
                    .orElse(matcher.group(0));
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    public static boolean hasPlaceholder(String text) {
        return text != null && PLACEHOLDER.matcher(text).find();
    }
}
