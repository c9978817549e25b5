package com.agentflow.workflow.validation;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Placeholder syntax shared by the validator and the template resolver: {@code {name}}, {@code {a.b}},
 * {@code {state.field}}. Braces around anything else (e.g. JSON examples in prompts) are left alone.
 */
public final class Placeholders {

    public static final Pattern PATTERN = Pattern.compile("\\{([a-zA-Z_][a-zA-Z0-9_.]*)}");
    public static final String STATE_PREFIX = "state.";

    private Placeholders() {
    }

    /** Distinct placeholder expressions in order of first appearance, without braces. */
    public static Set<String> extract(String template) {
        Set<String> out = new LinkedHashSet<>();
        if (template == null || template.isEmpty()) return out;
        Matcher m = PATTERN.matcher(template);
        while (m.find()) {
            out.add(m.group(1));
        }
        return out;
    }

    /** Strips a leading {@code state.} so {@code state.topic} and {@code topic} resolve alike. */
    public static String stripStatePrefix(String expression) {
        if (expression != null && expression.startsWith(STATE_PREFIX) && expression.length() > STATE_PREFIX.length()) {
            return expression.substring(STATE_PREFIX.length());
        }
        return expression;
    }

    /** First path segment after any {@code state.} prefix: {@code state.meta.author} gives {@code meta}. */
    public static String rootName(String expression) {
        String stripped = stripStatePrefix(expression);
        int dot = stripped.indexOf('.');
        return dot < 0 ? stripped : stripped.substring(0, dot);
    }

    public static boolean hasStatePrefix(String expression) {
        return expression != null && expression.startsWith(STATE_PREFIX);
    }
}
