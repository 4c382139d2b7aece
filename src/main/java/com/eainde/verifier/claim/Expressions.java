package com.eainde.verifier.claim;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Helpers for the small expression grammar shared with the resolution oracle:
 * infix {@code + - * / ^}, heads {@code Log[] Exp[] Sqrt[]}, literal
 * {@code Infinity} and conjunction {@code &&}.
 *
 * <p>Nothing here evaluates an expression; the helpers only normalize text and
 * find the identifiers it mentions.</p>
 */
public final class Expressions {

    public static final String INFINITY = "Infinity";
    public static final String NEGATIVE_INFINITY = "-Infinity";

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z][A-Za-z0-9]*");
    private static final Pattern ITERATOR_SPEC = Pattern.compile("\\{\\s*([A-Za-z][A-Za-z0-9]*)\\s*,");
    private static final Pattern LOWERCASE_HEAD = Pattern.compile("\\b(exp|log|sqrt)\\[", Pattern.CASE_INSENSITIVE);
    private static final Pattern SCOPING_HEAD = Pattern.compile("\\b(Integrate|Sum|Product|NIntegrate)\\[");

    private static final Set<String> RESERVED = Set.of(
            "Infinity", "ComplexInfinity", "True", "False", "E", "Pi", "I", "Reals", "Integers");

    private Expressions() {
    }

    /**
     * Normalizes operator spelling and the casing of the known function heads.
     * {@code log[x] ≤ 2·x} becomes {@code Log[x] <= 2*x}.
     */
    public static String normalize(String expression) {
        if (expression == null) {
            return "";
        }
        String s = expression.trim()
                .replace("≤", "<=")
                .replace("≥", ">=")
                .replace("≠", "!=")
                .replace("·", "*")
                .replace("×", "*")
                .replace("−", "-")
                .replace("∧", "&&")
                .replace("∨", "||")
                .replace("∞", INFINITY);
        Matcher m = LOWERCASE_HEAD.matcher(s);
        StringBuilder out = new StringBuilder();
        while (m.find()) {
            String head = m.group(1).toLowerCase(Locale.ROOT);
            m.appendReplacement(out, Character.toUpperCase(head.charAt(0)) + head.substring(1) + "[");
        }
        m.appendTail(out);
        return out.toString();
    }

    /**
     * Normalizes a summation limit: spelled-out or symbolic infinities become
     * {@code Infinity} / {@code -Infinity}, everything else goes through
     * {@link #normalize(String)}.
     */
    public static String normalizeLimit(String limit) {
        String s = normalize(limit).replace(" ", "");
        String lower = s.toLowerCase(Locale.ROOT);
        switch (lower) {
            case "infinity":
            case "+infinity":
            case "inf":
            case "+inf":
            case "oo":
                return INFINITY;
            case "-infinity":
            case "-inf":
            case "-oo":
                return NEGATIVE_INFINITY;
            default:
                return s;
        }
    }

    /**
     * Free identifiers of an expression in first-seen order. Function heads,
     * reserved symbols and iterator variables bound by {@code Integrate[..., {s, a, b}]}
     * style constructs are excluded.
     */
    public static Set<String> identifiers(String expression) {
        String s = normalize(expression);
        Set<String> bound = new LinkedHashSet<>();
        if (SCOPING_HEAD.matcher(s).find()) {
            Matcher it = ITERATOR_SPEC.matcher(s);
            while (it.find()) {
                bound.add(it.group(1));
            }
        }
        Set<String> found = new LinkedHashSet<>();
        Matcher m = IDENTIFIER.matcher(s);
        while (m.find()) {
            String name = m.group();
            if (RESERVED.contains(name) || bound.contains(name) || isHead(s, m.end())) {
                continue;
            }
            found.add(name);
        }
        return found;
    }

    /** True when {@code name} occurs free in {@code expression}. */
    public static boolean mentions(String expression, String name) {
        return identifiers(expression).contains(name);
    }

    /**
     * Parses a variable list written as {@code {h,m}}, {@code h, m} or left
     * empty ({@code ""}, {@code {}} or {@code True} all mean no variables).
     */
    public static List<String> variableList(String text) {
        List<String> variables = new ArrayList<>();
        if (text == null) {
            return variables;
        }
        String s = text.trim();
        if (s.startsWith("{") && s.endsWith("}")) {
            s = s.substring(1, s.length() - 1);
        }
        if (s.isBlank() || s.equalsIgnoreCase("true")) {
            return variables;
        }
        for (String part : s.split(",")) {
            String name = part.trim();
            if (name.isEmpty()) {
                continue;
            }
            if (!isIdentifier(name)) {
                throw new IllegalArgumentException("Not a variable name: '" + name + "'");
            }
            if (!variables.contains(name)) {
                variables.add(name);
            }
        }
        return variables;
    }

    public static boolean isIdentifier(String text) {
        return text != null && IDENTIFIER.matcher(text).matches() && !RESERVED.contains(text);
    }

    private static boolean isHead(String s, int end) {
        int i = end;
        while (i < s.length() && s.charAt(i) == ' ') {
            i++;
        }
        return i < s.length() && s.charAt(i) == '[';
    }
}
