package com.eainde.verifier.claim;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Splits domain predicates into conjuncts and joins them back.
 *
 * <p>A predicate may be written as {@code {x>0, y>1}}, {@code x>0, y>1},
 * {@code x>0 && y>1} or {@code True}. Splitting only happens at nesting depth
 * zero, so {@code Log[a, b] > 0} stays a single conjunct. A disjunction is
 * always one conjunct, and {@link #join} puts it back in parentheses.</p>
 */
public final class Conjuncts {

    public static final String TRUE = "True";

    private Conjuncts() {
    }

    public static List<String> split(String predicate) {
        List<String> result = new ArrayList<>();
        String s = Expressions.normalize(predicate);
        if (s.isEmpty()) {
            return result;
        }
        List<String> items = isWrapped(s, '{', '}')
                ? splitTopLevel(s.substring(1, s.length() - 1), ",")
                : splitTopLevel(s, ",");
        for (String item : items) {
            List<String> parts = isDisjunction(item) ? List.of(item) : splitTopLevel(item, "&&");
            for (String part : parts) {
                String conjunct = unwrapParentheses(part.trim());
                if (conjunct.isEmpty() || conjunct.equalsIgnoreCase(TRUE)) {
                    continue;
                }
                result.add(conjunct);
            }
        }
        return result;
    }

    /** Removes repeated conjuncts, keeping the first occurrence of each. */
    public static List<String> dedupe(List<String> conjuncts) {
        Map<String, String> seen = new LinkedHashMap<>();
        for (String conjunct : conjuncts) {
            seen.putIfAbsent(key(conjunct), conjunct);
        }
        return new ArrayList<>(seen.values());
    }

    /** Whitespace-insensitive identity of a conjunct. */
    public static String key(String conjunct) {
        return conjunct.replaceAll("\\s+", "");
    }

    public static String join(List<String> conjuncts) {
        if (conjuncts.isEmpty()) {
            return TRUE;
        }
        List<String> grouped = new ArrayList<>();
        for (String conjunct : conjuncts) {
            grouped.add(isDisjunction(conjunct) ? "(" + conjunct + ")" : conjunct);
        }
        return String.join(" && ", grouped);
    }

    /** {@code ||} binds looser than {@code &&}, so a top-level disjunction needs grouping. */
    static boolean isDisjunction(String predicate) {
        return splitTopLevel(predicate, "||").size() > 1;
    }

    static List<String> splitTopLevel(String text, String separator) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if ((c == ')' || c == ']' || c == '}') && depth > 0) {
                depth--;
            } else if (depth == 0 && text.startsWith(separator, i)) {
                parts.add(text.substring(start, i).trim());
                start = i + separator.length();
                i = start - 1;
            }
        }
        parts.add(text.substring(start).trim());
        return parts;
    }

    private static String unwrapParentheses(String s) {
        String current = s;
        while (isWrapped(current, '(', ')')) {
            current = current.substring(1, current.length() - 1).trim();
        }
        return current;
    }

    /** True when the opening character at 0 is closed by the last character. */
    private static boolean isWrapped(String s, char open, char close) {
        if (s.length() < 2 || s.charAt(0) != open || s.charAt(s.length() - 1) != close) {
            return false;
        }
        int depth = 0;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth--;
                if (depth == 0 && i < s.length() - 1) {
                    return false;
                }
            }
        }
        return depth == 0;
    }
}
