package com.eainde.verifier.query;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Syntactic checks on emitted oracle text: ASCII only and balanced delimiters.
 * Semantic correctness is left to the oracle.
 */
public final class WolframSyntax {

    private WolframSyntax() {
    }

    public static String requireWellFormed(String text) {
        Deque<Character> open = new ArrayDeque<>();
        boolean inString = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c > 0x7F) {
                throw new IllegalArgumentException("Non-ASCII character '" + c + "' at offset " + i);
            }
            if (c == '"' && (i == 0 || text.charAt(i - 1) != '\\')) {
                inString = !inString;
                continue;
            }
            if (inString) {
                continue;
            }
            if (c == '(' || c == '[' || c == '{') {
                open.push(c);
            } else if (c == ')' || c == ']' || c == '}') {
                char expected = c == ')' ? '(' : c == ']' ? '[' : '{';
                if (open.isEmpty() || open.pop() != expected) {
                    throw new IllegalArgumentException("Unbalanced '" + c + "' at offset " + i);
                }
            }
        }
        if (inString) {
            throw new IllegalArgumentException("Unterminated string literal");
        }
        if (!open.isEmpty()) {
            throw new IllegalArgumentException("Unclosed '" + open.peek() + "'");
        }
        return text;
    }
}
