package com.eainde.verifier.oracle;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Tri-state answer of the resolution oracle for a universally quantified comparison.
 */
public enum Resolution {
    TRUE,
    FALSE,
    /** Neither True nor False: an unevaluated residue, a conditional answer or a failure. */
    UNKNOWN;

    /** Maps the oracle's textual answer; anything but {@code True}/{@code False} is unknown. */
    public static Resolution fromToken(String token) {
        if (token == null) {
            return UNKNOWN;
        }
        String t = token.trim();
        if (t.equals("True") || t.equals("\"True\"")) {
            return TRUE;
        }
        if (t.equals("False") || t.equals("\"False\"")) {
            return FALSE;
        }
        return UNKNOWN;
    }

    public static Resolution fromJson(JsonNode node) {
        if (node == null || node.isNull()) {
            return UNKNOWN;
        }
        if (node.isBoolean()) {
            return node.booleanValue() ? TRUE : FALSE;
        }
        return node.isTextual() ? fromToken(node.textValue()) : UNKNOWN;
    }
}
