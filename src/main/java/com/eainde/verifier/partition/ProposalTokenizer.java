package com.eainde.verifier.partition;

import com.eainde.verifier.partition.MalformedPartitionException.Reason;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent tokenizer for decomposition proposals.
 *
 * <pre>
 * proposal := prose* list prose*
 * list     := ('[' | '{') [ element (',' element)* ] (']' | '}')
 * element  := ( group | atom )+
 * group    := '(' inner ')' | '[' inner ']' | '{' inner '}'
 * </pre>
 *
 * Markdown code fences and surrounding prose are skipped. A list whose only
 * element is itself a bracketed list ({@code [[a, b]]}) is unwrapped, and
 * elements wrapped in double quotes lose their quotes.
 */
public final class ProposalTokenizer {

    private final String text;
    private int pos;

    private ProposalTokenizer(String text) {
        this.text = text;
    }

    public static List<String> tokenize(String proposal) {
        if (proposal == null || proposal.isBlank()) {
            throw new MalformedPartitionException(Reason.EMPTY_PROPOSAL, "Proposal is empty");
        }
        return new ProposalTokenizer(stripCodeFences(proposal.trim())).parseProposal();
    }

    private List<String> parseProposal() {
        skipProse();
        if (pos >= text.length()) {
            throw new MalformedPartitionException(Reason.NO_LIST_LITERAL,
                    "No list literal found in proposal: " + abbreviate(text));
        }
        List<String> elements = parseList();
        skipProse();
        if (pos < text.length()) {
            throw new MalformedPartitionException(Reason.TRAILING_CONTENT,
                    "Unexpected content after the list at offset " + pos + ": " + abbreviate(text.substring(pos)));
        }
        if (elements.size() == 1 && isListLiteral(elements.get(0))) {
            return new ProposalTokenizer(elements.get(0)).parseProposal();
        }
        return elements;
    }

    /** Advances to the next opening bracket or brace; stray closers are an error. */
    private void skipProse() {
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (c == '[' || c == '{') {
                return;
            }
            if (c == '(') {
                parseGroup();
                continue;
            }
            if (c == ']' || c == '}' || c == ')') {
                throw new MalformedPartitionException(Reason.UNBALANCED_DELIMITERS,
                        "Unmatched '" + c + "' at offset " + pos);
            }
            pos++;
        }
    }

    private List<String> parseList() {
        char open = text.charAt(pos++);
        char close = closerOf(open);
        List<String> elements = new ArrayList<>();
        skipWhitespace();
        if (peek() == close) {
            pos++;
            return elements;
        }
        while (true) {
            String element = parseElement(close).trim();
            if (element.isEmpty()) {
                throw new MalformedPartitionException(Reason.EMPTY_ELEMENT,
                        "Empty element at offset " + pos);
            }
            elements.add(unquote(element));
            char c = peek();
            if (c == ',') {
                pos++;
            } else if (c == close) {
                pos++;
                return elements;
            } else {
                throw unbalanced(close);
            }
        }
    }

    /** Reads up to a top-level ',' or the list closer, without consuming it. */
    private String parseElement(char listClose) {
        int start = pos;
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (c == ',' || c == listClose) {
                return text.substring(start, pos);
            }
            if (c == '(' || c == '[' || c == '{') {
                parseGroup();
            } else if (c == ')' || c == ']' || c == '}') {
                throw new MalformedPartitionException(Reason.UNBALANCED_DELIMITERS,
                        "Unexpected '" + c + "' at offset " + pos + ", expected '" + listClose + "'");
            } else {
                pos++;
            }
        }
        throw unbalanced(listClose);
    }

    private void parseGroup() {
        char open = text.charAt(pos++);
        char close = closerOf(open);
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (c == close) {
                pos++;
                return;
            }
            if (c == '(' || c == '[' || c == '{') {
                parseGroup();
            } else if (c == ')' || c == ']' || c == '}') {
                throw new MalformedPartitionException(Reason.UNBALANCED_DELIMITERS,
                        "Unexpected '" + c + "' at offset " + pos + ", expected '" + close + "'");
            } else {
                pos++;
            }
        }
        throw unbalanced(close);
    }

    private MalformedPartitionException unbalanced(char expected) {
        return new MalformedPartitionException(Reason.UNBALANCED_DELIMITERS,
                "Expected '" + expected + "' before end of proposal: " + abbreviate(text));
    }

    private char peek() {
        return pos < text.length() ? text.charAt(pos) : '\0';
    }

    private void skipWhitespace() {
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
            pos++;
        }
    }

    private static char closerOf(char open) {
        switch (open) {
            case '(':
                return ')';
            case '[':
                return ']';
            default:
                return '}';
        }
    }

    private static boolean isListLiteral(String element) {
        return element.charAt(0) == '[' && element.charAt(element.length() - 1) == ']';
    }

    private static String unquote(String element) {
        if (element.length() >= 2 && element.startsWith("\"") && element.endsWith("\"")) {
            return element.substring(1, element.length() - 1).trim();
        }
        return element;
    }

    static String stripCodeFences(String text) {
        if (!text.startsWith("```")) {
            return text;
        }
        String body = text.substring(3);
        int newline = body.indexOf('\n');
        body = newline >= 0 ? body.substring(newline + 1) : "";
        if (body.endsWith("```")) {
            body = body.substring(0, body.length() - 3);
        }
        return body.trim();
    }

    private static String abbreviate(String s) {
        return s.length() <= 80 ? s : s.substring(0, 77) + "...";
    }
}
