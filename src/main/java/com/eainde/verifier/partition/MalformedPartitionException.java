package com.eainde.verifier.partition;

/**
 * Raised when a decomposition proposal cannot be turned into a partition.
 * The verification workflow treats it as a failed proposal cycle and asks again.
 */
public class MalformedPartitionException extends RuntimeException {

    public enum Reason {
        /** Blank proposal text. */
        EMPTY_PROPOSAL,
        /** No {@code [...]} or {@code {...}} list literal in the text. */
        NO_LIST_LITERAL,
        /** A bracket, brace or parenthesis is never closed or closed by the wrong character. */
        UNBALANCED_DELIMITERS,
        /** Two separators with nothing between them, e.g. {@code [1, , 2]}. */
        EMPTY_ELEMENT,
        /** A second list literal follows the first one. */
        TRAILING_CONTENT,
        /** The list parsed but holds no usable piece. */
        EMPTY_PARTITION,
        /** A breakpoint mentions the summation index. */
        REFERENCES_INDEX,
        /** A piece mentions a symbol the claim does not declare. */
        UNKNOWN_SYMBOL
    }

    private final Reason reason;

    public MalformedPartitionException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
