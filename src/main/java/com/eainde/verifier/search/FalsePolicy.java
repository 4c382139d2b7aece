package com.eainde.verifier.search;

/**
 * How a certified {@code False} on one piece affects the constant search.
 */
public enum FalsePolicy {
    /** The first certified False disproves the claim; larger constants are not tried. */
    TERMINAL,
    /**
     * A False only rules out the current constant. The claim is disproved when every
     * constant in the range was refuted on some piece.
     */
    ESCALATE
}
