package com.eainde.verifier.claim;

/**
 * The two claim shapes the verifier understands.
 */
public enum ClaimKind {
    SERIES,
    INEQUALITY
}
