package com.eainde.verifier.search;

import com.eainde.verifier.oracle.Resolution;

import java.io.Serializable;

/**
 * One oracle answer: piece {@code pieceIndex} under constant {@code 10^exponent}.
 */
public record VerificationAttempt(int pieceIndex, int exponent, Resolution resolution) implements Serializable {

    public String describe() {
        return "c=" + exponent + " piece " + pieceIndex + " -> " + resolution;
    }
}
