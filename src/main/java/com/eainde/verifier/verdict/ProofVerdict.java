package com.eainde.verifier.verdict;

import java.io.Serializable;

/**
 * Final answer for a claim.
 */
public sealed interface ProofVerdict extends Serializable {

    String ADVISORY = "try a different decomposition or a wider constant range";

    /** Short form used in transcripts, e.g. {@code PROVED(c=0)}. */
    String summary();

    /** Every piece holds with the constant {@code 10^witnessExponent}. */
    record Proved(int witnessExponent) implements ProofVerdict {
        @Override
        public String summary() {
            return "PROVED(c=" + witnessExponent + ")";
        }
    }

    /** The oracle certified the comparison false on {@code pieceIndex} with constant {@code 10^exponent}. */
    record Disproved(int pieceIndex, int exponent) implements ProofVerdict {
        @Override
        public String summary() {
            return "DISPROVED(piece=" + pieceIndex + ", c=" + exponent + ")";
        }
    }

    /** Neither proved nor disproved within the retry budget. */
    record Unknown(String advisory) implements ProofVerdict {
        @Override
        public String summary() {
            return "UNKNOWN(" + advisory + ")";
        }
    }
}
