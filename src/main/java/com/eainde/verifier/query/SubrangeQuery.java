package com.eainde.verifier.query;

import com.eainde.verifier.claim.Conjuncts;

import java.io.Serializable;
import java.util.List;

/**
 * Reduction and estimate requests for one subrange {@code (lower, upper)} of the index.
 *
 * @param pieceIndex  1-based subrange number
 * @param lower       left breakpoint
 * @param upper       right breakpoint
 * @param assumptions {@code base ∧ index > lower ∧ index < upper}
 */
public record SubrangeQuery(int pieceIndex, String lower, String upper, List<String> assumptions)
        implements Serializable {

    public SubrangeQuery {
        assumptions = List.copyOf(assumptions);
    }

    public String assumptionPredicate() {
        return Conjuncts.join(assumptions);
    }
}
