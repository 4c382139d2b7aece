package com.eainde.verifier.query;

import com.eainde.verifier.claim.ClaimKind;

import java.io.Serializable;

/**
 * Per-piece verification requests for one validated partition, parameterized by
 * the constant exponent {@code c} (constant {@code C = 10^c}).
 */
public sealed interface QueryPlan extends Serializable permits SeriesQueryPlan, InequalityQueryPlan {

    ClaimKind kind();

    int pieceCount();

    /** Domain predicate assumed on the given 1-based piece. */
    String pieceAssumptions(int pieceIndex);
}
