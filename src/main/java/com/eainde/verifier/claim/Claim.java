package com.eainde.verifier.claim;

import java.io.Serializable;
import java.util.List;

/**
 * An asymptotic-bound conjecture submitted for verification.
 *
 * <p>Claims are immutable value objects. They travel through the verification
 * workflow state, which is why they are {@link Serializable}.</p>
 */
public sealed interface Claim extends Serializable permits SeriesBoundClaim, InequalityClaim {

    /** Catalog or caller supplied name, used to tag log lines. */
    String name();

    ClaimKind kind();

    /** Variables universally quantified by the resolution queries of this claim. */
    List<String> quantifiedVariables();

    /** Domain predicate conjuncts that hold on every piece of any partition. */
    List<String> baseDomain();
}
