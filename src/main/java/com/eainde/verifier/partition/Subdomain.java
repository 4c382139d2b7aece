package com.eainde.verifier.partition;

import com.eainde.verifier.claim.Conjuncts;

import java.io.Serializable;
import java.util.List;

/**
 * One piece of an inequality domain.
 *
 * @param index      1-based position within the partition
 * @param conjuncts  base domain conjuncts followed by the piece's own restrictions
 */
public record Subdomain(int index, List<String> conjuncts) implements Serializable {

    public Subdomain {
        conjuncts = List.copyOf(conjuncts);
    }

    public String predicate() {
        return Conjuncts.join(conjuncts);
    }
}
