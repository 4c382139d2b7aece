package com.eainde.verifier.partition;

import com.eainde.verifier.claim.ClaimKind;
import com.eainde.verifier.claim.Conjuncts;

import java.util.ArrayList;
import java.util.List;

/**
 * Subdomains of an inequality claim. Every piece starts with the base domain
 * conjuncts, so each piece is a concrete predicate the oracle can evaluate.
 *
 * @param baseDomain base domain conjuncts of the claim
 * @param pieces     subdomains in proposal order
 */
public record DomainPartition(List<String> baseDomain, List<Subdomain> pieces) implements Partition {

    public DomainPartition {
        baseDomain = List.copyOf(baseDomain);
        pieces = List.copyOf(pieces);
        if (pieces.isEmpty()) {
            throw new IllegalArgumentException("A domain partition needs at least one subdomain");
        }
    }

    @Override
    public ClaimKind kind() {
        return ClaimKind.INEQUALITY;
    }

    public String basePredicate() {
        return Conjuncts.join(baseDomain);
    }

    @Override
    public int pieceCount() {
        return pieces.size();
    }

    @Override
    public String toProposalText() {
        List<String> predicates = new ArrayList<>();
        for (Subdomain piece : pieces) {
            predicates.add(piece.predicate());
        }
        return "[" + String.join(", ", predicates) + "]";
    }
}
