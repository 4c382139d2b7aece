package com.eainde.verifier.query;

import com.eainde.verifier.claim.ClaimKind;
import com.eainde.verifier.claim.Conjuncts;

import java.util.ArrayList;
import java.util.List;

/**
 * Direct comparison queries {@code lhs <= 10^c * rhs}, one per subdomain.
 *
 * @param variables   quantified variables
 * @param lhs         normalized left-hand side
 * @param rhs         normalized right-hand side
 * @param pieces      conjuncts of each subdomain, base domain first
 */
public record InequalityQueryPlan(List<String> variables, String lhs, String rhs, List<List<String>> pieces)
        implements QueryPlan {

    public InequalityQueryPlan {
        variables = List.copyOf(variables);
        List<List<String>> copies = new ArrayList<>();
        for (List<String> piece : pieces) {
            copies.add(List.copyOf(piece));
        }
        pieces = List.copyOf(copies);
    }

    @Override
    public ClaimKind kind() {
        return ClaimKind.INEQUALITY;
    }

    @Override
    public int pieceCount() {
        return pieces.size();
    }

    @Override
    public String pieceAssumptions(int pieceIndex) {
        return Conjuncts.join(pieces.get(pieceIndex - 1));
    }

    public ResolutionQuery query(int pieceIndex, int exponent) {
        return new ResolutionQuery(variables, pieces.get(pieceIndex - 1),
                WolframPrograms.scaledComparison(lhs, rhs, exponent));
    }
}
