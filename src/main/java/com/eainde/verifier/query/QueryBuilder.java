package com.eainde.verifier.query;

import com.eainde.verifier.claim.Claim;
import com.eainde.verifier.claim.InequalityClaim;
import com.eainde.verifier.claim.SeriesBoundClaim;
import com.eainde.verifier.partition.DomainPartition;
import com.eainde.verifier.partition.Partition;
import com.eainde.verifier.partition.SeriesPartition;
import com.eainde.verifier.partition.Subdomain;
import com.eainde.verifier.partition.Subrange;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the per-piece oracle requests for a validated partition.
 *
 * <p>Series subranges get the assumption {@code base ∧ index > b_i ∧ index < b_{i+1}};
 * inequality subdomains get their own conjuncts. Every emitted request is checked
 * for balanced delimiters and ASCII-only operators; an ill-formed request is
 * rejected with {@link IllegalArgumentException}.</p>
 */
@Slf4j
@Component
public class QueryBuilder {

    public QueryPlan build(Claim claim, Partition partition) {
        if (claim.kind() != partition.kind()) {
            throw new IllegalArgumentException(
                    "Partition of kind " + partition.kind() + " does not fit " + claim.kind() + " claim " + claim.name());
        }
        if (claim instanceof SeriesBoundClaim series) {
            return buildSeries(series, (SeriesPartition) partition);
        }
        return buildInequality((InequalityClaim) claim, (DomainPartition) partition);
    }

    SeriesQueryPlan buildSeries(SeriesBoundClaim claim, SeriesPartition partition) {
        String index = claim.summationIndex();
        List<String> base = claim.baseDomain();
        List<SubrangeQuery> subranges = new ArrayList<>();
        for (Subrange subrange : partition.subranges()) {
            List<String> assumptions = new ArrayList<>(base);
            assumptions.add(index + " > " + subrange.lower());
            assumptions.add(index + " < " + subrange.upper());
            subranges.add(new SubrangeQuery(subrange.index(), subrange.lower(), subrange.upper(), assumptions));
        }
        SeriesQueryPlan plan = new SeriesQueryPlan(claim.formula(), index, claim.otherVariables(),
                base, claim.conjecturedUpperBound(), subranges);
        WolframSyntax.requireWellFormed(plan.program(0));
        log.debug("Built {} subrange queries for {}", subranges.size(), claim.name());
        return plan;
    }

    InequalityQueryPlan buildInequality(InequalityClaim claim, DomainPartition partition) {
        List<List<String>> pieces = new ArrayList<>();
        for (Subdomain subdomain : partition.pieces()) {
            pieces.add(subdomain.conjuncts());
        }
        InequalityQueryPlan plan = new InequalityQueryPlan(claim.variables(), claim.lhs(), claim.rhs(), pieces);
        for (int i = 1; i <= plan.pieceCount(); i++) {
            WolframSyntax.requireWellFormed(WolframPrograms.forAll(plan.query(i, 0), false));
        }
        log.debug("Built {} subdomain queries for {}", pieces.size(), claim.name());
        return plan;
    }
}
