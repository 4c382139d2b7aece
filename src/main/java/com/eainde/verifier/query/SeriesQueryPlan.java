package com.eainde.verifier.query;

import com.eainde.verifier.claim.ClaimKind;

import java.util.List;

/**
 * Reduction, estimate and comparison requests for every subrange of a series,
 * batched into a single oracle program per constant exponent.
 *
 * @param formula        normalized summand
 * @param index          summation index
 * @param otherVariables free parameters, quantified in the final comparison
 * @param conditions     domain conjuncts over the free parameters
 * @param bound          conjectured upper bound
 * @param subranges      one entry per consecutive breakpoint pair
 */
public record SeriesQueryPlan(
        String formula,
        String index,
        List<String> otherVariables,
        List<String> conditions,
        String bound,
        List<SubrangeQuery> subranges) implements QueryPlan {

    public SeriesQueryPlan {
        otherVariables = List.copyOf(otherVariables);
        conditions = List.copyOf(conditions);
        subranges = List.copyOf(subranges);
    }

    @Override
    public ClaimKind kind() {
        return ClaimKind.SERIES;
    }

    @Override
    public int pieceCount() {
        return subranges.size();
    }

    @Override
    public String pieceAssumptions(int pieceIndex) {
        return subranges.get(pieceIndex - 1).assumptionPredicate();
    }

    /** Dominant-term reduced form of the summand on one subrange. */
    public String reductionRequest(SubrangeQuery subrange) {
        return WolframPrograms.reduction(formula, subrange);
    }

    /** Integral estimate of the reduced form over one subrange. */
    public String estimateRequest(SubrangeQuery subrange) {
        return WolframPrograms.estimate(formula, index, subrange);
    }

    /** The whole batch for exponent {@code c}: reductions, estimates, comparisons and log lines. */
    public String program(int exponent) {
        return WolframPrograms.seriesBatch(this, exponent);
    }
}
