package com.eainde.verifier.query;

import com.eainde.verifier.claim.Conjuncts;

import java.util.List;

/**
 * Renders verification requests in the resolution oracle's language.
 */
public final class WolframPrograms {

    /**
     * Helpers shared by every series batch. The dominant term of a sum is the
     * summand that dominates all others everywhere under the assumptions; when no
     * single summand does, a piecewise expression over the dominance regions is used.
     */
    private static final String SERIES_PRELUDE = """
            logMessages = {};
            log[s_String] := AppendTo[logMessages, s];
            logForm[label_String, expr_] := log[label <> ": " <> ToString[expr, InputForm]];
            termsOfSum[expr_] := Module[{e = Expand[expr]}, If[Head[e] === Plus, List @@ e, {e}]];
            leadingSummand[sum_, assum_] := Module[{terms, vars, dominatesQ, winners},
              terms = DeleteCases[termsOfSum[sum], 0];
              If[terms === {}, Return[0]];
              If[Length[terms] == 1, Return[First[terms]]];
              vars = Variables[{sum, assum}];
              dominatesQ[t_] := Resolve[ForAll[vars,
                  Implies[assum, And @@ Thread[t >= DeleteCases[terms, t, 1, 1]]]], Reals];
              winners = Select[terms, TrueQ[dominatesQ[#]] &];
              If[winners =!= {}, First[winners], Simplify[dominancePiecewise[terms, assum, vars], assum]]];
            dominancePiecewise[terms_, assum_, vars_] := Piecewise[Transpose[{terms,
              Table[Reduce[assum && And @@ Thread[ti >= DeleteCases[terms, ti, 1, 1]], vars, Reals], {ti, terms}]}]];
            factorsOf[expr_] := Module[{factors},
              factors = If[Head[expr] === Times, List @@ expr, {expr}];
              factors = Flatten[factors /. Power[base_, n_Integer?Positive] :> ConstantArray[base, n]];
              Select[factors, Not@*NumericQ]];
            reducedForm[expr_, assum_, idx_] := Module[{numr, denr, simpn, simpd},
              numr = factorsOf[Numerator[Simplify[expr, Assumptions -> assum]]];
              denr = factorsOf[Denominator[Simplify[expr, Assumptions -> assum]]];
              simpn = Times @@ (leadingSummand[#, assum] & /@ numr);
              simpd = Times @@ (leadingSummand[#, assum] & /@ denr);
              logForm["  Numerator factors", numr];
              logForm["  Denominator factors", denr];
              logForm["  Leading term in numerator in subdomain_" <> ToString[idx], simpn];
              logForm["  Leading term in denominator in subdomain_" <> ToString[idx], simpd];
              Simplify[simpn/simpd, Assumptions -> assum]];
            """;

    private WolframPrograms() {
    }

    /** {@code 10^c} with negative exponents parenthesized. */
    public static String constant(int exponent) {
        return exponent < 0 ? "10^(" + exponent + ")" : "10^" + exponent;
    }

    /** {@code lhs <= 10^c*(rhs)}. */
    public static String scaledComparison(String lhs, String rhs, int exponent) {
        return lhs + " <= " + constant(exponent) + "*(" + rhs + ")";
    }

    public static String list(List<String> items) {
        return "{" + String.join(", ", items) + "}";
    }

    /**
     * {@code Resolve[ForAll[vars, Implies[S, comparison]], Reals]}. In permutation
     * mode every ordering of the quantified variables is tried: True if any
     * ordering resolves to True, False if none does but one resolves to False.
     */
    public static String forAll(ResolutionQuery query, boolean permuteVariables) {
        String predicate = query.domainPredicate();
        String implication = "Implies[" + predicate + ", " + query.comparison() + "]";
        if (query.variables().isEmpty()) {
            return "Resolve[" + implication + ", Reals]";
        }
        String vars = list(query.variables());
        if (!permuteVariables || query.variables().size() == 1) {
            return "Resolve[ForAll[" + vars + ", " + implication + "], Reals]";
        }
        return "Module[{rs = Resolve[ForAll[#, " + implication + "], Reals] & /@ Permutations[" + vars + "]}, "
                + "Which[MemberQ[rs, True], True, MemberQ[rs, False], False, True, First[rs]]]";
    }

    public static String reduction(String formula, SubrangeQuery subrange) {
        return "reducedForm[" + formula + ", " + subrange.assumptionPredicate() + ", " + subrange.pieceIndex() + "]";
    }

    public static String estimate(String formula, String index, SubrangeQuery subrange) {
        return "Integrate[" + reduction(formula, subrange) + ", {" + index + ", " + subrange.lower() + ", "
                + subrange.upper() + "}, Assumptions -> " + subrange.assumptionPredicate() + "]";
    }

    /**
     * One round trip for the whole series: logs the setup, reduces and estimates
     * every subrange, compares each estimate with {@code 10^c * bound} and returns
     * {@code <|"Logs" -> {...}, "Result" -> True | {"True"|"False"|"Unknown", ...}|>}.
     */
    public static String seriesBatch(SeriesQueryPlan plan, int exponent) {
        StringBuilder sb = new StringBuilder(SERIES_PRELUDE);
        sb.append("log[\"== Verification run ==\"];\n");
        sb.append("logForm[\"Formula\", ").append(plan.formula()).append("];\n");
        sb.append("logForm[\"Base assumptions\", ").append(Conjuncts.join(plan.conditions())).append("];\n");
        sb.append("estimates = {};\n");
        for (SubrangeQuery subrange : plan.subranges()) {
            sb.append("logForm[\"Subdomain ").append(subrange.pieceIndex()).append("\", ")
                    .append(subrange.assumptionPredicate()).append("];\n");
            sb.append("AppendTo[estimates, ").append(plan.estimateRequest(subrange)).append("];\n");
        }
        sb.append("log[\"Trying constant C = ").append(constant(exponent)).append("\"];\n");
        String comparison = "# <= " + constant(exponent) + "*(" + plan.bound() + ")";
        String implication = "Implies[" + Conjuncts.join(plan.conditions()) + ", " + comparison + "]";
        String quantified = plan.otherVariables().isEmpty()
                ? implication
                : "ForAll[" + list(plan.otherVariables()) + ", " + implication + "]";
        sb.append("verdicts = Resolve[").append(quantified).append(", Reals] & /@ estimates;\n");
        sb.append("logForm[\"Resolve results\", verdicts];\n");
        sb.append("<|\"Logs\" -> logMessages, \"Result\" -> If[AllTrue[verdicts, TrueQ], True, ")
                .append("Which[TrueQ[#], \"True\", # === False, \"False\", True, \"Unknown\"] & /@ verdicts]|>");
        return sb.toString();
    }
}
