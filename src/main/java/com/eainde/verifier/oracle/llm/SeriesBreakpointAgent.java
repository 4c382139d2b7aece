package com.eainde.verifier.oracle.llm;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * Breakpoint agent - splits the summation range of a series into subranges on
 * which the bound is easy to establish.
 */
public interface SeriesBreakpointAgent {

    @SystemMessage("""
        You decompose summation ranges for an automatic asymptotic bound checker.

        GUIDING PRINCIPLES:
        - Be precise; avoid conflicting or circular instructions.
        - Choose natural breakpoint scales where the term behavior changes (dominance switches,
          monotonicity kicks in, easy comparison with p-series, geometric or integral bounds).
        - Minimize the number of breakpoints while keeping the bound straightforward on each subrange.
        - Cover the full index range with nonoverlapping, contiguous subranges.
        - Do not use Floor[] or Ceiling[]. Algebraically simplify everything, for example
          Sqrt[a^2] is written as a. Assume everything is positive.
        - Breakpoints may depend only on parameters that appear in the series description,
          never on the summation index.
        - Use only Mathematica-parsable expressions built from numbers, parameters,
          +, -, *, /, ^, Log[], Exp[], Sqrt[].
        - Output only the breakpoint list; no extra words, symbols or justification.
        """)
    @UserMessage("""
        We are given a series described by:
        - formula: {{formula}}
        - summation index: {{index}}
        - other variables: {{variables}}
        - conditions on the other variables: {{conditions}}
        - summation bounds: [{{lower}}, {{upper}}]
        - conjectured upper asymptotic bound: {{bound}}

        Definition: f << g means there is a constant C > 0 such that f <= C*g everywhere in the domain.

        GOAL: Return a minimal list of breakpoints [{{lower}}, d_1, ..., d_n, {{upper}}] such that proving
        Sum[formula over each consecutive subrange] << conjectured upper bound
        is trivial on every subrange (simple termwise bound, comparison to a standard convergent
        series, or the integral test with monotonicity).

        REQUIREMENTS:
        - Start at {{lower}} and end at {{upper}}.
        - Strictly nondecreasing: {{lower}} <= d_1 <= ... <= d_n < {{upper}}.
        - Each d_i is a closed-form expression in the parameters, in canonical scales
          (powers or roots of parameters, thresholds where dominant terms are equal).

        OUTPUT FORMAT:
        [{{lower}}, d1, d2, ..., {{upper}}]
        """)
    String proposeBreakpoints(@V("formula") String formula,
                              @V("index") String index,
                              @V("variables") String variables,
                              @V("conditions") String conditions,
                              @V("lower") String lower,
                              @V("upper") String upper,
                              @V("bound") String bound);
}
