package com.eainde.verifier.query;

import com.eainde.verifier.claim.Conjuncts;

import java.io.Serializable;
import java.util.List;

/**
 * "Does {@code comparison} hold for all {@code variables} satisfying {@code assumptions}?"
 *
 * @param variables   universally quantified variables
 * @param assumptions domain conjuncts, empty for {@code True}
 * @param comparison  inequality to decide, e.g. {@code x^2 <= 10^0*(x)}
 */
public record ResolutionQuery(List<String> variables, List<String> assumptions, String comparison)
        implements Serializable {

    public ResolutionQuery {
        variables = List.copyOf(variables);
        assumptions = List.copyOf(assumptions);
    }

    public String domainPredicate() {
        return Conjuncts.join(assumptions);
    }
}
