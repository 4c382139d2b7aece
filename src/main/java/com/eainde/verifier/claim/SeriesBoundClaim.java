package com.eainde.verifier.claim;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Conjecture that {@code Sum[formula, {index, lower, upper}] << conjecturedUpperBound},
 * i.e. the sum is bounded by a positive constant times the conjectured bound for
 * every choice of the other variables satisfying {@code conditions}.
 *
 * @param name                  claim name
 * @param formula               summand, an expression in the index and the other variables
 * @param summationIndex        the summed variable
 * @param otherVariables        free parameters of the summand
 * @param summationBounds       summation limits
 * @param conditions            domain predicate over the other variables, {@code True} when unconstrained
 * @param conjecturedUpperBound the target expression
 */
public record SeriesBoundClaim(
        String name,
        String formula,
        String summationIndex,
        List<String> otherVariables,
        SummationBounds summationBounds,
        String conditions,
        String conjecturedUpperBound) implements Claim {

    public SeriesBoundClaim {
        Objects.requireNonNull(summationBounds, "summationBounds");
        name = name == null || name.isBlank() ? "series" : name.trim();
        formula = requireExpression(formula, "formula");
        conjecturedUpperBound = requireExpression(conjecturedUpperBound, "conjecturedUpperBound");
        summationIndex = summationIndex == null ? "" : summationIndex.trim();
        if (!Expressions.isIdentifier(summationIndex)) {
            throw new IllegalArgumentException("Summation index must be a plain symbol: '" + summationIndex + "'");
        }
        otherVariables = List.copyOf(otherVariables == null ? List.of() : otherVariables);
        if (otherVariables.contains(summationIndex)) {
            throw new IllegalArgumentException("Summation index " + summationIndex + " is listed as a free variable");
        }
        List<String> conjuncts = Conjuncts.split(conditions == null ? "" : conditions);
        conditions = Conjuncts.join(conjuncts);

        Set<String> allowed = new LinkedHashSet<>(otherVariables);
        allowed.add(summationIndex);
        requireWithin(formula, allowed, "formula");
        requireWithin(conjecturedUpperBound, allowed, "conjectured bound");
        requireWithin(conditions, Set.copyOf(otherVariables), "conditions");
        requireWithin(summationBounds.lower(), Set.copyOf(otherVariables), "lower bound");
        requireWithin(summationBounds.upper(), Set.copyOf(otherVariables), "upper bound");
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    @Override
    public ClaimKind kind() {
        return ClaimKind.SERIES;
    }

    @Override
    public List<String> quantifiedVariables() {
        return otherVariables;
    }

    @Override
    public List<String> baseDomain() {
        return Conjuncts.split(conditions);
    }

    static String requireExpression(String expression, String field) {
        String normalized = Expressions.normalize(expression);
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return normalized;
    }

    static void requireWithin(String expression, Set<String> allowed, String field) {
        for (String identifier : Expressions.identifiers(expression)) {
            if (!allowed.contains(identifier)) {
                throw new IllegalArgumentException(
                        "Variable '" + identifier + "' in " + field + " is not declared; expected one of " + allowed);
            }
        }
    }

    public static class Builder {
        private final String name;
        private String formula;
        private String summationIndex;
        private List<String> otherVariables = List.of();
        private SummationBounds bounds = SummationBounds.of("0", Expressions.INFINITY);
        private String conditions = Conjuncts.TRUE;
        private String bound;

        private Builder(String name) {
            this.name = name;
        }

        public Builder formula(String formula) { this.formula = formula; return this; }
        public Builder index(String summationIndex) { this.summationIndex = summationIndex; return this; }
        public Builder variables(String variables) { this.otherVariables = Expressions.variableList(variables); return this; }
        public Builder variables(List<String> variables) { this.otherVariables = variables; return this; }
        public Builder bounds(String lower, String upper) { this.bounds = SummationBounds.of(lower, upper); return this; }
        public Builder conditions(String conditions) { this.conditions = conditions; return this; }
        public Builder bound(String bound) { this.bound = bound; return this; }

        public SeriesBoundClaim build() {
            return new SeriesBoundClaim(name, formula, summationIndex, otherVariables, bounds, conditions, bound);
        }
    }
}
