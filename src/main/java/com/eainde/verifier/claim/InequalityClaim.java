package com.eainde.verifier.claim;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Conjecture that {@code lhs <= C * rhs} for some constant {@code C > 0} and every
 * assignment of {@code variables} satisfying the domain.
 *
 * <p>When no variables are given they are inferred: constrained symbols of the
 * domain come first, then any remaining identifiers of the domain, lhs and rhs.</p>
 *
 * @param name              claim name
 * @param variables         universally quantified variables
 * @param domainDescription conjunction of constraints, {@code True} when unconstrained
 * @param lhs               dominated expression
 * @param rhs               dominating expression
 */
public record InequalityClaim(
        String name,
        List<String> variables,
        String domainDescription,
        String lhs,
        String rhs) implements Claim {

    private static final Pattern CONSTRAINED = Pattern.compile("([A-Za-z][A-Za-z0-9]*)\\s*(?:>=|>|<=|<|==)");

    public InequalityClaim {
        name = name == null || name.isBlank() ? "inequality" : name.trim();
        lhs = SeriesBoundClaim.requireExpression(lhs, "lhs");
        rhs = SeriesBoundClaim.requireExpression(rhs, "rhs");
        List<String> conjuncts = Conjuncts.split(domainDescription == null ? "" : domainDescription);
        domainDescription = Conjuncts.join(conjuncts);
        variables = variables == null || variables.isEmpty()
                ? inferVariables(conjuncts, lhs, rhs)
                : List.copyOf(variables);

        Set<String> allowed = Set.copyOf(variables);
        SeriesBoundClaim.requireWithin(lhs, allowed, "lhs");
        SeriesBoundClaim.requireWithin(rhs, allowed, "rhs");
        SeriesBoundClaim.requireWithin(domainDescription, allowed, "domain");
    }

    public static InequalityClaim of(String name, String variables, String domain, String lhs, String rhs) {
        return new InequalityClaim(name, Expressions.variableList(variables), domain, lhs, rhs);
    }

    @Override
    public ClaimKind kind() {
        return ClaimKind.INEQUALITY;
    }

    @Override
    public List<String> quantifiedVariables() {
        return variables;
    }

    @Override
    public List<String> baseDomain() {
        return Conjuncts.split(domainDescription);
    }

    static List<String> inferVariables(List<String> domain, String lhs, String rhs) {
        Set<String> found = new LinkedHashSet<>();
        for (String conjunct : domain) {
            Matcher m = CONSTRAINED.matcher(conjunct);
            while (m.find()) {
                if (Expressions.isIdentifier(m.group(1))) {
                    found.add(m.group(1));
                }
            }
        }
        for (String conjunct : domain) {
            found.addAll(Expressions.identifiers(conjunct));
        }
        found.addAll(Expressions.identifiers(lhs));
        found.addAll(Expressions.identifiers(rhs));
        return List.copyOf(new ArrayList<>(found));
    }
}
