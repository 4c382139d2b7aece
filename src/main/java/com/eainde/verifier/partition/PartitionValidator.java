package com.eainde.verifier.partition;

import com.eainde.verifier.claim.Claim;
import com.eainde.verifier.claim.Conjuncts;
import com.eainde.verifier.claim.Expressions;
import com.eainde.verifier.claim.InequalityClaim;
import com.eainde.verifier.claim.SeriesBoundClaim;
import com.eainde.verifier.partition.MalformedPartitionException.Reason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns a raw decomposition proposal into a well-formed {@link Partition}.
 *
 * <ul>
 *   <li>Series: breakpoints are anchored at the summation bounds, which are
 *       inserted when the proposal leaves them out. An empty list yields the
 *       single subrange {@code [lower, upper]}. Monotonicity of symbolic
 *       breakpoints is not checked.</li>
 *   <li>Inequality: an echoed copy of the base domain is stripped from each
 *       subdomain, the remaining conjuncts are deduplicated in first-seen order
 *       and the base domain is prepended. Coverage of the base domain by the
 *       union of the subdomains is not checked.</li>
 * </ul>
 *
 * Validation is idempotent: validating {@link Partition#toProposalText()} again
 * yields an equal partition.
 */
@Component
public class PartitionValidator {

    private static final Logger log = LoggerFactory.getLogger(PartitionValidator.class);

    public Partition validate(Claim claim, String proposal) {
        return validate(claim, ProposalTokenizer.tokenize(proposal));
    }

    public Partition validate(Claim claim, List<String> elements) {
        Partition partition;
        if (claim instanceof SeriesBoundClaim series) {
            partition = validateSeries(series, elements);
        } else {
            partition = validateDomain((InequalityClaim) claim, elements);
        }
        log.debug("Validated partition for {}: {}", claim.name(), partition.toProposalText());
        return partition;
    }

    SeriesPartition validateSeries(SeriesBoundClaim claim, List<String> elements) {
        String lower = claim.summationBounds().lower();
        String upper = claim.summationBounds().upper();
        Set<String> parameters = Set.copyOf(claim.otherVariables());

        List<String> breakpoints = new ArrayList<>();
        for (String element : elements) {
            String breakpoint = Expressions.normalizeLimit(element);
            Set<String> symbols = Expressions.identifiers(breakpoint);
            if (symbols.contains(claim.summationIndex())) {
                throw new MalformedPartitionException(Reason.REFERENCES_INDEX,
                        "Breakpoint '" + breakpoint + "' mentions the summation index " + claim.summationIndex());
            }
            requireKnown(symbols, parameters, breakpoint);
            breakpoints.add(breakpoint);
        }

        if (breakpoints.isEmpty() || !sameExpression(breakpoints.get(0), lower)) {
            breakpoints.add(0, lower);
        }
        if (breakpoints.size() == 1 || !sameExpression(breakpoints.get(breakpoints.size() - 1), upper)) {
            breakpoints.add(upper);
        }
        return new SeriesPartition(breakpoints);
    }

    DomainPartition validateDomain(InequalityClaim claim, List<String> elements) {
        if (elements.isEmpty()) {
            throw new MalformedPartitionException(Reason.EMPTY_PARTITION,
                    "Proposal lists no subdomain for " + claim.name());
        }
        List<String> base = claim.baseDomain();
        Set<String> baseKeys = new HashSet<>();
        for (String conjunct : base) {
            baseKeys.add(Conjuncts.key(conjunct));
        }
        Set<String> variables = Set.copyOf(claim.variables());

        List<Subdomain> pieces = new ArrayList<>();
        for (String element : elements) {
            List<String> conjuncts = new ArrayList<>(base);
            for (String conjunct : Conjuncts.split(element)) {
                if (baseKeys.contains(Conjuncts.key(conjunct))) {
                    continue;
                }
                requireKnown(Expressions.identifiers(conjunct), variables, conjunct);
                conjuncts.add(conjunct);
            }
            pieces.add(new Subdomain(pieces.size() + 1, Conjuncts.dedupe(conjuncts)));
        }
        return new DomainPartition(base, pieces);
    }

    private static void requireKnown(Set<String> symbols, Set<String> known, String piece) {
        for (String symbol : symbols) {
            if (!known.contains(symbol)) {
                throw new MalformedPartitionException(Reason.UNKNOWN_SYMBOL,
                        "'" + piece + "' mentions undeclared symbol " + symbol);
            }
        }
    }

    private static boolean sameExpression(String a, String b) {
        return Conjuncts.key(a).equals(Conjuncts.key(b));
    }
}
