package com.eainde.verifier.claim;

import java.io.Serializable;
import java.math.BigDecimal;
import java.util.Objects;

/**
 * Lower and upper limit of a summation. Either side may be a signed infinity
 * or any closed-form expression over the claim parameters.
 *
 * @param lower lower summation limit, e.g. {@code 0} or {@code -Infinity}
 * @param upper upper summation limit, e.g. {@code Infinity}
 */
public record SummationBounds(String lower, String upper) implements Serializable {

    public SummationBounds {
        lower = Expressions.normalizeLimit(Objects.requireNonNull(lower, "lower"));
        upper = Expressions.normalizeLimit(Objects.requireNonNull(upper, "upper"));
        if (lower.isEmpty() || upper.isEmpty()) {
            throw new IllegalArgumentException("Summation bounds must not be blank");
        }
        Double lo = numericValue(lower);
        Double hi = numericValue(upper);
        if (lo != null && hi != null && lo > hi) {
            throw new IllegalArgumentException(
                    "Lower summation bound " + lower + " exceeds upper bound " + upper);
        }
    }

    public static SummationBounds of(String lower, String upper) {
        return new SummationBounds(lower, upper);
    }

    /**
     * Numeric value of a limit when it is a plain number or a signed infinity;
     * {@code null} for symbolic limits, which are compared by the oracle only.
     */
    static Double numericValue(String limit) {
        if (Expressions.INFINITY.equals(limit)) {
            return Double.POSITIVE_INFINITY;
        }
        if (Expressions.NEGATIVE_INFINITY.equals(limit)) {
            return Double.NEGATIVE_INFINITY;
        }
        try {
            return new BigDecimal(limit).doubleValue();
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
