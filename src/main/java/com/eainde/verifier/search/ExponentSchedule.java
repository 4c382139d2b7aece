package com.eainde.verifier.search;

import com.eainde.verifier.claim.ClaimKind;

/**
 * Constant ranges per proposal cycle: the first cycle uses {@code initial}, later
 * cycles widen to the range of the claim's kind.
 */
public record ExponentSchedule(ExponentRange initial, ExponentRange seriesRetry, ExponentRange inequalityRetry) {

    public static ExponentSchedule defaults() {
        return new ExponentSchedule(new ExponentRange(0, 0), new ExponentRange(0, 4), new ExponentRange(-2, 6));
    }

    /** @param attempt 1-based proposal cycle */
    public ExponentRange rangeFor(ClaimKind kind, int attempt) {
        if (attempt <= 1) {
            return initial;
        }
        return kind == ClaimKind.SERIES ? seriesRetry : inequalityRetry;
    }
}
