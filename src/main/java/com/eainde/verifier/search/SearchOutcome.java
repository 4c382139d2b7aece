package com.eainde.verifier.search;

import java.io.Serializable;
import java.util.List;

/**
 * Result of one constant search over a query plan.
 *
 * @param status     overall result
 * @param exponent   witness exponent for {@code PROVED}, refuting exponent for {@code DISPROVED}
 * @param pieceIndex refuted piece for {@code DISPROVED}, otherwise 0
 * @param attempts   every oracle answer in the order received
 * @param oracleLog  log lines reported by the oracle program
 * @param detail     failure description for {@code TRANSPORT_FAILURE}, otherwise empty
 */
public record SearchOutcome(
        Status status,
        int exponent,
        int pieceIndex,
        List<VerificationAttempt> attempts,
        List<String> oracleLog,
        String detail) implements Serializable {

    public enum Status {
        PROVED,
        DISPROVED,
        UNKNOWN,
        TRANSPORT_FAILURE
    }

    public SearchOutcome {
        attempts = List.copyOf(attempts);
        oracleLog = List.copyOf(oracleLog);
        detail = detail == null ? "" : detail;
    }

    static SearchOutcome proved(int exponent, List<VerificationAttempt> attempts, List<String> oracleLog) {
        return new SearchOutcome(Status.PROVED, exponent, 0, attempts, oracleLog, "");
    }

    static SearchOutcome disproved(int exponent, int pieceIndex, List<VerificationAttempt> attempts,
                                   List<String> oracleLog) {
        return new SearchOutcome(Status.DISPROVED, exponent, pieceIndex, attempts, oracleLog, "");
    }

    static SearchOutcome unknown(List<VerificationAttempt> attempts, List<String> oracleLog) {
        return new SearchOutcome(Status.UNKNOWN, 0, 0, attempts, oracleLog, "");
    }

    static SearchOutcome transportFailure(String detail, List<VerificationAttempt> attempts,
                                          List<String> oracleLog) {
        return new SearchOutcome(Status.TRANSPORT_FAILURE, 0, 0, attempts, oracleLog, detail);
    }
}
