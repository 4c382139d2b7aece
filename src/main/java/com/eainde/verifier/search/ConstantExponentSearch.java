package com.eainde.verifier.search;

import com.eainde.verifier.oracle.OracleTransportException;
import com.eainde.verifier.oracle.Resolution;
import com.eainde.verifier.oracle.ResolutionOracle;
import com.eainde.verifier.query.InequalityQueryPlan;
import com.eainde.verifier.query.QueryPlan;
import com.eainde.verifier.query.SeriesQueryPlan;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Searches ascending exponents {@code c} for a constant {@code C = 10^c} under which
 * every piece of a plan resolves to True.
 *
 * <p>The first exponent at which all pieces hold proves the claim. Under
 * {@link FalsePolicy#TERMINAL} a certified False disproves it at once; under
 * {@link FalsePolicy#ESCALATE} the search moves to the next exponent and only
 * disproves when every exponent was refuted. An oracle transport failure ends the
 * search with {@link SearchOutcome.Status#TRANSPORT_FAILURE}, never with a
 * negative answer.</p>
 */
@Slf4j
public class ConstantExponentSearch {

    private final ResolutionOracle oracle;
    private final FalsePolicy falsePolicy;

    public ConstantExponentSearch(ResolutionOracle oracle, FalsePolicy falsePolicy) {
        this.oracle = oracle;
        this.falsePolicy = falsePolicy;
    }

    public FalsePolicy getFalsePolicy() {
        return falsePolicy;
    }

    public SearchOutcome search(QueryPlan plan, ExponentRange range) {
        List<VerificationAttempt> attempts = new ArrayList<>();
        List<String> oracleLog = new ArrayList<>();
        int firstRefutedExponent = 0;
        int firstRefutedPiece = 0;
        boolean everyExponentRefuted = true;

        for (int exponent : range.exponents()) {
            List<Resolution> resolutions;
            try {
                resolutions = resolve(plan, exponent, attempts, oracleLog);
            } catch (OracleTransportException e) {
                log.warn("Oracle transport failed at c={}: {}", exponent, e.getMessage());
                return SearchOutcome.transportFailure(e.getMessage(), attempts, oracleLog);
            } catch (RuntimeException e) {
                log.error("Oracle raised an unexpected error at c={}", exponent, e);
                return SearchOutcome.transportFailure(e.getClass().getSimpleName() + ": " + e.getMessage(),
                        attempts, oracleLog);
            }

            int refuted = indexOf(resolutions, Resolution.FALSE);
            if (refuted == 0 && resolutions.size() == plan.pieceCount()
                    && resolutions.stream().allMatch(r -> r == Resolution.TRUE)) {
                log.info("All {} piece(s) hold with C=10^{}", plan.pieceCount(), exponent);
                return SearchOutcome.proved(exponent, attempts, oracleLog);
            }
            if (refuted > 0) {
                if (falsePolicy == FalsePolicy.TERMINAL) {
                    log.info("Piece {} refuted with C=10^{}", refuted, exponent);
                    return SearchOutcome.disproved(exponent, refuted, attempts, oracleLog);
                }
                if (firstRefutedPiece == 0) {
                    firstRefutedExponent = exponent;
                    firstRefutedPiece = refuted;
                }
            } else {
                everyExponentRefuted = false;
            }
        }

        if (falsePolicy == FalsePolicy.ESCALATE && everyExponentRefuted) {
            return SearchOutcome.disproved(firstRefutedExponent, firstRefutedPiece, attempts, oracleLog);
        }
        return SearchOutcome.unknown(attempts, oracleLog);
    }

    /**
     * Resolves the pieces of a plan for one exponent. Inequality pieces are asked one
     * at a time and a TERMINAL False stops early; series pieces come back in one batch.
     */
    private List<Resolution> resolve(QueryPlan plan, int exponent, List<VerificationAttempt> attempts,
                                     List<String> oracleLog) throws OracleTransportException {
        List<Resolution> resolutions = new ArrayList<>();
        if (plan instanceof SeriesQueryPlan series) {
            SeriesBatchResult batch = SeriesBatchResult.parse(oracle.evaluate(series.program(exponent)),
                    series.pieceCount());
            oracleLog.addAll(batch.logs());
            for (int i = 0; i < batch.resolutions().size(); i++) {
                Resolution resolution = batch.resolutions().get(i);
                attempts.add(new VerificationAttempt(i + 1, exponent, resolution));
                resolutions.add(resolution);
            }
            return resolutions;
        }

        InequalityQueryPlan inequality = (InequalityQueryPlan) plan;
        for (int piece = 1; piece <= inequality.pieceCount(); piece++) {
            Resolution resolution = oracle.resolveForAll(inequality.query(piece, exponent));
            attempts.add(new VerificationAttempt(piece, exponent, resolution));
            resolutions.add(resolution);
            log.debug("c={} piece {} -> {}", exponent, piece, resolution);
            if (resolution == Resolution.FALSE) {
                break;
            }
        }
        return resolutions;
    }

    private static int indexOf(List<Resolution> resolutions, Resolution wanted) {
        for (int i = 0; i < resolutions.size(); i++) {
            if (resolutions.get(i) == wanted) {
                return i + 1;
            }
        }
        return 0;
    }
}
