package com.eainde.verifier.nodes;

import com.eainde.verifier.search.SearchOutcome;
import com.eainde.verifier.state.VerificationStage;
import com.eainde.verifier.state.VerificationState;
import com.eainde.verifier.verdict.ProofVerdict;
import lombok.extern.slf4j.Slf4j;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Turns a search outcome into a verdict. An undecided outcome fails the cycle so the
 * run can ask for another decomposition.
 */
@Slf4j
@Component
public class AggregateNode implements AsyncNodeAction<VerificationState> {

    @Override
    public CompletableFuture<Map<String, Object>> apply(VerificationState state) {
        SearchOutcome outcome = state.getOutcome();
        ProofVerdict verdict;
        switch (outcome.status()) {
            case PROVED:
                verdict = new ProofVerdict.Proved(outcome.exponent());
                break;
            case DISPROVED:
                verdict = new ProofVerdict.Disproved(outcome.pieceIndex(), outcome.exponent());
                break;
            default:
                String line = state.linePrefix() + "undecided: no constant in range holds on every piece";
                log.info(line);
                return CompletableFuture.completedFuture(
                        VerificationState.failed("undecided", state.transcriptWith(line)));
        }

        String line = state.linePrefix() + "verdict: " + verdict.summary();
        log.info(line);
        return CompletableFuture.completedFuture(Map.of(
                VerificationState.STAGE, VerificationStage.AGGREGATED,
                VerificationState.VERDICT, verdict,
                VerificationState.TRANSCRIPT, state.transcriptWith(line)));
    }
}
