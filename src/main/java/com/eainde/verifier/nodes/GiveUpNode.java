package com.eainde.verifier.nodes;

import com.eainde.verifier.state.VerificationStage;
import com.eainde.verifier.state.VerificationState;
import com.eainde.verifier.verdict.ProofVerdict;
import lombok.extern.slf4j.Slf4j;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Fallback once the retry budget is spent.
 */
@Slf4j
@Component
public class GiveUpNode implements AsyncNodeAction<VerificationState> {

    @Override
    public CompletableFuture<Map<String, Object>> apply(VerificationState state) {
        ProofVerdict verdict = new ProofVerdict.Unknown(ProofVerdict.ADVISORY);
        String line = state.linePrefix() + "verdict: " + verdict.summary();
        log.info("{} (last failure: {})", line, state.getFailure());
        return CompletableFuture.completedFuture(Map.of(
                VerificationState.STAGE, VerificationStage.AGGREGATED,
                VerificationState.VERDICT, verdict,
                VerificationState.TRANSCRIPT, state.transcriptWith(line)));
    }
}
