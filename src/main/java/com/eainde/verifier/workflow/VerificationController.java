package com.eainde.verifier.workflow;

import com.eainde.verifier.claim.Claim;
import com.eainde.verifier.state.VerificationState;
import com.eainde.verifier.verdict.ProofVerdict;
import com.eainde.verifier.verdict.VerificationReport;
import lombok.extern.slf4j.Slf4j;
import org.bsc.langgraph4j.CompiledGraph;

/**
 * Runs claims through one compiled verification graph, synchronously.
 */
@Slf4j
public class VerificationController {

    private final CompiledGraph<VerificationState> graph;

    public VerificationController(CompiledGraph<VerificationState> graph) {
        this.graph = graph;
    }

    public VerificationReport verify(Claim claim) {
        log.info("Verifying {} claim {}", claim.kind(), claim.name());
        VerificationState finalState = graph.invoke(VerificationState.initial(claim))
                .orElseThrow(() -> new IllegalStateException("Verification graph returned no state for " + claim.name()));

        ProofVerdict verdict = finalState.getVerdict()
                .orElseThrow(() -> new IllegalStateException("Verification of " + claim.name() + " ended without a verdict"));
        VerificationReport report = new VerificationReport(
                claim.name(), verdict, finalState.getAttempt(), finalState.getTranscript());
        log.info("Claim {} -> {} after {} attempt(s)", claim.name(), verdict.summary(), report.attempts());
        return report;
    }
}
