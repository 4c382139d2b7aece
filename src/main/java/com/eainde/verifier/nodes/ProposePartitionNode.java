package com.eainde.verifier.nodes;

import com.eainde.verifier.oracle.OracleTransportException;
import com.eainde.verifier.oracle.ProposalOracle;
import com.eainde.verifier.state.VerificationStage;
import com.eainde.verifier.state.VerificationState;
import lombok.extern.slf4j.Slf4j;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Opens a new proposal cycle and asks the proposal oracle for a decomposition.
 */
@Slf4j
@Component
public class ProposePartitionNode implements AsyncNodeAction<VerificationState> {

    private final ProposalOracle proposalOracle;

    public ProposePartitionNode(ProposalOracle proposalOracle) {
        this.proposalOracle = proposalOracle;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(VerificationState state) {
        int attempt = state.getAttempt() + 1;
        String prefix = "[attempt " + attempt + "] ";

        Map<String, Object> update = new HashMap<>();
        update.put(VerificationState.ATTEMPT, attempt);
        try {
            String proposal = Objects.requireNonNullElse(proposalOracle.proposePartition(state.getClaim()), "");
            String line = prefix + "proposal: " + singleLine(proposal);
            log.info(line);
            update.put(VerificationState.STAGE, VerificationStage.PROPOSAL_REQUESTED);
            update.put(VerificationState.PROPOSAL, proposal);
            update.put(VerificationState.TRANSCRIPT, state.transcriptWith(line));
        } catch (OracleTransportException | RuntimeException e) {
            String line = prefix + "proposal failed: " + e.getMessage();
            log.warn(line, e);
            update.putAll(VerificationState.failed(e.getMessage(), state.transcriptWith(List.of(line))));
        }
        return CompletableFuture.completedFuture(update);
    }

    static String singleLine(String text) {
        return text == null ? "" : text.strip().replaceAll("\\s*\\R\\s*", " ");
    }
}
