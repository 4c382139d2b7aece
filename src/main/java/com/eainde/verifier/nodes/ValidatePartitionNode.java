package com.eainde.verifier.nodes;

import com.eainde.verifier.partition.MalformedPartitionException;
import com.eainde.verifier.partition.Partition;
import com.eainde.verifier.partition.PartitionValidator;
import com.eainde.verifier.state.VerificationStage;
import com.eainde.verifier.state.VerificationState;
import lombok.extern.slf4j.Slf4j;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

@Slf4j
@Component
public class ValidatePartitionNode implements AsyncNodeAction<VerificationState> {

    private final PartitionValidator validator;

    public ValidatePartitionNode(PartitionValidator validator) {
        this.validator = validator;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(VerificationState state) {
        try {
            Partition partition = validator.validate(state.getClaim(), state.getProposal());
            String line = state.linePrefix() + "partition: " + partition.pieceCount() + " piece(s) "
                    + partition.toProposalText();
            log.info(line);
            return CompletableFuture.completedFuture(Map.of(
                    VerificationState.STAGE, VerificationStage.PARTITION_VALIDATED,
                    VerificationState.PARTITION, partition,
                    VerificationState.TRANSCRIPT, state.transcriptWith(line)));
        } catch (MalformedPartitionException e) {
            String line = state.linePrefix() + "malformed proposal (" + e.getReason() + "): " + e.getMessage();
            log.warn(line);
            return CompletableFuture.completedFuture(
                    VerificationState.failed(e.getMessage(), state.transcriptWith(line)));
        }
    }
}
