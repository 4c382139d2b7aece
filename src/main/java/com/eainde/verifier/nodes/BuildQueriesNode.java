package com.eainde.verifier.nodes;

import com.eainde.verifier.query.QueryBuilder;
import com.eainde.verifier.query.QueryPlan;
import com.eainde.verifier.state.VerificationStage;
import com.eainde.verifier.state.VerificationState;
import lombok.extern.slf4j.Slf4j;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

@Slf4j
@Component
public class BuildQueriesNode implements AsyncNodeAction<VerificationState> {

    private final QueryBuilder queryBuilder;

    public BuildQueriesNode(QueryBuilder queryBuilder) {
        this.queryBuilder = queryBuilder;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(VerificationState state) {
        try {
            QueryPlan plan = queryBuilder.build(state.getClaim(), state.getPartition());
            List<String> lines = new ArrayList<>();
            for (int piece = 1; piece <= plan.pieceCount(); piece++) {
                lines.add(state.linePrefix() + "piece " + piece + " assumptions: " + plan.pieceAssumptions(piece));
            }
            lines.forEach(log::info);
            return CompletableFuture.completedFuture(Map.of(
                    VerificationState.STAGE, VerificationStage.QUERIES_BUILT,
                    VerificationState.PLAN, plan,
                    VerificationState.TRANSCRIPT, state.transcriptWith(lines)));
        } catch (IllegalArgumentException e) {
            String line = state.linePrefix() + "query rejected: " + e.getMessage();
            log.warn(line);
            return CompletableFuture.completedFuture(
                    VerificationState.failed(e.getMessage(), state.transcriptWith(line)));
        }
    }
}
