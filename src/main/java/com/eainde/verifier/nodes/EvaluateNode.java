package com.eainde.verifier.nodes;

import com.eainde.verifier.search.ConstantExponentSearch;
import com.eainde.verifier.search.ExponentRange;
import com.eainde.verifier.search.ExponentSchedule;
import com.eainde.verifier.search.SearchOutcome;
import com.eainde.verifier.search.VerificationAttempt;
import com.eainde.verifier.state.VerificationStage;
import com.eainde.verifier.state.VerificationState;
import lombok.extern.slf4j.Slf4j;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Runs the constant search for the current plan with the exponent range scheduled
 * for this cycle.
 */
@Slf4j
@Component
public class EvaluateNode implements AsyncNodeAction<VerificationState> {

    private final ConstantExponentSearch search;
    private final ExponentSchedule schedule;

    public EvaluateNode(ConstantExponentSearch search, ExponentSchedule schedule) {
        this.search = search;
        this.schedule = schedule;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(VerificationState state) {
        String prefix = state.linePrefix();
        ExponentRange range = schedule.rangeFor(state.getClaim().kind(), state.getAttempt());

        List<String> lines = new ArrayList<>();
        lines.add(prefix + "exponents: " + range);
        SearchOutcome outcome = search.search(state.getPlan(), range);
        for (String oracleLine : outcome.oracleLog()) {
            lines.add(prefix + "oracle: " + oracleLine);
        }
        for (VerificationAttempt attempt : outcome.attempts()) {
            lines.add(prefix + attempt.describe());
        }
        lines.forEach(log::info);

        if (outcome.status() == SearchOutcome.Status.TRANSPORT_FAILURE) {
            String line = prefix + "oracle failure: " + outcome.detail();
            log.warn(line);
            lines.add(line);
            return CompletableFuture.completedFuture(
                    VerificationState.failed(outcome.detail(), state.transcriptWith(lines)));
        }
        return CompletableFuture.completedFuture(Map.of(
                VerificationState.STAGE, VerificationStage.ORACLE_EVALUATED,
                VerificationState.OUTCOME, outcome,
                VerificationState.TRANSCRIPT, state.transcriptWith(lines)));
    }
}
