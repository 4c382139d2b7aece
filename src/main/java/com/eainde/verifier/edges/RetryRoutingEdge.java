package com.eainde.verifier.edges;

import com.eainde.verifier.state.VerificationStage;
import com.eainde.verifier.state.VerificationState;
import org.bsc.langgraph4j.action.AsyncEdgeAction;

import java.util.concurrent.CompletableFuture;

/**
 * Routes a run after each step: on to the next step, back to a new proposal while
 * the retry budget lasts, or out once a verdict exists.
 */
public class RetryRoutingEdge implements AsyncEdgeAction<VerificationState> {

    public static final String NEXT = "next";
    public static final String RETRY = "retry";
    public static final String EXHAUSTED = "exhausted";
    public static final String DONE = "done";

    private final int maxAttempts;

    public RetryRoutingEdge(int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, was " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    @Override
    public CompletableFuture<String> apply(VerificationState state) {
        String route;
        if (state.getVerdict().isPresent()) {
            route = DONE;
        } else if (state.getStage().orElse(null) != VerificationStage.FAILED) {
            route = NEXT;
        } else if (state.getAttempt() < maxAttempts) {
            route = RETRY;
        } else {
            route = EXHAUSTED;
        }
        return CompletableFuture.completedFuture(route);
    }
}
