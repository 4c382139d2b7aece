package com.eainde.verifier.workflow;

import org.bsc.langgraph4j.GraphStateException;
import org.springframework.stereotype.Component;

/**
 * Hands out independent controllers, each with its own compiled graph. Nodes are
 * stateless and every run starts from a fresh state, so controllers never share
 * mutable data.
 */
@Component
public class VerificationControllerFactory {

    private final VerificationWorkflowGraph workflowGraph;

    public VerificationControllerFactory(VerificationWorkflowGraph workflowGraph) {
        this.workflowGraph = workflowGraph;
    }

    public VerificationController create() {
        try {
            return new VerificationController(workflowGraph.compile());
        } catch (GraphStateException e) {
            throw new IllegalStateException("Verification graph is invalid", e);
        }
    }
}
