package com.eainde.verifier.workflow;

import com.eainde.verifier.edges.RetryRoutingEdge;
import com.eainde.verifier.nodes.AggregateNode;
import com.eainde.verifier.nodes.BuildQueriesNode;
import com.eainde.verifier.nodes.EvaluateNode;
import com.eainde.verifier.nodes.GiveUpNode;
import com.eainde.verifier.nodes.ProposePartitionNode;
import com.eainde.verifier.nodes.ValidatePartitionNode;
import com.eainde.verifier.state.VerificationState;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.GraphStateException;
import org.bsc.langgraph4j.StateGraph;
import org.springframework.stereotype.Component;

import java.util.Map;

import static com.eainde.verifier.edges.RetryRoutingEdge.DONE;
import static com.eainde.verifier.edges.RetryRoutingEdge.EXHAUSTED;
import static com.eainde.verifier.edges.RetryRoutingEdge.NEXT;
import static com.eainde.verifier.edges.RetryRoutingEdge.RETRY;
import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;

/**
 * The verification loop as a graph:
 * <pre>
 * START -> propose -> validate -> build_queries -> evaluate -> aggregate -> END
 *             ^___________ retry (any step failed) ___________|
 *                          exhausted -> give_up -> END
 * </pre>
 */
@Component
public class VerificationWorkflowGraph {

    public static final String PROPOSE = "propose";
    public static final String VALIDATE = "validate";
    public static final String BUILD_QUERIES = "build_queries";
    public static final String EVALUATE = "evaluate";
    public static final String AGGREGATE = "aggregate";
    public static final String GIVE_UP = "give_up";

    private final ProposePartitionNode proposeNode;
    private final ValidatePartitionNode validateNode;
    private final BuildQueriesNode buildQueriesNode;
    private final EvaluateNode evaluateNode;
    private final AggregateNode aggregateNode;
    private final GiveUpNode giveUpNode;
    private final RetryRoutingEdge routingEdge;

    public VerificationWorkflowGraph(
            ProposePartitionNode proposeNode,
            ValidatePartitionNode validateNode,
            BuildQueriesNode buildQueriesNode,
            EvaluateNode evaluateNode,
            AggregateNode aggregateNode,
            GiveUpNode giveUpNode,
            RetryRoutingEdge routingEdge) {
        this.proposeNode = proposeNode;
        this.validateNode = validateNode;
        this.buildQueriesNode = buildQueriesNode;
        this.evaluateNode = evaluateNode;
        this.aggregateNode = aggregateNode;
        this.giveUpNode = giveUpNode;
        this.routingEdge = routingEdge;
    }

    /** Compiles a fresh, independent graph. */
    public CompiledGraph<VerificationState> compile() throws GraphStateException {
        StateGraph<VerificationState> workflow = new StateGraph<>(VerificationState::new);

        workflow.addNode(PROPOSE, proposeNode);
        workflow.addNode(VALIDATE, validateNode);
        workflow.addNode(BUILD_QUERIES, buildQueriesNode);
        workflow.addNode(EVALUATE, evaluateNode);
        workflow.addNode(AGGREGATE, aggregateNode);
        workflow.addNode(GIVE_UP, giveUpNode);

        workflow.addEdge(START, PROPOSE);
        workflow.addConditionalEdges(PROPOSE, routingEdge, step(VALIDATE));
        workflow.addConditionalEdges(VALIDATE, routingEdge, step(BUILD_QUERIES));
        workflow.addConditionalEdges(BUILD_QUERIES, routingEdge, step(EVALUATE));
        workflow.addConditionalEdges(EVALUATE, routingEdge, step(AGGREGATE));
        workflow.addConditionalEdges(AGGREGATE, routingEdge, Map.of(
                DONE, END,
                RETRY, PROPOSE,
                EXHAUSTED, GIVE_UP));
        workflow.addEdge(GIVE_UP, END);

        CompiledGraph<VerificationState> compiled = workflow.compile();
        // every cycle visits at most five steps, plus give_up
        compiled.setMaxIterations(routingEdge.getMaxAttempts() * 6 + 2);
        return compiled;
    }

    private static Map<String, String> step(String next) {
        return Map.of(
                NEXT, next,
                RETRY, PROPOSE,
                EXHAUSTED, GIVE_UP);
    }
}
