package com.eainde.verifier.state;

import com.eainde.verifier.claim.Claim;
import com.eainde.verifier.partition.Partition;
import com.eainde.verifier.query.QueryPlan;
import com.eainde.verifier.search.SearchOutcome;
import com.eainde.verifier.verdict.ProofVerdict;
import org.bsc.langgraph4j.state.AgentState;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Graph state of one verification run. Every value stored here is serializable.
 */
public class VerificationState extends AgentState {

    public static final String CLAIM = "claim";
    public static final String ATTEMPT = "attempt";
    public static final String STAGE = "stage";
    public static final String PROPOSAL = "proposal";
    public static final String PARTITION = "partition";
    public static final String PLAN = "plan";
    public static final String OUTCOME = "outcome";
    public static final String VERDICT = "verdict";
    public static final String FAILURE = "failure";
    public static final String TRANSCRIPT = "transcript";

    public VerificationState(Map<String, Object> initData) {
        super(initData);
    }

    public static Map<String, Object> initial(Claim claim) {
        Map<String, Object> data = new HashMap<>();
        data.put(CLAIM, claim);
        data.put(ATTEMPT, 0);
        data.put(TRANSCRIPT, new ArrayList<String>());
        return data;
    }

    public Claim getClaim() {
        return (Claim) data().get(CLAIM);
    }

    /** 1-based proposal cycle, 0 before the first proposal. */
    public int getAttempt() {
        return data().containsKey(ATTEMPT) ? (int) data().get(ATTEMPT) : 0;
    }

    public Optional<VerificationStage> getStage() {
        return value(STAGE);
    }

    public String getProposal() {
        return (String) data().get(PROPOSAL);
    }

    public Partition getPartition() {
        return (Partition) data().get(PARTITION);
    }

    public QueryPlan getPlan() {
        return (QueryPlan) data().get(PLAN);
    }

    public SearchOutcome getOutcome() {
        return (SearchOutcome) data().get(OUTCOME);
    }

    public Optional<ProofVerdict> getVerdict() {
        return value(VERDICT);
    }

    public String getFailure() {
        return (String) data().get(FAILURE);
    }

    @SuppressWarnings("unchecked")
    public List<String> getTranscript() {
        Object lines = data().get(TRANSCRIPT);
        return lines == null ? List.of() : (List<String>) lines;
    }

    /** The transcript extended with {@code lines}, as a fresh list for the next state update. */
    public ArrayList<String> transcriptWith(List<String> lines) {
        ArrayList<String> extended = new ArrayList<>(getTranscript());
        extended.addAll(lines);
        return extended;
    }

    public ArrayList<String> transcriptWith(String... lines) {
        return transcriptWith(Arrays.asList(lines));
    }

    /** Prefix of transcript lines written during the current cycle. */
    public String linePrefix() {
        return "[attempt " + getAttempt() + "] ";
    }

    public static Map<String, Object> failed(String failure, List<String> transcript) {
        Map<String, Object> update = new HashMap<>();
        update.put(STAGE, VerificationStage.FAILED);
        update.put(FAILURE, failure);
        update.put(TRANSCRIPT, transcript);
        return update;
    }
}
