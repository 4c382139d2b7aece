package com.eainde.verifier.state;

/**
 * Last step a verification run completed.
 */
public enum VerificationStage {
    PROPOSAL_REQUESTED,
    PARTITION_VALIDATED,
    QUERIES_BUILT,
    ORACLE_EVALUATED,
    AGGREGATED,
    /** The current proposal cycle failed; the run retries or gives up. */
    FAILED
}
