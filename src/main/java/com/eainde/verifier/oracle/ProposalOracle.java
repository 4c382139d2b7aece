package com.eainde.verifier.oracle;

import com.eainde.verifier.claim.Claim;

/**
 * Suggests a decomposition for a claim.
 *
 * <p>The answer is expected to be a single bracketed list of breakpoints (series)
 * or subdomain predicates (inequality) but may be malformed or wrapped in prose;
 * the partition validator decides.</p>
 */
public interface ProposalOracle {

    String proposePartition(Claim claim) throws OracleTransportException;
}
