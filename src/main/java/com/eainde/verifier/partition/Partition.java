package com.eainde.verifier.partition;

import com.eainde.verifier.claim.ClaimKind;

import java.io.Serializable;

/**
 * A validated decomposition of a claim's domain into pieces that are verified
 * independently.
 */
public sealed interface Partition extends Serializable permits SeriesPartition, DomainPartition {

    ClaimKind kind();

    int pieceCount();

    /**
     * Renders the partition back into proposal form. Validating this text
     * against the same claim yields an equal partition.
     */
    String toProposalText();
}
