package com.eainde.verifier.partition;

import com.eainde.verifier.claim.ClaimKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered breakpoints {@code b_0 = lower, b_1, ..., b_n = upper} of a summation range.
 *
 * @param breakpoints at least two breakpoints, first and last are the summation bounds
 */
public record SeriesPartition(List<String> breakpoints) implements Partition {

    public SeriesPartition {
        breakpoints = List.copyOf(breakpoints);
        if (breakpoints.size() < 2) {
            throw new IllegalArgumentException("A series partition needs at least two breakpoints");
        }
    }

    @Override
    public ClaimKind kind() {
        return ClaimKind.SERIES;
    }

    public String lower() {
        return breakpoints.get(0);
    }

    public String upper() {
        return breakpoints.get(breakpoints.size() - 1);
    }

    @Override
    public int pieceCount() {
        return breakpoints.size() - 1;
    }

    public List<Subrange> subranges() {
        List<Subrange> result = new ArrayList<>();
        for (int i = 0; i + 1 < breakpoints.size(); i++) {
            result.add(new Subrange(i + 1, breakpoints.get(i), breakpoints.get(i + 1)));
        }
        return result;
    }

    @Override
    public String toProposalText() {
        return "[" + String.join(", ", breakpoints) + "]";
    }
}
