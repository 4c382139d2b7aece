package com.eainde.verifier.partition;

import java.io.Serializable;

/**
 * One open interval {@code (lower, upper)} of the summation index.
 *
 * @param index 1-based position within the partition
 * @param lower left breakpoint
 * @param upper right breakpoint
 */
public record Subrange(int index, String lower, String upper) implements Serializable {
}
