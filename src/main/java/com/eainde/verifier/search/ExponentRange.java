package com.eainde.verifier.search;

import java.io.Serializable;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Inclusive ascending range of exponents {@code c}; the constant tried is {@code C = 10^c}.
 */
public record ExponentRange(int from, int to) implements Serializable {

    public ExponentRange {
        if (from > to) {
            throw new IllegalArgumentException("Exponent range must ascend: " + from + ".." + to);
        }
    }

    /** Parses {@code "a..b"} or a single exponent {@code "a"}. */
    public static ExponentRange parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Empty exponent range");
        }
        String trimmed = text.trim();
        int dots = trimmed.indexOf("..");
        try {
            if (dots < 0) {
                int single = Integer.parseInt(trimmed);
                return new ExponentRange(single, single);
            }
            return new ExponentRange(
                    Integer.parseInt(trimmed.substring(0, dots).trim()),
                    Integer.parseInt(trimmed.substring(dots + 2).trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not an exponent range: '" + text + "'", e);
        }
    }

    public List<Integer> exponents() {
        return IntStream.rangeClosed(from, to).boxed().toList();
    }

    @Override
    public String toString() {
        return from + ".." + to;
    }
}
