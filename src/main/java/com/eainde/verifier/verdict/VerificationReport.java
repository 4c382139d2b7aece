package com.eainde.verifier.verdict;

import java.util.List;

/**
 * Verdict of one verification run together with its transcript.
 *
 * @param claimName  name of the verified claim
 * @param verdict    final verdict
 * @param attempts   proposal cycles used
 * @param transcript ordered transcript lines
 */
public record VerificationReport(String claimName, ProofVerdict verdict, int attempts, List<String> transcript) {

    public VerificationReport {
        transcript = List.copyOf(transcript);
    }

    public boolean isProved() {
        return verdict instanceof ProofVerdict.Proved;
    }

    /** 0 when the claim was decided either way, 1 when it stayed unknown. */
    public int exitCode() {
        return verdict instanceof ProofVerdict.Unknown ? 1 : 0;
    }

    public String render() {
        StringBuilder sb = new StringBuilder();
        sb.append("Claim ").append(claimName).append(": ").append(verdict.summary())
                .append(" after ").append(attempts).append(" attempt(s)").append('\n');
        for (String line : transcript) {
            sb.append(line).append('\n');
        }
        return sb.toString();
    }
}
