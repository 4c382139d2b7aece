package com.eainde.verifier.verdict;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class VerificationReportTest {

    @Test
    void exitCodeSeparatesDecidedFromUnknown() {
        assertThat(new VerificationReport("a", new ProofVerdict.Proved(0), 1, List.of()).exitCode()).isZero();
        assertThat(new VerificationReport("b", new ProofVerdict.Disproved(2, 0), 1, List.of()).exitCode()).isZero();
        assertThat(new VerificationReport("c", new ProofVerdict.Unknown(ProofVerdict.ADVISORY), 5, List.of()).exitCode())
                .isEqualTo(1);
    }

    @Test
    void rendersSummaryAndTranscript() {
        VerificationReport report = new VerificationReport("p_series", new ProofVerdict.Proved(0), 1,
                List.of("[attempt 1] proposal: []", "[attempt 1] verdict: PROVED(c=0)"));

        assertThat(report.isProved()).isTrue();
        assertThat(report.render()).isEqualTo("""
                Claim p_series: PROVED(c=0) after 1 attempt(s)
                [attempt 1] proposal: []
                [attempt 1] verdict: PROVED(c=0)
                """);
    }

    @Test
    void summaries() {
        assertThat(new ProofVerdict.Disproved(2, -1).summary()).isEqualTo("DISPROVED(piece=2, c=-1)");
        assertThat(new ProofVerdict.Unknown(ProofVerdict.ADVISORY).summary())
                .isEqualTo("UNKNOWN(try a different decomposition or a wider constant range)");
    }
}
