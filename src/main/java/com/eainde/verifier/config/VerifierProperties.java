package com.eainde.verifier.config;

import com.eainde.verifier.oracle.wolfram.ResolutionTransport;
import com.eainde.verifier.search.ExponentRange;
import com.eainde.verifier.search.ExponentSchedule;
import com.eainde.verifier.search.FalsePolicy;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Settings under the {@code verifier} prefix.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "verifier")
public class VerifierProperties {

    /** Proposal cycles per claim. */
    private int maxAttempts = 5;

    private FalsePolicy falsePolicy = FalsePolicy.TERMINAL;

    /** Exponents tried in the first cycle. */
    private ExponentRange initialRange = new ExponentRange(0, 0);

    private ExponentRange seriesRetryRange = new ExponentRange(0, 4);

    private ExponentRange inequalityRetryRange = new ExponentRange(-2, 6);

    /** Also try every ordering of the quantified variables of an inequality. */
    private boolean permuteVariables = false;

    /** Wall-clock limit of a single oracle call. */
    private Duration oracleTimeout = Duration.ofSeconds(120);

    private Transport transport = new Transport();

    private Llm llm = new Llm();

    public ExponentSchedule toSchedule() {
        return new ExponentSchedule(initialRange, seriesRetryRange, inequalityRetryRange);
    }

    @Getter
    @Setter
    public static class Transport {

        public enum Mode {
            LOCAL,
            REMOTE
        }

        private Mode mode = Mode.LOCAL;

        /** Path of {@code wolframscript}; searched for when empty. */
        private String executable;

        /** Evaluation endpoint for {@link Mode#REMOTE}. */
        private String endpoint;

        public ResolutionTransport toResolutionTransport() {
            if (mode == Mode.REMOTE) {
                return new ResolutionTransport.Remote(endpoint);
            }
            return new ResolutionTransport.Local(executable);
        }
    }

    @Getter
    @Setter
    public static class Llm {
        private String baseUrl = "https://generativelanguage.googleapis.com/v1beta/openai/";
        private String apiKey;
        private String modelName = "gemini-2.5-flash";
        private Double temperature = 0.0;
        private Duration timeout = Duration.ofSeconds(120);
    }
}
