package com.eainde.verifier.oracle.wolfram;

import java.io.Serializable;

/**
 * Where resolution programs are executed. Chosen once, at construction time.
 */
public sealed interface ResolutionTransport extends Serializable {

    /**
     * A local {@code wolframscript} binary.
     *
     * @param executable explicit path, or {@code null} to search the environment
     */
    record Local(String executable) implements ResolutionTransport {
    }

    /**
     * A remote evaluation endpoint accepting a form-encoded {@code code} field.
     *
     * @param endpoint absolute http(s) URL
     */
    record Remote(String endpoint) implements ResolutionTransport {

        public Remote {
            if (endpoint == null || endpoint.isBlank()) {
                throw new IllegalArgumentException("A remote resolution transport needs an endpoint");
            }
        }
    }
}
