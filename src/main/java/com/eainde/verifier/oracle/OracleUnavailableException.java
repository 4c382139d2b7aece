package com.eainde.verifier.oracle;

/**
 * Fatal construction error: the oracle cannot be set up at all, for instance
 * because no {@code wolframscript} executable exists.
 */
public class OracleUnavailableException extends IllegalStateException {

    public OracleUnavailableException(String message) {
        super(message);
    }
}
