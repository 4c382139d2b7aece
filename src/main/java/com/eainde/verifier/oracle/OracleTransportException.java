package com.eainde.verifier.oracle;

/**
 * An oracle could not be reached or did not answer in time: process launch
 * failure, non-zero exit, network error, timeout or an undecodable payload.
 *
 * <p>Callers treat it as an unknown answer, never as a negative one.</p>
 */
public class OracleTransportException extends Exception {

    public OracleTransportException(String message) {
        super(message);
    }

    public OracleTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
