package com.eainde.verifier.oracle.wolfram;

import com.eainde.verifier.oracle.OracleTransportException;

/**
 * Runs one Wolfram Language program and returns its textual output, trimmed.
 */
public interface WolframTransport {

    String execute(String code) throws OracleTransportException;

    /** Short label used in log lines. */
    String describe();
}
