package com.eainde.verifier.oracle;

import com.eainde.verifier.query.ResolutionQuery;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Symbolic engine deciding universally quantified comparisons over the reals.
 *
 * <p>Calls are synchronous and may take minutes. Implementations bound them with
 * a timeout and report any transport problem as {@link OracleTransportException}.</p>
 */
public interface ResolutionOracle {

    /** Decides {@code ForAll[variables, Implies[assumptions, comparison]]} over the reals. */
    Resolution resolveForAll(ResolutionQuery query) throws OracleTransportException;

    /** Evaluates a program whose value is JSON-encodable and returns the decoded value. */
    JsonNode evaluate(String program) throws OracleTransportException;
}
