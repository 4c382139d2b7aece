package com.eainde.verifier.oracle.wolfram;

import com.eainde.verifier.oracle.OracleTransportException;
import com.eainde.verifier.oracle.Resolution;
import com.eainde.verifier.oracle.ResolutionOracle;
import com.eainde.verifier.query.ResolutionQuery;
import com.eainde.verifier.query.WolframPrograms;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

/**
 * Resolution oracle backed by the Wolfram Language.
 *
 * <p>Boolean queries are evaluated through {@code ToString[..., InputForm]} so a
 * residual expression reads as {@link Resolution#UNKNOWN}. Programs are exported
 * with {@code ExportString[..., "JSON"]} and decoded with Jackson.</p>
 */
@Slf4j
public class WolframResolutionOracle implements ResolutionOracle {

    private final WolframTransport transport;
    private final ObjectMapper objectMapper;
    private final boolean permuteVariables;

    public WolframResolutionOracle(WolframTransport transport, ObjectMapper objectMapper, boolean permuteVariables) {
        this.transport = transport;
        this.objectMapper = objectMapper;
        this.permuteVariables = permuteVariables;
    }

    @Override
    public Resolution resolveForAll(ResolutionQuery query) throws OracleTransportException {
        String program = WolframPrograms.forAll(query, permuteVariables);
        String output = transport.execute(inputForm(program));
        Resolution resolution = Resolution.fromToken(output);
        if (resolution == Resolution.UNKNOWN) {
            log.debug("Unresolved answer from {}: {}", transport.describe(), output);
        }
        return resolution;
    }

    @Override
    public JsonNode evaluate(String program) throws OracleTransportException {
        String output = transport.execute(json(program));
        try {
            return objectMapper.readTree(output);
        } catch (JsonProcessingException e) {
            throw new OracleTransportException("Oracle output is not JSON: " + abbreviate(output), e);
        }
    }

    static String inputForm(String program) {
        return "ToString[(\n" + program + "\n), InputForm]";
    }

    static String json(String program) {
        return "ExportString[(\n" + program + "\n), \"JSON\"]";
    }

    private static String abbreviate(String text) {
        return text.length() <= 200 ? text : text.substring(0, 200) + "...";
    }
}
