package com.eainde.verifier.search;

import com.eainde.verifier.oracle.OracleTransportException;
import com.eainde.verifier.oracle.Resolution;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Decoded answer of a batched series program:
 * {@code {"Logs": [...], "Result": true | ["True", "False", "Unknown", ...]}}.
 */
record SeriesBatchResult(List<String> logs, List<Resolution> resolutions) {

    static SeriesBatchResult parse(JsonNode payload, int pieceCount) throws OracleTransportException {
        if (payload == null || !payload.isObject() || !payload.has("Result")) {
            throw new OracleTransportException("Series batch answer has no Result field: " + payload);
        }
        List<String> logs = new ArrayList<>();
        JsonNode logNode = payload.path("Logs");
        if (logNode.isArray()) {
            for (JsonNode line : logNode) {
                logs.add(line.asText());
            }
        }

        JsonNode result = payload.get("Result");
        List<Resolution> resolutions;
        if (result.isBoolean()) {
            // false never certifies anything
            resolutions = Collections.nCopies(pieceCount, result.booleanValue() ? Resolution.TRUE : Resolution.UNKNOWN);
        } else if (result.isArray()) {
            if (result.size() != pieceCount) {
                throw new OracleTransportException(
                        "Series batch answered " + result.size() + " results for " + pieceCount + " subranges");
            }
            resolutions = new ArrayList<>();
            for (JsonNode entry : result) {
                resolutions.add(Resolution.fromJson(entry));
            }
        } else {
            resolutions = Collections.nCopies(pieceCount, Resolution.fromJson(result));
        }
        return new SeriesBatchResult(List.copyOf(logs), List.copyOf(resolutions));
    }
}
