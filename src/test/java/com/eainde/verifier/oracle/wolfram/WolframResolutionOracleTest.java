package com.eainde.verifier.oracle.wolfram;

import com.eainde.verifier.oracle.OracleTransportException;
import com.eainde.verifier.oracle.Resolution;
import com.eainde.verifier.query.ResolutionQuery;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WolframResolutionOracleTest {

    @Mock
    private WolframTransport transport;

    private final ResolutionQuery query =
            new ResolutionQuery(List.of("x"), List.of("x > 0"), "x <= 10^0*(x)");

    @Test
    @DisplayName("should wrap boolean queries in InputForm and map the answer")
    void resolvesForAll() throws Exception {
        when(transport.execute(anyString())).thenReturn("True");
        WolframResolutionOracle oracle = new WolframResolutionOracle(transport, new ObjectMapper(), false);

        assertThat(oracle.resolveForAll(query)).isEqualTo(Resolution.TRUE);

        ArgumentCaptor<String> code = ArgumentCaptor.forClass(String.class);
        verify(transport).execute(code.capture());
        assertThat(code.getValue())
                .startsWith("ToString[(")
                .endsWith("), InputForm]")
                .contains("Resolve[ForAll[{x}, Implies[x > 0, x <= 10^0*(x)]], Reals]");
    }

    @Test
    @DisplayName("should read a residual expression as unknown")
    void residualIsUnknown() throws Exception {
        when(transport.execute(anyString())).thenReturn("x > 1");
        WolframResolutionOracle oracle = new WolframResolutionOracle(transport, new ObjectMapper(), true);

        assertThat(oracle.resolveForAll(query)).isEqualTo(Resolution.UNKNOWN);
    }

    @Test
    @DisplayName("should export programs as JSON and decode them")
    void evaluatesJson() throws Exception {
        when(transport.execute(anyString())).thenReturn("{\"Logs\": [\"a\"], \"Result\": true}");
        WolframResolutionOracle oracle = new WolframResolutionOracle(transport, new ObjectMapper(), false);

        JsonNode node = oracle.evaluate("<|\"Result\" -> True|>");

        assertThat(node.get("Result").booleanValue()).isTrue();
        ArgumentCaptor<String> code = ArgumentCaptor.forClass(String.class);
        verify(transport).execute(code.capture());
        assertThat(code.getValue()).startsWith("ExportString[(").endsWith("), \"JSON\"]");
    }

    @Test
    @DisplayName("should report undecodable output as a transport failure")
    void undecodable() throws Exception {
        when(transport.execute(anyString())).thenReturn("$Failed[");
        WolframResolutionOracle oracle = new WolframResolutionOracle(transport, new ObjectMapper(), false);

        assertThatThrownBy(() -> oracle.evaluate("1"))
                .isInstanceOf(OracleTransportException.class)
                .hasMessageContaining("not JSON");
    }
}
