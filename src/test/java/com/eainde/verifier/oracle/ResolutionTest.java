package com.eainde.verifier.oracle;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ResolutionTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void tokens() {
        assertThat(Resolution.fromToken("True")).isEqualTo(Resolution.TRUE);
        assertThat(Resolution.fromToken(" False\n")).isEqualTo(Resolution.FALSE);
        assertThat(Resolution.fromToken("x > 2")).isEqualTo(Resolution.UNKNOWN);
        assertThat(Resolution.fromToken(null)).isEqualTo(Resolution.UNKNOWN);
    }

    @Test
    void json() throws Exception {
        assertThat(Resolution.fromJson(mapper.readTree("true"))).isEqualTo(Resolution.TRUE);
        assertThat(Resolution.fromJson(mapper.readTree("\"False\""))).isEqualTo(Resolution.FALSE);
        assertThat(Resolution.fromJson(mapper.readTree("\"Unknown\""))).isEqualTo(Resolution.UNKNOWN);
        assertThat(Resolution.fromJson(mapper.readTree("{\"a\": 1}"))).isEqualTo(Resolution.UNKNOWN);
    }
}
