package com.eainde.verifier.oracle.llm;

import com.eainde.verifier.claim.ClaimCatalog;
import com.eainde.verifier.claim.InequalityClaim;
import com.eainde.verifier.oracle.OracleTransportException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LlmProposalOracleTest {

    @Mock
    private SeriesBreakpointAgent breakpointAgent;

    @Mock
    private InequalitySubdomainAgent subdomainAgent;

    private final ClaimCatalog catalog = ClaimCatalog.defaults();

    @Test
    @DisplayName("should pass the series description to the breakpoint agent")
    void seriesPrompt() throws Exception {
        when(breakpointAgent.proposeBreakpoints("(2*d+1)/(2*h^2*(1+d*(d+1)/(h^2))*(1+d*(d+1)/(h^2*m^2))^2)",
                "d", "h, m", "h > 1 && m > 1", "0", "Infinity", "1+Log[m^2]"))
                .thenReturn("[0, h, h*m, Infinity]");
        LlmProposalOracle oracle = new LlmProposalOracle(breakpointAgent, subdomainAgent);

        assertThat(oracle.proposePartition(catalog.find("series_1").orElseThrow()))
                .isEqualTo("[0, h, h*m, Infinity]");
        verifyNoInteractions(subdomainAgent);
    }

    @Test
    @DisplayName("should ask for subdomains that repeat the base domain")
    void inequalityPrompt() throws Exception {
        when(subdomainAgent.proposeSubdomains(anyString(), anyString(), anyString(), anyString(), anyString()))
                .thenReturn("[x>0 && y>1 && x<=1]");
        LlmProposalOracle oracle = new LlmProposalOracle(breakpointAgent, subdomainAgent);
        InequalityClaim claim = (InequalityClaim) catalog.find("inequality_1").orElseThrow();

        oracle.proposePartition(claim);

        verify(subdomainAgent).proposeSubdomains("x>0 && y>1", "x, y", "x*y", "y*Log[y]+Exp[x]",
                "[x>0 && y>1 && subdomain1, x>0 && y>1 && subdomain2, ...]");
    }

    @Test
    @DisplayName("should report model failures as transport failures")
    void modelFailure() {
        when(subdomainAgent.proposeSubdomains(anyString(), anyString(), anyString(), anyString(), anyString()))
                .thenThrow(new RuntimeException("quota exceeded"));
        LlmProposalOracle oracle = new LlmProposalOracle(breakpointAgent, subdomainAgent);

        assertThatThrownBy(() -> oracle.proposePartition(catalog.find("inequality_4").orElseThrow()))
                .isInstanceOf(OracleTransportException.class)
                .hasMessageContaining("quota exceeded");
    }

    @Test
    void unconstrainedFormat() {
        InequalityClaim claim = InequalityClaim.of("free", "x", "True", "x^2", "x^2+1");

        assertThat(LlmProposalOracle.outputFormat(claim)).isEqualTo("[subdomain1, subdomain2, ...]");
    }
}
