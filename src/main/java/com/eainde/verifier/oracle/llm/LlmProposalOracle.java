package com.eainde.verifier.oracle.llm;

import com.eainde.verifier.claim.Claim;
import com.eainde.verifier.claim.Conjuncts;
import com.eainde.verifier.claim.InequalityClaim;
import com.eainde.verifier.claim.SeriesBoundClaim;
import com.eainde.verifier.oracle.OracleTransportException;
import com.eainde.verifier.oracle.ProposalOracle;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

/**
 * Asks a chat model for a decomposition. The raw answer is returned untouched;
 * parsing belongs to the partition validator.
 */
@Slf4j
public class LlmProposalOracle implements ProposalOracle {

    private final SeriesBreakpointAgent breakpointAgent;
    private final InequalitySubdomainAgent subdomainAgent;

    public LlmProposalOracle(ChatModel chatModel) {
        this(AiServices.builder(SeriesBreakpointAgent.class).chatModel(chatModel).build(),
                AiServices.builder(InequalitySubdomainAgent.class).chatModel(chatModel).build());
    }

    LlmProposalOracle(SeriesBreakpointAgent breakpointAgent, InequalitySubdomainAgent subdomainAgent) {
        this.breakpointAgent = breakpointAgent;
        this.subdomainAgent = subdomainAgent;
    }

    @Override
    public String proposePartition(Claim claim) throws OracleTransportException {
        MDC.put(ProposalRequestListener.CLAIM_KEY, claim.name());
        try {
            String answer;
            if (claim instanceof SeriesBoundClaim series) {
                MDC.put(ProposalRequestListener.AGENT_KEY, "series breakpoint");
                answer = breakpointAgent.proposeBreakpoints(
                        series.formula(),
                        series.summationIndex(),
                        String.join(", ", series.otherVariables()),
                        series.conditions(),
                        series.summationBounds().lower(),
                        series.summationBounds().upper(),
                        series.conjecturedUpperBound());
            } else {
                InequalityClaim inequality = (InequalityClaim) claim;
                MDC.put(ProposalRequestListener.AGENT_KEY, "inequality subdomain");
                answer = subdomainAgent.proposeSubdomains(
                        Conjuncts.join(inequality.baseDomain()),
                        String.join(", ", inequality.variables()),
                        inequality.lhs(),
                        inequality.rhs(),
                        outputFormat(inequality));
            }
            log.debug("Proposal for {}: {}", claim.name(), answer);
            return answer == null ? "" : answer;
        } catch (RuntimeException e) {
            throw new OracleTransportException("Proposal request failed for " + claim.name() + ": " + e.getMessage(), e);
        } finally {
            MDC.remove(ProposalRequestListener.CLAIM_KEY);
            MDC.remove(ProposalRequestListener.AGENT_KEY);
        }
    }

    static String outputFormat(InequalityClaim claim) {
        if (claim.baseDomain().isEmpty()) {
            return "[subdomain1, subdomain2, ...]";
        }
        String base = Conjuncts.join(claim.baseDomain());
        return "[" + base + " && subdomain1, " + base + " && subdomain2, ...]";
    }
}
