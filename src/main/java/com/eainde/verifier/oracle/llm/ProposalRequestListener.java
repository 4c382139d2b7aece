package com.eainde.verifier.oracle.llm;

import dev.langchain4j.model.chat.listener.ChatModelErrorContext;
import dev.langchain4j.model.chat.listener.ChatModelListener;
import dev.langchain4j.model.chat.listener.ChatModelRequestContext;
import dev.langchain4j.model.chat.listener.ChatModelResponseContext;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.TokenUsage;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Logs every proposal request against the claim and agent that issued it, and
 * keeps per-claim request and token totals.
 *
 * <p>The claim and agent are read from the {@link MDC} keys that
 * {@link LlmProposalOracle} sets around each call.</p>
 */
@Slf4j
public class ProposalRequestListener implements ChatModelListener {

    public static final String CLAIM_KEY = "claim";
    public static final String AGENT_KEY = "proposalAgent";

    private static final String START_TIME = "proposal.startTime";
    private static final String CLAIM = "proposal.claim";
    private static final String AGENT = "proposal.agent";
    private static final String UNATTRIBUTED = "<unattributed>";

    private final Map<String, ProposalUsage> usageByClaim = new ConcurrentHashMap<>();

    /** Requests, failures and tokens spent on one claim so far. */
    public record ProposalUsage(int requests, int failures, long inputTokens, long outputTokens) {

        static final ProposalUsage NONE = new ProposalUsage(0, 0, 0, 0);

        ProposalUsage plus(ProposalUsage other) {
            return new ProposalUsage(requests + other.requests, failures + other.failures,
                    inputTokens + other.inputTokens, outputTokens + other.outputTokens);
        }
    }

    @Override
    public void onRequest(ChatModelRequestContext requestContext) {
        String claim = Optional.ofNullable(MDC.get(CLAIM_KEY)).orElse(UNATTRIBUTED);
        String agent = Optional.ofNullable(MDC.get(AGENT_KEY)).orElse("unknown agent");
        Map<Object, Object> attributes = requestContext.attributes();
        attributes.put(START_TIME, System.currentTimeMillis());
        attributes.put(CLAIM, claim);
        attributes.put(AGENT, agent);

        log.info("Requesting {} proposal for claim {} ({} message(s))",
                agent, claim, requestContext.chatRequest().messages().size());
        log.debug("Proposal prompt for {}: {}", claim, requestContext.chatRequest().messages());
    }

    @Override
    public void onResponse(ChatModelResponseContext responseContext) {
        Map<Object, Object> attributes = responseContext.attributes();
        String claim = (String) attributes.getOrDefault(CLAIM, UNATTRIBUTED);
        ChatResponse response = responseContext.chatResponse();
        TokenUsage usage = response.tokenUsage();

        ProposalUsage total = usageByClaim.merge(claim, new ProposalUsage(1, 0,
                usage == null || usage.inputTokenCount() == null ? 0 : usage.inputTokenCount(),
                usage == null || usage.outputTokenCount() == null ? 0 : usage.outputTokenCount()),
                ProposalUsage::plus);

        log.info("{} proposal for claim {} answered in {}ms (finish: {}); claim totals: {} request(s), {} in / {} out tokens",
                attributes.getOrDefault(AGENT, "unknown agent"),
                claim,
                elapsed(attributes),
                response.finishReason(),
                total.requests(),
                total.inputTokens(),
                total.outputTokens());
    }

    @Override
    public void onError(ChatModelErrorContext errorContext) {
        Map<Object, Object> attributes = errorContext.attributes();
        String claim = (String) attributes.getOrDefault(CLAIM, UNATTRIBUTED);
        ProposalUsage total = usageByClaim.merge(claim, new ProposalUsage(1, 1, 0, 0), ProposalUsage::plus);
        log.error("{} proposal for claim {} failed after {}ms ({} of {} request(s) failed)",
                attributes.getOrDefault(AGENT, "unknown agent"), claim, elapsed(attributes),
                total.failures(), total.requests(), errorContext.error());
    }

    public ProposalUsage usageFor(String claimName) {
        return usageByClaim.getOrDefault(claimName, ProposalUsage.NONE);
    }

    private static long elapsed(Map<Object, Object> attributes) {
        Object start = attributes.get(START_TIME);
        return start instanceof Long startTime ? System.currentTimeMillis() - startTime : -1;
    }
}
