package com.eainde.verifier.oracle.llm;

import com.eainde.verifier.claim.ClaimCatalog;
import com.eainde.verifier.oracle.OracleTransportException;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.listener.ChatModelListener;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.FinishReason;
import dev.langchain4j.model.output.TokenUsage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProposalRequestListenerTest {

    private final ClaimCatalog catalog = ClaimCatalog.defaults();
    private final ProposalRequestListener listener = new ProposalRequestListener();

    /** Chat model answering every request with a fixed text, or failing when the text is null. */
    private static final class ScriptedChatModel implements ChatModel {

        private final String answer;
        private final ChatModelListener listener;

        ScriptedChatModel(String answer, ChatModelListener listener) {
            this.answer = answer;
            this.listener = listener;
        }

        @Override
        public ChatResponse doChat(ChatRequest chatRequest) {
            if (answer == null) {
                throw new IllegalStateException("quota exceeded");
            }
            return ChatResponse.builder()
                    .aiMessage(AiMessage.from(answer))
                    .tokenUsage(new TokenUsage(120, 8))
                    .finishReason(FinishReason.STOP)
                    .build();
        }

        @Override
        public List<ChatModelListener> listeners() {
            return List.of(listener);
        }
    }

    @Nested
    @DisplayName("Per-claim usage")
    class Usage {

        @Test
        @DisplayName("should attribute tokens to the claim that asked for the proposal")
        void attributesTokens() throws Exception {
            LlmProposalOracle oracle = new LlmProposalOracle(new ScriptedChatModel("[h, h*m]", listener));

            oracle.proposePartition(catalog.find("series_1").orElseThrow());
            oracle.proposePartition(catalog.find("series_1").orElseThrow());
            oracle.proposePartition(catalog.find("inequality_1").orElseThrow());

            assertThat(listener.usageFor("series_1"))
                    .isEqualTo(new ProposalRequestListener.ProposalUsage(2, 0, 240, 16));
            assertThat(listener.usageFor("inequality_1"))
                    .isEqualTo(new ProposalRequestListener.ProposalUsage(1, 0, 120, 8));
            assertThat(listener.usageFor("series_2")).isEqualTo(new ProposalRequestListener.ProposalUsage(0, 0, 0, 0));
        }

        @Test
        @DisplayName("should count failed requests and leave no claim in the MDC")
        void countsFailures() {
            LlmProposalOracle oracle = new LlmProposalOracle(new ScriptedChatModel(null, listener));

            assertThatThrownBy(() -> oracle.proposePartition(catalog.find("inequality_2").orElseThrow()))
                    .isInstanceOf(OracleTransportException.class)
                    .hasMessageContaining("quota exceeded");

            assertThat(listener.usageFor("inequality_2").failures()).isEqualTo(1);
            assertThat(MDC.get(ProposalRequestListener.CLAIM_KEY)).isNull();
            assertThat(MDC.get(ProposalRequestListener.AGENT_KEY)).isNull();
        }
    }
}
