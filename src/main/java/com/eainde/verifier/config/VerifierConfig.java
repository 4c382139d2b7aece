package com.eainde.verifier.config;

import com.eainde.verifier.claim.ClaimCatalog;
import com.eainde.verifier.edges.RetryRoutingEdge;
import com.eainde.verifier.oracle.ProposalOracle;
import com.eainde.verifier.oracle.ResolutionOracle;
import com.eainde.verifier.oracle.llm.ProposalRequestListener;
import com.eainde.verifier.oracle.llm.LlmProposalOracle;
import com.eainde.verifier.oracle.wolfram.ResolutionTransport;
import com.eainde.verifier.oracle.wolfram.WolframResolutionOracle;
import com.eainde.verifier.oracle.wolfram.WolframTransport;
import com.eainde.verifier.oracle.wolfram.WolframTransports;
import com.eainde.verifier.search.ConstantExponentSearch;
import com.eainde.verifier.search.ExponentSchedule;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationPropertiesBinding;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Wires the oracles, the constant search and the verification graph.
 */
@Slf4j
@Configuration
@ComponentScan(basePackages = "com.eainde.verifier")
@EnableConfigurationProperties(VerifierProperties.class)
public class VerifierConfig {

    @Bean
    @ConfigurationPropertiesBinding
    public static ExponentRangeConverter exponentRangeConverter() {
        return new ExponentRangeConverter();
    }

    @Bean
    public ObjectMapper verifierObjectMapper() {
        return new ObjectMapper();
    }

    @Bean
    public ResolutionTransport resolutionTransport(VerifierProperties properties) {
        return properties.getTransport().toResolutionTransport();
    }

    @Bean
    public WolframTransport wolframTransport(ResolutionTransport resolutionTransport, VerifierProperties properties) {
        WolframTransport transport = WolframTransports.create(resolutionTransport, properties.getOracleTimeout());
        log.info("Resolution oracle transport: {}", transport.describe());
        return transport;
    }

    @Bean
    public ResolutionOracle resolutionOracle(WolframTransport wolframTransport, ObjectMapper verifierObjectMapper,
                                             VerifierProperties properties) {
        return new WolframResolutionOracle(wolframTransport, verifierObjectMapper, properties.isPermuteVariables());
    }

    @Bean
    public ProposalRequestListener proposalRequestListener() {
        return new ProposalRequestListener();
    }

    @Bean
    public ChatModel proposalChatModel(VerifierProperties properties, ProposalRequestListener proposalRequestListener) {
        VerifierProperties.Llm llm = properties.getLlm();
        return OpenAiChatModel.builder()
                .baseUrl(llm.getBaseUrl())
                .apiKey(llm.getApiKey())
                .modelName(llm.getModelName())
                .temperature(llm.getTemperature())
                .timeout(llm.getTimeout())
                .listeners(List.of(proposalRequestListener))
                .build();
    }

    @Bean
    public ProposalOracle proposalOracle(ChatModel proposalChatModel) {
        return new LlmProposalOracle(proposalChatModel);
    }

    @Bean
    public ConstantExponentSearch constantExponentSearch(ResolutionOracle resolutionOracle,
                                                         VerifierProperties properties) {
        return new ConstantExponentSearch(resolutionOracle, properties.getFalsePolicy());
    }

    @Bean
    public ExponentSchedule exponentSchedule(VerifierProperties properties) {
        return properties.toSchedule();
    }

    @Bean
    public RetryRoutingEdge retryRoutingEdge(VerifierProperties properties) {
        return new RetryRoutingEdge(properties.getMaxAttempts());
    }

    @Bean
    public ClaimCatalog claimCatalog() {
        return ClaimCatalog.defaults();
    }
}
