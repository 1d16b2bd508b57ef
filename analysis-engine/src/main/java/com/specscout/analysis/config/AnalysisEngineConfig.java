package com.specscout.analysis.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.specscout.analysis.agent.AgentThresholds;
import com.specscout.analysis.ai.AnthropicLlmClient;
import com.specscout.analysis.ai.GenerativeAgent;
import com.specscout.analysis.ai.LlmClient;
import com.specscout.analysis.ai.LlmResponseParser;
import com.specscout.analysis.logger.AnalysisFlowLogger;
import com.specscout.analysis.service.AgentDispatchService;
import com.specscout.analysis.service.AnalysisService;
import com.specscout.common.consensus.ConsensusEngine;
import com.specscout.common.consensus.QuorumConsensusStrategy;
import com.specscout.common.model.AgentKind;
import com.specscout.common.safety.AnalysisConfig;
import com.specscout.common.safety.SafetyPolicy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;

@Configuration
public class AnalysisEngineConfig {

    @Value("${specscout.analysis.enabled-agents:database,factory,intent,risk}")
    private List<String> enabledAgents;

    @Value("${specscout.analysis.enforcement-mode:false}")
    private boolean enforcementMode;

    @Value("${specscout.analysis.fail-on-high-confidence:false}")
    private boolean failOnHighConfidence;

    @Value("${specscout.analysis.auto-apply-enabled:false}")
    private boolean autoApplyEnabled;

    @Value("${specscout.analysis.blocking-mode-enabled:false}")
    private boolean blockingModeEnabled;

    @Value("${specscout.analysis.spec-root:.}")
    private String specRoot;

    @Value("${specscout.thresholds.fast-runtime-ms:10}")
    private double fastRuntimeMs;

    @Value("${specscout.thresholds.slow-runtime-ms:100}")
    private double slowRuntimeMs;

    @Value("${specscout.thresholds.minimal-queries:2}")
    private int minimalQueries;

    @Value("${specscout.thresholds.heavy-queries:10}")
    private int heavyQueries;

    @Value("${specscout.thresholds.minimal-factory-count:2}")
    private int minimalFactoryCount;

    @Value("${specscout.thresholds.heavy-factory-count:5}")
    private int heavyFactoryCount;

    @Value("${specscout.thresholds.heavy-created-factories:3}")
    private int heavyCreatedFactories;

    @Value("${specscout.thresholds.callback-chain-length:2}")
    private int callbackChainLength;

    @Value("${specscout.llm.api-key:}")
    private String llmApiKey;

    @Value("${specscout.llm.model:claude-haiku-4-5-20251001}")
    private String llmModel;

    @Value("${specscout.llm.max-tokens:300}")
    private int llmMaxTokens;

    @Value("${specscout.llm.timeout-ms:10000}")
    private long llmTimeoutMs;

    /** Fails startup when the configured flags are unsafe. */
    @Bean
    public AnalysisConfig analysisConfig() {
        return SafetyPolicy.validate(new AnalysisConfig(
            new LinkedHashSet<>(enabledAgents), enforcementMode, failOnHighConfidence,
            autoApplyEnabled, blockingModeEnabled));
    }

    @Bean
    public AgentThresholds agentThresholds() {
        return new AgentThresholds(fastRuntimeMs, slowRuntimeMs, minimalQueries, heavyQueries,
            minimalFactoryCount, heavyFactoryCount, heavyCreatedFactories, callbackChainLength);
    }

    @Bean
    public ConsensusEngine consensusEngine() {
        return new QuorumConsensusStrategy();
    }

    @Bean
    public AnalysisService analysisService(AgentDispatchService dispatchService, ConsensusEngine consensusEngine,
                                           AnalysisFlowLogger flowLogger) {
        return new AnalysisService(dispatchService, consensusEngine, flowLogger, Path.of(specRoot));
    }

    // ── generative agents (specscout.llm.enabled=true) ──────────────────────

    @Bean
    @ConditionalOnProperty(name = "specscout.llm.enabled", havingValue = "true")
    public LlmClient llmClient(WebClient.Builder builder, ObjectMapper objectMapper) {
        return new AnthropicLlmClient(builder, objectMapper, llmApiKey, llmModel, llmMaxTokens);
    }

    @Bean
    @ConditionalOnProperty(name = "specscout.llm.enabled", havingValue = "true")
    public LlmResponseParser llmResponseParser(ObjectMapper objectMapper) {
        return new LlmResponseParser(objectMapper);
    }

    @Bean
    @ConditionalOnProperty(name = "specscout.llm.enabled", havingValue = "true")
    public GenerativeAgent llmDatabaseAgent(LlmClient client, LlmResponseParser parser, ObjectMapper objectMapper) {
        return generativeAgent(AgentKind.DATABASE, client, parser, objectMapper);
    }

    @Bean
    @ConditionalOnProperty(name = "specscout.llm.enabled", havingValue = "true")
    public GenerativeAgent llmFactoryAgent(LlmClient client, LlmResponseParser parser, ObjectMapper objectMapper) {
        return generativeAgent(AgentKind.FACTORY, client, parser, objectMapper);
    }

    @Bean
    @ConditionalOnProperty(name = "specscout.llm.enabled", havingValue = "true")
    public GenerativeAgent llmIntentAgent(LlmClient client, LlmResponseParser parser, ObjectMapper objectMapper) {
        return generativeAgent(AgentKind.INTENT, client, parser, objectMapper);
    }

    @Bean
    @ConditionalOnProperty(name = "specscout.llm.enabled", havingValue = "true")
    public GenerativeAgent llmRiskAgent(LlmClient client, LlmResponseParser parser, ObjectMapper objectMapper) {
        return generativeAgent(AgentKind.RISK, client, parser, objectMapper);
    }

    private GenerativeAgent generativeAgent(AgentKind kind, LlmClient client, LlmResponseParser parser,
                                            ObjectMapper objectMapper) {
        return new GenerativeAgent(kind, client, parser, objectMapper, Duration.ofMillis(llmTimeoutMs));
    }
}
