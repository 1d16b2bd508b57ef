package com.specscout.analysis.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.specscout.analysis.agent.AnalysisAgent;
import com.specscout.common.exception.AgentException;
import com.specscout.common.model.AgentKind;
import com.specscout.common.model.ProfileRecord;
import com.specscout.common.model.Verdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Model-backed agent for one concern. Registered alongside the rule-based agent of the same
 * kind under the name {@code llm_<kind>}.
 *
 * <p>Every failure mode (missing credentials, timeout, transport error, unusable completion)
 * produces a low-confidence verdict, so this agent can abstain but never break a run.
 */
public class GenerativeAgent implements AnalysisAgent {

    private static final Logger log = LoggerFactory.getLogger(GenerativeAgent.class);

    private final AgentKind kind;
    private final LlmClient client;
    private final LlmResponseParser parser;
    private final ObjectMapper objectMapper;
    private final Duration timeout;

    public GenerativeAgent(AgentKind kind, LlmClient client, LlmResponseParser parser,
                           ObjectMapper objectMapper, Duration timeout) {
        this.kind = kind;
        this.client = client;
        this.parser = parser;
        this.objectMapper = objectMapper;
        this.timeout = timeout;
    }

    @Override
    public String agentName() { return "llm_" + kind.id(); }

    @Override
    public AgentKind kind() { return kind; }

    @Override
    public boolean generative() { return true; }

    /** Blocking bridge for callers outside a reactive pipeline. */
    @Override
    public Verdict analyze(ProfileRecord profile) {
        return analyzeAsync(profile).block();
    }

    @Override
    public Mono<Verdict> analyzeAsync(ProfileRecord profile) {
        if (!client.available()) {
            log.warn("[{}] No model credentials configured. Abstaining.", agentName());
            return Mono.just(Verdict.noOpinion(agentName(), kind,
                "Generative analysis unavailable: no credentials configured", Map.of("source", "fallback")));
        }
        log.info("[{}] Calling model for location={}", agentName(), profile.location());

        return Mono.fromCallable(() -> PromptTemplates.userPrompt(kind, toJson(profile)))
            .flatMap(prompt -> client.complete(PromptTemplates.systemPrompt(kind), prompt))
            .timeout(timeout)
            .map(text -> parser.parse(text, agentName(), kind))
            .onErrorResume(e -> {
                String reason;
                if (e instanceof TimeoutException) {
                    reason = "timed out after " + timeout.toMillis() + "ms";
                } else if (e instanceof AgentException agentException) {
                    reason = agentException.reason();
                } else {
                    reason = e.getMessage();
                }
                log.error("[{}] Model call failed for location={}: {}", agentName(), profile.location(), reason);
                return Mono.just(Verdict.failed(agentName(), kind, reason));
            });
    }

    private String toJson(ProfileRecord profile) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(profile);
        } catch (JsonProcessingException e) {
            throw new AgentException(agentName(), profile.location(), "failed to serialize profile", e);
        }
    }
}
