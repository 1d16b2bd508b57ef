package com.specscout.analysis.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * {@link LlmClient} backed by the Anthropic Messages API.
 */
public class AnthropicLlmClient implements LlmClient {

    private static final Logger log = LoggerFactory.getLogger(AnthropicLlmClient.class);

    static final String BASE_URL = "https://api.anthropic.com";
    static final String API_VERSION = "2023-06-01";

    private final WebClient client;
    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final String model;
    private final int maxTokens;

    public AnthropicLlmClient(WebClient.Builder builder, ObjectMapper objectMapper,
                              String apiKey, String model, int maxTokens) {
        this.client = builder
            .baseUrl(BASE_URL)
            .defaultHeader("anthropic-version", API_VERSION)
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .build();
        this.objectMapper = objectMapper;
        this.apiKey = apiKey;
        this.model = model;
        this.maxTokens = maxTokens;
    }

    @Override
    public boolean available() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public Mono<String> complete(String systemPrompt, String userPrompt) {
        Map<String, Object> requestBody = Map.of(
            "model", model,
            "max_tokens", maxTokens,
            "system", systemPrompt,
            "messages", List.of(Map.of("role", "user", "content", userPrompt))
        );
        log.debug("[AnthropicLlmClient] Sending completion request model={}", model);

        return client.post()
            .uri("/v1/messages")
            .header("x-api-key", apiKey)
            .bodyValue(requestBody)
            .retrieve()
            .bodyToMono(String.class)
            .map(this::extractText);
    }

    String extractText(String response) {
        try {
            JsonNode root = objectMapper.readTree(response);
            JsonNode text = root.path("content").path(0).path("text");
            if (text.isMissingNode() || text.asText().isBlank()) {
                throw new IllegalStateException("Completion response carries no text content");
            }
            return text.asText();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Completion response is not valid JSON", e);
        }
    }
}
