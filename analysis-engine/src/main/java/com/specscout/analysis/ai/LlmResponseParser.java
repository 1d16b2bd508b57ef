package com.specscout.analysis.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.specscout.common.model.AgentKind;
import com.specscout.common.model.Confidence;
import com.specscout.common.model.FactoryStrategy;
import com.specscout.common.model.StrategyChange;
import com.specscout.common.model.Verdict;
import com.specscout.common.model.VerdictType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Turns a model completion into a {@link Verdict}. Anything that does not parse, or names a
 * verdict outside the concern's vocabulary, becomes a failed verdict, so a bad completion
 * can only ever abstain.
 */
public class LlmResponseParser {

    private static final Logger log = LoggerFactory.getLogger(LlmResponseParser.class);

    private final ObjectMapper objectMapper;

    public LlmResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Verdict parse(String responseText, String agentName, AgentKind kind) {
        if (responseText == null || responseText.isBlank()) {
            return Verdict.failed(agentName, kind, "empty completion");
        }
        JsonNode json;
        try {
            json = objectMapper.readTree(stripFences(responseText));
        } catch (JsonProcessingException e) {
            log.warn("[LlmResponseParser] Unparseable completion agent={}: {}", agentName, e.getOriginalMessage());
            return Verdict.failed(agentName, kind, "unparseable completion");
        }
        if (json == null || !json.isObject()) {
            return Verdict.failed(agentName, kind, "completion is not a JSON object");
        }

        String verdictText = json.path("verdict").asText("");
        VerdictType verdict = VerdictType.fromValue(verdictText);
        if (verdict == null || !VerdictType.allowedFor(kind).contains(verdict)) {
            return Verdict.failed(agentName, kind, "invalid verdict '" + verdictText + "' for " + kind.id());
        }

        String confidenceText = json.path("confidence").asText("").trim().toLowerCase(Locale.ROOT);
        if (!confidenceText.matches("high|medium|low")) {
            return Verdict.failed(agentName, kind, "invalid confidence '" + confidenceText + "'");
        }
        Confidence confidence = Confidence.fromValue(confidenceText);

        String reasoning = json.path("reasoning").asText("").trim();
        if (verdict != VerdictType.NO_ACTION && reasoning.isEmpty()) {
            return Verdict.failed(agentName, kind, "missing reasoning for " + verdict.value());
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("source", "llm");
        Verdict result = Verdict.of(agentName, kind, verdict, confidence, reasoning, metadata);

        String factory = json.path("factory").asText("").trim();
        if (verdict == VerdictType.PREFER_BUILD_STUBBED && !factory.isEmpty() && !"null".equals(factory)) {
            result = result.withSuggestedChange(
                StrategyChange.toBuildStubbed(factory.replaceFirst("^:", ""), FactoryStrategy.CREATE));
        }
        return result;
    }

    static String stripFences(String text) {
        return text.replaceAll("```json", "").replaceAll("```", "").trim();
    }
}
