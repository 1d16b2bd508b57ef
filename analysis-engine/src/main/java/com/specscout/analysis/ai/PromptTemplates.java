package com.specscout.analysis.ai;

import com.specscout.common.model.AgentKind;
import com.specscout.common.model.VerdictType;

import java.util.stream.Collectors;

/**
 * Prompts for the generative agents. Each concern gets its own system prompt;
 * the user prompt embeds the profile JSON and the verdicts the concern may emit.
 */
public final class PromptTemplates {

    private PromptTemplates() {}

    public static String systemPrompt(AgentKind kind) {
        String focus = switch (kind) {
            case DATABASE -> """
                Decide whether the test needs records persisted to the database.
                Persistence is required when a created record is reloaded or re-selected.
                Persistence is unnecessary when there are no inserts and nothing reads committed data.""";
            case FACTORY -> """
                Decide whether factories using the create strategy could use build_stubbed instead.
                If so, name the single factory with the most create calls in a "factory" field.""";
            case INTENT -> """
                Decide whether the test exercises one unit in isolation or several components together.
                Controller dispatch, rendering and HTTP traffic indicate integration behaviour.""";
            case RISK -> """
                Decide whether changing how test data is persisted could change the test outcome.
                after_commit callbacks, callback chains and nested operations are risks.""";
        };
        return """
            You review RSpec test profiles and assess test-data persistence.
            %s
            When the evidence is unclear, answer no_action with low confidence.
            Respond ONLY with JSON, no prose.""".formatted(focus);
    }

    public static String userPrompt(AgentKind kind, String profileJson) {
        String verdicts = VerdictType.allowedFor(kind).stream()
            .map(VerdictType::value)
            .collect(Collectors.joining("|"));
        String factoryField = kind == AgentKind.FACTORY ? ",\n  \"factory\": \"factory name or null\"" : "";
        return """
            Profile:
            %s

            Respond with a JSON object in this exact format:
            {
              "verdict": "%s",
              "confidence": "high|medium|low",
              "reasoning": "one sentence citing the profile evidence"%s
            }
            """.formatted(profileJson, verdicts, factoryField);
    }
}
