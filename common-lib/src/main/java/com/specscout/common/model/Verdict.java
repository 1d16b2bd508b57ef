package com.specscout.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Output of one agent for one profile.
 *
 * <p>{@code suggestedChange} is the only decision material beyond the verdict itself; it is
 * populated by factory-concern agents when they propose a concrete strategy swap.
 * {@code metadata} is audit evidence only and is never read by the consensus engine.
 */
public record Verdict(
    @JsonProperty("agent_name") String agentName,
    @JsonProperty("kind")       AgentKind kind,
    @JsonProperty("verdict")    VerdictType verdict,
    @JsonProperty("confidence") Confidence confidence,
    @JsonProperty("reasoning")  String reasoning,
    @JsonProperty("suggested_change")
    @JsonInclude(JsonInclude.Include.NON_NULL) StrategyChange suggestedChange,
    @JsonProperty("metadata")   Map<String, Object> metadata
) {
    public Verdict {
        if (reasoning == null) reasoning = "";
        metadata = metadata == null || metadata.isEmpty()
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static Verdict of(String agentName, AgentKind kind, VerdictType verdict,
                             Confidence confidence, String reasoning,
                             Map<String, Object> metadata) {
        return new Verdict(agentName, kind, verdict, confidence, reasoning, null, metadata);
    }

    /** Low-confidence "nothing to say" verdict. Abstains in consensus. */
    public static Verdict noOpinion(String agentName, AgentKind kind, String reasoning,
                                    Map<String, Object> metadata) {
        return new Verdict(agentName, kind, VerdictType.NO_ACTION, Confidence.LOW, reasoning, null, metadata);
    }

    /** Verdict standing in for an agent that could not finish. Abstains in consensus. */
    public static Verdict failed(String agentName, AgentKind kind, String reason) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("error", true);
        metadata.put("reason", reason == null ? "unknown" : reason);
        return noOpinion(agentName, kind, "Agent failed: " + (reason == null ? "unknown error" : reason), metadata);
    }

    public Verdict withSuggestedChange(StrategyChange change) {
        return new Verdict(agentName, kind, verdict, confidence, reasoning, change, metadata);
    }

    @JsonIgnore
    public Stance stance() {
        return verdict == null ? Stance.ABSTAIN : verdict.stanceAt(confidence);
    }

    /** True for every verdict except {@link VerdictType#NO_ACTION}. */
    @JsonIgnore
    public boolean actionable() {
        return verdict != null && verdict != VerdictType.NO_ACTION;
    }

    /**
     * Structural validity: identified agent, known kind, verdict and confidence,
     * and a non-blank reasoning whenever the verdict is actionable.
     */
    @JsonIgnore
    public boolean wellFormed() {
        if (agentName == null || agentName.isBlank()) return false;
        if (kind == null || verdict == null || confidence == null) return false;
        return !actionable() || !reasoning.isBlank();
    }
}
