package com.specscout.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Final, explainable outcome of one analysis call.
 *
 * <p>{@code agentResults} is the complete verdict list the recommendation was derived from,
 * kept as the audit trail. {@code fromValue}/{@code toValue} are empty for
 * {@link RecommendationAction#NO_ACTION}.
 */
public record Recommendation(
    @JsonProperty("spec_location") String specLocation,
    @JsonProperty("action")        RecommendationAction action,
    @JsonProperty("from_value")    String fromValue,
    @JsonProperty("to_value")      String toValue,
    @JsonProperty("confidence")    Confidence confidence,
    @JsonProperty("explanation")   List<String> explanation,
    @JsonProperty("agent_results") List<Verdict> agentResults
) {
    public Recommendation {
        if (specLocation == null) specLocation = "";
        if (fromValue == null) fromValue = "";
        if (toValue == null) toValue = "";
        explanation  = explanation == null ? List.of() : List.copyOf(explanation);
        agentResults = agentResults == null ? List.of() : List.copyOf(agentResults);
    }

    public static Recommendation noAction(String specLocation, List<String> explanation,
                                          List<Verdict> agentResults) {
        return new Recommendation(specLocation, RecommendationAction.NO_ACTION, "", "",
            Confidence.LOW, explanation, agentResults);
    }

    @JsonProperty("actionable")
    public boolean actionable() {
        return action != RecommendationAction.NO_ACTION;
    }

    /** Recognized action and confidence, and every verdict in the audit trail well-formed. */
    @JsonIgnore
    public boolean valid() {
        if (action == null || confidence == null) return false;
        if (actionable() && explanation.isEmpty()) return false;
        return agentResults.stream().allMatch(Verdict::wellFormed);
    }

    @JsonIgnore
    public boolean highConfidence() {
        return confidence == Confidence.HIGH;
    }
}
