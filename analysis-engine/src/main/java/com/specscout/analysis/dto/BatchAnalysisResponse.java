package com.specscout.analysis.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.specscout.common.model.Recommendation;
import com.specscout.common.safety.EnforcementOutcome;
import com.specscout.common.safety.SafetyStatus;

import java.util.List;

/** Recommendations for a batch of profiles, in input order, plus the CI verdict on them. */
public record BatchAnalysisResponse(
    @JsonProperty("trace_id")        String traceId,
    @JsonProperty("recommendations") List<Recommendation> recommendations,
    @JsonProperty("enforcement")     EnforcementOutcome enforcement,
    @JsonProperty("safety")          SafetyStatus safety
) {
    public BatchAnalysisResponse {
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }
}
