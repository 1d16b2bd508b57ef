package com.specscout.common.safety;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.specscout.common.model.Recommendation;

import java.util.List;

/**
 * Result of evaluating a batch of recommendations under enforcement.
 *
 * @param exitStatus  0 when the run passes, {@link EnforcementPolicy#FAILURE_EXIT_STATUS} otherwise
 * @param qualifying  high-confidence actionable recommendations (empty when enforcement is off)
 * @param message     CI-readable summary, one line per qualifying recommendation
 */
public record EnforcementOutcome(
    @JsonProperty("exit_status") int exitStatus,
    @JsonProperty("qualifying")  List<Recommendation> qualifying,
    @JsonProperty("message")     String message
) {
    public EnforcementOutcome {
        qualifying = qualifying == null ? List.of() : List.copyOf(qualifying);
        if (message == null) message = "";
    }

    @JsonProperty("should_fail")
    public boolean shouldFail() {
        return exitStatus != 0;
    }
}
