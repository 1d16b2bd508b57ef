package com.specscout.common.safety;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Read-only safety report for a configuration. */
public record SafetyStatus(
    @JsonProperty("safe_mode")           boolean safeMode,
    @JsonProperty("auto_apply_disabled") boolean autoApplyDisabled,
    @JsonProperty("non_blocking_mode")   boolean nonBlockingMode,
    @JsonProperty("ci_friendly")         boolean ciFriendly,
    @JsonProperty("warnings")            List<String> warnings
) {
    public SafetyStatus {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
