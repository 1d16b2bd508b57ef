package com.specscout.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * The concern an agent scores. Declaration order is the canonical order in which verdicts
 * are presented to the consensus engine and in which their reasoning is explained:
 * database → factory → intent → risk.
 */
public enum AgentKind {
    DATABASE,
    FACTORY,
    INTENT,
    RISK;

    /** Identifier used by the rule-based agent of this kind and in configuration. */
    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
