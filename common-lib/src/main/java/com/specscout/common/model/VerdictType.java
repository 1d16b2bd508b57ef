package com.specscout.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Closed vocabulary of agent outcomes.
 *
 * <p>{@link #NO_ACTION} is every agent's "nothing to recommend" outcome. Its stance depends
 * on confidence: at {@link Confidence#LOW} it is a no-opinion abstention, at medium or high it
 * is an explicit objection (e.g. the factory agent concluding persistence is required).
 */
public enum VerdictType {
    DB_UNNECESSARY(Stance.SUPPORT),
    DB_REQUIRED(Stance.OPPOSE),
    PREFER_BUILD_STUBBED(Stance.SUPPORT),
    UNIT_TEST_BEHAVIOR(Stance.SUPPORT),
    INTEGRATION_TEST_BEHAVIOR(Stance.OPPOSE),
    SAFE_TO_OPTIMIZE(Stance.SUPPORT),
    RISK_DETECTED(Stance.VETO),
    NO_ACTION(Stance.ABSTAIN);

    private final Stance baseStance;

    VerdictType(Stance baseStance) {
        this.baseStance = baseStance;
    }

    public Stance stanceAt(Confidence confidence) {
        if (this == NO_ACTION) {
            return confidence == Confidence.LOW ? Stance.ABSTAIN : Stance.OPPOSE;
        }
        return baseStance;
    }

    /** Verdicts a given concern is allowed to emit; used to validate generated responses. */
    public static Set<VerdictType> allowedFor(AgentKind kind) {
        return switch (kind) {
            case DATABASE -> EnumSet.of(DB_UNNECESSARY, DB_REQUIRED, NO_ACTION);
            case FACTORY  -> EnumSet.of(PREFER_BUILD_STUBBED, NO_ACTION);
            case INTENT   -> EnumSet.of(UNIT_TEST_BEHAVIOR, INTEGRATION_TEST_BEHAVIOR, NO_ACTION);
            case RISK     -> EnumSet.of(SAFE_TO_OPTIMIZE, RISK_DETECTED, NO_ACTION);
        };
    }

    /** Returns {@code null} for unrecognized values so callers can decide the fallback. */
    @JsonCreator
    public static VerdictType fromValue(String value) {
        if (value == null || value.isBlank()) return null;
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
