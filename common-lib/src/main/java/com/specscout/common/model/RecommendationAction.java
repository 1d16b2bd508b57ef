package com.specscout.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Recognized recommendation actions. The consensus engine currently materializes only
 * {@link #REPLACE_FACTORY_STRATEGY} and {@link #NO_ACTION}; the rest are accepted from
 * other producers and rendered by downstream formatters.
 */
public enum RecommendationAction {
    REPLACE_FACTORY_STRATEGY,
    AVOID_DB_PERSISTENCE,
    OPTIMIZE_QUERIES,
    REVIEW_TEST_INTENT,
    ASSESS_RISK_FACTORS,
    NO_ACTION;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
