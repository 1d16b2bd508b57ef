package com.specscout.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Fixture-construction mode of a factory call.
 *
 * <ul>
 *   <li>{@link #CREATE}: persisted to the database</li>
 *   <li>{@link #BUILD}: in-memory instance, not saved</li>
 *   <li>{@link #BUILD_STUBBED}: in-memory instance with stubbed persistence methods</li>
 *   <li>{@link #UNKNOWN}: profiler could not tell</li>
 * </ul>
 */
public enum FactoryStrategy {
    CREATE,
    BUILD,
    BUILD_STUBBED,
    UNKNOWN;

    @JsonCreator
    public static FactoryStrategy fromValue(String value) {
        if (value == null || value.isBlank()) return UNKNOWN;
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if (normalized.startsWith(":")) normalized = normalized.substring(1);
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }

    /** Factory method name as written in a spec, e.g. {@code build_stubbed}. */
    @JsonValue
    public String methodName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Renders a call site for the given factory, e.g. {@code create(:user)}. */
    public String callFor(String factoryName) {
        return methodName() + "(:" + factoryName + ")";
    }
}
