package com.specscout.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kind of spec an example lives in, inferred from its file location.
 *
 * <p>{@link #fromLocation(String)} checks path segments in declaration order, so a
 * location such as {@code spec/models/user_spec.rb:42} resolves to {@link #MODEL}.
 */
public enum SpecType {
    MODEL("spec/models/"),
    CONTROLLER("spec/controllers/"),
    REQUEST("spec/requests/"),
    FEATURE("spec/features/"),
    INTEGRATION("spec/integration/"),
    SYSTEM("spec/system/"),
    LIB("spec/lib/"),
    HELPER("spec/helpers/"),
    VIEW("spec/views/"),
    UNKNOWN(null);

    private final String pathSegment;

    SpecType(String pathSegment) {
        this.pathSegment = pathSegment;
    }

    /** Infers the spec type from a {@code file:line} location. Never returns {@code null}. */
    public static SpecType fromLocation(String location) {
        if (location == null || location.isBlank()) return UNKNOWN;
        String normalized = location.replace('\\', '/').toLowerCase(Locale.ROOT);
        for (SpecType type : values()) {
            if (type.pathSegment != null && normalized.contains(type.pathSegment)) {
                return type;
            }
        }
        return UNKNOWN;
    }

    @JsonCreator
    public static SpecType fromValue(String value) {
        if (value == null || value.isBlank()) return UNKNOWN;
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
