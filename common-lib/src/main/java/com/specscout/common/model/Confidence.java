package com.specscout.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Three-level confidence shared by verdicts and recommendations. */
public enum Confidence {
    HIGH,
    MEDIUM,
    LOW;

    /** Unrecognized or missing values read as {@link #LOW}. */
    @JsonCreator
    public static Confidence fromValue(String value) {
        if (value == null || value.isBlank()) return LOW;
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return LOW;
        }
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
