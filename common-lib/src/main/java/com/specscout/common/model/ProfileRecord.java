package com.specscout.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Normalized performance snapshot of one test example: the only input of an analysis call.
 *
 * <p>Every field is defaulted so that partially populated profiles are still analyzable:
 * empty location, zero counters, empty maps. When no spec type is given (or it is
 * {@link SpecType#UNKNOWN}) it is inferred from {@code location}.
 *
 * <p>Instances are immutable; the {@code with*} methods return modified copies.
 * Map iteration order is preserved from the input.
 */
public record ProfileRecord(
    @JsonProperty("location")   String location,
    @JsonProperty("spec_type")  SpecType specType,
    @JsonProperty("runtime_ms") double runtimeMs,
    @JsonProperty("factories")  Map<String, FactoryUsage> factories,
    @JsonProperty("db")         DbStats db,
    @JsonProperty("events")     Map<String, EventStats> events,
    @JsonProperty("metadata")   Map<String, Object> metadata
) {
    public ProfileRecord {
        if (location == null) location = "";
        if (specType == null || specType == SpecType.UNKNOWN) specType = SpecType.fromLocation(location);
        if (Double.isNaN(runtimeMs) || runtimeMs < 0.0) runtimeMs = 0.0;
        factories = freeze(factories);
        if (db == null) db = DbStats.EMPTY;
        events   = freeze(events);
        metadata = freeze(metadata);
    }

    public static ProfileRecord of(String location) {
        return new ProfileRecord(location, null, 0.0, null, null, null, null);
    }

    public ProfileRecord withSpecType(SpecType type) {
        return new ProfileRecord(location, type, runtimeMs, factories, db, events, metadata);
    }

    public ProfileRecord withRuntimeMs(double runtime) {
        return new ProfileRecord(location, specType, runtime, factories, db, events, metadata);
    }

    public ProfileRecord withFactory(String name, FactoryUsage usage) {
        Map<String, FactoryUsage> copy = new LinkedHashMap<>(factories);
        copy.put(name, usage);
        return new ProfileRecord(location, specType, runtimeMs, copy, db, events, metadata);
    }

    public ProfileRecord withDb(DbStats stats) {
        return new ProfileRecord(location, specType, runtimeMs, factories, stats, events, metadata);
    }

    public ProfileRecord withEvent(String name, EventStats stats) {
        Map<String, EventStats> copy = new LinkedHashMap<>(events);
        copy.put(name, stats);
        return new ProfileRecord(location, specType, runtimeMs, factories, db, copy, metadata);
    }

    public ProfileRecord withMetadata(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(metadata);
        copy.put(key, value);
        return new ProfileRecord(location, specType, runtimeMs, factories, db, events, copy);
    }

    private static <V> Map<String, V> freeze(Map<String, V> source) {
        if (source == null || source.isEmpty()) return Collections.emptyMap();
        Map<String, V> copy = new LinkedHashMap<>();
        source.forEach((k, v) -> {
            if (k != null && v != null) copy.put(k, v);
        });
        return Collections.unmodifiableMap(copy);
    }
}
