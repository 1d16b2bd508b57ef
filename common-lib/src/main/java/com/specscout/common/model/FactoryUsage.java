package com.specscout.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Aggregated usage of one factory inside one example.
 *
 * <p>When the profiler did not record a strategy explicitly, it is resolved by
 * {@link #resolveStrategy} through a fixed fallback chain:
 * explicit strategy → create count → build count → build_stubbed count → method name → unknown.
 * The order matters: reordering it changes recommendations.
 */
public record FactoryUsage(
    @JsonProperty("strategy") FactoryStrategy strategy,
    @JsonProperty("count")    int count,
    @JsonProperty("time")     double time
) {
    public FactoryUsage {
        if (strategy == null) strategy = FactoryStrategy.UNKNOWN;
        if (count < 0) count = 0;
        if (time < 0.0 || Double.isNaN(time)) time = 0.0;
    }

    public static FactoryUsage of(FactoryStrategy strategy, int count) {
        return new FactoryUsage(strategy, count, 0.0);
    }

    @JsonCreator
    static FactoryUsage fromJson(@JsonProperty("strategy")            String strategy,
                                 @JsonProperty("count")               Integer count,
                                 @JsonProperty("time")                Double time,
                                 @JsonProperty("create_count")        Integer createCount,
                                 @JsonProperty("build_count")         Integer buildCount,
                                 @JsonProperty("build_stubbed_count") Integer buildStubbedCount,
                                 @JsonProperty("method")              String method) {
        FactoryStrategy resolved = resolveStrategy(strategy, createCount, buildCount, buildStubbedCount, method);
        return new FactoryUsage(resolved,
            count != null ? count : 0,
            time != null ? time : 0.0);
    }

    /**
     * Resolves a strategy from optional profiler indicators. Any argument may be {@code null}.
     */
    public static FactoryStrategy resolveStrategy(String explicitStrategy,
                                                  Integer createCount,
                                                  Integer buildCount,
                                                  Integer buildStubbedCount,
                                                  String method) {
        if (explicitStrategy != null && !explicitStrategy.isBlank()) {
            return FactoryStrategy.fromValue(explicitStrategy);
        }
        if (positive(createCount))       return FactoryStrategy.CREATE;
        if (positive(buildCount))        return FactoryStrategy.BUILD;
        if (positive(buildStubbedCount)) return FactoryStrategy.BUILD_STUBBED;
        if (method != null && !method.isBlank()) {
            return FactoryStrategy.fromValue(method);
        }
        return FactoryStrategy.UNKNOWN;
    }

    public boolean persisted() {
        return strategy == FactoryStrategy.CREATE && count > 0;
    }

    private static boolean positive(Integer value) {
        return value != null && value > 0;
    }
}
