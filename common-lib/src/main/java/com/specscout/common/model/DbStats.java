package com.specscout.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Database query counters for one example.
 *
 * <p>{@code totalQueries} is reported by the driver and need not equal the sum of the
 * per-statement counters; some drivers double-count. Nothing in this codebase reconciles them.
 */
public record DbStats(
    @JsonProperty("total_queries") int totalQueries,
    @JsonProperty("inserts")       int inserts,
    @JsonProperty("selects")       int selects,
    @JsonProperty("updates")       int updates,
    @JsonProperty("deletes")       int deletes
) {
    public static final DbStats EMPTY = new DbStats(0, 0, 0, 0, 0);

    public DbStats {
        totalQueries = Math.max(0, totalQueries);
        inserts      = Math.max(0, inserts);
        selects      = Math.max(0, selects);
        updates      = Math.max(0, updates);
        deletes      = Math.max(0, deletes);
    }

    public int writes() {
        return inserts + updates + deletes;
    }

    public boolean hasActivity() {
        return totalQueries > 0 || inserts > 0;
    }
}
