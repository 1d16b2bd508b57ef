package com.specscout.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Aggregate of one instrumented event name within an example. */
public record EventStats(
    @JsonProperty("count")    int count,
    @JsonProperty("time")     double time,
    @JsonProperty("examples") List<EventExample> examples
) {
    public EventStats {
        count    = Math.max(0, count);
        time     = Double.isNaN(time) || time < 0.0 ? 0.0 : time;
        examples = examples == null ? List.of() : List.copyOf(examples);
    }

    public static EventStats of(int count, EventExample... examples) {
        return new EventStats(count, 0.0, List.of(examples));
    }
}
