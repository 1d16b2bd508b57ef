package com.specscout.common.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Locale;

/** One sampled occurrence of an instrumented event. Every field is optional. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EventExample(
    @JsonProperty("sql")       String sql,
    @JsonProperty("time")      Double time,
    @JsonProperty("location")  String location,
    @JsonProperty("backtrace") List<String> backtrace
) {
    public EventExample {
        backtrace = backtrace == null ? null : List.copyOf(backtrace);
    }

    public static EventExample ofSql(String sql) {
        return new EventExample(sql, null, null, null);
    }

    /** All text carried by this sample, lower-cased, for pattern matching. */
    public String searchableText() {
        StringBuilder sb = new StringBuilder();
        if (sql != null)      sb.append(sql).append(' ');
        if (location != null) sb.append(location).append(' ');
        if (backtrace != null) {
            for (String frame : backtrace) sb.append(frame).append(' ');
        }
        return sb.toString().toLowerCase(Locale.ROOT);
    }
}
