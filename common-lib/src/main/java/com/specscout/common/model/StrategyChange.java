package com.specscout.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A concrete factory strategy swap proposed by the factory agent, e.g.
 * {@code create(:user)} → {@code build_stubbed(:user)}.
 */
public record StrategyChange(
    @JsonProperty("factory") String factory,
    @JsonProperty("from")    FactoryStrategy from,
    @JsonProperty("to")      FactoryStrategy to
) {
    public static StrategyChange toBuildStubbed(String factory, FactoryStrategy current) {
        return new StrategyChange(factory, current, FactoryStrategy.BUILD_STUBBED);
    }

    public String fromValue() {
        return from.callFor(factory);
    }

    public String toValue() {
        return to.callFor(factory);
    }
}
