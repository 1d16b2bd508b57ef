package com.specscout.analysis.agent;

/**
 * Numeric cut-offs used by the rule-based agents.
 *
 * @param fastRuntimeMs          runtime at or below which a spec looks like a unit test
 * @param slowRuntimeMs          runtime above which a spec looks like an integration test
 * @param minimalQueries         total queries at or below which database usage is minimal
 * @param heavyQueries           total queries above which database usage is heavy
 * @param minimalFactoryCount    factory invocations at or below which setup is minimal
 * @param heavyFactoryCount      factory invocations above which setup is heavy
 * @param heavyCreatedFactories  distinct created factories above which setup is heavy
 * @param callbackChainLength    distinct callback events that make up a chain
 */
public record AgentThresholds(
    double fastRuntimeMs,
    double slowRuntimeMs,
    int minimalQueries,
    int heavyQueries,
    int minimalFactoryCount,
    int heavyFactoryCount,
    int heavyCreatedFactories,
    int callbackChainLength
) {
    public AgentThresholds {
        if (fastRuntimeMs > slowRuntimeMs) {
            throw new IllegalArgumentException(
                "fastRuntimeMs=" + fastRuntimeMs + " exceeds slowRuntimeMs=" + slowRuntimeMs);
        }
        if (minimalQueries > heavyQueries) {
            throw new IllegalArgumentException(
                "minimalQueries=" + minimalQueries + " exceeds heavyQueries=" + heavyQueries);
        }
        if (minimalFactoryCount > heavyFactoryCount) {
            throw new IllegalArgumentException(
                "minimalFactoryCount=" + minimalFactoryCount + " exceeds heavyFactoryCount=" + heavyFactoryCount);
        }
        if (callbackChainLength < 2) {
            throw new IllegalArgumentException("callbackChainLength must be at least 2");
        }
    }

    public static AgentThresholds defaults() {
        return new AgentThresholds(10.0, 100.0, 2, 10, 2, 5, 3, 2);
    }
}
