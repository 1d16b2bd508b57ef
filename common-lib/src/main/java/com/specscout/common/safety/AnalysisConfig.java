package com.specscout.common.safety;

import com.specscout.common.model.AgentKind;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Options consumed by one analysis run. Passed explicitly into every analysis call;
 * there is no global configuration state.
 *
 * <p>Construction enforces the auto-apply guard: a configuration that both auto-applies
 * changes and fails builds in enforcement mode cannot exist.
 *
 * @param enabledAgents        agent identifiers to run; defaults to the four rule-based agents
 * @param enforcementMode      fail the run when a high-confidence actionable recommendation exists
 * @param failOnHighConfidence CI intent flag reported by {@link SafetyPolicy#status}
 * @param autoApplyEnabled     request to rewrite spec sources automatically
 * @param blockingModeEnabled  request to block the build outside enforcement mode
 */
public record AnalysisConfig(
    Set<String> enabledAgents,
    boolean enforcementMode,
    boolean failOnHighConfidence,
    boolean autoApplyEnabled,
    boolean blockingModeEnabled
) {
    public static final Set<String> DEFAULT_AGENTS;

    static {
        Set<String> ids = new LinkedHashSet<>();
        for (AgentKind kind : AgentKind.values()) {
            ids.add(kind.id());
        }
        DEFAULT_AGENTS = Collections.unmodifiableSet(ids);
    }

    public AnalysisConfig {
        SafetyPolicy.requireNoAutoApplyUnderEnforcement(autoApplyEnabled, enforcementMode);
        enabledAgents = enabledAgents == null
            ? DEFAULT_AGENTS
            : Collections.unmodifiableSet(new LinkedHashSet<>(enabledAgents));
    }

    public static AnalysisConfig defaults() {
        return new AnalysisConfig(DEFAULT_AGENTS, false, false, false, false);
    }

    public AnalysisConfig withEnabledAgents(Collection<String> agents) {
        return new AnalysisConfig(new LinkedHashSet<>(agents), enforcementMode,
            failOnHighConfidence, autoApplyEnabled, blockingModeEnabled);
    }

    public AnalysisConfig withEnforcementMode(boolean enabled) {
        return new AnalysisConfig(enabledAgents, enabled, failOnHighConfidence,
            autoApplyEnabled, blockingModeEnabled);
    }

    public AnalysisConfig withFailOnHighConfidence(boolean enabled) {
        return new AnalysisConfig(enabledAgents, enforcementMode, enabled,
            autoApplyEnabled, blockingModeEnabled);
    }

    public AnalysisConfig withAutoApplyEnabled(boolean enabled) {
        return new AnalysisConfig(enabledAgents, enforcementMode, failOnHighConfidence,
            enabled, blockingModeEnabled);
    }

    public AnalysisConfig withBlockingModeEnabled(boolean enabled) {
        return new AnalysisConfig(enabledAgents, enforcementMode, failOnHighConfidence,
            autoApplyEnabled, enabled);
    }

    public boolean agentEnabled(String agentId) {
        return enabledAgents.contains(agentId);
    }
}
