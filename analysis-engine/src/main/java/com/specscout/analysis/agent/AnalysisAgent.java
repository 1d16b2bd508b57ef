package com.specscout.analysis.agent;

import com.specscout.common.model.AgentKind;
import com.specscout.common.model.ProfileRecord;
import com.specscout.common.model.Verdict;
import reactor.core.publisher.Mono;

/**
 * One concern's view of a profile. Implementations must be side-effect free and must not
 * depend on any other agent's output.
 */
public interface AnalysisAgent {

    Verdict analyze(ProfileRecord profile);

    /** Unique identifier, also the key used in {@code enabled-agents}. */
    String agentName();

    AgentKind kind();

    /** Generative agents run after the rule-based ones and may be slow or unavailable. */
    default boolean generative() { return false; }

    default Mono<Verdict> analyzeAsync(ProfileRecord profile) {
        return Mono.fromCallable(() -> analyze(profile));
    }
}
