package com.specscout.analysis.agent;

import com.specscout.analysis.indicator.ProfileIndicators;
import com.specscout.common.model.AgentKind;
import com.specscout.common.model.Confidence;
import com.specscout.common.model.ProfileRecord;
import com.specscout.common.model.Verdict;
import com.specscout.common.model.VerdictType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Flags behaviour that depends on persistence side effects: commit callbacks,
 * callback chains, nested operations. A flag here vetoes any optimization.
 */
@Component
public class RiskAgent implements AnalysisAgent {

    private static final Logger log = LoggerFactory.getLogger(RiskAgent.class);

    /** Metadata keys the profiler sets when it observes risky callback behaviour. */
    static final List<String> RISK_FLAGS = List.of(
        "after_commit", "commit_callbacks", "callbacks", "chained_callbacks", "nested_operations");

    private final AgentThresholds thresholds;

    public RiskAgent(AgentThresholds thresholds) {
        this.thresholds = thresholds;
    }

    @Override
    public String agentName() { return AgentKind.RISK.id(); }

    @Override
    public AgentKind kind() { return AgentKind.RISK; }

    @Override
    public Verdict analyze(ProfileRecord profile) {
        log.info("[RiskAgent] Analyzing location={} events={}", profile.location(), profile.events().size());

        // Without event data no risk can be ruled out.
        Optional<String> profilerError = ProfileIndicators.profilerError(profile, ProfileIndicators.EVENT_PROF_ERROR);
        if (profilerError.isPresent()) {
            return Verdict.noOpinion(agentName(), kind(),
                "Event profiling unavailable, risk cannot be ruled out: " + profilerError.get(),
                Map.of("profilerError", profilerError.get()));
        }

        List<String> indicators = new ArrayList<>();
        for (String event : ProfileIndicators.commitDependentEvents(profile)) {
            indicators.add("commit-dependent event " + event);
        }
        for (String flag : RISK_FLAGS) {
            if (ProfileIndicators.flagSet(profile.metadata(), flag)) {
                indicators.add("metadata flag " + flag);
            }
        }
        List<String> callbacks = ProfileIndicators.callbackEvents(profile);
        if (callbacks.size() >= thresholds.callbackChainLength()) {
            indicators.add("callback chain across " + callbacks.size() + " events (" + String.join(", ", callbacks) + ")");
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("riskScore", indicators.size());
        metadata.put("indicators", indicators);

        if (!indicators.isEmpty()) {
            log.info("[RiskAgent] Risk detected location={} indicators={}", profile.location(), indicators.size());
            return Verdict.of(agentName(), kind(), VerdictType.RISK_DETECTED, Confidence.HIGH,
                "Behaviour may depend on persistence side effects: " + String.join("; ", indicators),
                metadata);
        }
        return Verdict.of(agentName(), kind(), VerdictType.SAFE_TO_OPTIMIZE, Confidence.HIGH,
            "No commit callbacks, callback chains or risky metadata detected", metadata);
    }
}
