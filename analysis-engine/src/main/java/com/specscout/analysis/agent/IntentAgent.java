package com.specscout.analysis.agent;

import com.specscout.analysis.indicator.ProfileIndicators;
import com.specscout.common.model.AgentKind;
import com.specscout.common.model.Confidence;
import com.specscout.common.model.FactoryUsage;
import com.specscout.common.model.ProfileRecord;
import com.specscout.common.model.SpecType;
import com.specscout.common.model.Verdict;
import com.specscout.common.model.VerdictType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Classifies whether a spec exercises a single unit or crosses component boundaries.
 * Spec type and cross-boundary events decide outright; otherwise secondary signals
 * (location, runtime, query volume, factory volume) are tallied. A blank location
 * contributes no location signal.
 */
@Component
public class IntentAgent implements AnalysisAgent {

    private static final Logger log = LoggerFactory.getLogger(IntentAgent.class);

    private static final Set<SpecType> UNIT_TYPES = EnumSet.of(SpecType.MODEL, SpecType.LIB);
    private static final Set<SpecType> INTEGRATION_TYPES =
        EnumSet.of(SpecType.REQUEST, SpecType.FEATURE, SpecType.SYSTEM, SpecType.INTEGRATION);

    private static final List<String> UNIT_PATHS = List.of(
        "spec/helpers/", "spec/services/", "spec/presenters/", "spec/decorators/",
        "spec/serializers/", "spec/validators/", "spec/policies/", "spec/unit/");
    private static final List<String> INTEGRATION_PATHS = List.of(
        "spec/controllers/", "spec/views/", "spec/routing/", "spec/mailers/", "spec/channels/");

    private final AgentThresholds thresholds;

    public IntentAgent(AgentThresholds thresholds) {
        this.thresholds = thresholds;
    }

    @Override
    public String agentName() { return AgentKind.INTENT.id(); }

    @Override
    public AgentKind kind() { return AgentKind.INTENT; }

    @Override
    public Verdict analyze(ProfileRecord profile) {
        log.info("[IntentAgent] Analyzing location={} specType={}", profile.location(), profile.specType().value());

        SpecType type = profile.specType();
        List<String> crossBoundary = ProfileIndicators.crossBoundaryEvents(profile);
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("specType", type.value());
        metadata.put("crossBoundaryEvents", crossBoundary);

        if (INTEGRATION_TYPES.contains(type) || !crossBoundary.isEmpty()) {
            String reason = INTEGRATION_TYPES.contains(type)
                ? type.value() + " spec"
                : "cross-boundary events (" + String.join(", ", crossBoundary) + ")";
            return Verdict.of(agentName(), kind(), VerdictType.INTEGRATION_TEST_BEHAVIOR, Confidence.HIGH,
                "Spec exercises behaviour across components: " + reason, metadata);
        }
        if (UNIT_TYPES.contains(type)) {
            return Verdict.of(agentName(), kind(), VerdictType.UNIT_TEST_BEHAVIOR, Confidence.HIGH,
                "Isolated " + type.value() + " spec with no cross-boundary events", metadata);
        }

        List<String> unitSignals = unitSignals(profile);
        List<String> integrationSignals = integrationSignals(profile);
        metadata.put("unitSignals", unitSignals);
        metadata.put("integrationSignals", integrationSignals);
        log.debug("[IntentAgent] location={} unitSignals={} integrationSignals={}",
            profile.location(), unitSignals, integrationSignals);

        if (unitSignals.size() > integrationSignals.size()) {
            return Verdict.of(agentName(), kind(), VerdictType.UNIT_TEST_BEHAVIOR, Confidence.MEDIUM,
                "Unit-style signals dominate: " + String.join(", ", unitSignals), metadata);
        }
        if (integrationSignals.size() > unitSignals.size()) {
            return Verdict.of(agentName(), kind(), VerdictType.INTEGRATION_TEST_BEHAVIOR, Confidence.MEDIUM,
                "Integration-style signals dominate: " + String.join(", ", integrationSignals), metadata);
        }
        return Verdict.noOpinion(agentName(), kind(),
            String.format("Test intent unclear (%d unit vs %d integration signals)",
                unitSignals.size(), integrationSignals.size()),
            metadata);
    }

    private List<String> unitSignals(ProfileRecord profile) {
        List<String> signals = new ArrayList<>();
        if (matchesPath(profile.location(), UNIT_PATHS)) signals.add("unit-style location");
        double runtime = profile.runtimeMs();
        if (runtime > 0 && runtime <= thresholds.fastRuntimeMs()) {
            signals.add(String.format(Locale.ROOT, "fast runtime %.1fms", runtime));
        }
        if (profile.db().totalQueries() <= thresholds.minimalQueries()) {
            signals.add("minimal queries (" + profile.db().totalQueries() + ")");
        }
        int factoryCount = ProfileIndicators.totalCount(profile.factories().values());
        if (factoryCount <= thresholds.minimalFactoryCount()) {
            signals.add("minimal factory usage (" + factoryCount + ")");
        }
        return signals;
    }

    private List<String> integrationSignals(ProfileRecord profile) {
        List<String> signals = new ArrayList<>();
        if (matchesPath(profile.location(), INTEGRATION_PATHS)) signals.add("integration-style location");
        double runtime = profile.runtimeMs();
        if (runtime > thresholds.slowRuntimeMs()) {
            signals.add(String.format(Locale.ROOT, "slow runtime %.1fms", runtime));
        }
        if (profile.db().totalQueries() > thresholds.heavyQueries()) {
            signals.add("heavy queries (" + profile.db().totalQueries() + ")");
        }
        int factoryCount = ProfileIndicators.totalCount(profile.factories().values());
        long createdFactories = profile.factories().values().stream().filter(FactoryUsage::persisted).count();
        if (factoryCount > thresholds.heavyFactoryCount() || createdFactories > thresholds.heavyCreatedFactories()) {
            signals.add("heavy factory usage (" + factoryCount + ")");
        }
        return signals;
    }

    private static boolean matchesPath(String location, List<String> paths) {
        if (location == null || location.isBlank()) return false;
        String normalized = location.replace('\\', '/').toLowerCase(Locale.ROOT);
        return paths.stream().anyMatch(normalized::contains);
    }
}
