package com.specscout.analysis.agent;

import com.specscout.analysis.indicator.ProfileIndicators;
import com.specscout.common.model.AgentKind;
import com.specscout.common.model.Confidence;
import com.specscout.common.model.FactoryStrategy;
import com.specscout.common.model.FactoryUsage;
import com.specscout.common.model.ProfileRecord;
import com.specscout.common.model.StrategyChange;
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
 * Looks for {@code create} factories whose records are never read back and proposes
 * {@code build_stubbed} for the most-used one.
 *
 * <p>Confidence is high when every insert in the profile is accounted for by factory setup,
 * medium when the spec writes more rows than its factories create.
 */
@Component
public class FactoryAgent implements AnalysisAgent {

    private static final Logger log = LoggerFactory.getLogger(FactoryAgent.class);

    @Override
    public String agentName() { return AgentKind.FACTORY.id(); }

    @Override
    public AgentKind kind() { return AgentKind.FACTORY; }

    @Override
    public Verdict analyze(ProfileRecord profile) {
        log.info("[FactoryAgent] Analyzing location={} factories={}",
            profile.location(), profile.factories().size());

        Optional<String> profilerError = ProfileIndicators.profilerError(profile, ProfileIndicators.FACTORY_PROF_ERROR);
        if (profilerError.isPresent()) {
            return Verdict.noOpinion(agentName(), kind(),
                "Factory profiling unavailable: " + profilerError.get(),
                Map.of("profilerError", profilerError.get()));
        }

        Map<String, FactoryUsage> created = ProfileIndicators.createdFactories(profile);
        if (created.isEmpty()) {
            return Verdict.noOpinion(agentName(), kind(), "No factory uses the create strategy",
                Map.of("factories", profile.factories().size()));
        }

        int inserts = profile.db().inserts();
        Map<String, FactoryUsage> candidates = new LinkedHashMap<>();
        List<String> required = new ArrayList<>();
        created.forEach((name, usage) -> {
            if (inserts > 0 && !ProfileIndicators.reloadEventsFor(profile, name).isEmpty()) {
                required.add(name);
            } else {
                candidates.put(name, usage);
            }
        });

        int createCount = ProfileIndicators.totalCount(created.values());
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("createCount", createCount);
        metadata.put("inserts", inserts);
        metadata.put("candidates", List.copyOf(candidates.keySet()));
        metadata.put("persistenceRequired", List.copyOf(required));

        if (candidates.isEmpty()) {
            log.debug("[FactoryAgent] All created factories are read back location={}", profile.location());
            return Verdict.of(agentName(), kind(), VerdictType.NO_ACTION, Confidence.MEDIUM,
                "Created records are read back after insert (" + describe(required)
                    + "); the create strategy is required",
                metadata);
        }

        Map.Entry<String, FactoryUsage> dominant = ProfileIndicators.dominant(candidates).orElseThrow();
        boolean writesBeyondFixtures = inserts > createCount;
        Confidence confidence = writesBeyondFixtures ? Confidence.MEDIUM : Confidence.HIGH;
        metadata.put("dominantFactory", dominant.getKey());
        metadata.put("writesBeyondFixtures", writesBeyondFixtures);

        StrategyChange change = StrategyChange.toBuildStubbed(dominant.getKey(), FactoryStrategy.CREATE);
        StringBuilder reasoning = new StringBuilder()
            .append(change.fromValue()).append(" x").append(dominant.getValue().count())
            .append(" is never read back; ").append(change.toValue()).append(" avoids the insert");
        if (candidates.size() > 1) {
            reasoning.append(". Other candidates: ").append(describe(others(candidates, dominant.getKey())));
        }
        if (!required.isEmpty()) {
            reasoning.append(". Kept as create: ").append(describe(required));
        }
        if (writesBeyondFixtures) {
            reasoning.append(String.format(". %d insert(s) exceed the %d created record(s)", inserts, createCount));
        }

        return Verdict.of(agentName(), kind(), VerdictType.PREFER_BUILD_STUBBED, confidence,
                reasoning.toString(), metadata)
            .withSuggestedChange(change);
    }

    private static List<String> others(Map<String, FactoryUsage> candidates, String dominant) {
        return candidates.keySet().stream().filter(name -> !name.equals(dominant)).toList();
    }

    private static String describe(List<String> factories) {
        return String.join(", ", factories.stream().map(name -> ":" + name).toList());
    }
}
