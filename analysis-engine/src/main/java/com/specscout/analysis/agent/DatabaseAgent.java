package com.specscout.analysis.agent;

import com.specscout.analysis.indicator.ProfileIndicators;
import com.specscout.common.model.AgentKind;
import com.specscout.common.model.Confidence;
import com.specscout.common.model.DbStats;
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
 * Decides whether the spec needs database persistence at all.
 * A created record that is read back means persistence is required; no writes and no
 * commit-dependent reads means it is not. Anything in between is left undecided.
 */
@Component
public class DatabaseAgent implements AnalysisAgent {

    private static final Logger log = LoggerFactory.getLogger(DatabaseAgent.class);

    @Override
    public String agentName() { return AgentKind.DATABASE.id(); }

    @Override
    public AgentKind kind() { return AgentKind.DATABASE; }

    @Override
    public Verdict analyze(ProfileRecord profile) {
        log.info("[DatabaseAgent] Analyzing location={}", profile.location());

        Optional<String> profilerError = ProfileIndicators.profilerError(profile, ProfileIndicators.DB_QUERIES_ERROR);
        if (profilerError.isPresent()) {
            return Verdict.noOpinion(agentName(), kind(),
                "Database profiling unavailable: " + profilerError.get(),
                Map.of("profilerError", profilerError.get()));
        }

        DbStats db = profile.db();
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("inserts", db.inserts());
        metadata.put("selects", db.selects());
        metadata.put("totalQueries", db.totalQueries());

        Map<String, List<String>> reloads = new LinkedHashMap<>();
        for (String factory : ProfileIndicators.createdFactories(profile).keySet()) {
            List<String> events = ProfileIndicators.reloadEventsFor(profile, factory);
            if (!events.isEmpty()) reloads.put(factory, events);
        }
        if (!reloads.isEmpty()) {
            metadata.put("reloadEvents", reloads);
            List<String> reasons = new ArrayList<>();
            reloads.forEach((factory, events) ->
                reasons.add(":" + factory + " is re-read after creation (" + String.join(", ", events) + ")"));
            log.debug("[DatabaseAgent] Persistence required location={} reloads={}", profile.location(), reloads);
            return Verdict.of(agentName(), kind(), VerdictType.DB_REQUIRED, Confidence.HIGH,
                "Created records are read back from the database: " + String.join("; ", reasons), metadata);
        }

        List<String> commitEvents = ProfileIndicators.commitDependentEvents(profile);
        metadata.put("commitEvents", commitEvents);

        if (db.inserts() == 0 && commitEvents.isEmpty()) {
            return Verdict.of(agentName(), kind(), VerdictType.DB_UNNECESSARY, Confidence.HIGH,
                String.format("No database writes (%d selects, %d total queries) and no commit-dependent reads",
                    db.selects(), db.totalQueries()),
                metadata);
        }

        String reasoning = db.inserts() > 0
            ? String.format("%d insert(s) without a read-back of a created record; persistence need is unclear",
                db.inserts())
            : "Commit-dependent events present (" + String.join(", ", commitEvents)
                + "); persistence need is unclear";
        return Verdict.noOpinion(agentName(), kind(), reasoning, metadata);
    }
}
