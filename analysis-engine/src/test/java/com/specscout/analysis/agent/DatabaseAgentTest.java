package com.specscout.analysis.agent;

import com.specscout.analysis.ProfileFixtures;
import com.specscout.analysis.indicator.ProfileIndicators;
import com.specscout.common.model.Confidence;
import com.specscout.common.model.DbStats;
import com.specscout.common.model.EventStats;
import com.specscout.common.model.ProfileRecord;
import com.specscout.common.model.Stance;
import com.specscout.common.model.Verdict;
import com.specscout.common.model.VerdictType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DatabaseAgentTest {

    private final DatabaseAgent agent = new DatabaseAgent();

    @Test
    @DisplayName("no inserts and no commit-dependent reads → db_unnecessary / high")
    void noWrites() {
        Verdict verdict = agent.analyze(ProfileFixtures.systemSpecWithoutWrites());
        assertEquals(VerdictType.DB_UNNECESSARY, verdict.verdict());
        assertEquals(Confidence.HIGH, verdict.confidence());
        assertEquals("database", verdict.agentName());
        assertEquals(0, verdict.metadata().get("inserts"));
    }

    @Test
    @DisplayName("created record read back → db_required / high")
    void reloadRequiresPersistence() {
        Verdict verdict = agent.analyze(ProfileFixtures.modelSpecReloadingUser());
        assertEquals(VerdictType.DB_REQUIRED, verdict.verdict());
        assertEquals(Confidence.HIGH, verdict.confidence());
        assertTrue(verdict.reasoning().contains(":user"));
    }

    @Test
    @DisplayName("inserts without read-back → no opinion, abstaining")
    void insertsWithoutReadBack() {
        Verdict verdict = agent.analyze(ProfileFixtures.modelSpecCreatingUsers());
        assertEquals(VerdictType.NO_ACTION, verdict.verdict());
        assertEquals(Confidence.LOW, verdict.confidence());
        assertEquals(Stance.ABSTAIN, verdict.stance());
    }

    @Test
    @DisplayName("commit-dependent read with no inserts → no opinion")
    void commitDependentRead() {
        ProfileRecord profile = ProfileRecord.of("spec/models/a_spec.rb:1")
            .withDb(new DbStats(2, 0, 2, 0, 0))
            .withEvent("transaction.commit", EventStats.of(1));
        Verdict verdict = agent.analyze(profile);
        assertEquals(VerdictType.NO_ACTION, verdict.verdict());
        assertTrue(verdict.reasoning().contains("transaction.commit"));
    }

    @Test
    @DisplayName("empty profile → db_unnecessary")
    void emptyProfile() {
        assertEquals(VerdictType.DB_UNNECESSARY, agent.analyze(ProfileRecord.of("")).verdict());
    }

    @Test
    @DisplayName("database profiler error → no opinion")
    void profilerError() {
        Verdict verdict = agent.analyze(ProfileFixtures.systemSpecWithoutWrites()
            .withMetadata(ProfileIndicators.DB_QUERIES_ERROR, "adapter not instrumented"));
        assertEquals(VerdictType.NO_ACTION, verdict.verdict());
        assertEquals(Confidence.LOW, verdict.confidence());
    }
}
