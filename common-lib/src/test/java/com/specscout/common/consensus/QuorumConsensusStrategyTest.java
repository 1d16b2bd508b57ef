package com.specscout.common.consensus;

import com.specscout.common.model.AgentKind;
import com.specscout.common.model.Confidence;
import com.specscout.common.model.FactoryStrategy;
import com.specscout.common.model.Recommendation;
import com.specscout.common.model.RecommendationAction;
import com.specscout.common.model.StrategyChange;
import com.specscout.common.model.Verdict;
import com.specscout.common.model.VerdictType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Decision table of {@link QuorumConsensusStrategy}: veto, conflicts, quorum,
 * confidence derivation and explanation ordering.
 */
class QuorumConsensusStrategyTest {

    private static final String LOCATION = "spec/models/user_spec.rb:10";

    private final ConsensusEngine engine = new QuorumConsensusStrategy();

    private static Verdict verdict(AgentKind kind, VerdictType type, Confidence confidence) {
        return Verdict.of(kind.id(), kind, type, confidence, kind.id() + " says " + type.value(), Map.of());
    }

    private static Verdict stubbedUser(Confidence confidence) {
        return verdict(AgentKind.FACTORY, VerdictType.PREFER_BUILD_STUBBED, confidence)
            .withSuggestedChange(StrategyChange.toBuildStubbed("user", FactoryStrategy.CREATE));
    }

    private static Verdict abstain(AgentKind kind) {
        return Verdict.noOpinion(kind.id(), kind, "no opinion", Map.of());
    }

    private Recommendation compute(Verdict... verdicts) {
        return engine.compute(LOCATION, Arrays.asList(verdicts));
    }

    // ── agreement ────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("agreement")
    class Agreement {

        @Test
        @DisplayName("three high supporters, database abstaining → replace_factory_strategy / high")
        void unanimousHigh() {
            Recommendation rec = compute(
                abstain(AgentKind.DATABASE),
                stubbedUser(Confidence.HIGH),
                verdict(AgentKind.INTENT, VerdictType.UNIT_TEST_BEHAVIOR, Confidence.HIGH),
                verdict(AgentKind.RISK, VerdictType.SAFE_TO_OPTIMIZE, Confidence.HIGH));

            assertEquals(RecommendationAction.REPLACE_FACTORY_STRATEGY, rec.action());
            assertEquals("create(:user)", rec.fromValue());
            assertEquals("build_stubbed(:user)", rec.toValue());
            assertEquals(Confidence.HIGH, rec.confidence());
            assertEquals(LOCATION, rec.specLocation());
            assertEquals(4, rec.agentResults().size());
            assertEquals("3 agent(s) agree on optimize_persistence: create(:user) -> build_stubbed(:user)",
                rec.explanation().get(rec.explanation().size() - 1));
        }

        @Test
        @DisplayName("a medium supporter lowers confidence to medium")
        void mediumSupporter() {
            Recommendation rec = compute(
                stubbedUser(Confidence.MEDIUM),
                verdict(AgentKind.RISK, VerdictType.SAFE_TO_OPTIMIZE, Confidence.HIGH));
            assertEquals(RecommendationAction.REPLACE_FACTORY_STRATEGY, rec.action());
            assertEquals(Confidence.MEDIUM, rec.confidence());
        }

        @Test
        @DisplayName("a low supporter lowers confidence to low")
        void lowSupporter() {
            Recommendation rec = compute(
                stubbedUser(Confidence.HIGH),
                verdict(AgentKind.INTENT, VerdictType.UNIT_TEST_BEHAVIOR, Confidence.LOW),
                verdict(AgentKind.RISK, VerdictType.SAFE_TO_OPTIMIZE, Confidence.HIGH));
            assertEquals(Confidence.LOW, rec.confidence());
        }

        @Test
        @DisplayName("supporters without a concrete factory change → no_action / low")
        void noConcreteChange() {
            Recommendation rec = compute(
                verdict(AgentKind.DATABASE, VerdictType.DB_UNNECESSARY, Confidence.HIGH),
                verdict(AgentKind.RISK, VerdictType.SAFE_TO_OPTIMIZE, Confidence.HIGH));
            assertEquals(RecommendationAction.NO_ACTION, rec.action());
            assertEquals(Confidence.LOW, rec.confidence());
            assertTrue(rec.explanation().get(rec.explanation().size() - 1)
                .contains("no concrete factory change is available"));
        }

        @Test
        @DisplayName("a single supporter is below quorum")
        void belowQuorum() {
            Recommendation rec = compute(stubbedUser(Confidence.HIGH), abstain(AgentKind.RISK));
            assertEquals(RecommendationAction.NO_ACTION, rec.action());
            assertTrue(rec.explanation().get(rec.explanation().size() - 1).startsWith("Insufficient agreement"));
        }

        @Test
        @DisplayName("two verdicts from the same agent count once toward quorum")
        void distinctAgentsOnly() {
            Recommendation rec = compute(stubbedUser(Confidence.HIGH), stubbedUser(Confidence.HIGH));
            assertEquals(RecommendationAction.NO_ACTION, rec.action());
        }
    }

    // ── veto and conflicts ───────────────────────────────────────────────────

    @Nested
    @DisplayName("veto and conflicts")
    class VetoAndConflicts {

        @Test
        @DisplayName("risk_detected vetoes regardless of support")
        void riskVetoes() {
            Recommendation rec = compute(
                verdict(AgentKind.DATABASE, VerdictType.DB_UNNECESSARY, Confidence.HIGH),
                stubbedUser(Confidence.HIGH),
                verdict(AgentKind.INTENT, VerdictType.UNIT_TEST_BEHAVIOR, Confidence.HIGH),
                verdict(AgentKind.RISK, VerdictType.RISK_DETECTED, Confidence.LOW));

            assertEquals(RecommendationAction.NO_ACTION, rec.action());
            assertEquals(Confidence.LOW, rec.confidence());
            assertEquals("risk: risk says risk_detected", rec.explanation().get(0));
            assertTrue(rec.explanation().get(1).startsWith("Optimization vetoed"));
        }

        @Test
        @DisplayName("support plus opposition → mixed signals, both named")
        void mixedSignals() {
            Recommendation rec = compute(
                verdict(AgentKind.DATABASE, VerdictType.DB_UNNECESSARY, Confidence.HIGH),
                verdict(AgentKind.INTENT, VerdictType.INTEGRATION_TEST_BEHAVIOR, Confidence.HIGH),
                verdict(AgentKind.RISK, VerdictType.SAFE_TO_OPTIMIZE, Confidence.HIGH));

            assertEquals(RecommendationAction.NO_ACTION, rec.action());
            assertEquals(Confidence.LOW, rec.confidence());
            assertEquals("Conflicting signals: database, risk support optimize_persistence but intent oppose it",
                rec.explanation().get(0));
            assertEquals("No action: mixed signals need manual review",
                rec.explanation().get(rec.explanation().size() - 1));
        }

        @Test
        @DisplayName("medium no_action from the factory agent is an objection")
        void factoryObjection() {
            Recommendation rec = compute(
                Verdict.of("factory", AgentKind.FACTORY, VerdictType.NO_ACTION, Confidence.MEDIUM,
                    "records are reloaded", Map.of()),
                verdict(AgentKind.INTENT, VerdictType.UNIT_TEST_BEHAVIOR, Confidence.HIGH),
                verdict(AgentKind.RISK, VerdictType.SAFE_TO_OPTIMIZE, Confidence.HIGH));
            assertEquals(RecommendationAction.NO_ACTION, rec.action());
            assertTrue(rec.explanation().get(0).startsWith("Conflicting signals"));
        }

        @Test
        @DisplayName("only opposers → no_action naming the count")
        void onlyOpposers() {
            Recommendation rec = compute(
                verdict(AgentKind.DATABASE, VerdictType.DB_REQUIRED, Confidence.HIGH),
                abstain(AgentKind.FACTORY));
            assertEquals(RecommendationAction.NO_ACTION, rec.action());
            assertEquals("1 agent(s) oppose optimize_persistence, none support it",
                rec.explanation().get(rec.explanation().size() - 1));
        }
    }

    // ── input handling ───────────────────────────────────────────────────────

    @Nested
    @DisplayName("input handling")
    class InputHandling {

        @Test
        @DisplayName("empty or null input → no_action with explanation")
        void emptyInput() {
            for (List<Verdict> input : Arrays.asList(null, List.<Verdict>of())) {
                Recommendation rec = engine.compute(LOCATION, input);
                assertEquals(RecommendationAction.NO_ACTION, rec.action());
                assertEquals(List.of("No valid agent results available for analysis"), rec.explanation());
            }
        }

        @Test
        @DisplayName("malformed verdicts are ignored and counted")
        void malformedIgnored() {
            Verdict malformed = Verdict.of("intent", AgentKind.INTENT, VerdictType.UNIT_TEST_BEHAVIOR,
                Confidence.HIGH, "", Map.of());
            Recommendation rec = compute(
                stubbedUser(Confidence.HIGH),
                malformed,
                verdict(AgentKind.RISK, VerdictType.SAFE_TO_OPTIMIZE, Confidence.HIGH));

            assertEquals(RecommendationAction.REPLACE_FACTORY_STRATEGY, rec.action());
            assertEquals(2, rec.agentResults().size());
            assertEquals("Ignored 1 malformed agent result(s)", rec.explanation().get(rec.explanation().size() - 1));
        }

        @Test
        @DisplayName("input order does not change the recommendation")
        void orderIndependent() {
            List<Verdict> verdicts = new ArrayList<>(List.of(
                abstain(AgentKind.DATABASE),
                stubbedUser(Confidence.HIGH),
                verdict(AgentKind.INTENT, VerdictType.UNIT_TEST_BEHAVIOR, Confidence.MEDIUM),
                verdict(AgentKind.RISK, VerdictType.SAFE_TO_OPTIMIZE, Confidence.HIGH)));
            Recommendation first = engine.compute(LOCATION, verdicts);
            Collections.reverse(verdicts);
            Recommendation second = engine.compute(LOCATION, verdicts);

            assertEquals(first, second);
            assertEquals(List.of("factory: factory says prefer_build_stubbed",
                    "intent: intent says unit_test_behavior",
                    "risk: risk says safe_to_optimize",
                    "3 agent(s) agree on optimize_persistence: create(:user) -> build_stubbed(:user)"),
                second.explanation());
        }

        @Test
        @DisplayName("generative verdicts follow the rule-based ones in registry order")
        void generativeAfterRuleBased() {
            Verdict llmFactory = Verdict.of("llm_factory", AgentKind.FACTORY, VerdictType.NO_ACTION,
                Confidence.LOW, "llm factory", Map.of());
            Verdict llmDatabase = Verdict.of("llm_database", AgentKind.DATABASE, VerdictType.NO_ACTION,
                Confidence.LOW, "llm database", Map.of());
            Recommendation rec = compute(
                llmFactory,
                verdict(AgentKind.RISK, VerdictType.SAFE_TO_OPTIMIZE, Confidence.HIGH),
                abstain(AgentKind.DATABASE),
                llmDatabase,
                stubbedUser(Confidence.HIGH),
                verdict(AgentKind.INTENT, VerdictType.UNIT_TEST_BEHAVIOR, Confidence.HIGH));

            assertEquals(List.of("database", "factory", "intent", "risk", "llm_factory", "llm_database"),
                rec.agentResults().stream().map(Verdict::agentName).toList());
        }
    }
}
