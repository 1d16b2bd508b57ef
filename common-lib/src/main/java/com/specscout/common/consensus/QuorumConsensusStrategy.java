package com.specscout.common.consensus;

import com.specscout.common.model.AgentKind;
import com.specscout.common.model.Confidence;
import com.specscout.common.model.Recommendation;
import com.specscout.common.model.RecommendationAction;
import com.specscout.common.model.Stance;
import com.specscout.common.model.StrategyChange;
import com.specscout.common.model.Verdict;
import com.specscout.common.model.VerdictType;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Conservative {@link ConsensusEngine}: optimization needs a quorum and no dissent.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li><b>Veto</b>: any {@link Stance#VETO} verdict (a detected behavioural risk, at any
 *       confidence) forces {@code no_action}/{@code low}; its reasoning is quoted verbatim.</li>
 *   <li><b>Aggregation</b>: remaining verdicts are split into supporters and opposers of the
 *       "optimize persistence" direction; abstentions are ignored.</li>
 *   <li><b>Quorum</b>: at least {@value #QUORUM} distinct supporting agents and zero opposers.
 *       Mixed signals are never resolved by majority: they yield {@code no_action}/{@code low}
 *       and name the conflicting agents.</li>
 *   <li><b>Confidence</b>: {@code high} only if every supporter reported high, {@code medium}
 *       if the weakest supporter reported medium, otherwise {@code low}.</li>
 *   <li><b>Action</b>: {@code replace_factory_strategy} when a supporting factory verdict
 *       carries a concrete {@link StrategyChange}; otherwise {@code no_action}/{@code low}.</li>
 *   <li><b>Explanation</b>: contributing reasoning in database → factory → intent → risk order,
 *       then generative agents in registry order, then a summary line.</li>
 * </ol>
 *
 * <p>Malformed verdicts are dropped from both the decision and the audit trail.
 * This class is stateless and thread-safe.
 */
public class QuorumConsensusStrategy implements ConsensusEngine {

    /** Minimum number of distinct agents that must support a direction. */
    public static final int QUORUM = 2;

    public static final String DIRECTION = "optimize_persistence";

    /**
     * Rule-based agents (named after their kind) in kind order, then every other agent
     * after them in the order it was handed in.
     */
    private static final Comparator<Verdict> CANONICAL_ORDER =
        Comparator.comparingInt(QuorumConsensusStrategy::orderKey);

    @Override
    public Recommendation compute(String specLocation, List<Verdict> verdicts) {
        List<Verdict> present = verdicts == null ? List.of()
           : verdicts.stream().filter(Objects::nonNull).toList();
        List<Verdict> wellFormed = present.stream().filter(Verdict::wellFormed).toList();

        if (wellFormed.isEmpty()) {
            return Recommendation.noAction(specLocation,
                List.of("No valid agent results available for analysis"), List.of());
        }

        // Stable sort: generative agents keep their registry order.
        List<Verdict> ordered = wellFormed.stream().sorted(CANONICAL_ORDER).toList();
        int dropped = present.size() - wellFormed.size();

        List<Verdict> vetoes = withStance(ordered, Stance.VETO);
        if (!vetoes.isEmpty()) {
            List<String> explanation = reasoningOf(vetoes);
            explanation.add("Optimization vetoed: behavioural risk flagged by " + names(vetoes));
            return noAction(specLocation, explanation, ordered, dropped);
        }

        List<Verdict> supporters = withStance(ordered, Stance.SUPPORT);
        List<Verdict> opposers   = withStance(ordered, Stance.OPPOSE);

        if (!supporters.isEmpty() && !opposers.isEmpty()) {
            List<String> explanation = new ArrayList<>();
            explanation.add("Conflicting signals: " + names(supporters) + " support " + DIRECTION
                + " but " + names(opposers) + " oppose it");
            explanation.addAll(reasoningOf(ordered.stream()
                .filter(v -> v.stance() == Stance.SUPPORT || v.stance() == Stance.OPPOSE)
                .toList()));
            explanation.add("No action: mixed signals need manual review");
            return noAction(specLocation, explanation, ordered, dropped);
        }

        if (!opposers.isEmpty()) {
            List<String> explanation = reasoningOf(opposers);
            explanation.add(distinctAgents(opposers).size() + " agent(s) oppose " + DIRECTION
                + ", none support it");
            return noAction(specLocation, explanation, ordered, dropped);
        }

        int agreeing = distinctAgents(supporters).size();
        if (agreeing < QUORUM) {
            List<String> explanation = reasoningOf(supporters);
            explanation.add("Insufficient agreement: " + agreeing + " agent(s) support " + DIRECTION
                + ", at least " + QUORUM + " required");
            return noAction(specLocation, explanation, ordered, dropped);
        }

        StrategyChange change = supporters.stream()
            .filter(v -> v.kind() == AgentKind.FACTORY
                && v.verdict() == VerdictType.PREFER_BUILD_STUBBED
                && v.suggestedChange() != null)
            .map(Verdict::suggestedChange)
            .findFirst()
            .orElse(null);

        List<String> explanation = reasoningOf(supporters);
        if (change == null) {
            explanation.add(agreeing + " agent(s) agree on " + DIRECTION
                + ", but no concrete factory change is available");
            return noAction(specLocation, explanation, ordered, dropped);
        }

        explanation.add(agreeing + " agent(s) agree on " + DIRECTION + ": "
            + change.fromValue() + " -> " + change.toValue());
        appendDropped(explanation, dropped);
        return new Recommendation(specLocation, RecommendationAction.REPLACE_FACTORY_STRATEGY,
            change.fromValue(), change.toValue(), deriveConfidence(supporters), explanation, ordered);
    }

    private Confidence deriveConfidence(List<Verdict> supporters) {
        boolean anyLow = supporters.stream().anyMatch(v -> v.confidence() == Confidence.LOW);
        if (anyLow) return Confidence.LOW;
        boolean allHigh = supporters.stream().allMatch(v -> v.confidence() == Confidence.HIGH);
        return allHigh ? Confidence.HIGH: Confidence.MEDIUM;
    }

    private Recommendation noAction(String specLocation, List<String> explanation,
                                    List<Verdict> trail, int dropped) {
        appendDropped(explanation, dropped);
        return Recommendation.noAction(specLocation, explanation, trail);
    }

    private static void appendDropped(List<String> explanation, int dropped) {
        if (dropped > 0) {
            explanation.add("Ignored " + dropped + " malformed agent result(s)");
        }
    }

    private static List<Verdict> withStance(List<Verdict> verdicts, Stance stance) {
        return verdicts.stream().filter(v -> v.stance() == stance).toList();
    }

    private static List<String> reasoningOf(List<Verdict> verdicts) {
        List<String> lines = new ArrayList<>();
        for (Verdict v: verdicts) {
            if (!v.reasoning().isBlank()) {
                lines.add(v.agentName() + ": " + v.reasoning());
            }
        }
        return lines;
    }

    private static Set<String> distinctAgents(List<Verdict> verdicts) {
        return verdicts.stream().map(Verdict::agentName)
            .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private static String names(List<Verdict> verdicts) {
        return String.join(", ", distinctAgents(verdicts));
    }

    private static int orderKey(Verdict verdict) {
        return verdict.kind().id().equals(verdict.agentName())
            ? verdict.kind().ordinal()
            : AgentKind.values().length;
    }
}
