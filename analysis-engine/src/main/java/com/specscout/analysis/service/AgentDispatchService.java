package com.specscout.analysis.service;

import com.specscout.analysis.agent.AnalysisAgent;
import com.specscout.common.exception.AgentException;
import com.specscout.common.model.ProfileRecord;
import com.specscout.common.model.Verdict;
import com.specscout.common.safety.AnalysisConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Agent registry. Runs every enabled agent against a profile in parallel and returns one
 * verdict per agent, in a fixed order: rule-based agents by concern, then generative agents
 * in registration order.
 *
 * <p>An agent that throws, returns nothing, or returns a malformed verdict is replaced by a
 * failed verdict; it never aborts the run or affects the other agents.
 */
@Service
public class AgentDispatchService {

    private static final Logger log = LoggerFactory.getLogger(AgentDispatchService.class);

    private final List<AnalysisAgent> agents;

    public AgentDispatchService(List<AnalysisAgent> agents) {
        this.agents = canonicalOrder(agents);
        log.info("[AgentDispatch] Registered agents={}", agentNames());
    }

    public List<String> agentNames() {
        return agents.stream().map(AnalysisAgent::agentName).toList();
    }

    /** Registered agents enabled by {@code config}, in dispatch order. */
    public List<AnalysisAgent> enabledAgents(AnalysisConfig config) {
        List<AnalysisAgent> enabled = agents.stream()
            .filter(agent -> config.agentEnabled(agent.agentName()))
            .toList();
        Set<String> registered = new HashSet<>(agentNames());
        config.enabledAgents().stream()
            .filter(name -> !registered.contains(name))
            .forEach(name -> log.warn("[AgentDispatch] Enabled agent={} is not registered, skipping", name));
        return enabled;
    }

    public Mono<List<Verdict>> dispatchAll(ProfileRecord profile, AnalysisConfig config) {
        List<AnalysisAgent> selected = enabledAgents(config);
        log.info("Dispatching {} agents in parallel for location={}", selected.size(), profile.location());
        return Flux.fromIterable(selected)
            .flatMapSequential(agent -> Mono.defer(() -> agent.analyzeAsync(profile))
                .subscribeOn(Schedulers.boundedElastic())
                .switchIfEmpty(Mono.fromSupplier(() ->
                    Verdict.failed(agent.agentName(), agent.kind(), "no verdict produced")))
                .map(verdict -> checked(agent, verdict))
                .doOnNext(verdict -> log.info("Agent={} complete. verdict={} confidence={}",
                    agent.agentName(), verdict.verdict().value(), verdict.confidence().value()))
                .onErrorResume(e -> {
                    log.error("Agent={} failed for location={}", agent.agentName(), profile.location(), e);
                    return Mono.just(Verdict.failed(agent.agentName(), agent.kind(), reasonOf(e)));
                }))
            .collectList();
    }

    private static Verdict checked(AnalysisAgent agent, Verdict verdict) {
        if (verdict.wellFormed()) return verdict;
        log.warn("Agent={} returned a malformed verdict: {}", agent.agentName(), verdict);
        return Verdict.failed(agent.agentName(), agent.kind(), "malformed verdict");
    }

    private static String reasonOf(Throwable e) {
        if (e instanceof AgentException agentException) return agentException.reason();
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private static List<AnalysisAgent> canonicalOrder(List<AnalysisAgent> agents) {
        Set<String> names = new HashSet<>();
        for (AnalysisAgent agent : agents) {
            if (!names.add(agent.agentName())) {
                throw new IllegalArgumentException("Duplicate agent name: " + agent.agentName());
            }
        }
        List<AnalysisAgent> ruleBased = new ArrayList<>(agents.stream().filter(a -> !a.generative()).toList());
        ruleBased.sort(Comparator.comparing(AnalysisAgent::kind));
        List<AnalysisAgent> ordered = new ArrayList<>(ruleBased);
        agents.stream().filter(AnalysisAgent::generative).forEach(ordered::add);
        return List.copyOf(ordered);
    }
}
