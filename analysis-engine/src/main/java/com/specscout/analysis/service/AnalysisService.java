package com.specscout.analysis.service;

import com.specscout.analysis.dto.BatchAnalysisResponse;
import com.specscout.analysis.logger.AnalysisFlowLogger;
import com.specscout.common.consensus.ConsensusEngine;
import com.specscout.common.model.ProfileRecord;
import com.specscout.common.model.Recommendation;
import com.specscout.common.safety.AnalysisConfig;
import com.specscout.common.safety.EnforcementOutcome;
import com.specscout.common.safety.EnforcementPolicy;
import com.specscout.common.safety.SafetyPolicy;
import com.specscout.common.safety.SpecFileMutationGuard;
import com.specscout.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Entry point of an analysis call: validate configuration, dispatch agents, reach consensus.
 * The configuration is passed in on every call; the service holds no per-run state.
 */
public class AnalysisService {

    private static final Logger log = LoggerFactory.getLogger(AnalysisService.class);

    static final int BATCH_CONCURRENCY = 4;

    private final AgentDispatchService dispatchService;
    private final ConsensusEngine consensusEngine;
    private final AnalysisFlowLogger flowLogger;
    private final Path specRoot;

    public AnalysisService(AgentDispatchService dispatchService, ConsensusEngine consensusEngine,
                           AnalysisFlowLogger flowLogger, Path specRoot) {
        this.dispatchService = dispatchService;
        this.consensusEngine = consensusEngine;
        this.flowLogger = flowLogger;
        this.specRoot = specRoot;
    }

    /**
     * Analyzes one profile.
     *
     * @return the recommendation; errors with {@code UnsafeConfigurationException} before any
     *         agent runs when {@code config} is unsafe
     */
    public Mono<Recommendation> analyze(ProfileRecord profile, AnalysisConfig config, String traceId) {
        String resolvedTraceId = TraceContextUtil.orNew(traceId);
        Mono<Recommendation> pipeline = Mono.defer(() -> {
                SafetyPolicy.validate(config);
                return analyzeValidated(profile, config, resolvedTraceId);
            });
        return TraceContextUtil.withTraceId(pipeline, resolvedTraceId);
    }

    /**
     * Analyzes profiles concurrently, keeping input order, and evaluates enforcement over the
     * results. Spec files named by the profiles are checked for modification during the run.
     */
    public Mono<BatchAnalysisResponse> analyzeBatch(List<ProfileRecord> profiles, AnalysisConfig config,
                                                    String traceId) {
        String resolvedTraceId = TraceContextUtil.orNew(traceId);
        Mono<BatchAnalysisResponse> pipeline = Mono.defer(() -> {
            SafetyPolicy.validate(config);
            List<ProfileRecord> batch = profiles == null ? List.of() : profiles.stream().filter(Objects::nonNull).toList();
            SpecFileMutationGuard guard = SpecFileMutationGuard.snapshot(
                batch.stream().map(profile -> specFile(profile.location())).filter(Objects::nonNull).toList());
            log.info("[AnalysisService] Batch of {} profiles, monitoring {} spec files traceId={}",
                batch.size(), guard.monitoredCount(), resolvedTraceId);

            return Flux.fromIterable(batch)
                .flatMapSequential(profile -> analyzeValidated(profile, config, resolvedTraceId), BATCH_CONCURRENCY)
                .collectList()
                .map(recommendations -> {
                    guard.verifyUnchanged();
                    EnforcementOutcome outcome = EnforcementPolicy.evaluate(recommendations, config);
                    flowLogger.logEnforcement(outcome, resolvedTraceId);
                    return new BatchAnalysisResponse(resolvedTraceId, recommendations, outcome,
                        SafetyPolicy.status(config));
                });
        });
        return TraceContextUtil.withTraceId(pipeline, resolvedTraceId);
    }

    private Mono<Recommendation> analyzeValidated(ProfileRecord profile, AnalysisConfig config, String traceId) {
        return Mono.just(profile)
            .doOnEach(flowLogger.stage(AnalysisFlowLogger.ANALYSIS_REQUESTED))
            .flatMap(p -> dispatchService.dispatchAll(p, config))
            .doOnEach(flowLogger.stage(AnalysisFlowLogger.AGENTS_COMPLETED))
            .map(verdicts -> consensusEngine.compute(profile.location(), verdicts))
            .doOnNext(recommendation -> flowLogger.logRecommendation(recommendation, traceId));
    }

    /** {@code spec/models/user_spec.rb:42} resolves to the spec file under the spec root. */
    Path specFile(String location) {
        if (specRoot == null || location == null || location.isBlank()) return null;
        String file = location.replaceFirst("(:\\d+|\\[[\\d:]+])$", "");
        return specRoot.resolve(file).normalize();
    }
}
