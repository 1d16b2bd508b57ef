package com.specscout.analysis.logger;

import com.specscout.common.model.Recommendation;
import com.specscout.common.safety.EnforcementOutcome;
import com.specscout.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Logs the stages of one analysis call. Pure side effects; never alters the pipeline.
 *
 * <p>Stages, in order:
 * <ol>
 *   <li>{@link #ANALYSIS_REQUESTED}: profile accepted, configuration validated</li>
 *   <li>{@link #AGENTS_COMPLETED}: every enabled agent produced a verdict</li>
 *   <li>{@link #CONSENSUS_REACHED}: recommendation computed</li>
 *   <li>{@link #ENFORCEMENT_EVALUATED}: batch exit status decided</li>
 * </ol>
 *
 * <pre>
 *     .doOnEach(flowLogger.stage(AnalysisFlowLogger.AGENTS_COMPLETED))
 * </pre>
 */
@Component
public class AnalysisFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(AnalysisFlowLogger.class);

    public static final String ANALYSIS_REQUESTED    = "ANALYSIS_REQUESTED";
    public static final String AGENTS_COMPLETED      = "AGENTS_COMPLETED";
    public static final String CONSENSUS_REACHED     = "CONSENSUS_REACHED";
    public static final String ENFORCEMENT_EVALUATED = "ENFORCEMENT_EVALUATED";

    /**
     * Returns a {@code doOnEach} consumer logging {@code stageName} on each {@code onNext},
     * with the trace id read from the Reactor Context of the signal.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String traceId = TraceContextUtil.getTraceId(signal.getContextView());
            TraceContextUtil.withMdc(traceId, () ->
                log.info("[AnalysisFlow] stage={} traceId={}", stageName, traceId)
            );
        };
    }

    public void logRecommendation(Recommendation recommendation, String traceId) {
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[AnalysisFlow] stage={} location={} action={} confidence={} agents={} traceId={}",
                CONSENSUS_REACHED,
                recommendation.specLocation(),
                recommendation.action().value(),
                recommendation.confidence().value(),
                recommendation.agentResults().size(),
                traceId)
        );
    }

    public void logEnforcement(EnforcementOutcome outcome, String traceId) {
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[AnalysisFlow] stage={} exitStatus={} qualifying={} traceId={}",
                ENFORCEMENT_EVALUATED, outcome.exitStatus(), outcome.qualifying().size(), traceId)
        );
    }
}
