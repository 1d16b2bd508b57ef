package com.specscout.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.util.UUID;

/**
 * Carries the trace id of an analysis call through reactive pipelines.
 *
 * <p>Reactor Context is the single source of truth for the trace id. MDC is written only
 * as a temporary bridge around a log statement. The trace id is audit data: it never
 * reaches agents or the consensus engine.
 *
 * <pre>
 *     return TraceContextUtil.withTraceId(pipeline, traceId);
 * </pre>
 */
public final class TraceContextUtil {

    public static final String TRACE_ID_KEY = "traceId";

    private TraceContextUtil() {}

    public static String newTraceId() {
        return UUID.randomUUID().toString();
    }

    /** Returns {@code traceId} when present, a fresh id otherwise. */
    public static String orNew(String traceId) {
        return traceId == null || traceId.isBlank() ? newTraceId() : traceId;
    }

    public static <T> Mono<T> withTraceId(Mono<T> mono, String traceId) {
        return mono.contextWrite(ctx -> ctx.put(TRACE_ID_KEY, traceId));
    }

    /** Returns {@code "unknown"} if the context carries no trace id. */
    public static String getTraceId(ContextView ctx) {
        return ctx.getOrDefault(TRACE_ID_KEY, "unknown");
    }

    /** Bridges {@code traceId} into MDC for the duration of {@code logAction} only. */
    public static void withMdc(String traceId, Runnable logAction) {
        MDC.put(TRACE_ID_KEY, traceId);
        try {
            logAction.run();
        } finally {
            MDC.remove(TRACE_ID_KEY);
        }
    }
}
