package com.aerox.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.util.UUID;

/**
 * Reactive trace-id propagation.
 *
 * <p>The Reactor Context carries the trace id through a pipeline. MDC is written only for the
 * duration of a single log statement via {@link #withMdc}, never left populated on a thread.
 *
 * <pre>
 *     return TraceContextUtil.withTraceId(pipeline, traceId);
 *     ...
 *     .doOnEach(signal -> TraceContextUtil.getTraceId(signal.getContextView()))
 * </pre>
 */
public final class TraceContextUtil {

    public static final String TRACE_ID_KEY    = "traceId";
    public static final String TRACE_ID_HEADER = "X-Trace-Id";

    private TraceContextUtil() {}

    public static String newTraceId() {
        return UUID.randomUUID().toString();
    }

    /** Returns {@code candidate} if it is usable as a trace id, otherwise a fresh one. */
    public static String resolve(String candidate) {
        return candidate == null || candidate.isBlank() ? newTraceId() : candidate.trim();
    }

    /**
     * Stores {@code traceId} in the Reactor Context of {@code mono}.
     * {@code contextWrite} propagates upstream, so apply it at the end of assembly.
     */
    public static <T> Mono<T> withTraceId(Mono<T> mono, String traceId) {
        return mono.contextWrite(ctx -> ctx.put(TRACE_ID_KEY, traceId));
    }

    /** Trace id from the context, {@code "unknown"} when absent. Never null. */
    public static String getTraceId(ContextView ctx) {
        return ctx.getOrDefault(TRACE_ID_KEY, "unknown");
    }

    /** Runs {@code logAction} with {@code traceId} in MDC, removing it afterwards. */
    public static void withMdc(String traceId, Runnable logAction) {
        MDC.put(TRACE_ID_KEY, traceId);
        try {
            logAction.run();
        } finally {
            MDC.remove(TRACE_ID_KEY);
        }
    }
}
