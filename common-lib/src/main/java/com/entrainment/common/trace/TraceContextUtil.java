package com.entrainment.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.util.UUID;

/**
 * Carries the request trace id through a reactive validation call.
 *
 * <p>The Reactor Context owns the trace id. MDC is filled only for the duration of a
 * single log statement, so a pooled thread never keeps a stale id.
 *
 * <pre>
 *     String traceId = TraceContextUtil.resolve(request.getHeaders().getFirst(TRACE_HEADER));
 *     return TraceContextUtil.withTraceId(pipeline, traceId);
 * </pre>
 */
public final class TraceContextUtil {

    public static final String TRACE_ID_KEY = "traceId";
    public static final String TRACE_HEADER = "X-Trace-Id";
    public static final String UNKNOWN      = "unknown";

    private TraceContextUtil() {}

    /** The caller's trace id, or a fresh one when the header was absent or blank. */
    public static String resolve(String headerValue) {
        return headerValue == null || headerValue.isBlank() ? UUID.randomUUID().toString() : headerValue.trim();
    }

    /** Call last during assembly; {@code contextWrite} applies upstream. */
    public static <T> Mono<T> withTraceId(Mono<T> mono, String traceId) {
        return mono.contextWrite(ctx -> ctx.put(TRACE_ID_KEY, traceId));
    }

    /** @return the trace id, never {@code null} */
    public static String getTraceId(ContextView ctx) {
        return ctx.getOrDefault(TRACE_ID_KEY, UNKNOWN);
    }

    /** Runs {@code logAction} with the trace id in MDC and clears it afterwards. */
    public static void withMdc(String traceId, Runnable logAction) {
        MDC.put(TRACE_ID_KEY, traceId);
        try {
            logAction.run();
        } finally {
            MDC.remove(TRACE_ID_KEY);
        }
    }
}
