package com.dispatchplatform.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Carries a per-unit trace id (one audio chunk, one call, one incident) through reactive
 * pipelines. Reactor Context holds the id; MDC is written only for the duration of a log call.
 *
 * <pre>
 *     return TraceContextUtil.withTraceId(pipeline, TraceContextUtil.newTraceId("nyc"));
 * </pre>
 */
public final class TraceContextUtil {

    public static final String TRACE_ID_KEY = "traceId";
    public static final String CITY_KEY     = "city";

    private TraceContextUtil() {}

    /** Short id prefixed with the city, e.g. {@code nyc-3f2a91c0}. */
    public static String newTraceId(String city) {
        return city + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    public static <T> Mono<T> withTraceId(Mono<T> mono, String traceId) {
        return mono.contextWrite(ctx -> ctx.put(TRACE_ID_KEY, traceId));
    }

    /**
     * Bridges {@code traceId} and {@code city} into MDC for the duration of {@code logAction}.
     * Only for logging side effects.
     */
    public static void withMdc(String traceId, String city, Runnable logAction) {
        MDC.put(TRACE_ID_KEY, traceId);
        MDC.put(CITY_KEY, city);
        try {
            logAction.run();
        } finally {
            MDC.remove(TRACE_ID_KEY);
            MDC.remove(CITY_KEY);
        }
    }
}
