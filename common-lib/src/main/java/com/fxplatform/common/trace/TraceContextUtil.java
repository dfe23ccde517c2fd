package com.fxplatform.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.util.UUID;

/**
 * Carries the ingestion {@code cycleId} (or stream connection id) through Reactor pipelines.
 *
 * <p>The Reactor Context holds the id. MDC is written only for the duration of a single log
 * statement through {@link #withMdc}, never left on a pooled thread.
 *
 * <pre>
 *     return TraceContextUtil.withCycleId(runCycle(), cycleId);
 *     ...
 *     .doOnEach(signal -&gt; TraceContextUtil.withMdc(TraceContextUtil.getCycleId(signal.getContextView()),
 *                                                 () -&gt; log.info("...")))
 * </pre>
 */
public final class TraceContextUtil {

    public static final String CYCLE_ID_KEY = "cycleId";

    private TraceContextUtil() {}

    /** Short random id, enough to correlate one cycle's log lines. */
    public static String newCycleId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    public static <T> Mono<T> withCycleId(Mono<T> mono, String cycleId) {
        return mono.contextWrite(ctx -> ctx.put(CYCLE_ID_KEY, cycleId));
    }

    public static <T> Flux<T> withCycleId(Flux<T> flux, String cycleId) {
        return flux.contextWrite(ctx -> ctx.put(CYCLE_ID_KEY, cycleId));
    }

    /** Returns {@code "none"} when no id was written upstream. */
    public static String getCycleId(ContextView ctx) {
        return ctx.getOrDefault(CYCLE_ID_KEY, "none");
    }

    public static void withMdc(String cycleId, Runnable logAction) {
        MDC.put(CYCLE_ID_KEY, cycleId);
        try {
            logAction.run();
        } finally {
            MDC.remove(CYCLE_ID_KEY);
        }
    }
}
