package com.creditsim.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

/**
 * Carries the run identifier through reactive tick pipelines.
 *
 * <p>Reactor Context holds {@code runId}; MDC is written only for the duration of a
 * single log action and removed right after.
 */
public final class RunContextUtil {

    public static final String RUN_ID_KEY = "runId";

    private RunContextUtil() {}

    public static <T> Mono<T> withRunId(Mono<T> mono, String runId) {
        return mono.contextWrite(ctx -> ctx.put(RUN_ID_KEY, runId));
    }

    public static String getRunId(ContextView ctx) {
        return ctx.getOrDefault(RUN_ID_KEY, "unknown");
    }

    /** Bridges {@code runId} into MDC around {@code logAction}. */
    public static void withMdc(String runId, Runnable logAction) {
        MDC.put(RUN_ID_KEY, runId);
        try {
            logAction.run();
        } finally {
            MDC.remove(RUN_ID_KEY);
        }
    }
}
