package com.judgmentbell.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

/**
 * Run id and lifecycle stage for experiment pipelines.
 *
 * <p>The run id travels in the Reactor Context, attached once per pipeline. The stage is
 * known only where a stage is logged, so it is never stored in the context. Both reach the
 * log line through MDC, set for the duration of one logging action and then cleared:
 * <pre>
 *     return RunContextUtil.withRunId(pipeline, runId);
 *     ...
 *     RunContextUtil.logStage(runId, "BATCH_SUBMITTED", () -> log.info(...));
 * </pre>
 */
public final class RunContextUtil {

    public static final String RUN_ID_KEY = "runId";
    public static final String STAGE_KEY = "runStage";

    static final String UNKNOWN_RUN = "unknown";

    private RunContextUtil() {}

    /**
     * Stores {@code runId} in the Reactor Context. {@code contextWrite} propagates upstream,
     * so call this at the end of pipeline assembly. An id already present downstream wins.
     */
    public static <T> Mono<T> withRunId(Mono<T> mono, String runId) {
        return mono.contextWrite(ctx -> ctx.hasKey(RUN_ID_KEY) ? ctx : ctx.put(RUN_ID_KEY, runId));
    }

    public static String getRunId(ContextView ctx) {
        return ctx.getOrDefault(RUN_ID_KEY, UNKNOWN_RUN);
    }

    /**
     * Runs {@code logAction} with the run id and stage in MDC. Previous MDC values for the
     * two keys are restored afterwards, so nested stage logs do not clear the outer run.
     */
    public static void logStage(String runId, String stage, Runnable logAction) {
        String previousRun = MDC.get(RUN_ID_KEY);
        String previousStage = MDC.get(STAGE_KEY);
        MDC.put(RUN_ID_KEY, runId == null ? UNKNOWN_RUN : runId);
        MDC.put(STAGE_KEY, stage);
        try {
            logAction.run();
        } finally {
            restore(RUN_ID_KEY, previousRun);
            restore(STAGE_KEY, previousStage);
        }
    }

    private static void restore(String key, String previous) {
        if (previous == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, previous);
        }
    }
}
