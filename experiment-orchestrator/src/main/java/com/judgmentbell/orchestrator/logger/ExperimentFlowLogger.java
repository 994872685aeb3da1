package com.judgmentbell.orchestrator.logger;

import com.judgmentbell.common.trace.RunContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Logs the stages of an experiment run without touching the pipeline.
 *
 * <p>Stages, in order:
 * <ol>
 *   <li>{@link #DESIGN_RENDERED}:     trial design generated and run registered</li>
 *   <li>{@link #BATCH_SUBMITTED}:     oracle accepted the batch</li>
 *   <li>{@link #BATCH_POLLED}:        oracle reported progress</li>
 *   <li>{@link #RESULTS_RETRIEVED}:   outcomes fetched from the oracle</li>
 *   <li>{@link #VERDICTS_EXTRACTED}:  outcomes turned into a result set</li>
 * </ol>
 *
 * <pre>
 *     .doOnEach(flowLogger.stage(ExperimentFlowLogger.BATCH_SUBMITTED))
 * </pre>
 */
@Component
public class ExperimentFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(ExperimentFlowLogger.class);

    public static final String DESIGN_RENDERED    = "DESIGN_RENDERED";
    public static final String BATCH_SUBMITTED    = "BATCH_SUBMITTED";
    public static final String BATCH_POLLED       = "BATCH_POLLED";
    public static final String RESULTS_RETRIEVED  = "RESULTS_RETRIEVED";
    public static final String VERDICTS_EXTRACTED = "VERDICTS_EXTRACTED";

    /**
     * {@code doOnEach} consumer reading the run id from the Reactor Context. Fires on
     * {@code onNext} only.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String runId = RunContextUtil.getRunId(signal.getContextView());
            RunContextUtil.logStage(runId, stageName, () ->
                log.info("[ExperimentFlow] stage={} runId={}", stageName, runId)
            );
        };
    }

    public void logWithRunId(String stageName, String runId, String detail) {
        RunContextUtil.logStage(runId, stageName, () ->
            log.info("[ExperimentFlow] stage={} runId={} {}", stageName, runId, detail)
        );
    }
}
