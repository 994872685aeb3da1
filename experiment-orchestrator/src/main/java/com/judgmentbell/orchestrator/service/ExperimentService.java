package com.judgmentbell.orchestrator.service;

import com.judgmentbell.common.design.DesignGenerator;
import com.judgmentbell.common.design.DesignParameters;
import com.judgmentbell.common.design.TrialDesign;
import com.judgmentbell.common.design.TrialRequest;
import com.judgmentbell.common.exception.ExperimentException;
import com.judgmentbell.common.format.DesignManifest;
import com.judgmentbell.common.format.ResultRecord;
import com.judgmentbell.common.trace.RunContextUtil;
import com.judgmentbell.common.verdict.VerdictExtraction;
import com.judgmentbell.common.verdict.VerdictExtractor;
import com.judgmentbell.orchestrator.logger.ExperimentFlowLogger;
import com.judgmentbell.orchestrator.oracle.BatchHandle;
import com.judgmentbell.orchestrator.oracle.BatchStatus;
import com.judgmentbell.orchestrator.oracle.JudgmentOracle;
import com.judgmentbell.orchestrator.oracle.OracleOutcome;
import com.judgmentbell.orchestrator.oracle.OracleRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;

/**
 * Drives experiment runs through design → submit → poll → collect.
 *
 * <p>Runs are held in memory keyed by run id. Past {@code experiment.max-retained-runs},
 * designing a new run evicts the oldest finished runs, then the oldest never-submitted ones;
 * a run with a batch in flight is never evicted. Every oracle interaction is a non-blocking
 * {@code Mono} carrying the run id in its Reactor Context for the stage logger.
 *
 * <p>Collection is tolerant: a request whose outcome is missing or failed becomes a result
 * record with verdict 0 and an error, so the result set always covers the whole design.
 */
@Service
public class ExperimentService {

    private static final Logger log = LoggerFactory.getLogger(ExperimentService.class);

    static final String MISSING_RESULT = "No result returned by oracle";

    private final DesignGenerator generator;
    private final JudgmentOracle oracle;
    private final VerdictExtractor extractor;
    private final ExperimentFlowLogger flowLogger;
    private final Duration pollInterval;
    private final Duration maxWait;
    private final int maxRetainedRuns;

    private final Map<String, RunState> runs = new ConcurrentHashMap<>();

    public ExperimentService(DesignGenerator generator,
                             JudgmentOracle oracle,
                             VerdictExtractor extractor,
                             ExperimentFlowLogger flowLogger,
                             @Value("${oracle.poll-interval-ms:30000}") long pollIntervalMs,
                             @Value("${oracle.max-wait-ms:86400000}") long maxWaitMs,
                             @Value("${experiment.max-retained-runs:256}") int maxRetainedRuns) {
        this.generator = generator;
        this.oracle = oracle;
        this.extractor = extractor;
        this.flowLogger = flowLogger;
        this.pollInterval = Duration.ofMillis(pollIntervalMs);
        this.maxWait = Duration.ofMillis(maxWaitMs);
        this.maxRetainedRuns = maxRetainedRuns;
    }

    public String oracleName() {
        return oracle.name();
    }

    // ── design ───────────────────────────────────────────────────────────────

    public Mono<RunState> design(DesignParameters params) {
        return Mono.fromCallable(() -> {
            TrialDesign design = generator.generate(params);
            String runId = "run_" + UUID.randomUUID().toString().substring(0, 8);
            RunState state = new RunState(runId, design, DesignManifest.of(design, Instant.now()));
            runs.put(runId, state);
            evictRetiredRuns(runId);
            flowLogger.logWithRunId(ExperimentFlowLogger.DESIGN_RENDERED, runId,
                "requests=" + design.requests().size() + " skipped=" + design.skippedConfigurations()
                + " auditHash=" + design.auditHash());
            return state;
        });
    }

    /**
     * @throws ExperimentException with {@code UNKNOWN_RUN} when no run has this id
     */
    public RunState run(String runId) {
        RunState state = runs.get(runId);
        if (state == null) {
            throw new ExperimentException(runId, ExperimentException.Reason.UNKNOWN_RUN, "Unknown run");
        }
        return state;
    }

    // ── submit / poll ────────────────────────────────────────────────────────

    public Mono<BatchHandle> submit(String runId) {
        Mono<BatchHandle> pipeline = Mono.defer(() -> {
            RunState state = run(runId);
            List<TrialRequest> trialRequests = state.getDesign().requests();
            if (trialRequests.isEmpty()) {
                return Mono.error(new ExperimentException(runId, ExperimentException.Reason.INVALID_STATE,
                    "Design has no requests; every configuration was skipped"));
            }
            if (!state.claimSubmission()) {
                return Mono.error(new ExperimentException(runId, ExperimentException.Reason.INVALID_STATE,
                    "Run already submitted"));
            }
            List<OracleRequest> requests = trialRequests.stream().map(OracleRequest::from).toList();
            return oracle.submit(requests)
                .doOnNext(state::submitted)
                .onErrorMap(e -> !(e instanceof ExperimentException), e -> {
                    state.releaseSubmission();
                    log.error("[Experiment] Batch submission failed. runId={} reason={}", runId, e.getMessage());
                    return new ExperimentException(runId, ExperimentException.Reason.ORACLE_FAILURE,
                        "Batch submission failed: " + e.getMessage(), e);
                });
        }).doOnEach(flowLogger.stage(ExperimentFlowLogger.BATCH_SUBMITTED));
        return RunContextUtil.withRunId(pipeline, runId);
    }

    public Mono<BatchStatus> poll(String runId) {
        Mono<BatchStatus> pipeline = Mono.defer(() -> {
            RunState state = requireSubmitted(runId);
            return oracle.poll(state.getHandle())
                .doOnNext(state::polled)
                .onErrorMap(e -> !(e instanceof ExperimentException), e ->
                    new ExperimentException(runId, ExperimentException.Reason.ORACLE_FAILURE,
                        "Batch poll failed: " + e.getMessage(), e));
        }).doOnEach(flowLogger.stage(ExperimentFlowLogger.BATCH_POLLED));
        return RunContextUtil.withRunId(pipeline, runId);
    }

    // ── collect ──────────────────────────────────────────────────────────────

    public Mono<CollectedResults> collect(String runId) {
        Mono<CollectedResults> pipeline = Mono.defer(() -> {
            RunState state = requireSubmitted(runId);
            return oracle.retrieve(state.getHandle())
                .collectList()
                .doOnEach(flowLogger.stage(ExperimentFlowLogger.RESULTS_RETRIEVED))
                .map(outcomes -> toResultSet(state, outcomes))
                .doOnNext(collected -> state.collected(collected.results()))
                .doOnEach(flowLogger.stage(ExperimentFlowLogger.VERDICTS_EXTRACTED))
                .onErrorMap(e -> !(e instanceof ExperimentException), e ->
                    new ExperimentException(runId, ExperimentException.Reason.ORACLE_FAILURE,
                        "Result retrieval failed: " + e.getMessage(), e));
        });
        return RunContextUtil.withRunId(pipeline, runId);
    }

    /**
     * Polls every {@code oracle.poll-interval-ms} until the batch has ended, then collects.
     * A batch still running after {@code oracle.max-wait-ms} is reported as an invalid state.
     */
    public Mono<CollectedResults> awaitAndCollect(String runId) {
        Mono<CollectedResults> pipeline = Mono.defer(() -> {
            requireSubmitted(runId);
            return Flux.interval(Duration.ZERO, pollInterval)
                .concatMap(tick -> poll(runId))
                .filter(BatchStatus::ended)
                .next()
                .timeout(maxWait)
                .onErrorMap(TimeoutException.class, e ->
                    new ExperimentException(runId, ExperimentException.Reason.INVALID_STATE,
                        "Batch still in progress after " + maxWait.toMillis() + " ms"))
                .flatMap(status -> {
                    if (status.state() == BatchStatus.State.FAILED) {
                        return Mono.error(new ExperimentException(runId, ExperimentException.Reason.ORACLE_FAILURE,
                            "Oracle reported batch failure"));
                    }
                    return collect(runId);
                });
        });
        return RunContextUtil.withRunId(pipeline, runId);
    }

    CollectedResults toResultSet(RunState state, List<OracleOutcome> outcomes) {
        Map<String, OracleOutcome> byId = new HashMap<>();
        for (OracleOutcome outcome : outcomes) {
            if (outcome.identifier() != null) byId.put(outcome.identifier(), outcome);
        }

        Map<String, ResultRecord> results = new LinkedHashMap<>();
        int resolved = 0;
        int failed = 0;
        int missing = 0;
        for (TrialRequest request : state.getDesign().requests()) {
            OracleOutcome outcome = byId.remove(request.identifier());
            ResultRecord record;
            if (outcome == null) {
                missing++;
                record = new ResultRecord(0, request.condition(), null, MISSING_RESULT);
            } else if (!outcome.isSuccess()) {
                failed++;
                record = new ResultRecord(0, request.condition(), null, outcome.error());
            } else {
                VerdictExtraction extraction = extractor.extract(outcome.text());
                if (extraction.isResolved()) resolved++; else failed++;
                record = new ResultRecord(extraction.verdict().legacyValue(), request.condition(),
                                          outcome.text(), extraction.diagnostic());
            }
            results.put(request.identifier(), record);
        }
        if (!byId.isEmpty()) {
            log.warn("[Experiment] Ignoring outcomes for unknown identifiers. runId={} count={}",
                     state.getRunId(), byId.size());
        }

        log.info("[Experiment] Results collected. runId={} requests={} resolved={} failed={} missing={}",
                 state.getRunId(), results.size(), resolved, failed, missing);
        return new CollectedResults(state.getRunId(), oracle.name(), results.size(),
                                    resolved, failed, missing, results);
    }

    private void evictRetiredRuns(String keepRunId) {
        int excess = runs.size() - maxRetainedRuns;
        if (excess <= 0) return;

        List<RunState> retired = runs.values().stream()
            .filter(r -> !r.getRunId().equals(keepRunId))
            .filter(r -> r.isFinished() || r.isIdle())
            .sorted(Comparator.comparing((RunState r) -> !r.isFinished())
                              .thenComparing(RunState::getUpdatedAt))
            .limit(excess)
            .toList();
        retired.forEach(r -> runs.remove(r.getRunId()));

        if (retired.size() < excess) {
            log.warn("[Experiment] Retained runs above limit; remaining runs are in flight. retained={} limit={}",
                     runs.size(), maxRetainedRuns);
        } else {
            log.info("[Experiment] Evicted retired runs. count={} retained={}", retired.size(), runs.size());
        }
    }

    private RunState requireSubmitted(String runId) {
        RunState state = run(runId);
        if (!state.isSubmitted()) {
            throw new ExperimentException(runId, ExperimentException.Reason.INVALID_STATE, "Run not submitted");
        }
        return state;
    }
}
