package com.judgmentbell.orchestrator.controller;

import com.judgmentbell.common.design.DesignParameters;
import com.judgmentbell.common.format.DesignManifest;
import com.judgmentbell.orchestrator.oracle.BatchHandle;
import com.judgmentbell.orchestrator.oracle.BatchStatus;
import com.judgmentbell.orchestrator.oracle.SourceSelector;
import com.judgmentbell.orchestrator.service.CollectedResults;
import com.judgmentbell.orchestrator.service.ExperimentService;
import com.judgmentbell.orchestrator.service.RunState;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Experiment run lifecycle.
 *
 * <pre>
 *   POST /api/v1/experiments/design            → register a run from design parameters
 *   POST /api/v1/experiments/{runId}/submit    → send the run's requests to the oracle
 *   GET  /api/v1/experiments/{runId}/status    → run state plus a live poll once submitted
 *   POST /api/v1/experiments/{runId}/collect   → fetch whatever results exist now
 *   POST /api/v1/experiments/{runId}/await     → poll until the batch ends, then collect
 *   GET  /api/v1/experiments/{runId}/manifest  → design manifest for the analysis side
 * </pre>
 */
@RestController
@RequestMapping("/api/v1/experiments")
public class ExperimentController {

    private final ExperimentService experimentService;

    public ExperimentController(ExperimentService experimentService) {
        this.experimentService = experimentService;
    }

    @PostMapping("/design")
    public Mono<ResponseEntity<Map<String, Object>>> design(@RequestBody DesignParameters params) {
        return experimentService.design(params)
            .map(state -> {
                Map<String, Object> body = stateToMap(state);
                body.put("requests", state.getDesign().requests().size());
                body.put("skippedConfigurations", state.getDesign().skippedConfigurations());
                body.put("manifest", state.getManifest());
                return ResponseEntity.status(HttpStatus.CREATED).body(body);
            });
    }

    @PostMapping("/{runId}/submit")
    public Mono<ResponseEntity<Map<String, Object>>> submit(@PathVariable String runId) {
        return experimentService.submit(runId)
            .map(handle -> {
                Map<String, Object> body = stateToMap(experimentService.run(runId));
                body.put("batch", handleToMap(handle));
                return ResponseEntity.accepted().body(body);
            });
    }

    @GetMapping("/{runId}/status")
    public Mono<ResponseEntity<Map<String, Object>>> status(@PathVariable String runId) {
        return Mono.defer(() -> {
            RunState state = experimentService.run(runId);
            if (!state.isSubmitted() || state.getStatus() == RunState.Status.COLLECTED) {
                return Mono.just(ResponseEntity.ok(stateToMap(state)));
            }
            return experimentService.poll(runId)
                .map(poll -> ResponseEntity.ok(stateToMap(state)));
        });
    }

    @PostMapping("/{runId}/collect")
    public Mono<ResponseEntity<CollectedResults>> collect(@PathVariable String runId) {
        return experimentService.collect(runId).map(ResponseEntity::ok);
    }

    @PostMapping("/{runId}/await")
    public Mono<ResponseEntity<CollectedResults>> await(@PathVariable String runId) {
        return experimentService.awaitAndCollect(runId).map(ResponseEntity::ok);
    }

    @GetMapping("/{runId}/manifest")
    public ResponseEntity<DesignManifest> manifest(@PathVariable String runId) {
        return ResponseEntity.ok(experimentService.run(runId).getManifest());
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of(
            "status", "OK",
            "oracle", experimentService.oracleName(),
            "sources", SourceSelector.knownSources()
        ));
    }

    private static Map<String, Object> stateToMap(RunState state) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("runId", state.getRunId());
        map.put("status", state.getStatus().name());
        map.put("auditHash", state.getDesign().auditHash());
        map.put("updatedAt", state.getUpdatedAt().toString());
        if (state.getHandle() != null) {
            map.put("batchId", state.getHandle().batchId());
        }
        BatchStatus poll = state.getLastPoll();
        if (poll != null) {
            map.put("processing", poll.processing());
            map.put("succeeded", poll.succeeded());
            map.put("errored", poll.errored());
        }
        if (state.getErrorMessage() != null) {
            map.put("error", state.getErrorMessage());
        }
        return map;
    }

    private static Map<String, Object> handleToMap(BatchHandle handle) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("batchId", handle.batchId());
        map.put("oracle", handle.oracle());
        map.put("requestCount", handle.requestCount());
        map.put("submittedAt", handle.submittedAt().toString());
        return map;
    }
}
