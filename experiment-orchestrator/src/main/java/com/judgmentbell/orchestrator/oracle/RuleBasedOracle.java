package com.judgmentbell.orchestrator.oracle;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.judgmentbell.common.model.Axis;
import com.judgmentbell.common.model.Party;
import com.judgmentbell.common.model.TrialCondition;
import com.judgmentbell.common.model.Verdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Deterministic control oracle: one fixed verdict per (scenario, party, axis).
 *
 * <p>Every verdict is a function of the measured party's own axis only, so this oracle is a
 * local hidden-variable model and its CHSH value can never exceed 2. Batches end as soon as
 * they are submitted. Used when no API key is configured, and as the classical baseline.
 *
 * <p>Only the most recent {@code maxRetainedBatches} batches are kept; an evicted batch polls
 * as {@link BatchStatus.State#FAILED} and retrieves nothing.
 */
public class RuleBasedOracle implements JudgmentOracle {

    private static final Logger log = LoggerFactory.getLogger(RuleBasedOracle.class);

    static final Map<String, Map<Party, Map<Axis, Verdict>>> RULES = Map.of(
        "mutual_betrayal", Map.of(
            Party.ALPHA, axes(Verdict.GUILTY, Verdict.NOT_GUILTY),
            Party.BETA,  axes(Verdict.GUILTY, Verdict.NOT_GUILTY)),
        "kidney_gift", Map.of(
            Party.ALPHA, axes(Verdict.NOT_GUILTY, Verdict.NOT_GUILTY),
            Party.BETA,  axes(Verdict.NOT_GUILTY, Verdict.GUILTY)),
        "tainted_inheritance", Map.of(
            Party.ALPHA, axes(Verdict.NOT_GUILTY, Verdict.GUILTY),
            Party.BETA,  axes(Verdict.NOT_GUILTY, Verdict.NOT_GUILTY))
    );

    static final int DEFAULT_RETAINED_BATCHES = 64;

    private final ObjectMapper objectMapper;
    private final Map<String, List<OracleRequest>> batches;

    public RuleBasedOracle(ObjectMapper objectMapper) {
        this(objectMapper, DEFAULT_RETAINED_BATCHES);
    }

    public RuleBasedOracle(ObjectMapper objectMapper, int maxRetainedBatches) {
        if (maxRetainedBatches < 1) {
            throw new IllegalArgumentException("maxRetainedBatches must be >= 1: " + maxRetainedBatches);
        }
        this.objectMapper = objectMapper;
        this.batches = Collections.synchronizedMap(new LinkedHashMap<>() {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, List<OracleRequest>> eldest) {
                if (size() <= maxRetainedBatches) return false;
                log.debug("[RuleOracle] Batch evicted. batchId={}", eldest.getKey());
                return true;
            }
        });
    }

    private static Map<Axis, Verdict> axes(Verdict primary, Verdict secondary) {
        Map<Axis, Verdict> byAxis = new EnumMap<>(Axis.class);
        byAxis.put(Axis.PRIMARY, primary);
        byAxis.put(Axis.SECONDARY, secondary);
        return byAxis;
    }

    @Override
    public String name() {
        return "rule-based";
    }

    @Override
    public Mono<BatchHandle> submit(List<OracleRequest> requests) {
        String batchId = "rules_" + UUID.randomUUID();
        batches.put(batchId, List.copyOf(requests));
        log.info("[RuleOracle] Batch accepted. batchId={} requests={}", batchId, requests.size());
        return Mono.just(new BatchHandle(batchId, name(), requests.size(), Instant.now()));
    }

    @Override
    public Mono<BatchStatus> poll(BatchHandle handle) {
        List<OracleRequest> requests = batches.get(handle.batchId());
        if (requests == null) {
            return Mono.just(new BatchStatus(handle.batchId(), BatchStatus.State.FAILED, 0, 0, 0));
        }
        return Mono.just(new BatchStatus(handle.batchId(), BatchStatus.State.ENDED, 0, requests.size(), 0));
    }

    @Override
    public Flux<OracleOutcome> retrieve(BatchHandle handle) {
        List<OracleRequest> requests = batches.getOrDefault(handle.batchId(), List.of());
        List<OracleOutcome> outcomes = new ArrayList<>(requests.size());
        for (OracleRequest request : requests) {
            outcomes.add(judge(request));
        }
        return Flux.fromIterable(outcomes);
    }

    OracleOutcome judge(OracleRequest request) {
        TrialCondition condition = request.condition();
        if (condition == null) {
            return OracleOutcome.failed(request.identifier(), "No condition attached to request");
        }
        Verdict verdict = verdictFor(condition.scenarioId(), condition.subject(), condition.measuredAxis());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("verdict", verdict.label());
        body.put("confidence", 1.0);
        body.put("reasoning", "Fixed rule for " + condition.scenarioId() + " on the "
                              + condition.measuredAxis().label() + " axis.");
        try {
            return OracleOutcome.succeeded(request.identifier(), objectMapper.writeValueAsString(body));
        } catch (JsonProcessingException e) {
            return OracleOutcome.failed(request.identifier(), "Rule response not serializable: " + e.getOriginalMessage());
        }
    }

    static Verdict verdictFor(String scenarioId, Party party, Axis axis) {
        Map<Party, Map<Axis, Verdict>> byParty = RULES.get(scenarioId);
        if (byParty == null) return Verdict.NOT_GUILTY;
        return byParty.get(party).getOrDefault(axis, Verdict.NOT_GUILTY);
    }
}
