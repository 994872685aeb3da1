package com.judgmentbell.orchestrator.oracle;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link JudgmentOracle} backed by the Anthropic Message Batches API.
 *
 * <pre>
 *   POST /v1/messages/batches              {"requests": [{"custom_id", "params": {...}}]}
 *   GET  /v1/messages/batches/{id}         processing_status + request_counts
 *   GET  /v1/messages/batches/{id}/results JSONL, one result per line
 * </pre>
 *
 * <p>Each request carries its own model, resolved from the request's source label by
 * {@link SourceSelector}, so one batch can mix sources. Fully non-blocking: every HTTP call
 * is a {@code Mono} composed by the caller.
 */
public class AnthropicBatchOracle implements JudgmentOracle {

    private static final Logger log = LoggerFactory.getLogger(AnthropicBatchOracle.class);

    static final String BATCHES_PATH = "/v1/messages/batches";

    private final WebClient anthropicClient;
    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final int maxTokens;
    private final Duration timeout;
    private final String defaultSource;

    public AnthropicBatchOracle(WebClient anthropicClient, ObjectMapper objectMapper, String apiKey,
                                int maxTokens, Duration timeout, String defaultSource) {
        this.anthropicClient = anthropicClient;
        this.objectMapper = objectMapper;
        this.apiKey = apiKey;
        this.maxTokens = maxTokens;
        this.timeout = timeout;
        this.defaultSource = defaultSource;
    }

    @Override
    public String name() {
        return "anthropic-batch";
    }

    @Override
    public Mono<BatchHandle> submit(List<OracleRequest> requests) {
        return Mono.fromCallable(() -> objectMapper.writeValueAsString(batchBody(requests)))
            .flatMap(body -> anthropicClient.post()
                .uri(BATCHES_PATH)
                .header("x-api-key", apiKey)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(timeout))
            .map(this::readTree)
            .map(json -> new BatchHandle(json.path("id").asText(), name(), requests.size(), Instant.now()))
            .doOnSuccess(h -> log.info("[AnthropicOracle] Batch submitted. batchId={} requests={}",
                                       h.batchId(), h.requestCount()));
    }

    @Override
    public Mono<BatchStatus> poll(BatchHandle handle) {
        return anthropicClient.get()
            .uri(BATCHES_PATH + "/{id}", handle.batchId())
            .header("x-api-key", apiKey)
            .retrieve()
            .bodyToMono(String.class)
            .timeout(timeout)
            .map(this::readTree)
            .map(json -> status(handle.batchId(), json))
            .doOnSuccess(s -> log.debug("[AnthropicOracle] Batch polled. batchId={} state={} succeeded={} errored={}",
                                        s.batchId(), s.state(), s.succeeded(), s.errored()));
    }

    @Override
    public Flux<OracleOutcome> retrieve(BatchHandle handle) {
        return anthropicClient.get()
            .uri(BATCHES_PATH + "/{id}/results", handle.batchId())
            .header("x-api-key", apiKey)
            .retrieve()
            .bodyToMono(String.class)
            .timeout(timeout)
            .flatMapMany(body -> Flux.fromIterable(parseResults(body)))
            .doOnComplete(() -> log.info("[AnthropicOracle] Results retrieved. batchId={}", handle.batchId()));
    }

    // ── request and response mapping ─────────────────────────────────────────

    Map<String, Object> batchBody(List<OracleRequest> requests) {
        List<Map<String, Object>> entries = new ArrayList<>(requests.size());
        for (OracleRequest request : requests) {
            Map<String, Object> params = new LinkedHashMap<>();
            params.put("model", SourceSelector.selectModel(request.source(), defaultSource));
            params.put("max_tokens", maxTokens);
            params.put("messages", List.of(Map.of("role", "user", "content", request.prompt())));

            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("custom_id", request.identifier());
            entry.put("params", params);
            entries.add(entry);
        }
        return Map.of("requests", entries);
    }

    static BatchStatus status(String batchId, JsonNode json) {
        JsonNode counts = json.path("request_counts");
        int errored = counts.path("errored").asInt() + counts.path("canceled").asInt() + counts.path("expired").asInt();
        BatchStatus.State state = switch (json.path("processing_status").asText()) {
            case "ended" -> BatchStatus.State.ENDED;
            case "in_progress", "canceling" -> BatchStatus.State.IN_PROGRESS;
            default -> BatchStatus.State.FAILED;
        };
        return new BatchStatus(batchId, state, counts.path("processing").asInt(),
                               counts.path("succeeded").asInt(), errored);
    }

    /** Parses a JSONL result body; unreadable lines are skipped and logged. */
    List<OracleOutcome> parseResults(String body) {
        List<OracleOutcome> outcomes = new ArrayList<>();
        for (String line : body.split("\\R")) {
            if (line.isBlank()) continue;
            try {
                outcomes.add(parseResultLine(objectMapper.readTree(line)));
            } catch (JsonProcessingException e) {
                log.warn("[AnthropicOracle] Skipping unreadable result line. reason={}", e.getOriginalMessage());
            }
        }
        return outcomes;
    }

    static OracleOutcome parseResultLine(JsonNode line) {
        String id = line.path("custom_id").asText(null);
        JsonNode result = line.path("result");
        String type = result.path("type").asText("");
        if (!"succeeded".equals(type)) {
            String reason = result.path("error").path("error").path("message").asText(
                result.path("error").path("message").asText(type.isEmpty() ? "missing result" : type));
            return OracleOutcome.failed(id, reason);
        }

        StringBuilder text = new StringBuilder();
        for (JsonNode block : result.path("message").path("content")) {
            if ("text".equals(block.path("type").asText())) {
                text.append(block.path("text").asText());
            }
        }
        return text.length() == 0
            ? OracleOutcome.failed(id, "empty response")
            : OracleOutcome.succeeded(id, text.toString());
    }

    private JsonNode readTree(String body) {
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable Anthropic response", e);
        }
    }
}
