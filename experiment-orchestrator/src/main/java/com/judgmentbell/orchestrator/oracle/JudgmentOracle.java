package com.judgmentbell.orchestrator.oracle;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Asynchronous judgment contract: submit a batch, poll it, retrieve the outcomes.
 *
 * <p>Retrieval may be partial. A request missing from the retrieved outcomes is treated as
 * failed by the caller; per-request failures are outcomes, not errors of the Flux.
 */
public interface JudgmentOracle {

    String name();

    Mono<BatchHandle> submit(List<OracleRequest> requests);

    Mono<BatchStatus> poll(BatchHandle handle);

    Flux<OracleOutcome> retrieve(BatchHandle handle);
}
