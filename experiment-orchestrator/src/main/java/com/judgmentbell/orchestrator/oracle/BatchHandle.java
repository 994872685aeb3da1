package com.judgmentbell.orchestrator.oracle;

import java.time.Instant;

/** Reference to a submitted batch, returned by {@link JudgmentOracle#submit}. */
public record BatchHandle(String batchId, String oracle, int requestCount, Instant submittedAt) {
}
