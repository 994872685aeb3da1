package com.judgmentbell.common.aggregation;

/**
 * @param table          matched samples per configuration and setting
 * @param drops          per-reason drop counts
 * @param resultsSeen    identifiers in the result set
 * @param trialsAccepted trials that reached the pairing step
 */
public record AggregationOutcome(CorrelationTable table, DropTally drops, int resultsSeen, int trialsAccepted) {
}
