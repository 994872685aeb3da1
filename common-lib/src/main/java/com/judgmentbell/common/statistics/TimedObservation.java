package com.judgmentbell.common.statistics;

/** One answer of the timing variant. */
public record TimedObservation(String scenarioId, String axis, Timing timing, boolean answer) {
}
