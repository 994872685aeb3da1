package com.judgmentbell.common.statistics;

/**
 * One two-question trial of the ordering variant: framework {@code firstAxis} was asked
 * first, {@code secondAxis} second, and both were answered YES ({@code true}) or NO.
 */
public record OrderedObservation(
    String scenarioId,
    String firstAxis,
    String secondAxis,
    boolean firstAnswer,
    boolean secondAnswer
) {
}
