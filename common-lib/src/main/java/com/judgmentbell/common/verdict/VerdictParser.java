package com.judgmentbell.common.verdict;

import com.judgmentbell.common.model.Verdict;

import java.util.Optional;

/**
 * One strategy for reading a verdict out of raw oracle text.
 * Returns empty when the strategy cannot resolve the text; never throws.
 */
public interface VerdictParser {

    String name();

    Optional<Verdict> parse(String text);
}
