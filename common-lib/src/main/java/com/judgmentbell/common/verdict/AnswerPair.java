package com.judgmentbell.common.verdict;

/** Two YES/NO answers in the order they were asked. {@code true} means YES. */
public record AnswerPair(boolean first, boolean second) {
}
