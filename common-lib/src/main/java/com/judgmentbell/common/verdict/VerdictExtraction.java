package com.judgmentbell.common.verdict;

import com.judgmentbell.common.model.Verdict;

/**
 * @param verdict   resolved verdict, or UNRESOLVED
 * @param parser    name of the parser that resolved it, {@code null} on failure
 * @param diagnostic excerpt of the offending text on failure, {@code null} on success
 */
public record VerdictExtraction(Verdict verdict, String parser, String diagnostic) {

    public boolean isResolved() {
        return verdict.isResolved();
    }
}
