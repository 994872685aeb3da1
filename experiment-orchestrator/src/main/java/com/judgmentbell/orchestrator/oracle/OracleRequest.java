package com.judgmentbell.orchestrator.oracle;

import com.judgmentbell.common.design.TrialRequest;
import com.judgmentbell.common.model.TrialCondition;

/**
 * One prompt handed to a judgment oracle.
 *
 * @param source    source label ({@code haiku}, {@code sonnet}, ...) or a concrete model id
 * @param condition design-time condition; oracles that judge by rule read it, remote ones ignore it
 */
public record OracleRequest(String identifier, String prompt, String source, TrialCondition condition) {

    public static OracleRequest from(TrialRequest request) {
        return new OracleRequest(request.identifier(), request.prompt(), request.source(), request.condition());
    }
}
