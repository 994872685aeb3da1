package com.judgmentbell.orchestrator.oracle;

/**
 * Response to one request: either the oracle's text or a failure reason.
 */
public record OracleOutcome(String identifier, String text, String error) {

    public static OracleOutcome succeeded(String identifier, String text) {
        return new OracleOutcome(identifier, text, null);
    }

    public static OracleOutcome failed(String identifier, String error) {
        return new OracleOutcome(identifier, null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
