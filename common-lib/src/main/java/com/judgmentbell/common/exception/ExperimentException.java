package com.judgmentbell.common.exception;

public class ExperimentException extends RuntimeException {

    public enum Reason { UNKNOWN_RUN, INVALID_STATE, ORACLE_FAILURE }

    private final String runId;
    private final Reason reason;

    public ExperimentException(String runId, Reason reason, String message) {
        super("[" + runId + "] " + message);
        this.runId = runId;
        this.reason = reason;
    }

    public ExperimentException(String runId, Reason reason, String message, Throwable cause) {
        super("[" + runId + "] " + message, cause);
        this.runId = runId;
        this.reason = reason;
    }

    public String getRunId() {
        return runId;
    }

    public Reason getReason() {
        return reason;
    }
}
