package com.judgmentbell.common.exception;

/**
 * Raised only for structural failures of an analysis run: no result set at all, or a
 * result set from which zero configurations could be recovered. Per-trial problems are
 * tallied, never thrown.
 */
public class AnalysisException extends RuntimeException {
    private final String stage;

    public AnalysisException(String stage, String message) {
        super("[" + stage + "] " + message);
        this.stage = stage;
    }

    public AnalysisException(String stage, String message, Throwable cause) {
        super("[" + stage + "] " + message, cause);
        this.stage = stage;
    }

    public String getStage() {
        return stage;
    }
}
