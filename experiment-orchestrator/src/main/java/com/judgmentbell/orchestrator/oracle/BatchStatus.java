package com.judgmentbell.orchestrator.oracle;

/**
 * Progress snapshot of a submitted batch.
 *
 * @param processing requests not yet finished
 * @param succeeded  requests that produced a response
 * @param errored    requests that failed, expired or were canceled
 */
public record BatchStatus(String batchId, State state, int processing, int succeeded, int errored) {

    public enum State { IN_PROGRESS, ENDED, FAILED }

    public boolean ended() {
        return state != State.IN_PROGRESS;
    }
}
