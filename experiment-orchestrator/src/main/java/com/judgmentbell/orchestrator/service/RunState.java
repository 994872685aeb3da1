package com.judgmentbell.orchestrator.service;

import com.judgmentbell.common.design.TrialDesign;
import com.judgmentbell.common.format.DesignManifest;
import com.judgmentbell.common.format.ResultRecord;
import com.judgmentbell.orchestrator.oracle.BatchHandle;
import com.judgmentbell.orchestrator.oracle.BatchStatus;

import java.time.Instant;
import java.util.Map;

/**
 * Mutable lifecycle state of one experiment run, written by {@link ExperimentService} and
 * read by the controller. Fields are volatile; each transition is a single reference write.
 */
public class RunState {

    public enum Status { DESIGNED, SUBMITTED, ENDED, COLLECTED, FAILED }

    private final String runId;
    private final TrialDesign design;
    private final DesignManifest manifest;

    private volatile Status status = Status.DESIGNED;
    private volatile BatchHandle handle;
    private volatile BatchStatus lastPoll;
    private volatile Map<String, ResultRecord> results;
    private volatile String errorMessage;
    private volatile Instant updatedAt;
    private boolean submissionClaimed;

    public RunState(String runId, TrialDesign design, DesignManifest manifest) {
        this.runId = runId;
        this.design = design;
        this.manifest = manifest;
        this.updatedAt = manifest.generatedAt();
    }

    // ── transitions ─────────────────────────────────────────────────────────

    /** @return {@code true} for the first caller only; later submissions are rejected */
    synchronized boolean claimSubmission() {
        if (submissionClaimed) return false;
        submissionClaimed = true;
        return true;
    }

    synchronized void releaseSubmission() {
        submissionClaimed = false;
    }

    void submitted(BatchHandle handle) {
        this.handle = handle;
        this.updatedAt = handle.submittedAt();
        this.status = Status.SUBMITTED;
    }

    void polled(BatchStatus poll) {
        this.lastPoll = poll;
        this.updatedAt = Instant.now();
        if (poll.state() == BatchStatus.State.ENDED && status == Status.SUBMITTED) {
            this.status = Status.ENDED;
        } else if (poll.state() == BatchStatus.State.FAILED) {
            error("Oracle reported batch failure: " + poll.batchId());
        }
    }

    void collected(Map<String, ResultRecord> results) {
        this.results = Map.copyOf(results);
        this.updatedAt = Instant.now();
        this.status = Status.COLLECTED;
    }

    void error(String message) {
        this.errorMessage = message;
        this.updatedAt = Instant.now();
        this.status = Status.FAILED;
    }

    // ── accessors ───────────────────────────────────────────────────────────

    public String getRunId()                    { return runId; }
    public TrialDesign getDesign()              { return design; }
    public DesignManifest getManifest()         { return manifest; }
    public Status getStatus()                   { return status; }
    public BatchHandle getHandle()              { return handle; }
    public BatchStatus getLastPoll()            { return lastPoll; }
    public Map<String, ResultRecord> getResults() { return results; }
    public String getErrorMessage()             { return errorMessage; }
    public Instant getUpdatedAt()               { return updatedAt; }

    public boolean isSubmitted() {
        return handle != null;
    }

    /** Collected or failed; no further transitions expected. */
    public boolean isFinished() {
        Status current = status;
        return current == Status.COLLECTED || current == Status.FAILED;
    }

    /** Designed and not yet claimed for submission. */
    synchronized boolean isIdle() {
        return status == Status.DESIGNED && !submissionClaimed;
    }
}
