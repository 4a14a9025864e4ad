package com.example.triprisk_backend.job;

import java.time.OffsetDateTime;

/**
 * Mutable lifecycle record of one trip analysis. Status only moves forward:
 * pending, processing, then completed or failed. A result is only ever attached together
 * with the completed status, an error only with the failed one.
 */
public class Job {

    private final String id;
    private final OffsetDateTime createdAt;

    private volatile JobStatus status = JobStatus.PENDING;
    private volatile TripResult result;
    private volatile String error;
    private volatile OffsetDateTime finishedAt;

    public Job(String id, OffsetDateTime createdAt) {
        this.id = id;
        this.createdAt = createdAt;
    }

    public String id() {return id;}
    public OffsetDateTime createdAt() {return createdAt;}
    public JobStatus status() {return status;}
    public TripResult result() {return result;}
    public String error() {return error;}
    public OffsetDateTime finishedAt() {return finishedAt;}

    public synchronized void markProcessing() {
        checkMove(JobStatus.PROCESSING);
        status = JobStatus.PROCESSING;
    }

    // result is written before status so readers never see COMPLETED without it
    public synchronized void complete(TripResult result, OffsetDateTime at) {
        if (result == null) throw new IllegalArgumentException("a completed job needs a result");
        checkMove(JobStatus.COMPLETED);
        this.result = result;
        this.finishedAt = at;
        status = JobStatus.COMPLETED;
    }

    public synchronized void fail(String error, OffsetDateTime at) {
        checkMove(JobStatus.FAILED);
        this.error = error == null || error.isBlank() ? "unknown error" : error;
        this.finishedAt = at;
        status = JobStatus.FAILED;
    }

    private void checkMove(JobStatus next) {
        if (!status.canMoveTo(next)) {
            throw new IllegalStateException("Job " + id + " cannot move from " + status + " to " + next);
        }
    }
}
