package com.example.triprisk_backend.job;

import java.time.OffsetDateTime;

/** What a poller sees of a job, whether it is still in memory or read back from the database. */
public record JobView(String jobId, JobStatus status, String error, OffsetDateTime createdAt, TripResult result) {

    static JobView of(Job job) {
        // read status first so a result is never shown without COMPLETED
        JobStatus status = job.status();
        return new JobView(job.id(), status, job.error(), job.createdAt(),
            status == JobStatus.COMPLETED ? job.result() : null);
    }
}
