package com.dmarcradar.domain;

/**
 * Field-level updates on reprocessing_jobs. Status transitions are conditional and never overwrite a cancelled job.
 */
public interface ReprocessingJobRepositoryCustom {

    /**
     * Moves a PENDING job to RUNNING and stamps startedAt. Returns true if the job is RUNNING afterwards, false if it
     * was cancelled, finished or removed in the meantime.
     */
    boolean markRunningIfActive(String jobId);

    /** Counter snapshot; applied only while the job is RUNNING. */
    void updateProgress(String jobId, long processed, long forwarded, long notForwarded, long unknown);

    /** Final counters of a job whose status has already been settled (e.g. cancelled). */
    void updateCounters(String jobId, long processed, long forwarded, long notForwarded, long unknown);

    /**
     * Moves a RUNNING job to COMPLETED with final counters. Returns false if the job was no longer RUNNING.
     */
    boolean completeIfRunning(String jobId, long processed, long forwarded, long notForwarded, long unknown);

    /** Moves a PENDING or RUNNING job to FAILED. */
    boolean failIfActive(String jobId, String errorMessage);

    /** Moves a PENDING or RUNNING job to CANCELLED. */
    boolean cancelIfActive(String jobId);

    boolean isCancelled(String jobId);
}
