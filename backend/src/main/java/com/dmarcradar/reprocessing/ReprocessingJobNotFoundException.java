package com.dmarcradar.reprocessing;

import lombok.Getter;

/**
 * No reprocessing job with the given id. API layer maps to 404 JOB_NOT_FOUND.
 */
@Getter
public class ReprocessingJobNotFoundException extends RuntimeException {

    private final String jobId;

    public ReprocessingJobNotFoundException(String jobId) {
        super("Reprocessing job " + jobId + " not found");
        this.jobId = jobId;
    }
}
