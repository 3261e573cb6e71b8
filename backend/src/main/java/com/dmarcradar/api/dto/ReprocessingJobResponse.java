package com.dmarcradar.api.dto;

import com.dmarcradar.domain.ReprocessingJob;

import java.time.Instant;

/**
 * Reprocessing job status with derived progress values.
 */
public record ReprocessingJobResponse(String id, String status, long totalRecords, long processedRecords,
                                      long forwardedCount, long notForwardedCount, long unknownCount,
                                      int progressPercent, Long elapsedSeconds, String errorMessage,
                                      Instant startedAt, Instant completedAt, Instant createdAt) {

    public static ReprocessingJobResponse from(ReprocessingJob j) {
        return new ReprocessingJobResponse(j.getId(), j.getStatus() != null ? j.getStatus().name() : null,
                j.getTotalRecords(), j.getProcessedRecords(), j.getForwardedCount(), j.getNotForwardedCount(),
                j.getUnknownCount(), j.getProgressPercent(), j.getElapsedSeconds(), j.getErrorMessage(),
                j.getStartedAt(), j.getCompletedAt(), j.getCreatedAt());
    }
}
