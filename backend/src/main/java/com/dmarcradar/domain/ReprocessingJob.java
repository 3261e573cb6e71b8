package com.dmarcradar.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Duration;
import java.time.Instant;

/**
 * Re-runs forwarding classification over every record. Persisted in reprocessing_jobs.
 * At most one job is RUNNING at a time; counters are written by {@link ReprocessingJobRepositoryCustom}.
 */
@Document(collection = "reprocessing_jobs")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class ReprocessingJob {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private JobStatus status;
    private long totalRecords;
    private long processedRecords;
    private long forwardedCount;
    private long notForwardedCount;
    private long unknownCount;
    private String errorMessage;
    private Instant startedAt;
    private Instant completedAt;
    private Instant createdAt;
    private Instant updatedAt;

    public int getProgressPercent() {
        if (totalRecords <= 0) {
            return status == JobStatus.COMPLETED ? 100 : 0;
        }
        return (int) Math.min(100, (processedRecords * 100) / totalRecords);
    }

    public boolean isFinished() {
        return status == JobStatus.COMPLETED || status == JobStatus.FAILED || status == JobStatus.CANCELLED;
    }

    /** Seconds since start (or until completion); null before start. */
    public Long getElapsedSeconds() {
        if (startedAt == null) {
            return null;
        }
        Instant end = completedAt != null ? completedAt : Instant.now();
        return Duration.between(startedAt, end).getSeconds();
    }

    public enum JobStatus {
        PENDING,
        RUNNING,
        COMPLETED,
        FAILED,
        CANCELLED
    }
}
