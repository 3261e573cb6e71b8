package com.dmarcradar.domain;

import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * MongoTemplate-backed status-guarded updates for reprocessing_jobs.
 */
@Repository
@RequiredArgsConstructor
public class ReprocessingJobRepositoryImpl implements ReprocessingJobRepositoryCustom {

    private static final List<ReprocessingJob.JobStatus> ACTIVE = List.of(
            ReprocessingJob.JobStatus.PENDING, ReprocessingJob.JobStatus.RUNNING);

    private final MongoTemplate mongoTemplate;

    @Override
    public boolean markRunningIfActive(String jobId) {
        Instant now = Instant.now();
        Query pending = new Query(where("_id").is(jobId).and("status").is(ReprocessingJob.JobStatus.PENDING));
        Update update = new Update()
                .set("status", ReprocessingJob.JobStatus.RUNNING)
                .set("startedAt", now)
                .set("updatedAt", now);
        if (mongoTemplate.updateFirst(pending, update, ReprocessingJob.class).getModifiedCount() > 0) {
            return true;
        }
        return mongoTemplate.exists(
                new Query(where("_id").is(jobId).and("status").is(ReprocessingJob.JobStatus.RUNNING)),
                ReprocessingJob.class);
    }

    @Override
    public void updateProgress(String jobId, long processed, long forwarded, long notForwarded, long unknown) {
        Query query = new Query(where("_id").is(jobId).and("status").is(ReprocessingJob.JobStatus.RUNNING));
        mongoTemplate.updateFirst(query, counters(processed, forwarded, notForwarded, unknown), ReprocessingJob.class);
    }

    @Override
    public void updateCounters(String jobId, long processed, long forwarded, long notForwarded, long unknown) {
        mongoTemplate.updateFirst(new Query(where("_id").is(jobId)),
                counters(processed, forwarded, notForwarded, unknown), ReprocessingJob.class);
    }

    @Override
    public boolean completeIfRunning(String jobId, long processed, long forwarded, long notForwarded, long unknown) {
        Query query = new Query(where("_id").is(jobId).and("status").is(ReprocessingJob.JobStatus.RUNNING));
        Update update = counters(processed, forwarded, notForwarded, unknown)
                .set("status", ReprocessingJob.JobStatus.COMPLETED)
                .set("completedAt", Instant.now());
        return mongoTemplate.updateFirst(query, update, ReprocessingJob.class).getModifiedCount() > 0;
    }

    @Override
    public boolean failIfActive(String jobId, String errorMessage) {
        Query query = new Query(where("_id").is(jobId).and("status").in(ACTIVE));
        Update update = new Update()
                .set("status", ReprocessingJob.JobStatus.FAILED)
                .set("errorMessage", errorMessage)
                .set("completedAt", Instant.now())
                .set("updatedAt", Instant.now());
        return mongoTemplate.updateFirst(query, update, ReprocessingJob.class).getModifiedCount() > 0;
    }

    @Override
    public boolean cancelIfActive(String jobId) {
        Query query = new Query(where("_id").is(jobId).and("status").in(ACTIVE));
        Update update = new Update()
                .set("status", ReprocessingJob.JobStatus.CANCELLED)
                .set("completedAt", Instant.now())
                .set("updatedAt", Instant.now());
        return mongoTemplate.updateFirst(query, update, ReprocessingJob.class).getModifiedCount() > 0;
    }

    @Override
    public boolean isCancelled(String jobId) {
        return mongoTemplate.exists(
                new Query(where("_id").is(jobId).and("status").is(ReprocessingJob.JobStatus.CANCELLED)),
                ReprocessingJob.class);
    }

    private static Update counters(long processed, long forwarded, long notForwarded, long unknown) {
        return new Update()
                .set("processedRecords", processed)
                .set("forwardedCount", forwarded)
                .set("notForwardedCount", notForwarded)
                .set("unknownCount", unknown)
                .set("updatedAt", Instant.now());
    }
}
