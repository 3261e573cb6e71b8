package com.dmarcradar.reprocessing;

import com.dmarcradar.domain.ReprocessingJobRepository;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * Shared counters of one running job. Chunk workers add batch counts concurrently; a snapshot is written to
 * reprocessing_jobs at most once per persist interval.
 */
@Slf4j
public class ReprocessingProgress implements ReprocessingBatchCallback {

    private final String jobId;
    private final ReprocessingJobRepository reprocessingJobRepository;
    private final long persistIntervalMs;
    private final LongSupplier clock;

    private final AtomicLong processed;
    private final AtomicLong forwarded;
    private final AtomicLong notForwarded;
    private final AtomicLong unknown;
    private final AtomicLong lastPersistAt;

    public ReprocessingProgress(String jobId, Counts baseline, ReprocessingJobRepository reprocessingJobRepository,
                                long persistIntervalMs) {
        this(jobId, baseline, reprocessingJobRepository, persistIntervalMs, System::currentTimeMillis);
    }

    ReprocessingProgress(String jobId, Counts baseline, ReprocessingJobRepository reprocessingJobRepository,
                         long persistIntervalMs, LongSupplier clock) {
        this.jobId = jobId;
        this.reprocessingJobRepository = reprocessingJobRepository;
        this.persistIntervalMs = persistIntervalMs;
        this.clock = clock;
        this.processed = new AtomicLong(baseline.processed());
        this.forwarded = new AtomicLong(baseline.forwarded());
        this.notForwarded = new AtomicLong(baseline.notForwarded());
        this.unknown = new AtomicLong(baseline.unknown());
        this.lastPersistAt = new AtomicLong(clock.getAsLong());
    }

    @Override
    public void onBatch(long batchProcessed, long batchForwarded, long batchNotForwarded, long batchUnknown) {
        processed.addAndGet(batchProcessed);
        forwarded.addAndGet(batchForwarded);
        notForwarded.addAndGet(batchNotForwarded);
        unknown.addAndGet(batchUnknown);
        persistIfDue();
    }

    public Counts snapshot() {
        return new Counts(processed.get(), forwarded.get(), notForwarded.get(), unknown.get());
    }

    private void persistIfDue() {
        long now = clock.getAsLong();
        long last = lastPersistAt.get();
        if (now - last < persistIntervalMs || !lastPersistAt.compareAndSet(last, now)) {
            return;
        }
        Counts c = snapshot();
        try {
            reprocessingJobRepository.updateProgress(jobId, c.processed(), c.forwarded(), c.notForwarded(), c.unknown());
        } catch (RuntimeException e) {
            log.warn("Progress update for job {} failed: {}", jobId, e.getMessage());
        }
    }

    public record Counts(long processed, long forwarded, long notForwarded, long unknown) {

        public static Counts zero() {
            return new Counts(0, 0, 0, 0);
        }
    }
}
