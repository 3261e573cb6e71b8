package com.dmarcradar.reprocessing;

import com.dmarcradar.config.AsyncConfig;
import com.dmarcradar.domain.DmarcRecordRepository;
import com.dmarcradar.domain.ReprocessingJob;
import com.dmarcradar.domain.ReprocessingJob.JobStatus;
import com.dmarcradar.domain.ReprocessingJobRepository;
import com.dmarcradar.reprocessing.ReprocessingProgress.Counts;
import com.dmarcradar.reprocessing.config.ReprocessingProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Re-runs the forwarding classifier over every stored record. One active job at a time; records are split into
 * contiguous chunks processed in parallel on the reprocessing executor. Each record carries the id of the job that
 * reprocessed it, which lets an interrupted job resume with exact counters after a restart.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReprocessingJobService {

    private static final List<JobStatus> ACTIVE = List.of(JobStatus.PENDING, JobStatus.RUNNING);

    private final ReprocessingJobRepository reprocessingJobRepository;
    private final DmarcRecordRepository dmarcRecordRepository;
    private final ReprocessingChunkWorker reprocessingChunkWorker;
    private final ReprocessingProperties reprocessingProperties;
    @Qualifier(AsyncConfig.REPROCESSING_COORDINATOR_EXECUTOR)
    private final Executor reprocessingCoordinatorExecutor;
    @Qualifier(AsyncConfig.REPROCESSING_EXECUTOR)
    private final Executor reprocessingExecutor;

    /**
     * Starts a new job, or returns the active one unchanged.
     */
    public synchronized ReprocessingJob startReprocessing() {
        Optional<ReprocessingJob> active = reprocessingJobRepository.findFirstByStatusInOrderByCreatedAtDesc(ACTIVE);
        if (active.isPresent()) {
            log.info("Reprocessing job {} already {}", active.get().getId(), active.get().getStatus());
            return active.get();
        }
        long reset = dmarcRecordRepository.resetReprocessedFlags();
        long total = dmarcRecordRepository.count();

        Instant now = Instant.now();
        ReprocessingJob job = new ReprocessingJob();
        job.setStatus(JobStatus.PENDING);
        job.setTotalRecords(total);
        job.setCreatedAt(now);
        job.setUpdatedAt(now);
        ReprocessingJob saved = reprocessingJobRepository.save(job);
        log.info("Reprocessing job {} created for {} records ({} flags reset)", saved.getId(), total, reset);

        reprocessingCoordinatorExecutor.execute(() -> runJob(saved.getId(), Counts.zero()));
        return saved;
    }

    public List<ReprocessingJob> findAll() {
        return reprocessingJobRepository.findTop50ByOrderByCreatedAtDesc();
    }

    public ReprocessingJob findById(String jobId) {
        return reprocessingJobRepository.findById(jobId)
                .orElseThrow(() -> new ReprocessingJobNotFoundException(jobId));
    }

    /** Latest PENDING or RUNNING job. */
    public Optional<ReprocessingJob> getCurrentJob() {
        return reprocessingJobRepository.findFirstByStatusInOrderByCreatedAtDesc(ACTIVE);
    }

    /**
     * Cancels an active job; workers stop at their next batch boundary. Finished jobs are returned unchanged.
     */
    public ReprocessingJob cancel(String jobId) {
        ReprocessingJob job = findById(jobId);
        if (reprocessingJobRepository.cancelIfActive(jobId)) {
            log.info("Reprocessing job {} cancelled", jobId);
            return findById(jobId);
        }
        return job;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady(ApplicationReadyEvent event) {
        resumeInterruptedJob();
    }

    void resumeInterruptedJob() {
        Optional<ReprocessingJob> active = reprocessingJobRepository.findFirstByStatusInOrderByCreatedAtDesc(ACTIVE);
        if (active.isEmpty()) {
            return;
        }
        ReprocessingJob job = active.get();
        Counts baseline = ledgerCounts(job.getId());
        long remaining = dmarcRecordRepository.countByReprocessedFalse();
        if (remaining == 0) {
            if (!reprocessingJobRepository.markRunningIfActive(job.getId())) {
                return;
            }
            reprocessingJobRepository.completeIfRunning(job.getId(), baseline.processed(), baseline.forwarded(),
                    baseline.notForwarded(), baseline.unknown());
            log.info("Reprocessing job {} had no records left; marked COMPLETED", job.getId());
            return;
        }
        log.info("Resuming reprocessing job {}: {} done, {} remaining", job.getId(), baseline.processed(), remaining);
        reprocessingCoordinatorExecutor.execute(() -> runJob(job.getId(), baseline));
    }

    /** Counters rebuilt from the records stamped with this job id. */
    Counts ledgerCounts(String jobId) {
        return new Counts(
                dmarcRecordRepository.countByReprocessedByJobId(jobId),
                dmarcRecordRepository.countByReprocessedByJobIdAndForwarded(jobId, Boolean.TRUE),
                dmarcRecordRepository.countByReprocessedByJobIdAndForwarded(jobId, Boolean.FALSE),
                dmarcRecordRepository.countByReprocessedByJobIdAndForwardedIsNull(jobId));
    }

    void runJob(String jobId, Counts baseline) {
        try {
            if (!reprocessingJobRepository.markRunningIfActive(jobId)) {
                log.debug("Reprocessing job {} no longer active", jobId);
                return;
            }

            List<String> ids = dmarcRecordRepository.findUnprocessedIds();
            ReprocessingProgress progress = new ReprocessingProgress(jobId, baseline, reprocessingJobRepository,
                    reprocessingProperties.getProgressPersistIntervalMs());
            int batchSize = reprocessingProperties.getBatchSize();
            List<List<String>> chunks = split(ids, reprocessingProperties.getEffectiveWorkers());
            log.info("Reprocessing job {}: {} records in {} chunks", jobId, ids.size(), chunks.size());

            List<CompletableFuture<Boolean>> futures = new ArrayList<>();
            for (List<String> chunk : chunks) {
                futures.add(CompletableFuture.supplyAsync(
                        () -> reprocessingChunkWorker.process(jobId, chunk, batchSize, progress), reprocessingExecutor));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

            Counts c = progress.snapshot();
            if (reprocessingJobRepository.isCancelled(jobId)) {
                reprocessingJobRepository.updateCounters(jobId, c.processed(), c.forwarded(), c.notForwarded(), c.unknown());
                log.info("Reprocessing job {} stopped after cancellation at {} records", jobId, c.processed());
            } else if (reprocessingJobRepository.completeIfRunning(jobId, c.processed(), c.forwarded(), c.notForwarded(), c.unknown())) {
                log.info("Reprocessing job {} COMPLETED: processed={}, forwarded={}, notForwarded={}, unknown={}",
                        jobId, c.processed(), c.forwarded(), c.notForwarded(), c.unknown());
            }
        } catch (Exception e) {
            Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
            log.error("Reprocessing job {} failed: {}", jobId, cause.getMessage(), cause);
            reprocessingJobRepository.failIfActive(jobId, String.valueOf(cause.getMessage()));
        }
    }

    /** Contiguous, near-equal chunks; never more chunks than ids. */
    static List<List<String>> split(List<String> ids, int workers) {
        List<List<String>> chunks = new ArrayList<>();
        if (ids.isEmpty()) {
            return chunks;
        }
        int n = Math.max(1, Math.min(workers, ids.size()));
        int base = ids.size() / n;
        int extra = ids.size() % n;
        int from = 0;
        for (int i = 0; i < n; i++) {
            int len = base + (i < extra ? 1 : 0);
            chunks.add(ids.subList(from, from + len));
            from += len;
        }
        return chunks;
    }
}
