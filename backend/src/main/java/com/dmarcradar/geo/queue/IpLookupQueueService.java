package com.dmarcradar.geo.queue;

import com.dmarcradar.common.RetryPolicy;
import com.dmarcradar.config.AsyncConfig;
import com.dmarcradar.domain.DmarcRecordRepository;
import com.dmarcradar.domain.GeoLookupStatus;
import com.dmarcradar.geo.GeoLookupResult;
import com.dmarcradar.geo.GeoProviderException;
import com.dmarcradar.geo.GeoProviderType;
import com.dmarcradar.geo.GeoRateLimitException;
import com.dmarcradar.geo.GeolocationService;
import com.dmarcradar.geo.config.GeoLookupProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory priority queue of IPs awaiting geolocation. Entries are merged per IP; at most one provider call is in
 * flight, and after a call the next entry waits for the poll interval. Cache hits are drained without pause. Rate limits requeue at low priority without counting an attempt; failures back off and, after the retry
 * ceiling, get one last attempt with the offline database before the records are marked FAILED.
 */
@Service
@Slf4j
public class IpLookupQueueService {

    public static final int PRIORITY_HIGH = 0;
    public static final int PRIORITY_NORMAL = 1;
    public static final int PRIORITY_LOW = 2;

    private final GeolocationService geolocationService;
    private final DmarcRecordRepository dmarcRecordRepository;
    private final GeoLookupProperties geoLookupProperties;
    private final Executor geoLookupExecutor;
    private final Clock clock;
    private final RetryPolicy retryPolicy = RetryPolicy.defaultPolicy();

    private final ReentrantLock lock = new ReentrantLock();
    private final List<QueuedIpLookup> queue = new ArrayList<>();
    private final AtomicBoolean processing = new AtomicBoolean(false);
    private final AtomicBoolean drainScheduled = new AtomicBoolean(false);
    private volatile String currentIp;
    private volatile Instant nextProviderCallAt = Instant.EPOCH;

    @Autowired
    public IpLookupQueueService(GeolocationService geolocationService,
                                DmarcRecordRepository dmarcRecordRepository,
                                GeoLookupProperties geoLookupProperties,
                                @Qualifier(AsyncConfig.GEO_LOOKUP_EXECUTOR) Executor geoLookupExecutor) {
        this(geolocationService, dmarcRecordRepository, geoLookupProperties, geoLookupExecutor, Clock.systemUTC());
    }

    IpLookupQueueService(GeolocationService geolocationService,
                         DmarcRecordRepository dmarcRecordRepository,
                         GeoLookupProperties geoLookupProperties,
                         Executor geoLookupExecutor,
                         Clock clock) {
        this.geolocationService = geolocationService;
        this.dmarcRecordRepository = dmarcRecordRepository;
        this.geoLookupProperties = geoLookupProperties;
        this.geoLookupExecutor = geoLookupExecutor;
        this.clock = clock;
    }

    public void enqueue(String ip, Collection<String> recordIds, int priority) {
        if (ip == null || ip.isBlank() || recordIds == null || recordIds.isEmpty()) {
            return;
        }
        lock.lock();
        try {
            add(ip.strip(), recordIds, priority);
        } finally {
            lock.unlock();
        }
        triggerProcessing();
    }

    /** Enqueues every IP of the map (ip to record ids) with one priority. */
    public void enqueueAll(Map<String, ? extends Collection<String>> recordIdsByIp, int priority) {
        if (recordIdsByIp == null || recordIdsByIp.isEmpty()) {
            return;
        }
        lock.lock();
        try {
            recordIdsByIp.forEach((ip, ids) -> {
                if (ip != null && !ip.isBlank() && ids != null && !ids.isEmpty()) {
                    add(ip.strip(), ids, priority);
                }
            });
        } finally {
            lock.unlock();
        }
        triggerProcessing();
    }

    /**
     * Schedules a drain on the geo-lookup executor unless one is already scheduled or running.
     */
    public void triggerProcessing() {
        if (!drainScheduled.compareAndSet(false, true)) {
            return;
        }
        try {
            geoLookupExecutor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            drainScheduled.set(false);
            log.warn("Geo lookup drain rejected: {}", e.getMessage());
        }
    }

    /**
     * Processes the first ready entry.
     *
     * @return true when an entry was taken off the queue
     */
    public boolean processNext() {
        return processOne() != Step.IDLE;
    }

    private Step processOne() {
        if (!processing.compareAndSet(false, true)) {
            return Step.IDLE;
        }
        try {
            QueuedIpLookup item;
            lock.lock();
            try {
                item = firstReady(clock.instant());
                if (item == null) {
                    return Step.IDLE;
                }
                if (geolocationService.getPrimaryUsage().isExhausted()) {
                    log.debug("Primary provider quota exhausted; {} waits in queue", item.getIp());
                    return Step.IDLE;
                }
                queue.remove(item);
            } finally {
                lock.unlock();
            }
            currentIp = item.getIp();
            if (!process(item)) {
                return Step.CACHED;
            }
            nextProviderCallAt = clock.instant().plusMillis(geoLookupProperties.getQueuePollIntervalMs());
            return Step.CALLED;
        } finally {
            currentIp = null;
            processing.set(false);
        }
    }

    public QueueStats stats() {
        lock.lock();
        try {
            int high = 0;
            int normal = 0;
            int low = 0;
            int records = 0;
            for (QueuedIpLookup q : queue) {
                if (q.getPriority() <= PRIORITY_HIGH) {
                    high++;
                } else if (q.getPriority() == PRIORITY_NORMAL) {
                    normal++;
                } else {
                    low++;
                }
                records += q.getRecordIds().size();
            }
            int uniqueIps = (int) queue.stream().map(QueuedIpLookup::getIp).distinct().count();
            return new QueueStats(queue.size(), processing.get(), currentIp,
                    new QueueStats.ItemsByPriority(high, normal, low), uniqueIps, records);
        } finally {
            lock.unlock();
        }
    }

    /** Drops every queued entry; returns how many were removed. Records stay PENDING for a later scan. */
    public int clear() {
        lock.lock();
        try {
            int size = queue.size();
            queue.clear();
            log.info("Geo lookup queue cleared ({} entries)", size);
            return size;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Enqueues records that still lack a location at low priority.
     *
     * @return number of distinct IPs enqueued
     */
    public int scanUnresolved(int limit) {
        Map<String, List<String>> byIp = dmarcRecordRepository.findUnresolvedRecordIdsByIp(limit);
        enqueueAll(byIp, PRIORITY_LOW);
        if (!byIp.isEmpty()) {
            log.info("Queued {} IPs ({} records) for geolocation backfill", byIp.size(),
                    byIp.values().stream().mapToInt(List::size).sum());
        }
        return byIp.size();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady(ApplicationReadyEvent event) {
        int limit = geoLookupProperties.getStartupScanLimit();
        if (limit <= 0) {
            return;
        }
        try {
            geoLookupExecutor.execute(() -> scanUnresolved(limit));
        } catch (RejectedExecutionException e) {
            log.warn("Startup geolocation scan rejected: {}", e.getMessage());
        }
    }

    /** Runs cache hits back to back; stops after the first provider call and leaves the rest to later ticks. */
    private void drain() {
        try {
            while (!clock.instant().isBefore(nextProviderCallAt) && processOne() == Step.CACHED) {
                // next entry
            }
        } finally {
            drainScheduled.set(false);
        }
    }

    /** @return true when a provider was called (or attempted) for the entry */
    private boolean process(QueuedIpLookup item) {
        List<String> ids = new ArrayList<>(item.getRecordIds());
        try {
            dmarcRecordRepository.updateGeoLookupStatus(ids, GeoLookupStatus.PROCESSING);
            List<GeoProviderType> extras = item.isLastResort() ? List.of(GeoProviderType.MAXMIND) : List.of();
            GeoLookupResult result = geolocationService.lookup(item.getIp(), extras);
            if (result.isFound()) {
                dmarcRecordRepository.applyGeoLocation(ids, result.data());
                log.debug("Resolved {} via {} for {} records", item.getIp(), result.source(), ids.size());
            } else {
                log.info("No data available for {}", item.getIp());
                dmarcRecordRepository.updateGeoLookupStatus(ids, GeoLookupStatus.FAILED);
            }
            return result.providerCalled();
        } catch (GeoRateLimitException e) {
            item.setPriority(PRIORITY_LOW);
            item.setNotBefore(clock.instant().plusMillis(e.getRetryAfterMs()));
            requeue(item);
            markQuietly(ids, GeoLookupStatus.PENDING);
            log.info("Rate limited looking up {}; retry in {}ms", item.getIp(), e.getRetryAfterMs());
        } catch (GeoProviderException e) {
            onFailure(item, ids, e);
        } catch (RuntimeException e) {
            log.error("Unexpected error looking up {}", item.getIp(), e);
            onFailure(item, ids, e);
        }
        return true;
    }

    private void onFailure(QueuedIpLookup item, List<String> ids, RuntimeException cause) {
        item.setFailedAttempts(item.getFailedAttempts() + 1);
        if (!retryPolicy.isExhausted(item.getFailedAttempts())) {
            long delay = retryPolicy.delayMs(item.getFailedAttempts() - 1);
            item.setPriority(Math.min(item.getPriority() + 1, PRIORITY_LOW));
            item.setNotBefore(clock.instant().plusMillis(delay));
            requeue(item);
            markQuietly(ids, GeoLookupStatus.PENDING);
            log.warn("Lookup of {} failed (attempt {}), retry in {}ms: {}",
                    item.getIp(), item.getFailedAttempts(), delay, cause.getMessage());
            return;
        }
        boolean maxmindInChain = geolocationService.getSettings().includes(GeoProviderType.MAXMIND);
        if (!item.isLastResort() && !maxmindInChain && geolocationService.isProviderAvailable(GeoProviderType.MAXMIND)) {
            item.setLastResort(true);
            item.setPriority(PRIORITY_LOW);
            item.setNotBefore(clock.instant());
            requeue(item);
            markQuietly(ids, GeoLookupStatus.PENDING);
            log.warn("Lookup of {} failed {} times; retrying once with the offline database",
                    item.getIp(), item.getFailedAttempts());
            return;
        }
        markQuietly(ids, GeoLookupStatus.FAILED);
        log.warn("Giving up on {} after {} failed attempts: {}", item.getIp(), item.getFailedAttempts(), cause.getMessage());
    }

    private void markQuietly(List<String> ids, GeoLookupStatus status) {
        try {
            dmarcRecordRepository.updateGeoLookupStatus(ids, status);
        } catch (RuntimeException e) {
            log.error("Could not mark {} records {}: {}", ids.size(), status, e.getMessage());
        }
    }

    private void requeue(QueuedIpLookup item) {
        lock.lock();
        try {
            QueuedIpLookup existing = find(item.getIp());
            if (existing != null) {
                int before = existing.getPriority();
                existing.merge(item.getRecordIds(), item.getPriority());
                existing.setFailedAttempts(Math.max(existing.getFailedAttempts(), item.getFailedAttempts()));
                existing.setLastResort(existing.isLastResort() || item.isLastResort());
                if (item.getNotBefore().isAfter(existing.getNotBefore())) {
                    existing.setNotBefore(item.getNotBefore());
                }
                if (existing.getPriority() != before) {
                    resort(existing);
                }
            } else {
                insertByPriority(item);
            }
        } finally {
            lock.unlock();
        }
    }

    private void add(String ip, Collection<String> recordIds, int priority) {
        QueuedIpLookup existing = find(ip);
        if (existing != null) {
            int before = existing.getPriority();
            existing.merge(recordIds, priority);
            if (existing.getPriority() != before) {
                resort(existing);
            }
        } else {
            insertByPriority(new QueuedIpLookup(ip, recordIds, priority));
        }
    }

    private QueuedIpLookup find(String ip) {
        for (QueuedIpLookup q : queue) {
            if (q.getIp().equals(ip)) {
                return q;
            }
        }
        return null;
    }

    private void resort(QueuedIpLookup item) {
        queue.remove(item);
        insertByPriority(item);
    }

    /** Inserts after the last entry of the same or more urgent priority (FIFO within a priority). */
    private void insertByPriority(QueuedIpLookup item) {
        int i = queue.size();
        while (i > 0 && queue.get(i - 1).getPriority() > item.getPriority()) {
            i--;
        }
        queue.add(i, item);
    }

    private enum Step {
        IDLE, CACHED, CALLED
    }

    private QueuedIpLookup firstReady(Instant now) {
        for (QueuedIpLookup q : queue) {
            if (q.isReady(now)) {
                return q;
            }
        }
        return null;
    }
}
