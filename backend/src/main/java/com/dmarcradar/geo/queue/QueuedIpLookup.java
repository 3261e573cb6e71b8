package com.dmarcradar.geo.queue;

import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * One pending IP with every record waiting for it. Mutated only under the queue lock.
 */
@Getter
@Setter
class QueuedIpLookup {

    private final String ip;
    private final Set<String> recordIds = new LinkedHashSet<>();
    private int priority;
    private int failedAttempts;
    private Instant notBefore;
    /** Set once the regular chain is exhausted; the next attempt appends the offline database. */
    private boolean lastResort;

    QueuedIpLookup(String ip, Collection<String> recordIds, int priority) {
        this.ip = ip;
        this.recordIds.addAll(recordIds);
        this.priority = priority;
        this.notBefore = Instant.EPOCH;
    }

    /** Union of record ids; keeps the more urgent priority. */
    void merge(Collection<String> ids, int otherPriority) {
        recordIds.addAll(ids);
        priority = Math.min(priority, otherPriority);
    }

    boolean isReady(Instant now) {
        return !notBefore.isAfter(now);
    }
}
