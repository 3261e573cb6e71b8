package com.dmarcradar.geo.queue;

/**
 * Snapshot of the lookup queue.
 */
public record QueueStats(int queueSize, boolean processing, String currentIp,
                         ItemsByPriority itemsByPriority, int uniqueIps, int totalRecords) {

    public record ItemsByPriority(int high, int normal, int low) {
    }
}
