package com.dmarcradar.geo.queue;

import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic drain so entries whose retry delay has elapsed are picked up without a new enqueue.
 */
@Component
@RequiredArgsConstructor
public class IpLookupQueueJob {

    private final IpLookupQueueService ipLookupQueueService;

    @Scheduled(fixedDelayString = "${dmarcradar.geo.queue-poll-interval-ms:1000}")
    public void tick() {
        ipLookupQueueService.triggerProcessing();
    }
}
