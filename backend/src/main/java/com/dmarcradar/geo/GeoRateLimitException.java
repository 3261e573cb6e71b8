package com.dmarcradar.geo;

import lombok.Getter;

/**
 * Provider refused the call because of its request quota (local limiter or HTTP 429). Not a failure:
 * the queue requeues without counting an attempt and the provider chain does not fall through.
 */
@Getter
public class GeoRateLimitException extends GeoProviderException {

    /** Suggested wait before the next call; 0 when unknown. */
    private final long retryAfterMs;

    public GeoRateLimitException(String message, long retryAfterMs) {
        super(message);
        this.retryAfterMs = Math.max(0, retryAfterMs);
    }
}
