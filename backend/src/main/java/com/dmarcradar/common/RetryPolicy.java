package com.dmarcradar.common;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with jitter, capped at {@code maxDelayMs}. Used by the geolocation queue to delay
 * requeued lookups after a provider failure.
 */
public final class RetryPolicy {

    private final long baseDelayMs;
    private final double jitterFactor;
    private final int maxAttempts;
    private final long maxDelayMs;

    public RetryPolicy(long baseDelayMs, double jitterFactor, int maxAttempts, long maxDelayMs) {
        if (baseDelayMs < 0 || maxDelayMs < 0) {
            throw new IllegalArgumentException("delays must not be negative");
        }
        this.baseDelayMs = baseDelayMs;
        this.jitterFactor = jitterFactor;
        this.maxAttempts = maxAttempts;
        this.maxDelayMs = maxDelayMs;
    }

    /**
     * Delay in milliseconds for the given zero-based attempt: baseDelay * 2^attempt with jitter, never above the cap.
     */
    public long delayMs(int attempt) {
        if (attempt <= 0) {
            return Math.min(maxDelayMs, jitter(baseDelayMs));
        }
        long exponential = baseDelayMs * (1L << Math.min(attempt, 20));
        return Math.min(maxDelayMs, jitter(exponential));
    }

    /** True once {@code failedAttempts} has reached the ceiling. */
    public boolean isExhausted(int failedAttempts) {
        return failedAttempts >= maxAttempts;
    }

    private long jitter(long value) {
        if (jitterFactor <= 0) {
            return value;
        }
        ThreadLocalRandom r = ThreadLocalRandom.current();
        double jitter = 1.0 + (r.nextDouble() * 2.0 - 1.0) * jitterFactor;
        return Math.max(0, (long) (value * jitter));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Default for geolocation requeues: 2s base, ±20% jitter, 3 attempts, 5 min ceiling.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(2_000L, 0.2, 3, 300_000L);
    }
}
