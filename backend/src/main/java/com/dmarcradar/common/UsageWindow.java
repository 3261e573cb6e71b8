package com.dmarcradar.common;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Sliding-window request counter (per minute, per day, per 30 days). Counts only; callers decide what a
 * limit means. A limit of 0 or less is treated as unlimited.
 * <p>
 * Requests are counted in fixed buckets (1 s for the minute window, 1 min for the day, 1 h for the month), so
 * memory stays bounded whatever the traffic. A request leaves a window when its bucket start does.
 */
public class UsageWindow {

    static final long SECOND_MS = 1_000L;
    static final long MINUTE_MS = 60_000L;
    static final long HOUR_MS = 60 * MINUTE_MS;
    static final long DAY_MS = 24 * HOUR_MS;
    static final long MONTH_MS = 30 * DAY_MS;

    private final Clock clock;
    private final Window minute = new Window(MINUTE_MS, SECOND_MS);
    private final Window day = new Window(DAY_MS, MINUTE_MS);
    private final Window month = new Window(MONTH_MS, HOUR_MS);

    public UsageWindow() {
        this(Clock.systemUTC());
    }

    public UsageWindow(Clock clock) {
        this.clock = clock;
    }

    public synchronized void record() {
        long now = clock.millis();
        evict(now);
        minute.add(now);
        day.add(now);
        month.add(now);
    }

    public synchronized int minuteCount() {
        evict(clock.millis());
        return minute.total;
    }

    public synchronized int dayCount() {
        evict(clock.millis());
        return day.total;
    }

    public synchronized int monthCount() {
        evict(clock.millis());
        return month.total;
    }

    /**
     * True when any positive limit has been reached.
     */
    public synchronized boolean isExhausted(int perMinute, int perDay, int perMonth) {
        evict(clock.millis());
        return minute.reached(perMinute) || day.reached(perDay) || month.reached(perMonth);
    }

    /**
     * Milliseconds until the oldest bucket of the first exhausted window leaves it; 0 when nothing is exhausted.
     */
    public synchronized long millisUntilAvailable(int perMinute, int perDay, int perMonth) {
        long now = clock.millis();
        evict(now);
        if (minute.reached(perMinute)) {
            return minute.millisUntilOldestLeaves(now);
        }
        if (day.reached(perDay)) {
            return day.millisUntilOldestLeaves(now);
        }
        if (month.reached(perMonth)) {
            return month.millisUntilOldestLeaves(now);
        }
        return 0;
    }

    public synchronized void reset() {
        minute.clear();
        day.clear();
        month.clear();
    }

    synchronized int retainedBuckets() {
        return minute.buckets.size() + day.buckets.size() + month.buckets.size();
    }

    private void evict(long now) {
        minute.evict(now);
        day.evict(now);
        month.evict(now);
    }

    private static final class Window {

        private final long spanMs;
        private final long bucketMs;
        /** [bucketStart, count], oldest first */
        private final Deque<long[]> buckets = new ArrayDeque<>();
        private int total;

        Window(long spanMs, long bucketMs) {
            this.spanMs = spanMs;
            this.bucketMs = bucketMs;
        }

        void add(long now) {
            long start = now - Math.floorMod(now, bucketMs);
            long[] last = buckets.peekLast();
            if (last != null && last[0] == start) {
                last[1]++;
            } else {
                buckets.addLast(new long[]{start, 1});
            }
            total++;
        }

        void evict(long now) {
            long cutoff = now - spanMs;
            while (!buckets.isEmpty() && buckets.peekFirst()[0] <= cutoff) {
                total -= (int) buckets.pollFirst()[1];
            }
        }

        boolean reached(int limit) {
            return limit > 0 && total >= limit;
        }

        long millisUntilOldestLeaves(long now) {
            long[] oldest = buckets.peekFirst();
            return oldest == null ? 0 : Math.max(0, oldest[0] + spanMs - now);
        }

        void clear() {
            buckets.clear();
            total = 0;
        }
    }
}
