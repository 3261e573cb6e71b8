package com.dmarcradar.geo;

/**
 * Request counters of one provider against its configured limits (0 = unlimited).
 */
public record ProviderUsage(int minuteRequests, int dayRequests, int monthRequests,
                            int minuteLimit, int dayLimit, int monthLimit) {

    public static ProviderUsage unlimited() {
        return new ProviderUsage(0, 0, 0, 0, 0, 0);
    }

    public boolean isExhausted() {
        return (minuteLimit > 0 && minuteRequests >= minuteLimit)
                || (dayLimit > 0 && dayRequests >= dayLimit)
                || (monthLimit > 0 && monthRequests >= monthLimit);
    }
}
