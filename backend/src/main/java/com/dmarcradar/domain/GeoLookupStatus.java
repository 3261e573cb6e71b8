package com.dmarcradar.domain;

/**
 * Geolocation enrichment state of a record.
 */
public enum GeoLookupStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED
}
