package com.dmarcradar.geo;

/**
 * Lookup failed (HTTP error, timeout, unreadable response, missing database). Retryable by the queue.
 */
public class GeoProviderException extends RuntimeException {

    public GeoProviderException(String message) {
        super(message);
    }

    public GeoProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
