package com.dmarcradar.geo;

import com.dmarcradar.domain.GeoLocationData;

/**
 * Outcome of {@link GeolocationService#lookup}. data is null when no provider knows the IP.
 *
 * @param source         provider id, "cache", or null when not found
 * @param providerCalled true when at least one external provider was called
 */
public record GeoLookupResult(GeoLocationData data, String source, boolean providerCalled) {

    public static final String CACHE_SOURCE = "cache";

    public static GeoLookupResult notFound(boolean providerCalled) {
        return new GeoLookupResult(null, null, providerCalled);
    }

    public static GeoLookupResult fromCache(GeoLocationData data) {
        return new GeoLookupResult(data, CACHE_SOURCE, false);
    }

    public boolean isFound() {
        return data != null;
    }
}
