package com.dmarcradar.geo;

import com.dmarcradar.common.IpAddresses;
import com.dmarcradar.domain.GeoLocationData;

import java.util.Optional;

/**
 * One geolocation source. Implementations are Spring beans collected by {@link GeolocationService} and
 * selected by {@link GeoProviderType} from the lookup settings.
 */
public interface GeoProvider {

    GeoProviderType getType();

    /**
     * @return location, or empty when the provider has no data for this IP
     * @throws GeoRateLimitException when the provider quota is exhausted
     * @throws GeoProviderException  on any other failure
     */
    Optional<GeoLocationData> lookup(String ip);

    default boolean supportsIp(String ip) {
        return IpAddresses.isPublic(ip);
    }

    /** False when a required API key or database is missing; such providers are skipped. */
    default boolean isConfigured() {
        return true;
    }

    ProviderUsage getUsage();
}
