package com.dmarcradar.geo;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Runtime-changeable lookup settings. Immutable; replaced as a whole on update.
 */
public record GeoLookupSettings(GeoProviderType primaryProvider,
                                List<GeoProviderType> fallbackProviders,
                                boolean useCache,
                                int cacheTtlDays) {

    public GeoLookupSettings {
        if (primaryProvider == null) {
            throw new IllegalArgumentException("primaryProvider is required");
        }
        if (cacheTtlDays < 0) {
            throw new IllegalArgumentException("cacheTtlDays must not be negative");
        }
        fallbackProviders = fallbackProviders == null ? List.of() : List.copyOf(fallbackProviders);
    }

    /**
     * Primary first, then fallbacks, then extras; duplicates removed keeping the first position.
     */
    public List<GeoProviderType> chain(List<GeoProviderType> extraFallbacks) {
        LinkedHashSet<GeoProviderType> ordered = new LinkedHashSet<>();
        ordered.add(primaryProvider);
        ordered.addAll(fallbackProviders);
        if (extraFallbacks != null) {
            ordered.addAll(extraFallbacks);
        }
        return new ArrayList<>(ordered);
    }

    /** True when the provider is already primary or a configured fallback. */
    public boolean includes(GeoProviderType type) {
        return primaryProvider == type || fallbackProviders.contains(type);
    }
}
