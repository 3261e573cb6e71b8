package com.dmarcradar.api.dto;

import com.dmarcradar.geo.GeoLookupSettings;
import com.dmarcradar.geo.GeoProviderType;

import java.util.List;

public record GeoLookupConfigResponse(GeoProviderType primaryProvider, List<GeoProviderType> fallbackProviders,
                                      boolean useCache, int cacheTtlDays, boolean asyncGeoLookup) {

    public static GeoLookupConfigResponse from(GeoLookupSettings settings, boolean asyncGeoLookup) {
        return new GeoLookupConfigResponse(settings.primaryProvider(), settings.fallbackProviders(),
                settings.useCache(), settings.cacheTtlDays(), asyncGeoLookup);
    }
}
