package com.dmarcradar.api.dto;

import com.dmarcradar.geo.GeoProviderType;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * PUT /api/v1/ip-lookup/config request body. Null useCache / cacheTtlDays keep the current value.
 */
public record GeoLookupConfigRequest(
        @NotNull(message = "INVALID_PROVIDER")
        GeoProviderType primaryProvider,

        List<GeoProviderType> fallbackProviders,

        Boolean useCache,

        @Min(value = 0, message = "INVALID_TTL")
        @Max(value = 365, message = "INVALID_TTL")
        Integer cacheTtlDays
) {
}
