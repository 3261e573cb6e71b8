package com.dmarcradar.api.controller;

import com.dmarcradar.api.dto.GeoLookupConfigRequest;
import com.dmarcradar.api.dto.GeoLookupConfigResponse;
import com.dmarcradar.geo.GeoLookupSettings;
import com.dmarcradar.geo.GeolocationService;
import com.dmarcradar.geo.queue.IpLookupQueueService;
import com.dmarcradar.geo.queue.QueueStats;
import com.dmarcradar.ingestion.ReportIngestionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Geolocation queue and provider settings (/api/v1/ip-lookup).
 */
@RestController
@RequestMapping("/api/v1/ip-lookup")
@RequiredArgsConstructor
public class IpLookupController {

    private final IpLookupQueueService ipLookupQueueService;
    private final GeolocationService geolocationService;
    private final ReportIngestionService reportIngestionService;

    @GetMapping("/queue/stats")
    public QueueStats queueStats() {
        return ipLookupQueueService.stats();
    }

    @PostMapping("/queue/backfill")
    public Map<String, Integer> backfill(@RequestParam(defaultValue = "10000") int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        return Map.of("queuedIps", ipLookupQueueService.scanUnresolved(limit));
    }

    @DeleteMapping("/queue")
    public Map<String, Integer> clearQueue() {
        return Map.of("removed", ipLookupQueueService.clear());
    }

    @GetMapping("/config")
    public GeoLookupConfigResponse getConfig() {
        return GeoLookupConfigResponse.from(geolocationService.getSettings(), reportIngestionService.isAsyncGeoLookup());
    }

    @PutMapping("/config")
    public GeoLookupConfigResponse updateConfig(@Valid @RequestBody GeoLookupConfigRequest request) {
        GeoLookupSettings current = geolocationService.getSettings();
        GeoLookupSettings updated = new GeoLookupSettings(
                request.primaryProvider(),
                request.fallbackProviders() != null ? request.fallbackProviders() : current.fallbackProviders(),
                request.useCache() != null ? request.useCache() : current.useCache(),
                request.cacheTtlDays() != null ? request.cacheTtlDays() : current.cacheTtlDays());
        geolocationService.updateSettings(updated);
        return GeoLookupConfigResponse.from(updated, reportIngestionService.isAsyncGeoLookup());
    }

    @PutMapping("/mode")
    public Map<String, Boolean> setMode(@RequestParam boolean async) {
        reportIngestionService.setAsyncGeoLookup(async);
        return Map.of("asyncGeoLookup", async);
    }

    @GetMapping("/providers")
    public List<GeolocationService.ProviderStatus> providers() {
        return geolocationService.getProviderStats();
    }
}
