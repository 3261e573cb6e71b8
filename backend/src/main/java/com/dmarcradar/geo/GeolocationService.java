package com.dmarcradar.geo;

import com.dmarcradar.common.IpAddresses;
import com.dmarcradar.domain.GeoLocationData;
import com.dmarcradar.domain.IpLocation;
import com.dmarcradar.domain.IpLocationRepository;
import com.dmarcradar.geo.config.GeoLookupProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Resolves an IP through the ip_locations cache and then the configured provider chain
 * (primary, fallbacks, per-call extras). Successful and "no data" outcomes are cached; provider errors are not.
 */
@Service
@Slf4j
public class GeolocationService {

    private final Map<GeoProviderType, GeoProvider> providers = new EnumMap<>(GeoProviderType.class);
    private final IpLocationRepository ipLocationRepository;
    private final AtomicReference<GeoLookupSettings> settings;

    public GeolocationService(List<GeoProvider> providers,
                              IpLocationRepository ipLocationRepository,
                              GeoLookupProperties geoLookupProperties) {
        providers.forEach(p -> this.providers.put(p.getType(), p));
        this.ipLocationRepository = ipLocationRepository;
        this.settings = new AtomicReference<>(new GeoLookupSettings(
                geoLookupProperties.getPrimaryProvider(),
                geoLookupProperties.getFallbackProviders(),
                geoLookupProperties.isUseCache(),
                geoLookupProperties.getCacheTtlDays()));
    }

    public GeoLookupResult lookup(String ip) {
        return lookup(ip, List.of());
    }

    /**
     * @param extraFallbacks providers tried after the configured chain for this call only
     * @throws GeoRateLimitException when a provider in the chain is rate limited (no fall-through)
     * @throws GeoProviderException  when every attempted provider failed
     */
    public GeoLookupResult lookup(String ip, List<GeoProviderType> extraFallbacks) {
        if (ip == null || !IpAddresses.isPublic(ip)) {
            return GeoLookupResult.notFound(false);
        }
        GeoLookupSettings current = settings.get();
        if (current.useCache()) {
            Optional<GeoLookupResult> cached = fromCache(ip, current.cacheTtlDays());
            if (cached.isPresent()) {
                return cached.get();
            }
        }

        boolean anyCalled = false;
        boolean anyNoData = false;
        GeoProviderException lastError = null;
        for (GeoProviderType type : current.chain(extraFallbacks)) {
            GeoProvider provider = providers.get(type);
            if (provider == null || !provider.isConfigured() || !provider.supportsIp(ip)) {
                log.debug("Skipping provider {} for {}", type.getId(), ip);
                continue;
            }
            anyCalled = true;
            try {
                Optional<GeoLocationData> data = provider.lookup(ip);
                if (data.isPresent()) {
                    ipLocationRepository.save(IpLocation.of(ip, data.get(), type.getId(), Instant.now()));
                    return new GeoLookupResult(data.get(), type.getId(), true);
                }
                anyNoData = true;
            } catch (GeoRateLimitException e) {
                throw e;
            } catch (GeoProviderException e) {
                log.warn("Provider {} failed for {}: {}", type.getId(), ip, e.getMessage());
                lastError = e;
            }
        }

        if (anyNoData) {
            ipLocationRepository.save(IpLocation.noData(ip, Instant.now()));
            return GeoLookupResult.notFound(true);
        }
        if (lastError != null) {
            throw new GeoProviderException("All geolocation providers failed for " + ip, lastError);
        }
        log.debug("No configured provider supports {}", ip);
        return GeoLookupResult.notFound(anyCalled);
    }

    public GeoLookupSettings getSettings() {
        return settings.get();
    }

    public GeoLookupSettings updateSettings(GeoLookupSettings updated) {
        settings.set(updated);
        log.info("Geolocation settings updated: primary={}, fallbacks={}, useCache={}, cacheTtlDays={}",
                updated.primaryProvider().getId(), updated.fallbackProviders(), updated.useCache(), updated.cacheTtlDays());
        return updated;
    }

    /** Usage of the current primary provider; unlimited when it is not registered. */
    public ProviderUsage getPrimaryUsage() {
        GeoProvider primary = providers.get(settings.get().primaryProvider());
        return primary != null ? primary.getUsage() : ProviderUsage.unlimited();
    }

    public boolean isProviderAvailable(GeoProviderType type) {
        GeoProvider provider = providers.get(type);
        return provider != null && provider.isConfigured();
    }

    public List<ProviderStatus> getProviderStats() {
        GeoLookupSettings current = settings.get();
        List<ProviderStatus> result = new ArrayList<>();
        for (GeoProvider p : providers.values()) {
            result.add(new ProviderStatus(p.getType(), p.isConfigured(),
                    p.getType() == current.primaryProvider(),
                    current.fallbackProviders().contains(p.getType()),
                    p.getUsage()));
        }
        return result;
    }

    private Optional<GeoLookupResult> fromCache(String ip, int ttlDays) {
        Optional<IpLocation> row = ipLocationRepository.findById(ip);
        if (row.isEmpty() || row.get().getResolvedAt() == null) {
            return Optional.empty();
        }
        Instant cutoff = Instant.now().minus(Duration.ofDays(ttlDays));
        if (row.get().getResolvedAt().isBefore(cutoff)) {
            return Optional.empty();
        }
        return Optional.of(row.get().isNoData()
                ? GeoLookupResult.notFound(false)
                : GeoLookupResult.fromCache(row.get().toGeoLocationData()));
    }

    public record ProviderStatus(GeoProviderType provider, boolean configured, boolean primary, boolean fallback,
                                 ProviderUsage usage) {
    }
}
