package com.dmarcradar.geo.config;

import com.dmarcradar.geo.GeoProviderType;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Geolocation configuration. Documented in application.yml under dmarcradar.geo.
 * Primary/fallback/cache values are only the startup defaults of the runtime settings.
 */
@ConfigurationProperties(prefix = "dmarcradar.geo")
@Getter
@Setter
public class GeoLookupProperties {

    private GeoProviderType primaryProvider = GeoProviderType.IP_API;

    private List<GeoProviderType> fallbackProviders = new ArrayList<>(List.of(GeoProviderType.IPWHOIS));

    /** Serve lookups from ip_locations when the row is younger than cacheTtlDays. */
    private boolean useCache = true;

    private int cacheTtlDays = 30;

    /** Delay between scheduled queue drains. */
    private long queuePollIntervalMs = 1000;

    /** Maximum number of IPs picked up by the backfill scan at startup. */
    private int startupScanLimit = 100_000;

    private ProviderProperties ipApi = new ProviderProperties("http://ip-api.com/json", 45, 0, 0);

    /** Without an API key ipapi.co allows about 1000 requests per day. */
    private ProviderProperties ipapiCo = new ProviderProperties("https://ipapi.co", 0, 1000, 0);

    private ProviderProperties ipwhois = new ProviderProperties("http://ipwho.is", 0, 0, 10_000);

    /** Requires an API key (X-API-Key header). */
    private ProviderProperties iplocate = new ProviderProperties("https://iplocate.io/api/lookup", 0, 1000, 0);

    private MaxMindProperties maxmind = new MaxMindProperties();

    @Getter
    @Setter
    public static class ProviderProperties {
        private String baseUrl;
        private String apiKey;
        /** 0 = unlimited. */
        private int requestsPerMinute;
        private int requestsPerDay;
        private int requestsPerMonth;
        private long timeoutMs = 10_000;

        public ProviderProperties() {
        }

        public ProviderProperties(String baseUrl, int requestsPerMinute, int requestsPerDay, int requestsPerMonth) {
            this.baseUrl = baseUrl;
            this.requestsPerMinute = requestsPerMinute;
            this.requestsPerDay = requestsPerDay;
            this.requestsPerMonth = requestsPerMonth;
        }

        public boolean hasApiKey() {
            return apiKey != null && !apiKey.isBlank();
        }
    }

    @Getter
    @Setter
    public static class MaxMindProperties {
        /** Path to a GeoLite2-City / GeoIP2-City .mmdb file; provider is disabled when blank. */
        private String databasePath;
    }
}
