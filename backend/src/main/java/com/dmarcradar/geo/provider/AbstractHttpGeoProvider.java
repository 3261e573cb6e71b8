package com.dmarcradar.geo.provider;

import com.dmarcradar.common.UsageWindow;
import com.dmarcradar.domain.GeoLocationData;
import com.dmarcradar.geo.GeoProvider;
import com.dmarcradar.geo.GeoProviderException;
import com.dmarcradar.geo.GeoProviderType;
import com.dmarcradar.geo.GeoRateLimitException;
import com.dmarcradar.geo.ProviderUsage;
import com.dmarcradar.geo.config.GeoLookupProperties.ProviderProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * Base for JSON-over-HTTP providers: local quota check, single GET via WebClient, 429 mapping and JSON parsing.
 * Per-minute quota is enforced by a resilience4j limiter; daily and monthly quotas by a {@link UsageWindow}.
 */
@Slf4j
public abstract class AbstractHttpGeoProvider implements GeoProvider {

    static final ObjectMapper MAPPER = new ObjectMapper();
    private static final long DEFAULT_RETRY_AFTER_MS = 60_000L;

    private final GeoProviderType type;
    protected final ProviderProperties properties;
    private final WebClient webClient;
    private final UsageWindow usage;
    private final RateLimiter minuteLimiter;

    protected AbstractHttpGeoProvider(GeoProviderType type, ProviderProperties properties,
                                      WebClient.Builder webClientBuilder, UsageWindow usage) {
        this.type = type;
        this.properties = properties;
        this.webClient = webClientBuilder.build();
        this.usage = usage;
        this.minuteLimiter = properties.getRequestsPerMinute() > 0
                ? RateLimiter.of(type.getId(), RateLimiterConfig.custom()
                        .limitRefreshPeriod(Duration.ofMinutes(1))
                        .limitForPeriod(properties.getRequestsPerMinute())
                        .timeoutDuration(Duration.ZERO)
                        .build())
                : null;
    }

    @Override
    public GeoProviderType getType() {
        return type;
    }

    @Override
    public Optional<GeoLocationData> lookup(String ip) {
        checkQuota();
        usage.record();
        String body;
        try {
            body = webClient.get()
                    .uri(requestUrl(ip))
                    .headers(this::addHeaders)
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(Duration.ofMillis(properties.getTimeoutMs()));
        } catch (WebClientResponseException e) {
            if (e.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
                throw new GeoRateLimitException(type.getId() + " rate limit exceeded (429)", retryAfterMs(e));
            }
            throw new GeoProviderException(type.getId() + " HTTP " + e.getStatusCode().value() + " for " + ip, e);
        } catch (RuntimeException e) {
            throw new GeoProviderException(type.getId() + " request failed for " + ip + ": " + e.getMessage(), e);
        }
        if (body == null || body.isBlank()) {
            throw new GeoProviderException(type.getId() + " returned an empty response for " + ip);
        }
        JsonNode root;
        try {
            root = MAPPER.readTree(body);
        } catch (JsonProcessingException e) {
            throw new GeoProviderException(type.getId() + " returned unreadable JSON for " + ip, e);
        }
        Optional<GeoLocationData> data = parse(root);
        if (data.isEmpty()) {
            log.debug("{} has no data for {}", type.getId(), ip);
        }
        return data;
    }

    @Override
    public ProviderUsage getUsage() {
        int perMinute = limitsApply() ? properties.getRequestsPerMinute() : 0;
        int perDay = limitsApply() ? properties.getRequestsPerDay() : 0;
        int perMonth = limitsApply() ? properties.getRequestsPerMonth() : 0;
        return new ProviderUsage(usage.minuteCount(), usage.dayCount(), usage.monthCount(), perMinute, perDay, perMonth);
    }

    /** Some providers lift their free-tier quota once an API key is configured. */
    protected boolean limitsApply() {
        return true;
    }

    protected abstract String requestUrl(String ip);

    protected void addHeaders(HttpHeaders headers) {
    }

    /** Maps the provider response; empty when the provider reports it has nothing for the IP. */
    protected abstract Optional<GeoLocationData> parse(JsonNode root);

    private void checkQuota() {
        if (!limitsApply()) {
            return;
        }
        int perDay = properties.getRequestsPerDay();
        int perMonth = properties.getRequestsPerMonth();
        if (usage.isExhausted(0, perDay, perMonth)) {
            long wait = usage.millisUntilAvailable(0, perDay, perMonth);
            log.warn("{} quota reached, next slot in {}s", type.getId(), Math.max(1, wait / 1000));
            throw new GeoRateLimitException(type.getId() + " quota exceeded", wait);
        }
        if (minuteLimiter != null && !minuteLimiter.acquirePermission()) {
            long wait = usage.millisUntilAvailable(properties.getRequestsPerMinute(), 0, 0);
            throw new GeoRateLimitException(type.getId() + " per-minute limit exceeded", wait > 0 ? wait : DEFAULT_RETRY_AFTER_MS);
        }
    }

    private static long retryAfterMs(WebClientResponseException e) {
        String header = e.getHeaders().getFirst(HttpHeaders.RETRY_AFTER);
        if (header != null) {
            try {
                return Long.parseLong(header.strip()) * 1000L;
            } catch (NumberFormatException ignored) {
                // HTTP-date form; fall back to the default wait
            }
        }
        return DEFAULT_RETRY_AFTER_MS;
    }

    static String text(JsonNode node, String field) {
        JsonNode v = node.path(field);
        if (v.isMissingNode() || v.isNull()) {
            return null;
        }
        String s = v.asText();
        return s.isBlank() ? null : s;
    }

    static Double number(JsonNode node, String field) {
        JsonNode v = node.path(field);
        if (v.isNumber()) {
            return v.doubleValue();
        }
        if (v.isTextual()) {
            try {
                return Double.parseDouble(v.asText());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    /** English country name for an ISO code when the provider omits it. */
    static String countryName(String name, String code) {
        if (name != null) {
            return name;
        }
        if (code == null || code.length() != 2) {
            return null;
        }
        String display = new Locale("", code.toUpperCase(Locale.ROOT)).getDisplayCountry(Locale.ENGLISH);
        return display.isBlank() || display.equalsIgnoreCase(code) ? null : display;
    }
}
