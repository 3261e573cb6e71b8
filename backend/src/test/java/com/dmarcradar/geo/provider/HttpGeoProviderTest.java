package com.dmarcradar.geo.provider;

import com.dmarcradar.domain.GeoLocationData;
import com.dmarcradar.geo.GeoProviderException;
import com.dmarcradar.geo.GeoRateLimitException;
import com.dmarcradar.geo.ProviderUsage;
import com.dmarcradar.geo.config.GeoLookupProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpGeoProviderTest {

    private static final String IP_API_OK = """
            {"status":"success","country":"Netherlands","countryCode":"NL","city":"Amsterdam","lat":52.37,"lon":4.89}
            """;

    private final List<ClientRequest> requests = new ArrayList<>();

    @Test
    @DisplayName("successful GET is parsed and counted")
    void success() {
        IpApiProvider provider = new IpApiProvider(new GeoLookupProperties(), respond(HttpStatus.OK, IP_API_OK));

        Optional<GeoLocationData> data = provider.lookup("145.100.1.1");

        assertThat(data).isPresent();
        assertThat(data.get().getCity()).isEqualTo("Amsterdam");
        assertThat(requests).hasSize(1);
        assertThat(requests.get(0).url().toString()).isEqualTo("http://ip-api.com/json/145.100.1.1");
        assertThat(provider.getUsage().minuteRequests()).isEqualTo(1);
        assertThat(provider.getUsage().minuteLimit()).isEqualTo(45);
    }

    @Test
    @DisplayName("HTTP 429 becomes a rate limit using Retry-After seconds")
    void tooManyRequests() {
        WebClient.Builder builder = WebClient.builder().exchangeFunction(req -> Mono.just(
                ClientResponse.create(HttpStatus.TOO_MANY_REQUESTS).header(HttpHeaders.RETRY_AFTER, "30").build()));
        IpApiProvider provider = new IpApiProvider(new GeoLookupProperties(), builder);

        assertThatThrownBy(() -> provider.lookup("145.100.1.1"))
                .isInstanceOf(GeoRateLimitException.class)
                .extracting("retryAfterMs").isEqualTo(30_000L);
    }

    @Test
    @DisplayName("other HTTP errors are provider failures, not rate limits")
    void serverError() {
        IpApiProvider provider = new IpApiProvider(new GeoLookupProperties(), respond(HttpStatus.BAD_GATEWAY, ""));

        assertThatThrownBy(() -> provider.lookup("145.100.1.1"))
                .isInstanceOf(GeoProviderException.class)
                .isNotInstanceOf(GeoRateLimitException.class);
    }

    @Test
    void unreadableBody() {
        IpApiProvider provider = new IpApiProvider(new GeoLookupProperties(), respond(HttpStatus.OK, "<html>"));

        assertThatThrownBy(() -> provider.lookup("145.100.1.1"))
                .isInstanceOf(GeoProviderException.class)
                .hasMessageContaining("unreadable JSON");
    }

    @Test
    @DisplayName("per-minute limit is enforced locally without calling the provider")
    void minuteLimit() {
        GeoLookupProperties properties = new GeoLookupProperties();
        properties.getIpApi().setRequestsPerMinute(1);
        IpApiProvider provider = new IpApiProvider(properties, respond(HttpStatus.OK, IP_API_OK));

        provider.lookup("145.100.1.1");

        assertThatThrownBy(() -> provider.lookup("145.100.1.2")).isInstanceOf(GeoRateLimitException.class);
        assertThat(requests).hasSize(1);
    }

    @Test
    @DisplayName("daily quota without key rejects, with key it is lifted")
    void dailyQuotaDependsOnKey() {
        String body = """
                {"country_code":"FR","country_name":"France","city":"Paris"}
                """;
        GeoLookupProperties keyless = new GeoLookupProperties();
        keyless.getIpapiCo().setRequestsPerDay(1);
        IpApiCoProvider limited = new IpApiCoProvider(keyless, respond(HttpStatus.OK, body));

        limited.lookup("90.1.1.1");
        assertThatThrownBy(() -> limited.lookup("90.1.1.2")).isInstanceOf(GeoRateLimitException.class);
        assertThat(limited.getUsage().isExhausted()).isTrue();

        GeoLookupProperties keyed = new GeoLookupProperties();
        keyed.getIpapiCo().setRequestsPerDay(1);
        keyed.getIpapiCo().setApiKey("secret");
        IpApiCoProvider unlimited = new IpApiCoProvider(keyed, respond(HttpStatus.OK, body));

        unlimited.lookup("90.1.1.1");
        assertThat(unlimited.lookup("90.1.1.2")).isPresent();
        ProviderUsage usage = unlimited.getUsage();
        assertThat(usage.dayLimit()).isZero();
        assertThat(requests.get(requests.size() - 1).url().toString()).endsWith("/90.1.1.2/json/?key=secret");
    }

    @Test
    @DisplayName("iplocate sends the API key header and is unconfigured without one")
    void iplocateKeyHeader() {
        GeoLookupProperties properties = new GeoLookupProperties();
        assertThat(new IpLocateProvider(properties, respond(HttpStatus.OK, "{}")).isConfigured()).isFalse();

        properties.getIplocate().setApiKey("k1");
        IpLocateProvider provider = new IpLocateProvider(properties,
                respond(HttpStatus.OK, "{\"country_code\":\"JP\"}"));

        assertThat(provider.isConfigured()).isTrue();
        assertThat(provider.lookup("133.1.1.1")).isPresent();
        assertThat(requests.get(0).headers().getFirst(IpLocateProvider.API_KEY_HEADER)).isEqualTo("k1");
    }

    private WebClient.Builder respond(HttpStatus status, String body) {
        return WebClient.builder().exchangeFunction(req -> {
            requests.add(req);
            return Mono.just(ClientResponse.create(status)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .body(body)
                    .build());
        });
    }
}
