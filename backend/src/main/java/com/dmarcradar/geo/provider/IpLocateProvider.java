package com.dmarcradar.geo.provider;

import com.dmarcradar.common.UsageWindow;
import com.dmarcradar.domain.GeoLocationData;
import com.dmarcradar.geo.GeoProviderType;
import com.dmarcradar.geo.config.GeoLookupProperties;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.Optional;

/**
 * iplocate.io. Needs an API key sent as X-API-Key; skipped by the lookup chain without one.
 */
@Component
public class IpLocateProvider extends AbstractHttpGeoProvider {

    static final String API_KEY_HEADER = "X-API-Key";

    public IpLocateProvider(GeoLookupProperties geoLookupProperties, WebClient.Builder webClientBuilder) {
        super(GeoProviderType.IPLOCATE, geoLookupProperties.getIplocate(), webClientBuilder, new UsageWindow());
    }

    @Override
    public boolean isConfigured() {
        return properties.hasApiKey();
    }

    @Override
    protected String requestUrl(String ip) {
        return properties.getBaseUrl() + "/" + ip;
    }

    @Override
    protected void addHeaders(HttpHeaders headers) {
        headers.set(API_KEY_HEADER, properties.getApiKey());
    }

    @Override
    protected Optional<GeoLocationData> parse(JsonNode root) {
        return parseResponse(root);
    }

    static Optional<GeoLocationData> parseResponse(JsonNode root) {
        String code = text(root, "country_code");
        if (code == null && text(root, "country") == null) {
            return Optional.empty();
        }
        JsonNode asn = root.path("asn");
        String isp = text(root.path("hosting"), "provider");
        String org = text(root.path("company"), "name");
        return Optional.of(GeoLocationData.builder()
                .country(code)
                .countryName(countryName(text(root, "country"), code))
                .region(text(root, "subdivision"))
                .regionName(text(root, "subdivision"))
                .city(text(root, "city"))
                .latitude(number(root, "latitude"))
                .longitude(number(root, "longitude"))
                .timezone(text(root, "time_zone"))
                .isp(isp != null ? isp : text(asn, "name"))
                .org(org != null ? org : text(asn, "netname"))
                .asn(text(asn, "asn"))
                .build());
    }
}
