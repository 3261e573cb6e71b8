package com.dmarcradar.geo.provider;

import com.dmarcradar.common.UsageWindow;
import com.dmarcradar.domain.GeoLocationData;
import com.dmarcradar.geo.GeoProviderType;
import com.dmarcradar.geo.config.GeoLookupProperties;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.Optional;

/**
 * ip-api.com free endpoint (45 req/min, no key).
 */
@Component
public class IpApiProvider extends AbstractHttpGeoProvider {

    public IpApiProvider(GeoLookupProperties geoLookupProperties, WebClient.Builder webClientBuilder) {
        super(GeoProviderType.IP_API, geoLookupProperties.getIpApi(), webClientBuilder, new UsageWindow());
    }

    @Override
    protected String requestUrl(String ip) {
        return properties.getBaseUrl() + "/" + ip;
    }

    @Override
    protected Optional<GeoLocationData> parse(JsonNode root) {
        return parseResponse(root);
    }

    static Optional<GeoLocationData> parseResponse(JsonNode root) {
        if ("fail".equalsIgnoreCase(text(root, "status"))) {
            return Optional.empty();
        }
        String code = text(root, "countryCode");
        return Optional.of(GeoLocationData.builder()
                .country(code)
                .countryName(countryName(text(root, "country"), code))
                .region(text(root, "region"))
                .regionName(text(root, "regionName"))
                .city(text(root, "city"))
                .latitude(number(root, "lat"))
                .longitude(number(root, "lon"))
                .timezone(text(root, "timezone"))
                .isp(text(root, "isp"))
                .org(text(root, "org"))
                .asn(text(root, "as"))
                .build());
    }
}
