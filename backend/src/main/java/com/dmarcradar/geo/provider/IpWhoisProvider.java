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
 * ipwho.is. Monthly quota applies only without an API key.
 */
@Component
public class IpWhoisProvider extends AbstractHttpGeoProvider {

    public IpWhoisProvider(GeoLookupProperties geoLookupProperties, WebClient.Builder webClientBuilder) {
        super(GeoProviderType.IPWHOIS, geoLookupProperties.getIpwhois(), webClientBuilder, new UsageWindow());
    }

    @Override
    protected boolean limitsApply() {
        return !properties.hasApiKey();
    }

    @Override
    protected String requestUrl(String ip) {
        String url = properties.getBaseUrl() + "/" + ip;
        return properties.hasApiKey() ? url + "?key=" + properties.getApiKey() : url;
    }

    @Override
    protected Optional<GeoLocationData> parse(JsonNode root) {
        return parseResponse(root);
    }

    static Optional<GeoLocationData> parseResponse(JsonNode root) {
        if (!root.path("success").asBoolean(false)) {
            return Optional.empty();
        }
        JsonNode connection = root.path("connection");
        String code = text(root, "country_code");
        String asn = text(connection, "asn");
        return Optional.of(GeoLocationData.builder()
                .country(code)
                .countryName(countryName(text(root, "country"), code))
                .region(text(root, "region_code"))
                .regionName(text(root, "region"))
                .city(text(root, "city"))
                .latitude(number(root, "latitude"))
                .longitude(number(root, "longitude"))
                .timezone(text(root.path("timezone"), "id"))
                .isp(text(connection, "isp"))
                .org(text(connection, "org"))
                .asn(asn != null ? "AS" + asn : null)
                .build());
    }
}
