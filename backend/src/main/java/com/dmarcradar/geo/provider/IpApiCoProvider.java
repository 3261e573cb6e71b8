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
 * ipapi.co. Daily quota applies only without an API key.
 */
@Component
public class IpApiCoProvider extends AbstractHttpGeoProvider {

    public IpApiCoProvider(GeoLookupProperties geoLookupProperties, WebClient.Builder webClientBuilder) {
        super(GeoProviderType.IPAPI_CO, geoLookupProperties.getIpapiCo(), webClientBuilder, new UsageWindow());
    }

    @Override
    protected boolean limitsApply() {
        return !properties.hasApiKey();
    }

    @Override
    protected String requestUrl(String ip) {
        String url = properties.getBaseUrl() + "/" + ip + "/json/";
        return properties.hasApiKey() ? url + "?key=" + properties.getApiKey() : url;
    }

    @Override
    protected Optional<GeoLocationData> parse(JsonNode root) {
        return parseResponse(root);
    }

    static Optional<GeoLocationData> parseResponse(JsonNode root) {
        if (root.path("error").asBoolean(false)) {
            return Optional.empty();
        }
        String code = text(root, "country_code");
        String org = text(root, "org");
        return Optional.of(GeoLocationData.builder()
                .country(code)
                .countryName(countryName(text(root, "country_name"), code))
                .region(text(root, "region_code"))
                .regionName(text(root, "region"))
                .city(text(root, "city"))
                .latitude(number(root, "latitude"))
                .longitude(number(root, "longitude"))
                .timezone(text(root, "timezone"))
                .isp(org)
                .org(org)
                .asn(text(root, "asn"))
                .build());
    }
}
