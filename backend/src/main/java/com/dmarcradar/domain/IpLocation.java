package com.dmarcradar.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Persistent geolocation cache keyed by IP. noData=true records a lookup that returned nothing,
 * so the same IP is not sent to providers again until the row is stale.
 */
@Document(collection = "ip_locations")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class IpLocation {

    @Id
    @EqualsAndHashCode.Include
    private String ip;

    private String country;
    private String countryName;
    private String region;
    private String regionName;
    private String city;
    private Double latitude;
    private Double longitude;
    private String timezone;
    private String isp;
    private String org;
    private String asn;
    private String provider;
    private boolean noData;
    private Instant resolvedAt;

    public static IpLocation of(String ip, GeoLocationData data, String provider, Instant resolvedAt) {
        IpLocation l = new IpLocation();
        l.setIp(ip);
        l.setCountry(data.getCountry());
        l.setCountryName(data.getCountryName());
        l.setRegion(data.getRegion());
        l.setRegionName(data.getRegionName());
        l.setCity(data.getCity());
        l.setLatitude(data.getLatitude());
        l.setLongitude(data.getLongitude());
        l.setTimezone(data.getTimezone());
        l.setIsp(data.getIsp());
        l.setOrg(data.getOrg());
        l.setAsn(data.getAsn());
        l.setProvider(provider);
        l.setResolvedAt(resolvedAt);
        return l;
    }

    public static IpLocation noData(String ip, Instant resolvedAt) {
        IpLocation l = new IpLocation();
        l.setIp(ip);
        l.setNoData(true);
        l.setResolvedAt(resolvedAt);
        return l;
    }

    public GeoLocationData toGeoLocationData() {
        return GeoLocationData.builder()
                .country(country)
                .countryName(countryName)
                .region(region)
                .regionName(regionName)
                .city(city)
                .latitude(latitude)
                .longitude(longitude)
                .timezone(timezone)
                .isp(isp)
                .org(org)
                .asn(asn)
                .build();
    }
}
