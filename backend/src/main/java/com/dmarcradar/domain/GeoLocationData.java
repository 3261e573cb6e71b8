package com.dmarcradar.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Resolved location of one IP as returned by a geolocation provider or read from the ip_locations cache.
 */
@Getter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class GeoLocationData {

    /** ISO 3166-1 alpha-2. */
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
}
