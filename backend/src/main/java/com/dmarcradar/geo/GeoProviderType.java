package com.dmarcradar.geo;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;

/**
 * Geolocation providers selectable as primary or fallback. MAXMIND is the offline database and the
 * last-resort provider of the lookup queue.
 */
public enum GeoProviderType {
    IP_API("ip-api"),
    IPAPI_CO("ipapi-co"),
    IPWHOIS("ipwhois"),
    IPLOCATE("iplocate"),
    MAXMIND("maxmind");

    private final String id;

    GeoProviderType(String id) {
        this.id = id;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    /** Accepts the id ("ip-api") or the constant name ("IP_API"). */
    @JsonCreator
    public static GeoProviderType fromId(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Provider must not be null");
        }
        String v = value.strip();
        return Arrays.stream(values())
                .filter(t -> t.id.equalsIgnoreCase(v) || t.name().equalsIgnoreCase(v.replace('-', '_').toUpperCase(Locale.ROOT)))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown geolocation provider: " + value));
    }
}
