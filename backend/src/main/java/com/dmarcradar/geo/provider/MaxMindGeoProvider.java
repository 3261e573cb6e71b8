package com.dmarcradar.geo.provider;

import com.dmarcradar.domain.GeoLocationData;
import com.dmarcradar.geo.GeoProvider;
import com.dmarcradar.geo.GeoProviderException;
import com.dmarcradar.geo.GeoProviderType;
import com.dmarcradar.geo.ProviderUsage;
import com.dmarcradar.geo.config.GeoLookupProperties;
import com.maxmind.geoip2.DatabaseReader;
import com.maxmind.geoip2.exception.GeoIp2Exception;
import com.maxmind.geoip2.model.CityResponse;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.net.InetAddress;
import java.util.Optional;

/**
 * Offline lookups against a local MaxMind City database. No quota; not configured when the database is absent.
 */
@Component
@Slf4j
public class MaxMindGeoProvider implements GeoProvider {

    private final DatabaseReader reader;

    @Autowired
    public MaxMindGeoProvider(GeoLookupProperties geoLookupProperties) {
        this(openReader(geoLookupProperties.getMaxmind().getDatabasePath()));
    }

    MaxMindGeoProvider(DatabaseReader reader) {
        this.reader = reader;
    }

    @Override
    public GeoProviderType getType() {
        return GeoProviderType.MAXMIND;
    }

    @Override
    public boolean isConfigured() {
        return reader != null;
    }

    @Override
    public Optional<GeoLocationData> lookup(String ip) {
        if (reader == null) {
            throw new GeoProviderException("MaxMind database is not configured");
        }
        try {
            return reader.tryCity(InetAddress.getByName(ip)).map(MaxMindGeoProvider::toData);
        } catch (IOException | GeoIp2Exception e) {
            throw new GeoProviderException("MaxMind lookup failed for " + ip + ": " + e.getMessage(), e);
        }
    }

    @Override
    public ProviderUsage getUsage() {
        return ProviderUsage.unlimited();
    }

    @PreDestroy
    void close() throws IOException {
        if (reader != null) {
            reader.close();
        }
    }

    private static GeoLocationData toData(CityResponse city) {
        return GeoLocationData.builder()
                .country(city.getCountry().getIsoCode())
                .countryName(city.getCountry().getName())
                .region(city.getMostSpecificSubdivision().getIsoCode())
                .regionName(city.getMostSpecificSubdivision().getName())
                .city(city.getCity().getName())
                .latitude(city.getLocation().getLatitude())
                .longitude(city.getLocation().getLongitude())
                .timezone(city.getLocation().getTimeZone())
                .build();
    }

    private static DatabaseReader openReader(String path) {
        if (path == null || path.isBlank()) {
            return null;
        }
        File file = new File(path);
        if (!file.isFile()) {
            log.warn("MaxMind database {} not found; offline lookups disabled", path);
            return null;
        }
        try {
            DatabaseReader reader = new DatabaseReader.Builder(file).build();
            log.info("MaxMind database loaded from {}", path);
            return reader;
        } catch (IOException e) {
            log.warn("MaxMind database {} could not be opened: {}", path, e.getMessage());
            return null;
        }
    }
}
