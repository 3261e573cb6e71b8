package com.dmarcradar.geo.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Geolocation module configuration.
 */
@Configuration
@EnableConfigurationProperties(GeoLookupProperties.class)
public class GeoConfig {
}
