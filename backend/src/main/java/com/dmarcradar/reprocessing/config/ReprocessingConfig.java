package com.dmarcradar.reprocessing.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Reprocessing module configuration.
 */
@Configuration
@EnableConfigurationProperties(ReprocessingProperties.class)
public class ReprocessingConfig {
}
