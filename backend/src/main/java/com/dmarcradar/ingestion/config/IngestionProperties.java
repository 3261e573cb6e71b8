package com.dmarcradar.ingestion.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Report ingestion configuration. Documented in application.yml under dmarcradar.ingestion.
 */
@ConfigurationProperties(prefix = "dmarcradar.ingestion")
@Getter
@Setter
public class IngestionProperties {

    /**
     * Startup default for geolocation during ingestion: true queues IPs for the background queue,
     * false resolves them inline before the records are saved. Switchable at runtime.
     */
    private boolean asyncGeoLookup = true;

    /**
     * Directory polled for report files (.xml, .gz, .zip). Import job is idle when blank.
     */
    private String importDirectory;

    /**
     * Delete files after a successful import; otherwise they are remembered and skipped until modified.
     */
    private boolean deleteAfterImport = false;

    private long importPollIntervalMs = 60_000;
}
