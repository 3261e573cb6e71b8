package com.dmarcradar.reprocessing.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Reprocessing configuration. Documented in application.yml under dmarcradar.reprocessing.
 */
@ConfigurationProperties(prefix = "dmarcradar.reprocessing")
@Getter
@Setter
public class ReprocessingProperties {

    /**
     * Parallel chunk workers per job. 0 or less means max(1, cpus / 4).
     */
    private int workers = 0;

    /**
     * Records loaded and classified per batch.
     */
    private int batchSize = 100;

    /**
     * Minimum interval between progress writes to reprocessing_jobs.
     */
    private long progressPersistIntervalMs = 2000;

    public int getEffectiveWorkers() {
        if (workers > 0) {
            return workers;
        }
        return Math.max(1, Runtime.getRuntime().availableProcessors() / 4);
    }
}
