package com.dmarcradar.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pools: geo-lookup (single in-flight provider call), reprocessing coordinator and chunk workers.
 * Coordinator runs a reprocessing job (and blocks on join); worker pool runs one chunk per task.
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    public static final String GEO_LOOKUP_EXECUTOR = "geo-lookup-executor";
    public static final String REPROCESSING_COORDINATOR_EXECUTOR = "reprocessing-coordinator-executor";
    public static final String REPROCESSING_EXECUTOR = "reprocessing-executor";

    /** Exactly one thread: the queue never has two provider calls in flight. */
    @Bean(name = GEO_LOOKUP_EXECUTOR)
    public Executor geoLookupExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(1);
        e.setMaxPoolSize(1);
        e.setQueueCapacity(16);
        e.setThreadNamePrefix("geo-lookup-");
        e.initialize();
        return e;
    }

    @Bean(name = REPROCESSING_COORDINATOR_EXECUTOR)
    public Executor reprocessingCoordinatorExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(1);
        e.setMaxPoolSize(1);
        e.setThreadNamePrefix("reprocess-coord-");
        e.initialize();
        return e;
    }

    @Bean(name = REPROCESSING_EXECUTOR)
    public Executor reprocessingExecutor() {
        int cpus = Runtime.getRuntime().availableProcessors();
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(Math.max(2, cpus / 2));
        e.setMaxPoolSize(Math.max(4, cpus));
        e.setThreadNamePrefix("reprocess-");
        e.initialize();
        return e;
    }
}
