package com.dmarcradar.config;

import com.dmarcradar.classification.config.ClassificationConfig;
import com.dmarcradar.classification.sender.ThirdPartySenderMatcher;
import com.github.benmanes.caffeine.cache.Cache;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.List;
import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(classes = {
        ClassificationConfig.class,
        AsyncConfig.class,
        SchedulerConfig.class
})
class ExecutorConfigTest {

    @Autowired
    Cache<String, List<ThirdPartySenderMatcher.CompiledSender>> thirdPartySenderCache;

    @Autowired
    @Qualifier(AsyncConfig.GEO_LOOKUP_EXECUTOR)
    Executor geoLookupExecutor;

    @Autowired
    @Qualifier(AsyncConfig.REPROCESSING_COORDINATOR_EXECUTOR)
    Executor coordinatorExecutor;

    @Autowired
    @Qualifier(AsyncConfig.REPROCESSING_EXECUTOR)
    Executor reprocessingExecutor;

    @Autowired
    @Qualifier(SchedulerConfig.SCHEDULER_POOL)
    ThreadPoolTaskScheduler schedulerPool;

    @Test
    @DisplayName("third-party sender cache is created and usable")
    void senderCache() {
        thirdPartySenderCache.put("enabled", List.of());
        assertThat(thirdPartySenderCache.getIfPresent("enabled")).isEmpty();
    }

    @Test
    @DisplayName("geo lookups run on a single thread, reprocessing pools are separate")
    void executorsCreated() {
        assertThat(geoLookupExecutor).isInstanceOf(ThreadPoolTaskExecutor.class);
        ThreadPoolTaskExecutor geo = (ThreadPoolTaskExecutor) geoLookupExecutor;
        assertThat(geo.getCorePoolSize()).isEqualTo(1);
        assertThat(geo.getMaxPoolSize()).isEqualTo(1);

        ThreadPoolTaskExecutor coordinator = (ThreadPoolTaskExecutor) coordinatorExecutor;
        assertThat(coordinator.getMaxPoolSize()).isEqualTo(1);

        ThreadPoolTaskExecutor workers = (ThreadPoolTaskExecutor) reprocessingExecutor;
        assertThat(workers.getCorePoolSize()).isGreaterThanOrEqualTo(2);
        assertThat(workers).isNotSameAs(coordinator);
    }

    @Test
    void schedulerPoolCreated() {
        assertThat(schedulerPool.getThreadNamePrefix()).isEqualTo("scheduler-");
        assertThat(schedulerPool.getPoolSize()).isLessThanOrEqualTo(2);
    }
}
