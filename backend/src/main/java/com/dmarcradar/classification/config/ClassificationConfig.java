package com.dmarcradar.classification.config;

import com.dmarcradar.classification.sender.ThirdPartySenderMatcher;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Classification module beans: the single-entry cache of compiled enabled senders.
 */
@Configuration
public class ClassificationConfig {

    @Bean
    public Cache<String, List<ThirdPartySenderMatcher.CompiledSender>> thirdPartySenderCache(
            @Value("${dmarcradar.classification.sender-cache-ttl-seconds:60}") long ttlSeconds) {
        return Caffeine.newBuilder()
                .expireAfterWrite(Math.max(1, ttlSeconds), TimeUnit.SECONDS)
                .maximumSize(1)
                .build();
    }
}
