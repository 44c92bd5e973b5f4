package com.fleetinsight.config;

import com.fleetinsight.analytics.MetricsStore;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Caffeine in-process caches. The metrics cache is evicted on every metrics save.
 */
@Configuration
@EnableCaching
public class CaffeineConfig {

    public static final String METRICS_CACHE = MetricsStore.METRICS_CACHE;

    @Bean
    public CacheManager caffeineCacheManager() {
        CaffeineCacheManager manager = new CaffeineCacheManager();
        manager.registerCustomCache(METRICS_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(10, TimeUnit.MINUTES)
                .maximumSize(10)
                .build());
        return manager;
    }
}
