package com.fleetinsight.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.cache.CacheManager;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(classes = {
        CaffeineConfig.class,
        AsyncConfig.class
})
class CacheAndExecutorConfigTest {

    @Autowired
    CacheManager cacheManager;

    @Autowired
    @Qualifier(AsyncConfig.ENRICHMENT_EXECUTOR)
    Executor enrichmentExecutor;

    @Test
    @DisplayName("metrics cache is created and usable")
    void metricsCacheCreated() {
        assertThat(cacheManager.getCache(CaffeineConfig.METRICS_CACHE)).isNotNull();

        cacheManager.getCache(CaffeineConfig.METRICS_CACHE).put("latest", "value1");
        assertThat(cacheManager.getCache(CaffeineConfig.METRICS_CACHE).get("latest").get()).isEqualTo("value1");
    }

    @Test
    @DisplayName("enrichment executor is a single thread")
    void enrichmentExecutorSingleThread() {
        assertThat(enrichmentExecutor).isInstanceOf(ThreadPoolTaskExecutor.class);
        ThreadPoolTaskExecutor e = (ThreadPoolTaskExecutor) enrichmentExecutor;
        assertThat(e.getCorePoolSize()).isEqualTo(1);
        assertThat(e.getMaxPoolSize()).isEqualTo(1);
        assertThat(e.getThreadNamePrefix()).isEqualTo("enrichment-");
    }
}
