package com.fleetinsight.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Enrichment runs on a single dedicated thread: one run at a time, batches and records strictly in sequence.
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    public static final String ENRICHMENT_EXECUTOR = "enrichment-executor";

    @Bean(name = ENRICHMENT_EXECUTOR)
    public Executor enrichmentExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(1);
        e.setMaxPoolSize(1);
        e.setQueueCapacity(1);
        e.setThreadNamePrefix("enrichment-");
        e.initialize();
        return e;
    }
}
