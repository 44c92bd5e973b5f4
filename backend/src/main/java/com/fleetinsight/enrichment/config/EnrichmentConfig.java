package com.fleetinsight.enrichment.config;

import com.fleetinsight.enrichment.oracle.InsightOracle;
import com.fleetinsight.enrichment.oracle.LangChainInsightOracle;
import dev.langchain4j.model.openai.OpenAiChatModel;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Wires the inference oracle: OpenAI chat model behind a per-second rate limiter.
 */
@Configuration
@Slf4j
@EnableConfigurationProperties({ EnrichmentProperties.class, OracleProperties.class })
public class EnrichmentConfig {

    @Bean(name = "oracleRateLimiter")
    public RateLimiter oracleRateLimiter(OracleProperties oracleProperties) {
        int rps = Math.max(1, oracleProperties.getMaxRequestsPerSecond());
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(rps)
                .timeoutDuration(oracleProperties.getLimiterTimeout())
                .build();
        return RateLimiter.of("insight-oracle", config);
    }

    @Bean
    public InsightOracle insightOracle(OracleProperties oracleProperties, RateLimiter oracleRateLimiter) {
        if (!oracleProperties.isConfigured()) {
            log.warn("fleetinsight.oracle.api-key is not set; processing runs will be rejected");
            return new UnconfiguredInsightOracle();
        }
        OpenAiChatModel chatModel = OpenAiChatModel.builder()
                .apiKey(oracleProperties.getApiKey())
                .modelName(oracleProperties.getModelName())
                .temperature(oracleProperties.getTemperature())
                .maxTokens(oracleProperties.getMaxTokens())
                .timeout(oracleProperties.getTimeout())
                .maxRetries(oracleProperties.getMaxRetries())
                .build();
        return new LangChainInsightOracle(chatModel, oracleRateLimiter);
    }
}
