package com.fleetinsight.enrichment.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Inference oracle (OpenAI chat model) config. Timeout and retries apply to each oracle call inside the
 * model client; the enrichment engine itself never retries.
 */
@ConfigurationProperties(prefix = "fleetinsight.oracle")
@NoArgsConstructor
@Getter
@Setter
public class OracleProperties {

    static final String PLACEHOLDER_KEY = "your_openai_api_key_here";

    private String apiKey;

    private String modelName = "gpt-4o-mini";

    private double temperature = 0.3;

    private int maxTokens = 500;

    private Duration timeout = Duration.ofSeconds(30);

    private int maxRetries = 3;

    /** Oracle calls are billed per call; cap the request rate. */
    private int maxRequestsPerSecond = 5;

    /** How long a call may wait for a rate-limiter permit before it counts as failed. */
    private Duration limiterTimeout = Duration.ofSeconds(30);

    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank() && !PLACEHOLDER_KEY.equals(apiKey.strip());
    }
}
