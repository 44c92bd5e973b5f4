package com.fleetinsight.enrichment.oracle;

import dev.langchain4j.model.chat.ChatModel;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link InsightOracle} backed by a LangChain4j chat model. Each call takes a permit from the oracle rate
 * limiter first; a rejected permit surfaces as {@code RequestNotPermitted} like any other call failure.
 * Timeout and retries are configured on the chat model itself.
 */
@Slf4j
public class LangChainInsightOracle implements InsightOracle {

    private final ChatModel chatModel;
    private final RateLimiter rateLimiter;

    public LangChainInsightOracle(ChatModel chatModel, RateLimiter rateLimiter) {
        this.chatModel = chatModel;
        this.rateLimiter = rateLimiter;
    }

    @Override
    public String complete(String prompt) {
        String answer = rateLimiter.executeSupplier(() -> chatModel.chat(prompt));
        log.debug("Oracle answered with {} chars", answer != null ? answer.length() : 0);
        return answer;
    }

    @Override
    public boolean isConfigured() {
        return true;
    }
}
