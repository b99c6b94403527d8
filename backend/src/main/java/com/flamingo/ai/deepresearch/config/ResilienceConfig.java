package com.flamingo.ai.deepresearch.config;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Programmatic Resilience4j wiring for LLM calls.
 *
 * <p>The "llm" retry uses exponential backoff starting at {@code research.llm.backoff-ms}. Search
 * provider circuit breakers are created on demand by {@code ProviderCircuitBreakers}.
 */
@Configuration
public class ResilienceConfig {

  public static final String LLM_RETRY = "llm";

  @Bean
  public Retry llmRetry(RetryRegistry retryRegistry, ResearchConfig researchConfig) {
    ResearchConfig.Llm llm = researchConfig.getLlm();
    RetryConfig config =
        RetryConfig.custom()
            .maxAttempts(Math.max(1, llm.getMaxAttempts()))
            .intervalFunction(
                IntervalFunction.ofExponentialBackoff(Math.max(1, llm.getBackoffMs())))
            .build();
    return retryRegistry.retry(LLM_RETRY, config);
  }
}
