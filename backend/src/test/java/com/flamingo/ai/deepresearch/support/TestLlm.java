package com.flamingo.ai.deepresearch.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.deepresearch.service.llm.LlmCallExecutor;
import com.flamingo.ai.deepresearch.service.llm.StructuredOutputParser;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.micrometer.core.instrument.MeterRegistry;

/** LLM plumbing for unit tests: a single attempt, no backoff. */
public final class TestLlm {

  private TestLlm() {}

  public static LlmCallExecutor executor(MeterRegistry meterRegistry) {
    return new LlmCallExecutor(
        Retry.of("llm-test", RetryConfig.custom().maxAttempts(1).build()), meterRegistry);
  }

  public static StructuredOutputParser parser() {
    return new StructuredOutputParser(new ObjectMapper());
  }
}
