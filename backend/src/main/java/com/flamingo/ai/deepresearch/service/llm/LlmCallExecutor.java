package com.flamingo.ai.deepresearch.service.llm;

import com.flamingo.ai.deepresearch.exception.LlmServiceException;
import io.github.resilience4j.retry.Retry;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Locale;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Runs LLM agent calls through the "llm" Resilience4j retry. Failures that survive the retry are
 * reported as {@link LlmServiceException}.
 */
@Component
@Slf4j
public class LlmCallExecutor {

  private final Retry retry;
  private final MeterRegistry meterRegistry;

  public LlmCallExecutor(@Qualifier("llmRetry") Retry retry, MeterRegistry meterRegistry) {
    this.retry = retry;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Executes the call, retrying with backoff.
   *
   * @param operation short name used in logs and metrics
   * @param call the agent invocation
   * @return the agent result
   * @throws LlmServiceException when every attempt failed
   */
  public <T> T execute(String operation, Supplier<T> call) {
    Supplier<T> decorated = Retry.decorateSupplier(retry, call);
    try {
      T result = decorated.get();
      meterRegistry.counter("llm.calls", "operation", operation, "outcome", "success").increment();
      return result;
    } catch (LlmServiceException e) {
      throw e;
    } catch (RuntimeException e) {
      meterRegistry.counter("llm.calls", "operation", operation, "outcome", "failure").increment();
      log.error("LLM call '{}' failed after retries: {}", operation, e.getMessage());
      throw new LlmServiceException(
          "LLM call '" + operation + "' failed: " + e.getMessage(), isRateLimited(e), e);
    }
  }

  private boolean isRateLimited(Throwable e) {
    String message = e.getMessage();
    if (message == null) {
      return false;
    }
    String lower = message.toLowerCase(Locale.ROOT);
    return lower.contains("429") || lower.contains("rate limit") || lower.contains("quota");
  }
}
