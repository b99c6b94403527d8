package com.flamingo.ai.deepresearch.search;

import com.flamingo.ai.deepresearch.config.ResearchConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import java.time.Duration;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Opt-in per-provider circuit breakers. When enabled, a provider that failed
 * {@code failure-threshold} times in a row within {@code window-seconds} is skipped for
 * {@code open-seconds}. Provider order itself never changes.
 */
@Component
@Slf4j
public class ProviderCircuitBreakers {

  private static final String PREFIX = "search-provider-";

  private final CircuitBreakerRegistry registry;
  private final boolean enabled;
  private final CircuitBreakerConfig config;

  public ProviderCircuitBreakers(
      CircuitBreakerRegistry circuitBreakerRegistry, ResearchConfig researchConfig) {
    ResearchConfig.Search.CircuitBreaker settings =
        researchConfig.getSearch().getCircuitBreaker();
    this.registry = circuitBreakerRegistry;
    this.enabled = settings.isEnabled();
    int threshold = Math.max(1, settings.getFailureThreshold());
    // Every call in the window failing, with at least `threshold` calls, means `threshold`
    // consecutive failures.
    this.config =
        CircuitBreakerConfig.custom()
            .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.TIME_BASED)
            .slidingWindowSize(Math.max(1, settings.getWindowSeconds()))
            .minimumNumberOfCalls(threshold)
            .failureRateThreshold(100)
            .permittedNumberOfCallsInHalfOpenState(1)
            .waitDurationInOpenState(Duration.ofSeconds(Math.max(1, settings.getOpenSeconds())))
            .build();
    if (enabled) {
      log.info(
          "Search provider circuit breakers enabled: threshold={}, window={}s, open={}s",
          threshold,
          settings.getWindowSeconds(),
          settings.getOpenSeconds());
    }
  }

  public boolean isEnabled() {
    return enabled;
  }

  /**
   * Returns the breaker for a provider, or empty when breakers are disabled.
   *
   * @param provider the provider name
   * @return the breaker
   */
  public Optional<CircuitBreaker> forProvider(String provider) {
    if (!enabled) {
      return Optional.empty();
    }
    return Optional.of(registry.circuitBreaker(PREFIX + provider, config));
  }
}
