package com.flamingo.ai.deepresearch.search;

import com.flamingo.ai.deepresearch.config.ResearchConfig;
import com.flamingo.ai.deepresearch.exception.AllProvidersFailedException;
import com.flamingo.ai.deepresearch.exception.SearchProviderException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Fans research queries out to the search providers.
 *
 * <p>Each query walks the providers in the static {@code provider-priority} order: the first
 * provider that returns hits wins, a failing provider (timeout, error, empty response) is logged
 * and the next one is tried. A query for which every provider failed yields an empty outcome; a
 * fan-out never throws because of a single query.
 */
@Service
@Slf4j
public class SearchCoordinator {

  public static final String INDEX_PROVIDER = "evidence-index";
  private static final String COORDINATOR = "coordinator";

  private final Map<String, SearchProvider> providersByName;
  private final ResearchConfig researchConfig;
  private final ProviderCircuitBreakers circuitBreakers;
  private final EvidenceLookup evidenceLookup;
  private final Executor fanOutExecutor;
  private final Executor providerCallExecutor;
  private final MeterRegistry meterRegistry;

  public SearchCoordinator(
      List<SearchProvider> providers,
      ResearchConfig researchConfig,
      ProviderCircuitBreakers circuitBreakers,
      EvidenceLookup evidenceLookup,
      @Qualifier("searchFanOutExecutor") Executor fanOutExecutor,
      @Qualifier("providerCallExecutor") Executor providerCallExecutor,
      MeterRegistry meterRegistry) {
    this.providersByName = new LinkedHashMap<>();
    for (SearchProvider provider : providers) {
      providersByName.put(provider.getName().toLowerCase(Locale.ROOT), provider);
    }
    this.researchConfig = researchConfig;
    this.circuitBreakers = circuitBreakers;
    this.evidenceLookup = evidenceLookup;
    this.fanOutExecutor = fanOutExecutor;
    this.providerCallExecutor = providerCallExecutor;
    this.meterRegistry = meterRegistry;

    for (String name : researchConfig.getSearch().getProviderPriority()) {
      if (!providersByName.containsKey(name.toLowerCase(Locale.ROOT))) {
        log.warn("Provider '{}' in provider-priority has no registered adapter", name);
      }
    }
    log.info(
        "Search coordinator initialized: priority={}, registered={}",
        researchConfig.getSearch().getProviderPriority(),
        providersByName.keySet());
  }

  /**
   * Runs one search per query concurrently and waits for all of them.
   *
   * @param queries the queries, in plan order
   * @param token cancellation token of the owning session
   * @return one outcome per query, in the order of {@code queries}
   */
  @Timed(value = "research.fan_out", description = "Time to complete a fan-out batch")
  public FanOutResult fanOut(List<String> queries, CancellationToken token) {
    if (queries.isEmpty()) {
      return new FanOutResult(List.of(), token.isCancelled());
    }
    log.info("[FanOut] Dispatching {} queries", queries.size());

    List<CompletableFuture<QuerySearchOutcome>> futures = new ArrayList<>(queries.size());
    for (String query : queries) {
      futures.add(submit(query, token));
    }
    List<QuerySearchOutcome> outcomes = new ArrayList<>(queries.size());
    try (CancellationToken.Registration ignored =
        token.onCancel(() -> futures.forEach(future -> future.cancel(true)))) {
      for (int i = 0; i < futures.size(); i++) {
        outcomes.add(await(queries.get(i), futures.get(i)));
      }
    }

    FanOutResult result = new FanOutResult(outcomes, token.isCancelled());
    log.info(
        "[FanOut] Batch completed: succeeded={}, failed={}, cancelled={}",
        result.succeededCount(),
        result.failedCount(),
        result.cancelled());
    meterRegistry.counter("search.fan_out.queries", "outcome", "success")
        .increment(result.succeededCount());
    meterRegistry.counter("search.fan_out.queries", "outcome", "empty")
        .increment(result.failedCount());
    return result;
  }

  /**
   * Searches the providers in priority order and returns the first success.
   *
   * @param query the search query
   * @return the winning provider's hits plus the failures recorded before it
   * @throws AllProvidersFailedException if no provider returned hits
   */
  public ProviderSearchResult search(String query) {
    ResearchConfig.Search settings = researchConfig.getSearch();
    Duration timeout = Duration.ofMillis(settings.getTimeoutMs());
    List<ProviderFailure> failures = new ArrayList<>();

    for (String name : settings.getProviderPriority()) {
      SearchProvider provider = providersByName.get(name.toLowerCase(Locale.ROOT));
      if (provider == null) {
        failures.add(new ProviderFailure(name, "not registered"));
        continue;
      }

      Optional<CircuitBreaker> breaker = circuitBreakers.forProvider(provider.getName());
      if (breaker.isPresent() && !breaker.get().tryAcquirePermission()) {
        log.warn("[Search] Skipping provider {} for '{}': circuit open", name, query);
        failures.add(new ProviderFailure(name, "circuit open"));
        continue;
      }

      long start = System.nanoTime();
      try {
        List<SearchHit> hits = callWithTimeout(provider, query, settings.getMaxResults(), timeout);
        if (hits == null || hits.isEmpty()) {
          throw new SearchProviderException(provider.getName(), "empty response");
        }
        breaker.ifPresent(cb -> cb.onSuccess(System.nanoTime() - start, TimeUnit.NANOSECONDS));
        meterRegistry.counter("search.provider.success", "provider", name).increment();
        log.debug("[Search] Provider {} returned {} hits for '{}'", name, hits.size(), query);
        return new ProviderSearchResult(query, provider.getName(), hits, failures);
      } catch (SearchProviderException e) {
        breaker.ifPresent(cb -> cb.onError(System.nanoTime() - start, TimeUnit.NANOSECONDS, e));
        meterRegistry.counter("search.provider.failures", "provider", name).increment();
        log.warn("[Search] Provider {} failed for '{}': {}", name, query, e.getMessage());
        failures.add(new ProviderFailure(name, e.getMessage()));
      }
    }

    throw new AllProvidersFailedException(query, failures);
  }

  private CompletableFuture<QuerySearchOutcome> submit(String query, CancellationToken token) {
    try {
      return CompletableFuture.supplyAsync(() -> searchContained(query, token), fanOutExecutor);
    } catch (RejectedExecutionException e) {
      log.error("[FanOut] Query '{}' rejected by executor: {}", query, e.getMessage());
      return CompletableFuture.completedFuture(
          QuerySearchOutcome.failed(
              query, List.of(new ProviderFailure(COORDINATOR, "rejected: " + e.getMessage()))));
    }
  }

  private QuerySearchOutcome await(String query, CompletableFuture<QuerySearchOutcome> future) {
    try {
      return future.join();
    } catch (CancellationException e) {
      return cancelled(query);
    } catch (CompletionException e) {
      log.error("[FanOut] Query '{}' failed unexpectedly: {}", query, e.getMessage());
      return QuerySearchOutcome.failed(
          query, List.of(new ProviderFailure(COORDINATOR, String.valueOf(e.getMessage()))));
    }
  }

  private QuerySearchOutcome searchContained(String query, CancellationToken token) {
    if (token.isCancelled()) {
      return cancelled(query);
    }
    List<SearchHit> reusable = lookupReusable(query);
    if (!reusable.isEmpty()) {
      log.debug("[FanOut] Reusing {} indexed hits for '{}'", reusable.size(), query);
      meterRegistry.counter("search.evidence_reuse.hits").increment();
      return new QuerySearchOutcome(query, INDEX_PROVIDER, reusable, List.of());
    }
    try {
      return QuerySearchOutcome.of(search(query));
    } catch (AllProvidersFailedException e) {
      log.warn("[FanOut] {}", e.getMessage());
      meterRegistry.counter("search.all_providers_failed").increment();
      return QuerySearchOutcome.failed(query, e.getFailures());
    } catch (RuntimeException e) {
      log.error("[FanOut] Unexpected failure for '{}': {}", query, e.getMessage(), e);
      return QuerySearchOutcome.failed(
          query, List.of(new ProviderFailure(COORDINATOR, String.valueOf(e.getMessage()))));
    }
  }

  private static QuerySearchOutcome cancelled(String query) {
    return QuerySearchOutcome.failed(query, List.of(new ProviderFailure(COORDINATOR, "cancelled")));
  }

  private List<SearchHit> lookupReusable(String query) {
    try {
      List<SearchHit> hits = evidenceLookup.findReusable(query);
      return hits == null ? List.of() : hits;
    } catch (RuntimeException e) {
      log.warn("[FanOut] Evidence lookup failed for '{}': {}", query, e.getMessage());
      return List.of();
    }
  }

  private List<SearchHit> callWithTimeout(
      SearchProvider provider, String query, int maxResults, Duration timeout) {
    CompletableFuture<List<SearchHit>> call;
    try {
      call =
          CompletableFuture.supplyAsync(
              () -> provider.search(query, maxResults, timeout), providerCallExecutor);
    } catch (RejectedExecutionException e) {
      throw new SearchProviderException(provider.getName(), "rejected: " + e.getMessage(), e);
    }
    try {
      return call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      call.cancel(true);
      throw new SearchProviderException(
          provider.getName(), "timeout after " + timeout.toMillis() + "ms", e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof SearchProviderException providerException) {
        throw providerException;
      }
      throw new SearchProviderException(provider.getName(), String.valueOf(cause), cause);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      call.cancel(true);
      throw new SearchProviderException(provider.getName(), "interrupted", e);
    }
  }
}
