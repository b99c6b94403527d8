package com.flamingo.ai.deepresearch.search;

import java.util.List;

/**
 * Result of one query inside a fan-out batch. A failed query carries no hits and the ordered
 * provider failures.
 *
 * @param query the query text
 * @param provider the provider that answered, {@code "evidence-index"} for reused evidence, or
 *     {@code null} if nothing answered
 * @param hits the hits, empty when the query failed
 * @param failures provider failures in attempt order
 */
public record QuerySearchOutcome(
    String query, String provider, List<SearchHit> hits, List<ProviderFailure> failures) {

  public QuerySearchOutcome {
    hits = List.copyOf(hits);
    failures = List.copyOf(failures);
  }

  public static QuerySearchOutcome failed(String query, List<ProviderFailure> failures) {
    return new QuerySearchOutcome(query, null, List.of(), failures);
  }

  public static QuerySearchOutcome of(ProviderSearchResult result) {
    return new QuerySearchOutcome(
        result.query(), result.provider(), result.hits(), result.failures());
  }

  public boolean isEmpty() {
    return hits.isEmpty();
  }
}
