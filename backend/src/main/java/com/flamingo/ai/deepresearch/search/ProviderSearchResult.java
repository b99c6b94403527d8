package com.flamingo.ai.deepresearch.search;

import java.util.List;

/**
 * Hits from the first provider that answered a query, with the failures of the providers tried
 * before it.
 */
public record ProviderSearchResult(
    String query, String provider, List<SearchHit> hits, List<ProviderFailure> failures) {

  public ProviderSearchResult {
    hits = List.copyOf(hits);
    failures = List.copyOf(failures);
  }
}
