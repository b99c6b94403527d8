package com.flamingo.ai.deepresearch.search;

import com.flamingo.ai.deepresearch.exception.SearchProviderException;
import java.time.Duration;
import java.util.List;

/** Uniform capability wrapping one external search or retrieval service. */
public interface SearchProvider {

  /**
   * Returns the provider name used in {@code research.search.provider-priority}.
   *
   * @return the provider name
   */
  String getName();

  /**
   * Searches the provider.
   *
   * @param query the search query
   * @param maxResults maximum number of hits to return
   * @param timeout upper bound for the remote call
   * @return the hits, never empty
   * @throws SearchProviderException on timeout, auth error, empty or malformed response
   */
  List<SearchHit> search(String query, int maxResults, Duration timeout);
}
