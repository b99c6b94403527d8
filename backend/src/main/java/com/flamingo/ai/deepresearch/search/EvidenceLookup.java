package com.flamingo.ai.deepresearch.search;

import java.util.List;

/** Source of previously gathered evidence consulted before any provider is called. */
@FunctionalInterface
public interface EvidenceLookup {

  /**
   * Returns stored hits that already answer the query, or an empty list.
   *
   * @param query the search query
   * @return reusable hits
   */
  List<SearchHit> findReusable(String query);

  static EvidenceLookup disabled() {
    return query -> List.of();
  }
}
