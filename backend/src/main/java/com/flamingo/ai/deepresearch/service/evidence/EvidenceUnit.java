package com.flamingo.ai.deepresearch.service.evidence;

import com.flamingo.ai.deepresearch.search.SearchHit;

/**
 * One piece of evidence flowing through validation and compression. Immutable; stages produce new
 * units instead of editing existing ones.
 *
 * @param sourceUrl where the snippet came from
 * @param title source title
 * @param snippet snippet text ending in a markdown citation
 * @param score rank-derived relevance score in (0, 1]
 * @param citationIndex citation id of the source, {@code null} until assigned
 * @param query the query that produced the unit
 */
public record EvidenceUnit(
    String sourceUrl,
    String title,
    String snippet,
    double score,
    Integer citationIndex,
    String query) {

  private static final double RANK_DECAY = 0.1;
  private static final double MIN_SCORE = 0.1;

  /** Converts the hit at {@code rank} (zero-based) of a query's result list. */
  public static EvidenceUnit fromHit(SearchHit hit, String query, int rank) {
    double score = Math.max(MIN_SCORE, 1.0 - rank * RANK_DECAY);
    return new EvidenceUnit(hit.url(), hit.title(), hit.toCitedSnippet(), score, null, query);
  }

  public EvidenceUnit withSnippet(String newSnippet) {
    return new EvidenceUnit(sourceUrl, title, newSnippet, score, citationIndex, query);
  }

  public EvidenceUnit withCitationIndex(int index) {
    return new EvidenceUnit(sourceUrl, title, snippet, score, index, query);
  }
}
