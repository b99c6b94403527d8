package com.flamingo.ai.deepresearch.index;

/**
 * Metadata filter applied to index queries. Null fields do not filter.
 *
 * @param subgoalId only chunks of this subgoal
 * @param sourceUrl only chunks from this source
 * @param minScore drop results scoring below this value
 */
public record ChunkFilter(String subgoalId, String sourceUrl, Double minScore) {

  public static ChunkFilter none() {
    return new ChunkFilter(null, null, null);
  }

  public static ChunkFilter bySubgoal(String subgoalId) {
    return new ChunkFilter(subgoalId, null, null);
  }

  public static ChunkFilter withMinScore(double minScore) {
    return new ChunkFilter(null, null, minScore);
  }

  public boolean accepts(EvidenceChunk chunk, double score) {
    return (subgoalId == null || subgoalId.equals(chunk.subgoalId()))
        && (sourceUrl == null || sourceUrl.equals(chunk.sourceUrl()))
        && (minScore == null || score >= minScore);
  }
}
