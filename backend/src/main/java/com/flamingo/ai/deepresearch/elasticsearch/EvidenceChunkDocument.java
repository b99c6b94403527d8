package com.flamingo.ai.deepresearch.elasticsearch;

import java.time.Instant;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Evidence chunk as stored in Elasticsearch.
 *
 * <p>{@code active=false} marks a soft-pruned chunk: it stays in the index for audit but is
 * excluded from retrieval and from memory rebuilds.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EvidenceChunkDocument implements AbstractElasticsearchIndexService.ScoredDocument {

  private String id;
  private String subgoalId;
  private String sourceUrl;
  private String title;
  private String text;
  private List<Float> embedding;
  @Builder.Default private boolean active = true;
  private Instant createdAt;

  @Builder.Default private Double relevanceScore = 0.0;

  @Override
  public void setRelevanceScore(Double score) {
    this.relevanceScore = score;
  }
}
