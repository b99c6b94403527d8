package com.flamingo.ai.deepresearch.index;

import java.util.List;
import java.util.Map;

/**
 * A unit of retrievable evidence: text, its embedding and source metadata.
 *
 * @param id globally unique chunk id
 * @param subgoalId the plan step that produced the chunk
 * @param text the evidence text
 * @param embedding the embedding vector
 * @param sourceMetadata source attributes such as {@code sourceUrl} and {@code title}
 */
public record EvidenceChunk(
    String id,
    String subgoalId,
    String text,
    List<Float> embedding,
    Map<String, String> sourceMetadata) {

  public static final String SOURCE_URL = "sourceUrl";
  public static final String TITLE = "title";

  public EvidenceChunk {
    embedding = embedding == null ? List.of() : List.copyOf(embedding);
    sourceMetadata = sourceMetadata == null ? Map.of() : Map.copyOf(sourceMetadata);
  }

  public String sourceUrl() {
    return sourceMetadata.getOrDefault(SOURCE_URL, "");
  }

  public ChunkRef toRef() {
    return new ChunkRef(id, subgoalId, sourceUrl());
  }
}
