package com.flamingo.ai.deepresearch.index;

import java.util.List;

/**
 * Outcome of an ingestion.
 *
 * @param chunkIds ids generated for the submitted chunks, in input order
 * @param writtenIds chunks accepted by every target backend
 * @param partialWrites per-backend failures; a chunk rejected by all targets appears once per
 *     backend
 */
public record IngestResult(
    List<String> chunkIds, List<String> writtenIds, List<PartialWrite> partialWrites) {

  public IngestResult {
    chunkIds = List.copyOf(chunkIds);
    writtenIds = List.copyOf(writtenIds);
    partialWrites = List.copyOf(partialWrites);
  }

  public boolean isComplete() {
    return partialWrites.isEmpty();
  }
}
