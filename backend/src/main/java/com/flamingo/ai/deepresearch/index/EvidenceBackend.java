package com.flamingo.ai.deepresearch.index;

import com.flamingo.ai.deepresearch.exception.IndexWriteException;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/** One storage backend of the evidence index. Implementations must be thread-safe. */
public interface EvidenceBackend {

  BackendType getType();

  /**
   * Writes chunks.
   *
   * @param chunks the chunks, ids already assigned
   * @return rejected chunk ids mapped to the rejection reason; empty if all were accepted
   * @throws IndexWriteException if the backend rejected the whole batch
   */
  Map<String, String> write(List<EvidenceChunk> chunks);

  /**
   * Nearest-neighbour query over active chunks.
   *
   * @param embedding the query vector
   * @param topK maximum number of results
   * @param filter metadata filter
   * @return results ordered by descending score
   */
  List<RetrievedChunk> query(List<Float> embedding, int topK, ChunkFilter filter);

  /**
   * Tombstones chunks so they are no longer returned, keeping their storage. Unknown ids are
   * ignored.
   *
   * @throws IndexWriteException if the backend could not record the tombstones
   */
  void markInactive(Collection<String> ids);

  /**
   * Physically deletes chunks. Unknown ids are ignored.
   *
   * @throws IndexWriteException if the backend could not delete
   */
  void delete(Collection<String> ids);

  /**
   * Reads back every active chunk, embeddings included.
   *
   * @param pageSize maximum number of chunks fetched per request; backends that read in one pass
   *     ignore it
   * @return all active chunks
   */
  List<EvidenceChunk> loadActive(int pageSize);
}
