package com.flamingo.ai.deepresearch.index;

import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.filter.Filter;
import dev.langchain4j.store.embedding.filter.MetadataFilterBuilder;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Backend A: LangChain4j {@link InMemoryEmbeddingStore} holding chunk vectors for the lifetime of
 * the process. Tombstoned chunks stay in the store and are filtered out of results; {@link
 * #rebuild} and {@link #delete} build a fresh store and publish it together with its chunk table,
 * so a concurrent query sees either the old contents or the new ones.
 */
@Component
@Slf4j
public class InMemoryVectorBackend implements EvidenceBackend {

  private static final String SUBGOAL_KEY = "subgoalId";

  private volatile Contents contents = Contents.empty();

  /** Embedding dimension fixed by the first accepted chunk; guarded by this. */
  private int dimensions = -1;

  @Override
  public BackendType getType() {
    return BackendType.MEMORY;
  }

  @Override
  public synchronized Map<String, String> write(List<EvidenceChunk> batch) {
    Map<String, String> rejected = new LinkedHashMap<>();
    List<EvidenceChunk> accepted = new ArrayList<>();
    for (EvidenceChunk chunk : batch) {
      String problem = checkEmbedding(chunk, dimensions);
      if (problem != null) {
        rejected.put(chunk.id(), problem);
        continue;
      }
      dimensions = chunk.embedding().size();
      accepted.add(chunk);
    }

    if (!accepted.isEmpty()) {
      Contents current = contents;
      current.store.addAll(
          accepted.stream().map(EvidenceChunk::id).toList(),
          accepted.stream().map(chunk -> Embedding.from(chunk.embedding())).toList(),
          accepted.stream().map(this::toSegment).toList());
      accepted.forEach(chunk -> current.chunks.put(chunk.id(), chunk));
    }
    log.debug(
        "[Index] Memory backend accepted {} chunks, rejected {}", accepted.size(), rejected.size());
    return rejected;
  }

  @Override
  public List<RetrievedChunk> query(List<Float> embedding, int topK, ChunkFilter filter) {
    Contents current = contents;
    if (current.chunks.isEmpty() || topK <= 0) {
      return List.of();
    }
    // Exact search: asking for topK plus every tombstone still yields topK live matches.
    EmbeddingSearchRequest request =
        EmbeddingSearchRequest.builder()
            .queryEmbedding(Embedding.from(embedding))
            .maxResults(topK + current.inactiveIds.size())
            .minScore(filter.minScore() == null ? 0.0 : filter.minScore())
            .filter(toMetadataFilter(filter))
            .build();

    List<RetrievedChunk> results = new ArrayList<>();
    for (EmbeddingMatch<TextSegment> match : current.store.search(request).matches()) {
      EvidenceChunk chunk = current.chunks.get(match.embeddingId());
      if (chunk == null || current.inactiveIds.contains(chunk.id())) {
        continue;
      }
      if (filter.accepts(chunk, match.score())) {
        results.add(new RetrievedChunk(chunk, match.score()));
      }
      if (results.size() >= topK) {
        break;
      }
    }
    return results;
  }

  @Override
  public synchronized void markInactive(Collection<String> ids) {
    Contents current = contents;
    for (String id : ids) {
      if (current.chunks.containsKey(id)) {
        current.inactiveIds.add(id);
      }
    }
  }

  @Override
  public synchronized void delete(Collection<String> ids) {
    Contents current = contents;
    Set<String> removed = new HashSet<>(ids);
    if (removed.stream().noneMatch(current.chunks::containsKey)) {
      return;
    }
    List<EvidenceChunk> retained = new ArrayList<>();
    for (EvidenceChunk chunk : current.chunks.values()) {
      if (!removed.contains(chunk.id())) {
        retained.add(chunk);
      }
    }
    Contents next = build(retained);
    for (String id : current.inactiveIds) {
      if (next.chunks.containsKey(id)) {
        next.inactiveIds.add(id);
      }
    }
    contents = next;
  }

  /** Returns every active chunk in one pass; the page size does not apply in memory. */
  @Override
  public List<EvidenceChunk> loadActive(int pageSize) {
    Contents current = contents;
    return current.chunks.values().stream()
        .filter(chunk -> !current.inactiveIds.contains(chunk.id()))
        .toList();
  }

  /**
   * Replaces the whole index with the given chunks.
   *
   * @param liveChunks the chunks to keep
   */
  public synchronized void rebuild(Collection<EvidenceChunk> liveChunks) {
    int expected = -1;
    List<EvidenceChunk> accepted = new ArrayList<>();
    for (EvidenceChunk chunk : liveChunks) {
      String problem = checkEmbedding(chunk, expected);
      if (problem == null) {
        expected = chunk.embedding().size();
        accepted.add(chunk);
      } else {
        log.warn("[Index] Skipping chunk {} during rebuild: {}", chunk.id(), problem);
      }
    }
    Contents next = build(accepted);
    dimensions = expected;
    contents = next;
    log.info("[Index] Memory backend rebuilt with {} chunks", accepted.size());
  }

  public int size() {
    return contents.chunks.size();
  }

  private Contents build(List<EvidenceChunk> retained) {
    Contents fresh = Contents.empty();
    if (!retained.isEmpty()) {
      fresh.store.addAll(
          retained.stream().map(EvidenceChunk::id).toList(),
          retained.stream().map(chunk -> Embedding.from(chunk.embedding())).toList(),
          retained.stream().map(this::toSegment).toList());
      retained.forEach(chunk -> fresh.chunks.put(chunk.id(), chunk));
    }
    return fresh;
  }

  private static String checkEmbedding(EvidenceChunk chunk, int expected) {
    if (chunk.embedding().isEmpty()) {
      return "missing embedding";
    }
    if (expected >= 0 && expected != chunk.embedding().size()) {
      return "embedding has " + chunk.embedding().size() + " dimensions, expected " + expected;
    }
    return null;
  }

  private TextSegment toSegment(EvidenceChunk chunk) {
    Metadata metadata = new Metadata();
    metadata.put(SUBGOAL_KEY, chunk.subgoalId());
    chunk.sourceMetadata().forEach(metadata::put);
    return TextSegment.from(chunk.text(), metadata);
  }

  private Filter toMetadataFilter(ChunkFilter filter) {
    Filter result = null;
    if (filter.subgoalId() != null) {
      result = MetadataFilterBuilder.metadataKey(SUBGOAL_KEY).isEqualTo(filter.subgoalId());
    }
    if (filter.sourceUrl() != null) {
      Filter bySource =
          MetadataFilterBuilder.metadataKey(EvidenceChunk.SOURCE_URL).isEqualTo(filter.sourceUrl());
      result = result == null ? bySource : result.and(bySource);
    }
    return result;
  }

  /** One generation of the store with the chunk table and tombstones that belong to it. */
  private record Contents(
      InMemoryEmbeddingStore<TextSegment> store,
      Map<String, EvidenceChunk> chunks,
      Set<String> inactiveIds) {

    static Contents empty() {
      return new Contents(
          new InMemoryEmbeddingStore<>(),
          new ConcurrentHashMap<>(),
          ConcurrentHashMap.newKeySet());
    }
  }
}
