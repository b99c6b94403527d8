package com.flamingo.ai.deepresearch.index;

import com.flamingo.ai.deepresearch.elasticsearch.EvidenceChunkDocument;
import com.flamingo.ai.deepresearch.elasticsearch.EvidenceChunkIndexService;
import com.flamingo.ai.deepresearch.exception.IndexWriteException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Backend B: durable Elasticsearch store with per-chunk deletion and metadata filtering. */
@Component
@RequiredArgsConstructor
@Slf4j
public class ElasticsearchEvidenceBackend implements EvidenceBackend {

  private final EvidenceChunkIndexService indexService;

  @Override
  public BackendType getType() {
    return BackendType.ELASTICSEARCH;
  }

  @Override
  public Map<String, String> write(List<EvidenceChunk> chunks) {
    if (chunks.isEmpty()) {
      return Map.of();
    }
    Instant now = Instant.now();
    List<EvidenceChunkDocument> documents = new ArrayList<>(chunks.size());
    for (EvidenceChunk chunk : chunks) {
      documents.add(
          EvidenceChunkDocument.builder()
              .id(chunk.id())
              .subgoalId(chunk.subgoalId())
              .sourceUrl(chunk.sourceMetadata().get(EvidenceChunk.SOURCE_URL))
              .title(chunk.sourceMetadata().get(EvidenceChunk.TITLE))
              .text(chunk.text())
              .embedding(chunk.embedding())
              .active(true)
              .createdAt(now)
              .build());
    }
    Map<String, String> rejected = indexService.indexDocuments(documents);
    indexService.refresh();
    return rejected;
  }

  @Override
  public List<RetrievedChunk> query(List<Float> embedding, int topK, ChunkFilter filter) {
    Map<String, Object> criteria = new HashMap<>();
    if (filter.subgoalId() != null) {
      criteria.put(EvidenceChunkIndexService.FIELD_SUBGOAL_ID, filter.subgoalId());
    }
    if (filter.sourceUrl() != null) {
      criteria.put(EvidenceChunkIndexService.FIELD_SOURCE_URL, filter.sourceUrl());
    }

    List<RetrievedChunk> results = new ArrayList<>();
    for (EvidenceChunkDocument document : indexService.vectorSearch(criteria, embedding, topK)) {
      EvidenceChunk chunk = toChunk(document);
      double score = document.getRelevanceScore() == null ? 0.0 : document.getRelevanceScore();
      if (filter.accepts(chunk, score)) {
        results.add(new RetrievedChunk(chunk, score));
      }
    }
    return results;
  }

  @Override
  public void markInactive(Collection<String> ids) {
    Map<String, String> failed = indexService.markInactive(ids);
    if (!failed.isEmpty()) {
      throw new IndexWriteException(
          indexService.getIndexName(), "Could not tombstone " + failed.keySet() + ": " + failed);
    }
    indexService.refresh();
  }

  @Override
  public void delete(Collection<String> ids) {
    Map<String, String> failed = indexService.deleteDocuments(ids);
    if (!failed.isEmpty()) {
      throw new IndexWriteException(
          indexService.getIndexName(), "Could not delete " + failed.keySet() + ": " + failed);
    }
    indexService.refresh();
  }

  @Override
  public List<EvidenceChunk> loadActive(int pageSize) {
    int size = Math.max(1, pageSize);
    List<EvidenceChunk> live = new ArrayList<>();
    String searchAfter = null;
    int pages = 0;
    while (true) {
      List<EvidenceChunkDocument> page = indexService.findActivePage(size, searchAfter);
      pages++;
      page.forEach(document -> live.add(toChunk(document)));
      if (page.size() < size) {
        break;
      }
      searchAfter = page.get(page.size() - 1).getId();
    }
    log.info(
        "[Index] Loaded {} active chunks from {} in {} pages",
        live.size(),
        indexService.getIndexName(),
        pages);
    return live;
  }

  private EvidenceChunk toChunk(EvidenceChunkDocument document) {
    Map<String, String> metadata = new HashMap<>();
    if (document.getSourceUrl() != null) {
      metadata.put(EvidenceChunk.SOURCE_URL, document.getSourceUrl());
    }
    if (document.getTitle() != null) {
      metadata.put(EvidenceChunk.TITLE, document.getTitle());
    }
    return new EvidenceChunk(
        document.getId(),
        document.getSubgoalId(),
        document.getText(),
        document.getEmbedding(),
        metadata);
  }
}
