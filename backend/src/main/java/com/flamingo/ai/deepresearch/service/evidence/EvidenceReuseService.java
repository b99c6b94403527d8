package com.flamingo.ai.deepresearch.service.evidence;

import com.flamingo.ai.deepresearch.config.ResearchConfig;
import com.flamingo.ai.deepresearch.index.ChunkFilter;
import com.flamingo.ai.deepresearch.index.EvidenceChunk;
import com.flamingo.ai.deepresearch.index.EvidenceIndex;
import com.flamingo.ai.deepresearch.index.RetrievedChunk;
import com.flamingo.ai.deepresearch.search.EvidenceLookup;
import com.flamingo.ai.deepresearch.search.SearchHit;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Answers a query from the evidence index when stored chunks are close enough to it, so the
 * search coordinator can skip provider calls. Any failure means "no reuse".
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EvidenceReuseService implements EvidenceLookup {

  private final EmbeddingService embeddingService;
  private final EvidenceIndex evidenceIndex;
  private final ResearchConfig researchConfig;
  private final MeterRegistry meterRegistry;

  @Override
  public List<SearchHit> findReusable(String query) {
    ResearchConfig.Index config = researchConfig.getIndex();
    if (!config.isReuseEnabled() || evidenceIndex.stats().activeCount() == 0) {
      return List.of();
    }
    try {
      List<Float> embedding = embeddingService.embed(query);
      if (embedding.isEmpty()) {
        return List.of();
      }
      List<RetrievedChunk> matches =
          evidenceIndex.query(
              embedding,
              researchConfig.getSearch().getMaxResults(),
              ChunkFilter.withMinScore(config.getReuseMinScore()));
      List<SearchHit> hits = new ArrayList<>(matches.size());
      for (RetrievedChunk match : matches) {
        EvidenceChunk chunk = match.chunk();
        hits.add(
            new SearchHit(
                chunk.sourceUrl(),
                chunk.sourceMetadata().getOrDefault(EvidenceChunk.TITLE, chunk.sourceUrl()),
                chunk.text()));
      }
      if (!hits.isEmpty()) {
        meterRegistry.counter("index.reuse.hits").increment();
        log.debug("[Reuse] {} stored chunks answer query '{}'", hits.size(), query);
      }
      return hits;
    } catch (RuntimeException e) {
      log.warn("[Reuse] Lookup failed for '{}', searching providers: {}", query, e.getMessage());
      meterRegistry.counter("index.reuse.errors").increment();
      return List.of();
    }
  }
}
