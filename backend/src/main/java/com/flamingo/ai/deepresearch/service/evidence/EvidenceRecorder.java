package com.flamingo.ai.deepresearch.service.evidence;

import com.flamingo.ai.deepresearch.config.ResearchConfig;
import com.flamingo.ai.deepresearch.exception.IndexWriteException;
import com.flamingo.ai.deepresearch.index.ChunkInput;
import com.flamingo.ai.deepresearch.index.EvidenceChunk;
import com.flamingo.ai.deepresearch.index.EvidenceIndex;
import com.flamingo.ai.deepresearch.index.IngestResult;
import com.flamingo.ai.deepresearch.index.TextChunker;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Chunks, embeds and ingests validated evidence under its plan step. */
@Service
@Slf4j
public class EvidenceRecorder {

  private final EmbeddingService embeddingService;
  private final EvidenceIndex evidenceIndex;
  private final TextChunker chunker;

  public EvidenceRecorder(
      EmbeddingService embeddingService, EvidenceIndex evidenceIndex, ResearchConfig config) {
    this.embeddingService = embeddingService;
    this.evidenceIndex = evidenceIndex;
    this.chunker =
        new TextChunker(config.getIndex().getChunkSize(), config.getIndex().getChunkOverlap());
  }

  /**
   * Records the units as chunks of {@code subgoalId}.
   *
   * @return the ingest result; partial writes are reported there
   * @throws IndexWriteException if the evidence could not be embedded
   */
  public IngestResult record(String subgoalId, List<EvidenceUnit> units) {
    List<String> texts = new ArrayList<>();
    List<Map<String, String>> metadata = new ArrayList<>();
    for (EvidenceUnit unit : units) {
      Map<String, String> source = new HashMap<>();
      if (unit.sourceUrl() != null) {
        source.put(EvidenceChunk.SOURCE_URL, unit.sourceUrl());
      }
      if (unit.title() != null) {
        source.put(EvidenceChunk.TITLE, unit.title());
      }
      for (String piece : chunker.split(unit.snippet())) {
        texts.add(piece);
        metadata.add(source);
      }
    }
    if (texts.isEmpty()) {
      return new IngestResult(List.of(), List.of(), List.of());
    }

    List<List<Float>> embeddings = embeddingService.embedAll(texts);
    if (embeddings.size() != texts.size()) {
      throw new IndexWriteException(
          "embedding",
          "Embedded " + embeddings.size() + " of " + texts.size() + " chunks for " + subgoalId);
    }

    List<ChunkInput> inputs = new ArrayList<>(texts.size());
    for (int i = 0; i < texts.size(); i++) {
      inputs.add(new ChunkInput(texts.get(i), embeddings.get(i), metadata.get(i)));
    }
    IngestResult result = evidenceIndex.ingest(subgoalId, inputs);
    log.debug("[Index] Recorded {} chunks for {}", result.chunkIds().size(), subgoalId);
    return result;
  }
}
