package com.flamingo.ai.deepresearch.api.rest;

import com.flamingo.ai.deepresearch.api.dto.request.PruneRequest;
import com.flamingo.ai.deepresearch.api.dto.response.IndexRebuildResponse;
import com.flamingo.ai.deepresearch.index.ChunkRef;
import com.flamingo.ai.deepresearch.index.EvidenceIndex;
import com.flamingo.ai.deepresearch.index.IndexStats;
import com.flamingo.ai.deepresearch.index.PruneResult;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for maintenance of the shared evidence index. */
@RestController
@RequestMapping("/api/evidence")
@RequiredArgsConstructor
@Slf4j
public class EvidenceController {

  private final EvidenceIndex evidenceIndex;

  /** Prunes chunks by subgoal and/or id. */
  @PostMapping("/prune")
  public ResponseEntity<PruneResult> prune(@RequestBody PruneRequest request) {
    if (!request.hasSelector()) {
      throw new IllegalArgumentException("subgoalId or chunkIds is required");
    }
    String subgoalId = request.getSubgoalId();
    Set<String> ids =
        new HashSet<>(request.getChunkIds() == null ? List.of() : request.getChunkIds());
    Predicate<ChunkRef> selector =
        ref -> ids.contains(ref.id()) || (subgoalId != null && subgoalId.equals(ref.subgoalId()));
    PruneResult result = evidenceIndex.prune(selector, request.getPolicy());
    log.info(
        "Pruned {} chunks with policy {} ({} backend failures)",
        result.prunedIds().size(),
        result.policy(),
        result.backendFailures().size());
    return ResponseEntity.ok(result);
  }

  /** Rebuilds the in-memory index from the durable store. */
  @PostMapping("/rebuild")
  public ResponseEntity<IndexRebuildResponse> rebuild() {
    int loaded = evidenceIndex.rebuildFromDurable();
    return ResponseEntity.ok(new IndexRebuildResponse(loaded, evidenceIndex.stats()));
  }

  /** Gets index statistics. */
  @GetMapping("/stats")
  public ResponseEntity<IndexStats> stats() {
    return ResponseEntity.ok(evidenceIndex.stats());
  }
}
