package com.flamingo.ai.deepresearch.index;

import com.flamingo.ai.deepresearch.config.ResearchConfig;
import com.flamingo.ai.deepresearch.exception.IndexWriteException;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Hybrid evidence store shared by all sessions of the process.
 *
 * <p>Ingestion writes to every target backend: both when dual write is on, otherwise only the
 * configured read backend. Reads are answered by the read backend alone and never merged. The
 * active mapping decides what is retrievable; pruning removes entries from it.
 *
 * <p>Ingest and soft prune run concurrently under the read lock. Hard prune and rebuild swap the
 * in-memory store and take the write lock. Queries take no lock.
 */
@Service
@Slf4j
public class EvidenceIndex {

  private static final int CHARS_PER_TOKEN = 4;
  private static final String CONTEXT_SEPARATOR = "\n---\n";

  private final InMemoryVectorBackend memoryBackend;
  private final EvidenceBackend durableBackend;
  private final ChunkIdGenerator idGenerator;
  private final ResearchConfig.Index config;
  private final MeterRegistry meterRegistry;

  private final Map<String, ChunkRef> activeChunks = new ConcurrentHashMap<>();
  private final Map<String, ChunkRef> prunedChunks = new ConcurrentHashMap<>();

  /** Pruned ids whose tombstone some backend has not recorded yet. */
  private final Set<String> pendingTombstones = ConcurrentHashMap.newKeySet();
  private final ReadWriteLock lock = new ReentrantReadWriteLock();

  public EvidenceIndex(
      InMemoryVectorBackend memoryBackend,
      @Qualifier("elasticsearchEvidenceBackend") EvidenceBackend durableBackend,
      ChunkIdGenerator idGenerator,
      ResearchConfig researchConfig,
      MeterRegistry meterRegistry) {
    this.memoryBackend = memoryBackend;
    this.durableBackend = durableBackend;
    this.idGenerator = idGenerator;
    this.config = researchConfig.getIndex();
    this.meterRegistry = meterRegistry;
  }

  /**
   * Assigns ids to the chunks and writes them to every target backend.
   *
   * <p>A backend failure never throws: each chunk it did not accept is reported as a {@link
   * PartialWrite} naming that backend. Chunks accepted by at least one backend become active.
   *
   * @param subgoalId the plan step the evidence belongs to
   * @param inputs chunk text, embedding and source metadata
   * @return ids in input order plus any partial writes
   */
  @Timed(value = "index.ingest", description = "Time to ingest evidence chunks")
  public IngestResult ingest(String subgoalId, List<ChunkInput> inputs) {
    if (subgoalId == null || subgoalId.isBlank()) {
      throw new IllegalArgumentException("subgoalId is required");
    }
    if (inputs.isEmpty()) {
      return new IngestResult(List.of(), List.of(), List.of());
    }

    List<EvidenceChunk> chunks = new ArrayList<>(inputs.size());
    for (ChunkInput input : inputs) {
      chunks.add(
          new EvidenceChunk(
              idGenerator.nextId(subgoalId),
              subgoalId,
              input.text(),
              input.embedding(),
              input.sourceMetadata()));
    }
    List<String> ids = chunks.stream().map(EvidenceChunk::id).toList();

    List<PartialWrite> partialWrites = new ArrayList<>();
    Map<String, Integer> acceptedBy = new LinkedHashMap<>();
    List<EvidenceBackend> targets = writeTargets();

    lock.readLock().lock();
    try {
      for (EvidenceBackend backend : targets) {
        Map<String, String> rejected = writeTo(backend, chunks);
        for (String id : ids) {
          String reason = rejected.get(id);
          if (reason == null) {
            acceptedBy.merge(id, 1, Integer::sum);
          } else {
            partialWrites.add(new PartialWrite(id, backend.getType(), reason));
          }
        }
      }
      for (EvidenceChunk chunk : chunks) {
        if (acceptedBy.containsKey(chunk.id())) {
          activeChunks.put(chunk.id(), chunk.toRef());
        }
      }
    } finally {
      lock.readLock().unlock();
    }

    List<String> written =
        ids.stream().filter(id -> acceptedBy.getOrDefault(id, 0) == targets.size()).toList();
    if (!partialWrites.isEmpty()) {
      meterRegistry.counter("index.ingest.partial").increment(partialWrites.size());
      log.warn(
          "[Index] Partial ingest for subgoal {}: {} of {} chunks fully written, failures={}",
          subgoalId,
          written.size(),
          ids.size(),
          partialWrites.size());
    } else {
      log.debug("[Index] Ingested {} chunks for subgoal {}", ids.size(), subgoalId);
    }
    meterRegistry.counter("index.ingest.chunks").increment(ids.size());
    return new IngestResult(ids, written, partialWrites);
  }

  private Map<String, String> writeTo(EvidenceBackend backend, List<EvidenceChunk> chunks) {
    try {
      return backend.write(chunks);
    } catch (RuntimeException e) {
      log.error("[Index] {} backend rejected batch: {}", backend.getType(), e.getMessage());
      Map<String, String> all = new LinkedHashMap<>();
      String reason = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
      chunks.forEach(chunk -> all.put(chunk.id(), reason));
      return all;
    }
  }

  /**
   * Nearest-neighbour query against the configured read backend.
   *
   * @param embedding query vector
   * @param topK maximum number of results
   * @param filter metadata filter
   * @return active chunks ordered by descending score
   */
  @Timed(value = "index.query", description = "Time to query the evidence index")
  public List<RetrievedChunk> query(List<Float> embedding, int topK, ChunkFilter filter) {
    if (topK <= 0) {
      return List.of();
    }
    ChunkFilter effective = filter == null ? ChunkFilter.none() : filter;
    // A backend whose tombstone write failed may still return pruned chunks.
    int fetch = topK + prunedChunks.size();
    List<RetrievedChunk> results = new ArrayList<>();
    for (RetrievedChunk hit : readBackend().query(embedding, fetch, effective)) {
      if (prunedChunks.containsKey(hit.chunk().id())) {
        continue;
      }
      results.add(hit);
      if (results.size() >= topK) {
        break;
      }
    }
    return results;
  }

  /** Prunes the given ids with the configured policy. */
  public PruneResult prune(Collection<String> chunkIds) {
    Set<String> ids = new HashSet<>(chunkIds);
    return prune(ref -> ids.contains(ref.id()), config.getPrunePolicy());
  }

  /**
   * Removes every chunk matching the predicate from the active mapping. Idempotent: ids that are
   * no longer active (or, for {@link PrunePolicy#HARD}, no longer stored) are not matched again.
   * A soft prune also retries tombstones that earlier prunes failed to record.
   *
   * @param predicate selects chunks to prune
   * @param policy soft keeps the stored rows as tombstones; hard deletes them and rebuilds the
   *     in-memory store
   * @return pruned ids and backends that failed to record the change
   */
  @Timed(value = "index.prune", description = "Time to prune evidence chunks")
  public PruneResult prune(Predicate<ChunkRef> predicate, PrunePolicy policy) {
    PrunePolicy effective = policy == null ? config.getPrunePolicy() : policy;
    return effective == PrunePolicy.HARD ? hardPrune(predicate) : softPrune(predicate);
  }

  private PruneResult softPrune(Predicate<ChunkRef> predicate) {
    List<String> pruned = new ArrayList<>();
    List<PartialWrite> failures = new ArrayList<>();
    lock.readLock().lock();
    try {
      for (ChunkRef ref : List.copyOf(activeChunks.values())) {
        // remove() is the claim; a concurrent prune of the same id loses here
        if (predicate.test(ref) && activeChunks.remove(ref.id()) != null) {
          prunedChunks.put(ref.id(), ref);
          pruned.add(ref.id());
        }
      }
      List<String> tombstones = new ArrayList<>(pruned);
      for (String id : pendingTombstones) {
        if (!pruned.contains(id)) {
          tombstones.add(id);
        }
      }
      if (!tombstones.isEmpty()) {
        boolean recorded = true;
        for (EvidenceBackend backend : writeTargets()) {
          try {
            backend.markInactive(tombstones);
          } catch (RuntimeException e) {
            recorded = false;
            log.error(
                "[Index] {} backend failed to tombstone {} chunks: {}",
                backend.getType(),
                tombstones.size(),
                e.getMessage());
            for (String id : tombstones) {
              failures.add(new PartialWrite(id, backend.getType(), e.getMessage()));
            }
          }
        }
        if (recorded) {
          tombstones.forEach(pendingTombstones::remove);
        } else {
          pendingTombstones.addAll(tombstones);
        }
      }
    } finally {
      lock.readLock().unlock();
    }
    log.info("[Index] Soft-pruned {} chunks", pruned.size());
    meterRegistry.counter("index.prune.chunks", "policy", "soft").increment(pruned.size());
    return new PruneResult(PrunePolicy.SOFT, pruned, failures);
  }

  private PruneResult hardPrune(Predicate<ChunkRef> predicate) {
    List<String> pruned = new ArrayList<>();
    List<PartialWrite> failures = new ArrayList<>();
    lock.writeLock().lock();
    try {
      List<ChunkRef> candidates = new ArrayList<>(activeChunks.values());
      candidates.addAll(prunedChunks.values());
      List<String> matched = candidates.stream().filter(predicate).map(ChunkRef::id).toList();
      if (matched.isEmpty()) {
        return PruneResult.empty(PrunePolicy.HARD);
      }

      boolean durableDeleted = true;
      if (isDurableWritten()) {
        try {
          durableBackend.delete(matched);
        } catch (RuntimeException e) {
          durableDeleted = false;
          log.error("[Index] Durable delete failed, keeping tombstones: {}", e.getMessage());
          matched.forEach(
              id -> failures.add(new PartialWrite(id, durableBackend.getType(), e.getMessage())));
        }
      }
      memoryBackend.delete(matched);

      for (String id : matched) {
        ChunkRef ref = activeChunks.remove(id);
        if (durableDeleted) {
          prunedChunks.remove(id);
          pendingTombstones.remove(id);
        } else if (ref != null) {
          // retried by the next hard prune
          prunedChunks.put(id, ref);
        }
        pruned.add(id);
      }
    } finally {
      lock.writeLock().unlock();
    }
    log.info("[Index] Hard-pruned {} chunks", pruned.size());
    meterRegistry.counter("index.prune.chunks", "policy", "hard").increment(pruned.size());
    return new PruneResult(PrunePolicy.HARD, pruned, failures);
  }

  /**
   * Replaces the in-memory store and the active mapping with the durable backend's live set,
   * paging through it until exhausted. Pending tombstones are retried first; chunks whose
   * tombstone is still pending stay pruned.
   *
   * @return number of chunks loaded
   * @throws IndexWriteException if the durable backend is not written in this configuration
   */
  @Timed(value = "index.rebuild", description = "Time to rebuild the in-memory index")
  public int rebuildFromDurable() {
    if (!isDurableWritten()) {
      throw new IndexWriteException(
          durableBackend.getType().name().toLowerCase(),
          "Durable backend is not written; enable dual write or read from it to rebuild");
    }
    lock.writeLock().lock();
    try {
      retryTombstones();
      List<EvidenceChunk> live = new ArrayList<>();
      int skipped = 0;
      for (EvidenceChunk chunk : durableBackend.loadActive(config.getRebuildPageSize())) {
        if (pendingTombstones.contains(chunk.id())) {
          skipped++;
        } else {
          live.add(chunk);
        }
      }
      memoryBackend.rebuild(live);
      activeChunks.clear();
      for (EvidenceChunk chunk : live) {
        activeChunks.put(chunk.id(), chunk.toRef());
        prunedChunks.remove(chunk.id());
      }
      if (skipped > 0) {
        log.warn("[Index] Rebuild kept {} chunks with pending tombstones out", skipped);
      }
      log.info("[Index] Rebuilt in-memory index with {} chunks from durable store", live.size());
      return live.size();
    } finally {
      lock.writeLock().unlock();
    }
  }

  private void retryTombstones() {
    if (pendingTombstones.isEmpty()) {
      return;
    }
    List<String> ids = List.copyOf(pendingTombstones);
    try {
      durableBackend.markInactive(ids);
      ids.forEach(pendingTombstones::remove);
      log.info("[Index] Recorded {} pending tombstones", ids.size());
    } catch (RuntimeException e) {
      log.error("[Index] {} pending tombstones still failing: {}", ids.size(), e.getMessage());
    }
  }

  /**
   * Formats retrieved chunks as a context block, stopping before the token budget is exceeded.
   *
   * @param chunks chunks in priority order
   * @param tokenBudget maximum tokens, estimated at four characters each
   * @return the context text
   */
  public String buildContext(List<RetrievedChunk> chunks, int tokenBudget) {
    int charBudget = tokenBudget * CHARS_PER_TOKEN;
    StringBuilder context = new StringBuilder();
    for (RetrievedChunk retrieved : chunks) {
      String entry = "[Source: " + retrieved.chunk().sourceUrl() + "]\n" + retrieved.chunk().text();
      int added =
          context.length() == 0 ? entry.length() : CONTEXT_SEPARATOR.length() + entry.length();
      if (context.length() + added > charBudget) {
        break;
      }
      if (context.length() > 0) {
        context.append(CONTEXT_SEPARATOR);
      }
      context.append(entry);
    }
    return context.toString();
  }

  public IndexStats stats() {
    Map<String, Integer> bySubgoal = new TreeMap<>();
    for (ChunkRef ref : activeChunks.values()) {
      bySubgoal.merge(ref.subgoalId(), 1, Integer::sum);
    }
    return new IndexStats(activeChunks.size(), prunedChunks.size(), bySubgoal);
  }

  public boolean isActive(String chunkId) {
    return activeChunks.containsKey(chunkId);
  }

  /** Whether a backend still has to record the tombstone of this pruned chunk. */
  public boolean isTombstonePending(String chunkId) {
    return pendingTombstones.contains(chunkId);
  }

  /** Whether ingestion writes to the durable backend. */
  public boolean isDurableWritten() {
    return config.isDualWrite() || config.getReadBackend() == BackendType.ELASTICSEARCH;
  }

  private EvidenceBackend readBackend() {
    return config.getReadBackend() == BackendType.ELASTICSEARCH ? durableBackend : memoryBackend;
  }

  private List<EvidenceBackend> writeTargets() {
    if (config.isDualWrite()) {
      return List.of(memoryBackend, durableBackend);
    }
    return List.of(readBackend());
  }
}
