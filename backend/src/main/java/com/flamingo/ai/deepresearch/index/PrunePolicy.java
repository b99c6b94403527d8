package com.flamingo.ai.deepresearch.index;

/** How {@link EvidenceIndex#prune} removes chunks. */
public enum PrunePolicy {
  /** Drop from the active mapping and tombstone in the backends; storage is kept. */
  SOFT,
  /** Delete from every written backend and rebuild the in-memory index. */
  HARD
}
