package com.flamingo.ai.deepresearch.index;

import java.util.List;

/**
 * Outcome of a prune. Pruning ids that are no longer active yields an empty result.
 *
 * @param policy the policy applied
 * @param prunedIds ids removed from the active set
 * @param backendFailures backends that could not record the removal
 */
public record PruneResult(
    PrunePolicy policy, List<String> prunedIds, List<PartialWrite> backendFailures) {

  public PruneResult {
    prunedIds = List.copyOf(prunedIds);
    backendFailures = List.copyOf(backendFailures);
  }

  public static PruneResult empty(PrunePolicy policy) {
    return new PruneResult(policy, List.of(), List.of());
  }
}
