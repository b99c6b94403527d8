package com.flamingo.ai.deepresearch.search;

import java.util.List;

/** Joined results of a fan-out batch, in the order the queries were submitted. */
public record FanOutResult(List<QuerySearchOutcome> outcomes, boolean cancelled) {

  public FanOutResult {
    outcomes = List.copyOf(outcomes);
  }

  public long succeededCount() {
    return outcomes.stream().filter(outcome -> !outcome.isEmpty()).count();
  }

  public long failedCount() {
    return outcomes.stream().filter(QuerySearchOutcome::isEmpty).count();
  }
}
