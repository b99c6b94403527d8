package com.flamingo.ai.deepresearch.service.research;

/** States of the research state machine. */
public enum ResearchState {
  INIT,
  GENERATE_QUERIES,
  PLANNING,
  /** Suspended until an external planning command arrives. */
  PLANNING_WAIT,
  RESEARCH_FAN_OUT,
  VALIDATE,
  COMPRESS,
  REFLECT,
  FINALIZE,
  DONE,
  FAILED,
  CANCELLED;

  public boolean isTerminal() {
    return this == DONE || this == FAILED || this == CANCELLED;
  }
}
