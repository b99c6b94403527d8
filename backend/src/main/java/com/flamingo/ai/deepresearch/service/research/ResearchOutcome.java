package com.flamingo.ai.deepresearch.service.research;

/** How a finished session ended. */
public enum ResearchOutcome {
  /** An answer backed by evidence. */
  ANSWERED,
  /** No evidence was found; an answer was still attempted with a caveat. */
  NO_EVIDENCE,
  /** The pipeline failed; no answer. */
  ABORTED,
  CANCELLED
}
