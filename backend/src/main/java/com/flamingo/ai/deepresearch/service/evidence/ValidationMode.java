package com.flamingo.ai.deepresearch.service.evidence;

/** How search results are checked before they become evidence. */
public enum ValidationMode {
  /** Citation and keyword checks only. */
  HEURISTIC,
  /** Citation check, then an LLM relevance verdict. */
  LLM,
  /** Citation and keyword checks, then an LLM relevance verdict. */
  HYBRID
}
