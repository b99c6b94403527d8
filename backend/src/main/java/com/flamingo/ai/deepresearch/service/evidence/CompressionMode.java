package com.flamingo.ai.deepresearch.service.evidence;

/** How validated evidence is shrunk before reflection. */
public enum CompressionMode {
  /** De-duplication and budget trimming only. */
  EXTRACTIVE,
  /** Extractive steps plus LLM shortening of oversized snippets. */
  TIERED
}
