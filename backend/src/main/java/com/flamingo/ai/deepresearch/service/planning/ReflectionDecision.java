package com.flamingo.ai.deepresearch.service.planning;

import java.util.List;

/**
 * Outcome of one reflection.
 *
 * @param sufficient whether the evidence answers the question
 * @param knowledgeGap what is missing, if anything
 * @param followUpQueries new queries, none of them already executed
 * @param fallback true when the model output could not be parsed and sufficiency was assumed
 */
public record ReflectionDecision(
    boolean sufficient, String knowledgeGap, List<String> followUpQueries, boolean fallback) {

  public ReflectionDecision {
    followUpQueries = List.copyOf(followUpQueries);
  }
}
