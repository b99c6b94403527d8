package com.flamingo.ai.deepresearch.service.research;

import com.flamingo.ai.deepresearch.config.ResearchConfig;

/**
 * Per-session settings, resolved from configuration and optional start-request overrides.
 *
 * @param maxResearchLoops hard ceiling on research rounds
 * @param initialQueryCount number of queries generated up front
 * @param requirePlanningConfirmation whether the engine suspends for plan confirmation
 * @param tokenBudget compressed evidence ceiling
 */
public record ResearchOptions(
    int maxResearchLoops,
    int initialQueryCount,
    boolean requirePlanningConfirmation,
    int tokenBudget) {

  public ResearchOptions {
    if (maxResearchLoops < 1) {
      throw new IllegalArgumentException("maxResearchLoops must be at least 1");
    }
    if (initialQueryCount < 1) {
      throw new IllegalArgumentException("initialQueryCount must be at least 1");
    }
    if (tokenBudget < 1) {
      throw new IllegalArgumentException("tokenBudget must be positive");
    }
  }

  public static ResearchOptions from(ResearchConfig config) {
    return new ResearchOptions(
        config.getMaxResearchLoops(),
        config.getInitialQueryCount(),
        config.isRequirePlanningConfirmation(),
        config.getTokenBudget());
  }

  /** Returns a copy with the non-null overrides applied. */
  public ResearchOptions withOverrides(
      Integer maxLoops, Integer queryCount, Boolean requireConfirmation) {
    return new ResearchOptions(
        maxLoops != null ? maxLoops : maxResearchLoops,
        queryCount != null ? queryCount : initialQueryCount,
        requireConfirmation != null ? requireConfirmation : requirePlanningConfirmation,
        tokenBudget);
  }
}
