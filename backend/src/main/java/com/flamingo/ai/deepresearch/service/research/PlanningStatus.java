package com.flamingo.ai.deepresearch.service.research;

/** Gate deciding whether the engine proceeds past planning. {@code null} before planning. */
public enum PlanningStatus {
  AWAITING_CONFIRMATION,
  CONFIRMED,
  AUTO_APPROVED
}
