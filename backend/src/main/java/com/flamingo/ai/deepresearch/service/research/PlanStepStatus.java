package com.flamingo.ai.deepresearch.service.research;

public enum PlanStepStatus {
  PENDING,
  IN_PROGRESS,
  DONE,
  /** The step's search produced no evidence. */
  BLOCKED
}
