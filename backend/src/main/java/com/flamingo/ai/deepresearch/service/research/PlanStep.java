package com.flamingo.ai.deepresearch.service.research;

/**
 * One task of the research plan. Steps are never removed; only their status changes.
 *
 * @param id {@code plan-{n}}, sequential within the session
 * @param title human-readable title
 * @param query the search query the step runs
 * @param tool the tool the step uses
 * @param status current status
 */
public record PlanStep(String id, String title, String query, String tool, PlanStepStatus status) {

  public static final String WEB_RESEARCH = "web_research";

  public static PlanStep pending(int number, String query) {
    return new PlanStep(
        "plan-" + number, "Investigate: " + query, query, WEB_RESEARCH, PlanStepStatus.PENDING);
  }

  public PlanStep withStatus(PlanStepStatus newStatus) {
    return new PlanStep(id, title, query, tool, newStatus);
  }
}
