package com.flamingo.ai.deepresearch.service.research;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/** Read-only view of a session returned by status queries. */
public record SessionStatus(
    UUID sessionId,
    String question,
    ResearchState state,
    PlanningStatus planningStatus,
    List<PlanStep> plan,
    int evidenceCount,
    int researchLoopCount,
    Map<String, Integer> sources,
    List<String> validationNotes,
    ResearchOutcome outcome,
    String answer,
    String failureReason) {

  static SessionStatus of(ResearchSession session) {
    return new SessionStatus(
        session.getId(),
        session.getQuestion(),
        session.getState(),
        session.getPlanningStatus(),
        List.copyOf(session.getPlan()),
        session.getEvidenceCount(),
        session.getResearchLoopCount(),
        session.getCitations().asMap(),
        List.copyOf(session.getValidationNotes()),
        session.getOutcome(),
        session.getAnswer(),
        session.getFailureReason());
  }
}
