package com.flamingo.ai.deepresearch.api.dto.response;

import com.flamingo.ai.deepresearch.service.planning.RoutingDecision;
import com.flamingo.ai.deepresearch.service.research.PlanningStatus;
import com.flamingo.ai.deepresearch.service.research.ResearchState;
import java.util.UUID;

/** Response DTO for a routed planning command. */
public record PlanningCommandResponse(
    UUID sessionId,
    ResearchState state,
    PlanningStatus planningStatus,
    String feedback,
    boolean recognized) {

  public static PlanningCommandResponse from(UUID sessionId, RoutingDecision decision) {
    return new PlanningCommandResponse(
        sessionId,
        decision.nextState(),
        decision.nextStatus(),
        decision.feedback(),
        decision.recognized());
  }
}
