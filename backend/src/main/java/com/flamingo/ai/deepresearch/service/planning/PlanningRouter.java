package com.flamingo.ai.deepresearch.service.planning;

import com.flamingo.ai.deepresearch.service.research.PlanningStatus;
import com.flamingo.ai.deepresearch.service.research.ResearchState;
import org.springframework.stereotype.Component;

/**
 * Maps {@code (current planning status, command)} to the next status and state. Stateless; an
 * unknown command keeps the status and stays in {@link ResearchState#PLANNING_WAIT}.
 */
@Component
public class PlanningRouter {

  static final String SKIPPED = "Planning skipped.";
  static final String CONFIRMED = "Plan confirmed. Proceeding to research.";
  static final String AWAITING = "Awaiting plan confirmation.";

  public RoutingDecision route(PlanningStatus current, String command) {
    return PlanningCommand.parse(command)
        .map(this::route)
        .orElseGet(
            () ->
                new RoutingDecision(
                    current,
                    ResearchState.PLANNING_WAIT,
                    "Unknown planning command '" + command + "'. " + AWAITING,
                    false));
  }

  private RoutingDecision route(PlanningCommand command) {
    return switch (command) {
      case ENTER_PLANNING -> new RoutingDecision(
          PlanningStatus.AWAITING_CONFIRMATION, ResearchState.PLANNING_WAIT, AWAITING, true);
      case SKIP_PLANNING -> new RoutingDecision(
          PlanningStatus.AUTO_APPROVED, ResearchState.RESEARCH_FAN_OUT, SKIPPED, true);
      case CONFIRM_PLAN -> new RoutingDecision(
          PlanningStatus.CONFIRMED, ResearchState.RESEARCH_FAN_OUT, CONFIRMED, true);
    };
  }
}
