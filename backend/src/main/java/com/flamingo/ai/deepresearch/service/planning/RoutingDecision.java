package com.flamingo.ai.deepresearch.service.planning;

import com.flamingo.ai.deepresearch.service.research.PlanningStatus;
import com.flamingo.ai.deepresearch.service.research.ResearchState;

/**
 * Result of routing a planning command.
 *
 * @param nextStatus planning status after the command
 * @param nextState state the engine moves to
 * @param feedback message for the caller
 * @param recognized false when the command was not understood and nothing changed
 */
public record RoutingDecision(
    PlanningStatus nextStatus, ResearchState nextState, String feedback, boolean recognized) {}
