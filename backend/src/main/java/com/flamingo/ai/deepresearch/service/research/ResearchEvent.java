package com.flamingo.ai.deepresearch.service.research;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Event published on a session's stream. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ResearchEvent {

  public static final String PLANNING_UPDATED = "planning_updated";
  public static final String SEARCH_BATCH_COMPLETED = "search_batch_completed";
  public static final String REFLECTION_COMPLETED = "reflection_completed";
  public static final String FINALIZED = "finalized";
  public static final String FAILED = "failed";
  public static final String INDEX_WRITE_DEGRADED = "index_write_degraded";
  public static final String CANCELLED = "cancelled";

  private String eventType;
  private UUID sessionId;
  private ResearchState state;
  private Object data;
  @Builder.Default private Instant timestamp = Instant.now();

  public static ResearchEvent planningUpdated(
      ResearchSession session, String feedback, List<PlanStep> plan) {
    return of(
        PLANNING_UPDATED,
        session,
        new PlanningData(session.getPlanningStatus(), feedback, List.copyOf(plan)));
  }

  public static ResearchEvent searchBatchCompleted(
      ResearchSession session, int round, long succeeded, long failed, int results) {
    return of(
        SEARCH_BATCH_COMPLETED, session, new SearchBatchData(round, succeeded, failed, results));
  }

  public static ResearchEvent reflectionCompleted(
      ResearchSession session, boolean sufficient, String knowledgeGap, List<String> followUps) {
    return of(
        REFLECTION_COMPLETED,
        session,
        new ReflectionData(
            session.getResearchLoopCount(), sufficient, knowledgeGap, List.copyOf(followUps)));
  }

  public static ResearchEvent finalized(ResearchSession session) {
    return of(
        FINALIZED,
        session,
        new FinalizedData(
            session.getOutcome(), session.getAnswer(), session.getCitations().size()));
  }

  public static ResearchEvent failed(ResearchSession session, String reason) {
    return of(FAILED, session, new MessageData(reason));
  }

  public static ResearchEvent indexWriteDegraded(
      ResearchSession session, String subgoalId, String reason) {
    return of(INDEX_WRITE_DEGRADED, session, new IndexDegradedData(subgoalId, reason));
  }

  public static ResearchEvent cancelled(ResearchSession session) {
    return of(CANCELLED, session, new MessageData("Research cancelled."));
  }

  private static ResearchEvent of(String type, ResearchSession session, Object data) {
    return ResearchEvent.builder()
        .eventType(type)
        .sessionId(session.getId())
        .state(session.getState())
        .data(data)
        .build();
  }

  public record PlanningData(PlanningStatus planningStatus, String feedback, List<PlanStep> plan) {}

  public record SearchBatchData(
      int round, long succeededQueries, long failedQueries, int results) {}

  public record ReflectionData(
      int round, boolean sufficient, String knowledgeGap, List<String> followUpQueries) {}

  public record FinalizedData(ResearchOutcome outcome, String answer, int sourceCount) {}

  public record IndexDegradedData(String subgoalId, String reason) {}

  public record MessageData(String message) {}
}
