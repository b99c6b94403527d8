package com.flamingo.ai.deepresearch.service.research;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.flamingo.ai.deepresearch.service.evidence.EvidenceUnit;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Mutable state of one research run. Owned by the engine: only the thread running the session
 * mutates it, and snapshots are taken under the session lock.
 *
 * <p>Stage contracts:
 *
 * <ul>
 *   <li>generate queries: reads question, options; writes pendingQueries
 *   <li>planning: reads pendingQueries; writes plan, planningStatus
 *   <li>fan-out: reads pendingQueries; writes rawResults, executedQueries, plan statuses
 *   <li>validate: reads rawResults; writes validatedResults, validationNotes
 *   <li>compress: reads validatedResults, compressedResults; writes compressedResults, citations
 *   <li>reflect: reads compressedResults; writes sufficient, knowledgeGap, pendingQueries,
 *       researchLoopCount
 *   <li>finalize: reads compressedResults, citations; writes answer, outcome, messages
 * </ul>
 */
@Getter
@Setter
@NoArgsConstructor
public class ResearchSession {

  private UUID id;
  private String question;
  private ResearchOptions options;
  private ResearchState state = ResearchState.INIT;
  private PlanningStatus planningStatus;

  private List<SessionMessage> messages = new ArrayList<>();
  private List<PlanStep> plan = new ArrayList<>();
  private List<String> pendingQueries = new ArrayList<>();
  private List<String> executedQueries = new ArrayList<>();

  private List<EvidenceUnit> rawResults = new ArrayList<>();
  private List<EvidenceUnit> validatedResults = new ArrayList<>();
  private List<EvidenceUnit> compressedResults = new ArrayList<>();
  private CitationRegistry citations = new CitationRegistry();
  private List<String> validationNotes = new ArrayList<>();

  private int researchLoopCount;
  private boolean sufficient;
  private String knowledgeGap;

  private String answer;
  private ResearchOutcome outcome;
  private String failureReason;

  private Instant createdAt;
  private Instant updatedAt;

  public static ResearchSession start(String question, ResearchOptions options) {
    ResearchSession session = new ResearchSession();
    session.id = UUID.randomUUID();
    session.question = question;
    session.options = options;
    session.createdAt = Instant.now();
    session.updatedAt = session.createdAt;
    session.messages.add(SessionMessage.user(question));
    return session;
  }

  /** Appends a pending step per query, numbering on from the existing plan. */
  public List<PlanStep> addPlanSteps(List<String> queries) {
    List<PlanStep> added = new ArrayList<>();
    for (String query : queries) {
      PlanStep step = PlanStep.pending(plan.size() + 1, query);
      plan.add(step);
      added.add(step);
    }
    return added;
  }

  /** Latest step running {@code query}, matched case-insensitively. */
  public Optional<PlanStep> stepFor(String query) {
    String key = query.strip().toLowerCase(Locale.ROOT);
    for (int i = plan.size() - 1; i >= 0; i--) {
      if (plan.get(i).query().strip().toLowerCase(Locale.ROOT).equals(key)) {
        return Optional.of(plan.get(i));
      }
    }
    return Optional.empty();
  }

  public void updateStep(String stepId, PlanStepStatus status) {
    plan.replaceAll(step -> step.id().equals(stepId) ? step.withStatus(status) : step);
  }

  public void touch() {
    updatedAt = Instant.now();
  }

  @JsonIgnore
  public int getEvidenceCount() {
    return compressedResults.size();
  }
}
