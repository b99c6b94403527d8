package com.flamingo.ai.deepresearch.service.research;

import static com.flamingo.ai.deepresearch.service.research.ResearchState.CANCELLED;
import static com.flamingo.ai.deepresearch.service.research.ResearchState.COMPRESS;
import static com.flamingo.ai.deepresearch.service.research.ResearchState.DONE;
import static com.flamingo.ai.deepresearch.service.research.ResearchState.FAILED;
import static com.flamingo.ai.deepresearch.service.research.ResearchState.FINALIZE;
import static com.flamingo.ai.deepresearch.service.research.ResearchState.GENERATE_QUERIES;
import static com.flamingo.ai.deepresearch.service.research.ResearchState.INIT;
import static com.flamingo.ai.deepresearch.service.research.ResearchState.PLANNING;
import static com.flamingo.ai.deepresearch.service.research.ResearchState.PLANNING_WAIT;
import static com.flamingo.ai.deepresearch.service.research.ResearchState.REFLECT;
import static com.flamingo.ai.deepresearch.service.research.ResearchState.RESEARCH_FAN_OUT;
import static com.flamingo.ai.deepresearch.service.research.ResearchState.VALIDATE;

import jakarta.annotation.PostConstruct;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Table of stage metadata and allowed transitions, built once. Not used on the hot path. */
@Component
@Slf4j
public class StageRegistry {

  private static final Map<ResearchState, StageDescriptor> STAGES =
      new EnumMap<>(ResearchState.class);

  static {
    register(
        INIT,
        "Create the session",
        List.of("question"),
        List.of("messages"),
        List.of(GENERATE_QUERIES, CANCELLED));
    register(
        GENERATE_QUERIES,
        "Generate distinct search queries for the question",
        List.of("question", "options"),
        List.of("pendingQueries"),
        List.of(PLANNING, FAILED, CANCELLED));
    register(
        PLANNING,
        "Turn queries into plan steps and decide whether to wait for confirmation",
        List.of("pendingQueries", "options"),
        List.of("plan", "planningStatus"),
        List.of(PLANNING_WAIT, RESEARCH_FAN_OUT, CANCELLED));
    register(
        PLANNING_WAIT,
        "Suspended until enter-planning, skip-planning or confirm-plan",
        List.of("planningStatus"),
        List.of("planningStatus"),
        List.of(PLANNING_WAIT, RESEARCH_FAN_OUT, CANCELLED));
    register(
        RESEARCH_FAN_OUT,
        "Search every pending query concurrently with provider fallback",
        List.of("pendingQueries", "plan"),
        List.of("rawResults", "executedQueries", "plan"),
        List.of(VALIDATE, FINALIZE, CANCELLED));
    register(
        VALIDATE,
        "Drop results without citations or relevance",
        List.of("rawResults", "question"),
        List.of("validatedResults", "validationNotes"),
        List.of(COMPRESS, FAILED, CANCELLED));
    register(
        COMPRESS,
        "De-duplicate, shorten and budget evidence, then assign citation ids",
        List.of("validatedResults", "compressedResults"),
        List.of("compressedResults", "citations"),
        List.of(REFLECT, FAILED, CANCELLED));
    register(
        REFLECT,
        "Decide whether evidence suffices or propose follow-up queries",
        List.of("compressedResults", "executedQueries", "researchLoopCount"),
        List.of("sufficient", "knowledgeGap", "pendingQueries", "researchLoopCount"),
        List.of(RESEARCH_FAN_OUT, FINALIZE, FAILED, CANCELLED));
    register(
        FINALIZE,
        "Synthesize the cited answer",
        List.of("compressedResults", "citations"),
        List.of("answer", "outcome", "messages"),
        List.of(DONE, FAILED));
    register(DONE, "Answer delivered", List.of(), List.of(), List.of());
    register(FAILED, "Pipeline aborted", List.of(), List.of("failureReason"), List.of());
    register(CANCELLED, "Cancelled by the caller", List.of(), List.of(), List.of());
  }

  private static void register(
      ResearchState stage,
      String description,
      List<String> reads,
      List<String> writes,
      List<ResearchState> next) {
    STAGES.put(stage, new StageDescriptor(stage, description, reads, writes, next));
  }

  @PostConstruct
  void logStages() {
    STAGES.values().forEach(stage -> log.info("[Stages] {} -> {}", stage.stage(), stage.next()));
  }

  public Collection<StageDescriptor> all() {
    return STAGES.values();
  }

  public StageDescriptor describe(ResearchState stage) {
    return STAGES.get(stage);
  }

  public boolean canTransition(ResearchState from, ResearchState to) {
    return STAGES.get(from).next().contains(to);
  }
}
