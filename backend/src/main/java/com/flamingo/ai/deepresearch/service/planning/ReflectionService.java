package com.flamingo.ai.deepresearch.service.planning;

import com.flamingo.ai.deepresearch.agent.ReflectionAgent;
import com.flamingo.ai.deepresearch.agent.dto.ReflectionResult;
import com.flamingo.ai.deepresearch.exception.SchemaValidationException;
import com.flamingo.ai.deepresearch.service.evidence.EvidenceUnit;
import com.flamingo.ai.deepresearch.service.llm.LlmCallExecutor;
import com.flamingo.ai.deepresearch.service.llm.StructuredOutputParser;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Decides after each research round whether more searching is needed. */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReflectionService {

  private final ReflectionAgent reflectionAgent;
  private final LlmCallExecutor llmCallExecutor;
  private final StructuredOutputParser outputParser;
  private final MeterRegistry meterRegistry;

  /**
   * Reflects on the evidence gathered so far.
   *
   * <p>Unparseable output is treated as sufficient: finishing early beats looping on empty
   * reflections.
   *
   * @param question the research question
   * @param evidence compressed evidence
   * @param round the round that just completed, starting at 1
   * @param executedQueries queries already searched; follow-ups repeating them are dropped
   * @param maxFollowUps cap on follow-up queries
   * @throws com.flamingo.ai.deepresearch.exception.LlmServiceException if the model call fails
   *     after retries
   */
  @Timed(value = "research.stage.reflect", description = "Time to reflect on evidence")
  public ReflectionDecision reflect(
      String question,
      List<EvidenceUnit> evidence,
      int round,
      List<String> executedQueries,
      int maxFollowUps) {
    String searched = executedQueries.stream().map(q -> "- " + q).collect(Collectors.joining("\n"));
    String numbered =
        evidence.isEmpty()
            ? "(no evidence gathered)"
            : evidence.stream()
                .map(unit -> "[" + unit.citationIndex() + "] " + unit.snippet())
                .collect(Collectors.joining("\n"));

    String raw =
        llmCallExecutor.execute(
            "reflect", () -> reflectionAgent.reflect(question, round, searched, numbered));

    ReflectionResult result;
    try {
      result = outputParser.parse(raw, ReflectionResult.class);
    } catch (SchemaValidationException e) {
      log.warn("[Reflect] Round {} output unparseable, finalizing: {}", round, e.getMessage());
      meterRegistry.counter("llm.schema_errors", "schema", e.getSchema()).increment();
      return new ReflectionDecision(true, null, List.of(), true);
    }

    List<String> followUps =
        QueryPlanner.distinct(
            result.followUpQueries() == null ? List.of() : result.followUpQueries(),
            executedQueries,
            maxFollowUps);
    boolean sufficient =
        result.isSufficient() != null ? result.isSufficient() : followUps.isEmpty();

    log.info(
        "[Reflect] Round {}: sufficient={}, followUps={}, gap={}",
        round,
        sufficient,
        followUps.size(),
        result.knowledgeGap());
    return new ReflectionDecision(
        sufficient, result.knowledgeGap(), sufficient ? List.of() : followUps, false);
  }
}
