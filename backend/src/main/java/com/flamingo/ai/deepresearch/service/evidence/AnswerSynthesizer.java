package com.flamingo.ai.deepresearch.service.evidence;

import com.flamingo.ai.deepresearch.agent.AnswerSynthesisAgent;
import com.flamingo.ai.deepresearch.agent.dto.SynthesizedAnswer;
import com.flamingo.ai.deepresearch.exception.StageFatalException;
import com.flamingo.ai.deepresearch.service.llm.LlmCallExecutor;
import io.micrometer.core.annotation.Timed;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Writes the final answer from compressed evidence, numbered by citation id. */
@Service
@RequiredArgsConstructor
@Slf4j
public class AnswerSynthesizer {

  static final String NO_EVIDENCE_CAVEAT =
      "No supporting evidence could be gathered for this question; the answer relies on general"
          + " knowledge and may be incomplete or outdated.";

  private final AnswerSynthesisAgent synthesisAgent;
  private final LlmCallExecutor llmCallExecutor;

  /**
   * Synthesizes the answer. Units must carry citation ids.
   *
   * @throws com.flamingo.ai.deepresearch.exception.LlmServiceException if the call fails after
   *     retries
   * @throws StageFatalException if the model returned no answer
   */
  @Timed(value = "research.stage.finalize", description = "Time to synthesize the answer")
  public FinalAnswer synthesize(String question, List<EvidenceUnit> evidence) {
    boolean caveated = evidence.isEmpty();
    String numbered = caveated ? "(none)" : numberEvidence(evidence);
    String caveat = caveated ? NO_EVIDENCE_CAVEAT : "(none)";

    SynthesizedAnswer answer =
        llmCallExecutor.execute(
            "synthesize",
            () ->
                synthesisAgent.synthesize(
                    question, numbered, caveat, LocalDate.now().toString()));
    if (answer == null || answer.answer() == null || answer.answer().isBlank()) {
      throw new StageFatalException("FINALIZE", "Answer synthesis returned an empty answer");
    }

    Map<Integer, EvidenceUnit> sources = sourcesByCitation(evidence);
    StringBuilder text = new StringBuilder(answer.answer().strip());
    if (!sources.isEmpty()) {
      text.append("\n\n### Sources\n");
      sources.forEach(
          (index, unit) ->
              text.append(index)
                  .append(". [")
                  .append(label(unit))
                  .append("](")
                  .append(unit.sourceUrl())
                  .append(")\n"));
    }
    log.debug("[Finalize] Answer with {} sources, caveated={}", sources.size(), caveated);
    return new FinalAnswer(text.toString().strip(), sources.size(), caveated);
  }

  static String numberEvidence(List<EvidenceUnit> evidence) {
    StringBuilder numbered = new StringBuilder();
    for (EvidenceUnit unit : evidence) {
      numbered
          .append('[')
          .append(unit.citationIndex() == null ? "?" : unit.citationIndex())
          .append("] ")
          .append(unit.snippet())
          .append('\n');
    }
    return numbered.toString().strip();
  }

  private static Map<Integer, EvidenceUnit> sourcesByCitation(List<EvidenceUnit> evidence) {
    Map<Integer, EvidenceUnit> sources = new TreeMap<>();
    for (EvidenceUnit unit : evidence) {
      if (unit.citationIndex() != null) {
        sources.putIfAbsent(unit.citationIndex(), unit);
      }
    }
    return sources;
  }

  private static String label(EvidenceUnit unit) {
    return unit.title() == null || unit.title().isBlank() ? unit.sourceUrl() : unit.title().strip();
  }
}
