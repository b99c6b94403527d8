package com.flamingo.ai.deepresearch.service.evidence;

import com.flamingo.ai.deepresearch.agent.EvidenceValidationAgent;
import com.flamingo.ai.deepresearch.agent.dto.RelevanceVerdict;
import com.flamingo.ai.deepresearch.config.ResearchConfig;
import com.flamingo.ai.deepresearch.exception.LlmServiceException;
import com.flamingo.ai.deepresearch.service.llm.LlmCallExecutor;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Filters raw search results before they enter the session's evidence.
 *
 * <p>Checks per unit, in order:
 *
 * <ol>
 *   <li>a markdown citation {@code [title](http...)} is present (hard fail when citations are
 *       required)
 *   <li>the snippet shares a keyword with the question, exactly or by fuzzy match (heuristic and
 *       hybrid modes)
 *   <li>the LLM judges the snippet relevant (llm and hybrid modes); a failed call accepts the unit
 * </ol>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EvidenceValidator {

  static final Pattern CITATION = Pattern.compile("\\[[^\\]]+\\]\\(https?://[^)]+\\)");
  private static final Pattern TOKEN_SPLIT = Pattern.compile("[^\\p{L}\\p{N}]+");
  private static final Set<String> STOPWORDS =
      Set.of(
          "what", "which", "when", "where", "does", "that", "this", "with", "from", "have",
          "about", "there", "their", "into", "your", "will", "would", "could", "should", "been",
          "were", "they", "them", "than", "then", "also", "some", "more", "most", "many", "much",
          "explain", "describe", "tell");

  private final EvidenceValidationAgent validationAgent;
  private final LlmCallExecutor llmCallExecutor;
  private final ResearchConfig researchConfig;
  private final MeterRegistry meterRegistry;

  @Timed(value = "research.stage.validate", description = "Time to validate search results")
  public ValidationReport validate(String question, List<EvidenceUnit> units) {
    ResearchConfig.Validation config = researchConfig.getValidation();
    Set<String> keywords = keywords(question, config.getMinKeywordLength());
    boolean keywordCheck = config.getMode() != ValidationMode.LLM;
    boolean llmCheck = config.getMode() != ValidationMode.HEURISTIC;

    List<EvidenceUnit> accepted = new ArrayList<>();
    List<String> notes = new ArrayList<>();
    for (int i = 0; i < units.size(); i++) {
      EvidenceUnit unit = units.get(i);
      int number = i + 1;
      if (config.isRequireCitations() && !hasCitation(unit.snippet())) {
        notes.add("Result " + number + " rejected: Missing citations (Hard Fail).");
        continue;
      }
      if (keywordCheck && !sharesKeyword(unit.snippet(), keywords, config.getFuzzyCutoff())) {
        notes.add("Result " + number + " rejected: No keyword overlap with the question.");
        continue;
      }
      if (llmCheck) {
        String reason = judgeIrrelevant(question, unit);
        if (reason != null) {
          notes.add("Result " + number + " rejected: Judged irrelevant (" + reason + ").");
          continue;
        }
      }
      accepted.add(unit);
    }

    if (!units.isEmpty() && accepted.isEmpty()) {
      notes.add("All summaries failed validation.");
    }
    meterRegistry.counter("validation.units", "outcome", "accepted").increment(accepted.size());
    meterRegistry
        .counter("validation.units", "outcome", "rejected")
        .increment(units.size() - accepted.size());
    log.debug("[Validate] {} of {} units accepted", accepted.size(), units.size());
    return new ValidationReport(accepted, notes);
  }

  /** Returns the rejection reason, or {@code null} if the unit is relevant or the check failed. */
  private String judgeIrrelevant(String question, EvidenceUnit unit) {
    try {
      RelevanceVerdict verdict =
          llmCallExecutor.execute(
              "validate", () -> validationAgent.judge(question, unit.snippet()));
      if (verdict == null || verdict.relevant()) {
        return null;
      }
      return verdict.reason() == null || verdict.reason().isBlank()
          ? "no reason given"
          : verdict.reason().strip();
    } catch (LlmServiceException e) {
      log.warn("[Validate] Relevance check failed, accepting unit: {}", e.getMessage());
      meterRegistry.counter("validation.llm.fail_open").increment();
      return null;
    }
  }

  static boolean hasCitation(String snippet) {
    return snippet != null && CITATION.matcher(snippet).find();
  }

  static Set<String> keywords(String text, int minLength) {
    Set<String> keywords = new LinkedHashSet<>();
    for (String token : TOKEN_SPLIT.split(text.toLowerCase(Locale.ROOT))) {
      if (token.length() >= minLength && !STOPWORDS.contains(token)) {
        keywords.add(token);
      }
    }
    return keywords;
  }

  static boolean sharesKeyword(String snippet, Set<String> keywords, double cutoff) {
    if (keywords.isEmpty()) {
      return true;
    }
    String lower = snippet.toLowerCase(Locale.ROOT);
    for (String keyword : keywords) {
      if (lower.contains(keyword)) {
        return true;
      }
    }
    for (String word : TOKEN_SPLIT.split(lower)) {
      if (word.length() < 3) {
        continue;
      }
      for (String keyword : keywords) {
        if (similarity(word, keyword) >= cutoff) {
          return true;
        }
      }
    }
    return false;
  }

  /** Similarity ratio {@code 2 * LCS / (|a| + |b|)} over characters, in [0, 1]. */
  static double similarity(String a, String b) {
    if (a.isEmpty() && b.isEmpty()) {
      return 1.0;
    }
    int[] previous = new int[b.length() + 1];
    int[] current = new int[b.length() + 1];
    for (int i = 1; i <= a.length(); i++) {
      for (int j = 1; j <= b.length(); j++) {
        current[j] =
            a.charAt(i - 1) == b.charAt(j - 1)
                ? previous[j - 1] + 1
                : Math.max(previous[j], current[j - 1]);
      }
      int[] swap = previous;
      previous = current;
      current = swap;
    }
    return 2.0 * previous[b.length()] / (a.length() + b.length());
  }
}
