package com.flamingo.ai.deepresearch.service.evidence;

import com.flamingo.ai.deepresearch.agent.EvidenceCompressionAgent;
import com.flamingo.ai.deepresearch.agent.dto.CompressedSnippet;
import com.flamingo.ai.deepresearch.config.ResearchConfig;
import com.flamingo.ai.deepresearch.exception.LlmServiceException;
import com.flamingo.ai.deepresearch.service.llm.LlmCallExecutor;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Shrinks validated evidence to fit the session token budget.
 *
 * <p>Tier 1 drops repeated snippets, keeping the first occurrence. Tier 2 (tiered mode) asks the
 * LLM to shorten snippets longer than the configured limit; a shortened snippet that lost its
 * citation, or a failed call, keeps the original. Finally units past the budget are dropped.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EvidenceCompressor {

  static final int CHARS_PER_TOKEN = 4;

  private final EvidenceCompressionAgent compressionAgent;
  private final LlmCallExecutor llmCallExecutor;
  private final ResearchConfig researchConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Merges a round's validated units into the evidence compressed so far.
   *
   * @param question the research question
   * @param existing evidence kept from earlier rounds, already within budget
   * @param incoming this round's validated units
   * @param tokenBudget ceiling for the whole evidence set
   * @return the new compressed evidence, earlier rounds first
   */
  @Timed(value = "research.stage.compress", description = "Time to compress evidence")
  public List<EvidenceUnit> compress(
      String question, List<EvidenceUnit> existing, List<EvidenceUnit> incoming, int tokenBudget) {
    ResearchConfig.Compression config = researchConfig.getCompression();
    if (!config.isEnabled()) {
      List<EvidenceUnit> merged = new ArrayList<>(existing);
      merged.addAll(incoming);
      return List.copyOf(merged);
    }

    Set<String> seen = new HashSet<>();
    existing.forEach(unit -> seen.add(normalize(unit.snippet())));
    List<EvidenceUnit> fresh = new ArrayList<>();
    for (EvidenceUnit unit : incoming) {
      if (seen.add(normalize(unit.snippet()))) {
        fresh.add(unit);
      }
    }
    int duplicates = incoming.size() - fresh.size();

    if (config.getMode() == CompressionMode.TIERED) {
      fresh.replaceAll(unit -> shorten(question, unit, config.getMaxSnippetChars()));
    }

    List<EvidenceUnit> result = new ArrayList<>();
    long charBudget = (long) tokenBudget * CHARS_PER_TOKEN;
    long used = 0;
    int dropped = 0;
    for (EvidenceUnit unit : concat(existing, fresh)) {
      int length = unit.snippet().length();
      if (used + length > charBudget) {
        dropped++;
        continue;
      }
      used += length;
      result.add(unit);
    }

    if (dropped > 0) {
      meterRegistry.counter("compression.units.dropped").increment(dropped);
    }
    log.debug(
        "[Compress] incoming={} duplicates={} droppedOverBudget={} total={} (~{} tokens)",
        incoming.size(),
        duplicates,
        dropped,
        result.size(),
        used / CHARS_PER_TOKEN);
    return List.copyOf(result);
  }

  private EvidenceUnit shorten(String question, EvidenceUnit unit, int maxChars) {
    if (unit.snippet().length() <= maxChars) {
      return unit;
    }
    try {
      CompressedSnippet compressed =
          llmCallExecutor.execute(
              "compress", () -> compressionAgent.compress(question, unit.snippet(), maxChars));
      String text = compressed == null ? null : compressed.text();
      if (text == null || text.isBlank() || !EvidenceValidator.hasCitation(text)) {
        log.debug("[Compress] Shortened snippet lost its citation, keeping original");
        return unit;
      }
      meterRegistry.counter("compression.snippets.shortened").increment();
      return unit.withSnippet(text.strip());
    } catch (LlmServiceException e) {
      log.warn("[Compress] Shortening failed, keeping original snippet: {}", e.getMessage());
      return unit;
    }
  }

  private static List<EvidenceUnit> concat(List<EvidenceUnit> first, List<EvidenceUnit> second) {
    List<EvidenceUnit> all = new ArrayList<>(first.size() + second.size());
    all.addAll(first);
    all.addAll(second);
    return all;
  }

  private static String normalize(String snippet) {
    return snippet.strip().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
  }
}
