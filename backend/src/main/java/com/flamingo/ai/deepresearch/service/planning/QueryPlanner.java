package com.flamingo.ai.deepresearch.service.planning;

import com.flamingo.ai.deepresearch.agent.QueryGenerationAgent;
import com.flamingo.ai.deepresearch.agent.dto.GeneratedQueries;
import com.flamingo.ai.deepresearch.exception.SchemaValidationException;
import com.flamingo.ai.deepresearch.service.llm.LlmCallExecutor;
import com.flamingo.ai.deepresearch.service.llm.StructuredOutputParser;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Generates the initial search queries for a research question. */
@Service
@RequiredArgsConstructor
@Slf4j
public class QueryPlanner {

  private final QueryGenerationAgent queryGenerationAgent;
  private final LlmCallExecutor llmCallExecutor;
  private final StructuredOutputParser outputParser;
  private final MeterRegistry meterRegistry;

  /**
   * Returns at most {@code count} distinct, non-blank queries. Duplicates are compared
   * case-insensitively. Unparseable model output yields the question itself as the only query.
   *
   * @throws com.flamingo.ai.deepresearch.exception.LlmServiceException if the model call fails
   *     after retries
   */
  @Timed(value = "research.stage.generate_queries", description = "Time to generate queries")
  public List<String> generateQueries(String question, int count) {
    if (count < 1) {
      throw new IllegalArgumentException("count must be at least 1");
    }
    String raw =
        llmCallExecutor.execute(
            "generate_queries",
            () ->
                queryGenerationAgent.generateQueries(
                    question, count, LocalDate.now().toString()));

    List<String> proposed;
    try {
      GeneratedQueries generated = outputParser.parse(raw, GeneratedQueries.class);
      proposed = generated.queries() == null ? List.of() : generated.queries();
      log.debug("[Plan] Rationale: {}", generated.rationale());
    } catch (SchemaValidationException e) {
      log.warn("[Plan] Query output unparseable, using the question: {}", e.getMessage());
      meterRegistry.counter("llm.schema_errors", "schema", e.getSchema()).increment();
      return List.of(question.strip());
    }

    List<String> queries = distinct(proposed, List.of(), count);
    if (queries.isEmpty()) {
      log.warn("[Plan] Model proposed no usable queries, using the question");
      return List.of(question.strip());
    }
    log.info("[Plan] Generated {} queries (requested {})", queries.size(), count);
    return queries;
  }

  /**
   * Keeps the first occurrence of each non-blank candidate not already in {@code exclude}, up to
   * {@code limit}. Comparison is case-insensitive and ignores surrounding blanks.
   */
  public static List<String> distinct(
      Collection<String> candidates, Collection<String> exclude, int limit) {
    Set<String> seen = new HashSet<>();
    exclude.forEach(query -> seen.add(normalize(query)));
    List<String> result = new ArrayList<>();
    for (String candidate : candidates) {
      if (result.size() >= limit) {
        break;
      }
      if (candidate == null || candidate.isBlank()) {
        continue;
      }
      if (seen.add(normalize(candidate))) {
        result.add(candidate.strip());
      }
    }
    return result;
  }

  private static String normalize(String query) {
    return query.strip().toLowerCase(Locale.ROOT);
  }
}
