package com.flamingo.ai.deepresearch.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * AI agent that turns a research question into web search queries. Returns the raw JSON text so
 * that unparseable output can be told apart from a failed call.
 */
public interface QueryGenerationAgent {

  @SystemMessage(
      """
        You are a research planner preparing web searches for an automated research assistant.

        Rules:
        1. Produce at most {{count}} search queries.
        2. Each query targets a distinct aspect of the question; never repeat a query.
        3. Prefer one query when the question is narrow.
        4. Queries should surface recent information. Today's date is {{currentDate}}.

        Return JSON with these fields:
        - queries (array of strings)
        - rationale (string) - brief explanation of how the queries cover the question
        """)
  @UserMessage(
      """
        Research question: {{question}}

        Return JSON with queries and rationale fields.
        """)
  String generateQueries(
      @V("question") String question,
      @V("count") int count,
      @V("currentDate") String currentDate);
}
