package com.flamingo.ai.deepresearch.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * AI agent that decides whether gathered evidence answers the research question. Returns the raw
 * JSON text; parsing happens in the reflection service.
 */
public interface ReflectionAgent {

  @SystemMessage(
      """
        You are an expert research assistant reviewing evidence gathered so far.

        Task: decide whether the evidence is sufficient to answer the question.

        Rules:
        1. If the evidence answers the question, return isSufficient=true and no follow-up queries.
        2. Otherwise describe the missing information in knowledgeGap and propose self-contained
           follow-up search queries that close the gap.
        3. Do not repeat queries that were already searched.

        Return JSON with these fields:
        - isSufficient (boolean)
        - knowledgeGap (string)
        - followUpQueries (array of strings)
        """)
  @UserMessage(
      """
        Research question: {{question}}

        Research round: {{round}}

        Already searched:
        {{searchedQueries}}

        Evidence:
        {{evidence}}

        Return JSON with isSufficient, knowledgeGap and followUpQueries fields.
        """)
  String reflect(
      @V("question") String question,
      @V("round") int round,
      @V("searchedQueries") String searchedQueries,
      @V("evidence") String evidence);
}
