package com.flamingo.ai.deepresearch.agent;

import com.flamingo.ai.deepresearch.agent.dto.CompressedSnippet;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** AI agent that shortens an oversized evidence snippet while keeping its citation. */
public interface EvidenceCompressionAgent {

  @SystemMessage(
      """
        You condense research evidence.

        Rules:
        1. Keep only facts relevant to the research question.
        2. Keep every markdown citation of the form [Title](url) exactly as written.
        3. Stay under {{maxChars}} characters.

        Return JSON with a single field:
        - text (string)
        """)
  @UserMessage(
      """
        Research question: {{question}}

        Evidence:
        {{snippet}}
        """)
  CompressedSnippet compress(
      @V("question") String question, @V("snippet") String snippet, @V("maxChars") int maxChars);
}
