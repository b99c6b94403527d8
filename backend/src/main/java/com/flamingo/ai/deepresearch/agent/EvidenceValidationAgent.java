package com.flamingo.ai.deepresearch.agent;

import com.flamingo.ai.deepresearch.agent.dto.RelevanceVerdict;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** AI agent giving a yes/no relevance verdict for a single search snippet. */
public interface EvidenceValidationAgent {

  @SystemMessage(
      """
        You check whether a search snippet is relevant evidence for a research question.
        Answer relevant=true only if the snippet contains facts that help answer the question.

        Return JSON with these fields:
        - relevant (boolean)
        - reason (string) - one short sentence
        """)
  @UserMessage(
      """
        Research question: {{question}}

        Snippet:
        {{snippet}}
        """)
  RelevanceVerdict judge(@V("question") String question, @V("snippet") String snippet);
}
