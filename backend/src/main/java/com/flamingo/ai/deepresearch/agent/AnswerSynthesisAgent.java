package com.flamingo.ai.deepresearch.agent;

import com.flamingo.ai.deepresearch.agent.dto.SynthesizedAnswer;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** AI agent that writes the final cited answer from compressed evidence. */
public interface AnswerSynthesisAgent {

  @SystemMessage(
      """
        You write the final answer of a research assistant.

        Rules:
        1. Use only the numbered evidence provided.
        2. Cite sources inline with their number in square brackets, e.g. [1] or [2][3].
        3. Never invent a citation number that is not in the evidence list.
        4. If a caveat is given, state it at the start of the answer.
        5. Today's date is {{currentDate}}.

        Return JSON with a single field:
        - answer (string, markdown)
        """)
  @UserMessage(
      """
        Research question: {{question}}

        Caveat: {{caveat}}

        Evidence:
        {{evidence}}
        """)
  SynthesizedAnswer synthesize(
      @V("question") String question,
      @V("evidence") String evidence,
      @V("caveat") String caveat,
      @V("currentDate") String currentDate);
}
