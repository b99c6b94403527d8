package com.flamingo.ai.deepresearch.service.evidence;

/**
 * The synthesized answer with its source list appended.
 *
 * @param text markdown answer ending in a "Sources" section when evidence exists
 * @param sourceCount number of distinct sources listed
 * @param caveated whether the answer was produced without evidence
 */
public record FinalAnswer(String text, int sourceCount, boolean caveated) {}
