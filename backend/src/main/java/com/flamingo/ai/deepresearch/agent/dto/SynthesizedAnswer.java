package com.flamingo.ai.deepresearch.agent.dto;

/** Structured output from AnswerSynthesisAgent. */
public record SynthesizedAnswer(String answer) {}
