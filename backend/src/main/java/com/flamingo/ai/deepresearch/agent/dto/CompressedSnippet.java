package com.flamingo.ai.deepresearch.agent.dto;

/** Structured output from EvidenceCompressionAgent. */
public record CompressedSnippet(String text) {}
