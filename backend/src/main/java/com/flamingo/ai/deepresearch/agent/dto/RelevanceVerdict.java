package com.flamingo.ai.deepresearch.agent.dto;

/**
 * Structured output from EvidenceValidationAgent. LangChain4j deserializes the LLM JSON response
 * to this record.
 */
public record RelevanceVerdict(boolean relevant, String reason) {}
