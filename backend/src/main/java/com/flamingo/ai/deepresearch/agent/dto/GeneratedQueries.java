package com.flamingo.ai.deepresearch.agent.dto;

import java.util.List;

/** Parsed output of {@code QueryGenerationAgent}. */
public record GeneratedQueries(List<String> queries, String rationale) {}
