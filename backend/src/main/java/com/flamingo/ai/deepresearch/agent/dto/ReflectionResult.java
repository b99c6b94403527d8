package com.flamingo.ai.deepresearch.agent.dto;

import java.util.List;

/** Parsed output of {@code ReflectionAgent}. */
public record ReflectionResult(
    Boolean isSufficient, String knowledgeGap, List<String> followUpQueries) {}
