package com.flamingo.ai.deepresearch.index;

/** A query result with its similarity score. */
public record RetrievedChunk(EvidenceChunk chunk, double score) {}
