package com.flamingo.ai.deepresearch.index;

/** Lightweight view of an indexed chunk, used by prune predicates. */
public record ChunkRef(String id, String subgoalId, String sourceUrl) {}
