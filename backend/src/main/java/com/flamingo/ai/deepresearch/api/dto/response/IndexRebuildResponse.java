package com.flamingo.ai.deepresearch.api.dto.response;

import com.flamingo.ai.deepresearch.index.IndexStats;

/** Response DTO for a rebuild of the in-memory evidence index. */
public record IndexRebuildResponse(int loadedChunks, IndexStats stats) {}
