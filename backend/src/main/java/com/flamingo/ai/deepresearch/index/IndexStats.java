package com.flamingo.ai.deepresearch.index;

import java.util.Map;

/** Snapshot of the active evidence mapping. */
public record IndexStats(int activeCount, int prunedCount, Map<String, Integer> chunksBySubgoal) {}
