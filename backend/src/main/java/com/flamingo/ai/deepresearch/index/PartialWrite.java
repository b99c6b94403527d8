package com.flamingo.ai.deepresearch.index;

/** A chunk that one backend failed to accept. */
public record PartialWrite(String chunkId, BackendType failedBackend, String reason) {}
