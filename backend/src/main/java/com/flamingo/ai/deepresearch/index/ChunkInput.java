package com.flamingo.ai.deepresearch.index;

import java.util.List;
import java.util.Map;

/** A chunk submitted for ingestion; the index assigns its id. */
public record ChunkInput(String text, List<Float> embedding, Map<String, String> sourceMetadata) {}
