package com.flamingo.ai.deepresearch.index;

/** The two evidence index backends. */
public enum BackendType {
  /** In-memory vector index, rebuilt on restart. */
  MEMORY,
  /** Durable Elasticsearch store with per-chunk deletion and metadata filtering. */
  ELASTICSEARCH
}
