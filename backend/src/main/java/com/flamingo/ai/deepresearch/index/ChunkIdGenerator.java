package com.flamingo.ai.deepresearch.index;

import com.google.common.annotations.VisibleForTesting;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Generates chunk ids of the form {@code {subgoalId}_{instance}_{sequence}}. The sequence is a
 * process-wide counter; the random instance token keeps ids distinct from those written to the
 * durable backend by earlier runs.
 */
@Component
public class ChunkIdGenerator {

  private final String instanceToken;
  private final AtomicLong sequence = new AtomicLong();

  @Autowired
  public ChunkIdGenerator() {
    this(UUID.randomUUID().toString().replace("-", "").substring(0, 10));
  }

  /** Constructor for testing - fixes the instance token. */
  @VisibleForTesting
  public ChunkIdGenerator(String instanceToken) {
    this.instanceToken = instanceToken;
  }

  public String nextId(String subgoalId) {
    return subgoalId + "_" + instanceToken + "_" + sequence.incrementAndGet();
  }
}
