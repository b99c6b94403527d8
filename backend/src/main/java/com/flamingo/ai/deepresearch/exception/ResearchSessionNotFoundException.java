package com.flamingo.ai.deepresearch.exception;

import java.util.UUID;

/** Exception thrown when a research session is neither live nor persisted. */
public class ResearchSessionNotFoundException extends RuntimeException {

  private final UUID sessionId;

  public ResearchSessionNotFoundException(UUID sessionId) {
    super("Research session not found: " + sessionId);
    this.sessionId = sessionId;
  }

  public UUID getSessionId() {
    return sessionId;
  }
}
