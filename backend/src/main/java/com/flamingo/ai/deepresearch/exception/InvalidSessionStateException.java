package com.flamingo.ai.deepresearch.exception;

import com.flamingo.ai.deepresearch.service.research.ResearchState;
import java.util.UUID;

/** Exception thrown when a command is not accepted in the session's current state. */
public class InvalidSessionStateException extends RuntimeException {

  private final UUID sessionId;
  private final ResearchState state;

  public InvalidSessionStateException(UUID sessionId, ResearchState state, String message) {
    super(message);
    this.sessionId = sessionId;
    this.state = state;
  }

  public UUID getSessionId() {
    return sessionId;
  }

  public ResearchState getState() {
    return state;
  }
}
