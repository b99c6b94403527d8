package com.flamingo.ai.deepresearch.service.research;

import java.time.Instant;

/** A user or assistant turn of a session. */
public record SessionMessage(String role, String content, Instant timestamp) {

  public static SessionMessage user(String content) {
    return new SessionMessage("user", content, Instant.now());
  }

  public static SessionMessage assistant(String content) {
    return new SessionMessage("assistant", content, Instant.now());
  }
}
