package com.flamingo.ai.deepresearch.exception;

/** Exception thrown when an evidence index backend rejects a write or delete. */
public class IndexWriteException extends RuntimeException {

  private final String backend;

  public IndexWriteException(String backend, String message) {
    super(message);
    this.backend = backend;
  }

  public IndexWriteException(String backend, String message, Throwable cause) {
    super(message, cause);
    this.backend = backend;
  }

  public String getBackend() {
    return backend;
  }

  public String getUserMessage() {
    return "Evidence storage is temporarily degraded.";
  }
}
