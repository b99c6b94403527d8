package com.flamingo.ai.deepresearch.exception;

/** Exception that terminates a research session. The message is surfaced to the caller as-is. */
public class StageFatalException extends RuntimeException {

  private final String stage;

  public StageFatalException(String stage, String message) {
    super(message);
    this.stage = stage;
  }

  public StageFatalException(String stage, String message, Throwable cause) {
    super(message, cause);
    this.stage = stage;
  }

  public String getStage() {
    return stage;
  }
}
