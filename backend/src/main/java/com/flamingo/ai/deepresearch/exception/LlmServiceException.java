package com.flamingo.ai.deepresearch.exception;

/** Exception thrown when the LLM service fails after retries are exhausted. */
public class LlmServiceException extends ProviderException {

  private static final String UNAVAILABLE =
      "AI service is temporarily unavailable. Please try again later.";
  private static final String BUSY = "Service is temporarily busy. Please try again in a moment.";

  private final boolean rateLimited;

  public LlmServiceException(String message) {
    super("llm", message, UNAVAILABLE);
    this.rateLimited = false;
  }

  public LlmServiceException(String message, Throwable cause) {
    super("llm", message, UNAVAILABLE, cause);
    this.rateLimited = false;
  }

  public LlmServiceException(String message, boolean rateLimited, Throwable cause) {
    super("llm", message, rateLimited ? BUSY : UNAVAILABLE, cause);
    this.rateLimited = rateLimited;
  }

  public boolean isRateLimited() {
    return rateLimited;
  }
}
