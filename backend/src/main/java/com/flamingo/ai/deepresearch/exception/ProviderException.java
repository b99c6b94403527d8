package com.flamingo.ai.deepresearch.exception;

/** Base exception for failures of an external provider (LLM or search). */
public class ProviderException extends RuntimeException {

  private final String provider;
  private final String userMessage;

  public ProviderException(String provider, String message, String userMessage) {
    super(message);
    this.provider = provider;
    this.userMessage = userMessage;
  }

  public ProviderException(String provider, String message, String userMessage, Throwable cause) {
    super(message, cause);
    this.provider = provider;
    this.userMessage = userMessage;
  }

  public String getProvider() {
    return provider;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
