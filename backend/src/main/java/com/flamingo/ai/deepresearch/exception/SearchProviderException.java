package com.flamingo.ai.deepresearch.exception;

/** Exception thrown by a single search provider (timeout, auth error, empty or bad response). */
public class SearchProviderException extends ProviderException {

  private static final String USER_MESSAGE = "Search is temporarily unavailable. Please try again.";

  public SearchProviderException(String provider, String reason) {
    super(provider, reason, USER_MESSAGE);
  }

  public SearchProviderException(String provider, String reason, Throwable cause) {
    super(provider, reason, USER_MESSAGE, cause);
  }
}
