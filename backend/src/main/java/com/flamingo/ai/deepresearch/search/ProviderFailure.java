package com.flamingo.ai.deepresearch.search;

/** Why one provider could not answer a query. */
public record ProviderFailure(String provider, String reason) {

  @Override
  public String toString() {
    return provider + ": " + reason;
  }
}
