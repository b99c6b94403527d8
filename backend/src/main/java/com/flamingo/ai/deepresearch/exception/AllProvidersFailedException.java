package com.flamingo.ai.deepresearch.exception;

import com.flamingo.ai.deepresearch.search.ProviderFailure;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Exception thrown when every configured search provider failed for a query. Carries the failure
 * reasons in the order the providers were attempted.
 */
public class AllProvidersFailedException extends RuntimeException {

  private final String query;
  private final List<ProviderFailure> failures;

  public AllProvidersFailedException(String query, List<ProviderFailure> failures) {
    super(
        "All providers failed for query '"
            + query
            + "': "
            + failures.stream().map(ProviderFailure::toString).collect(Collectors.joining("; ")));
    this.query = query;
    this.failures = List.copyOf(failures);
  }

  public String getQuery() {
    return query;
  }

  public List<ProviderFailure> getFailures() {
    return failures;
  }

  public String getUserMessage() {
    return "No search provider could answer the query.";
  }
}
