package com.flamingo.ai.deepresearch.search.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.flamingo.ai.deepresearch.config.ResearchConfig;
import com.flamingo.ai.deepresearch.exception.SearchProviderException;
import com.flamingo.ai.deepresearch.search.SearchHit;
import com.flamingo.ai.deepresearch.search.SearchProvider;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

/**
 * Base class for HTTP search providers. Subclasses build the request and map the JSON body to
 * hits; this class enforces the timeout and turns every failure into a {@link
 * SearchProviderException}.
 */
@Slf4j
public abstract class AbstractWebClientSearchProvider implements SearchProvider {

  protected final WebClient webClient;
  protected final ResearchConfig.Search.Provider settings;

  protected AbstractWebClientSearchProvider(ResearchConfig researchConfig, String defaultBaseUrl) {
    this.settings = researchConfig.getSearch().provider(getName());
    String baseUrl =
        settings.getBaseUrl() == null || settings.getBaseUrl().isBlank()
            ? defaultBaseUrl
            : settings.getBaseUrl();
    this.webClient =
        WebClient.builder()
            .baseUrl(baseUrl)
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(2 * 1024 * 1024))
            .build();
    log.debug("Search provider {} initialized: baseUrl={}", getName(), baseUrl);
  }

  /**
   * Builds the provider request.
   *
   * @param query the search query
   * @param maxResults the maximum number of hits requested
   * @return the response body
   */
  protected abstract Mono<JsonNode> fetch(String query, int maxResults);

  /**
   * Maps the response body to hits. Entries without a URL are skipped by the caller.
   *
   * @param body the JSON response
   * @return the hits in provider rank order
   */
  protected abstract List<SearchHit> parseHits(JsonNode body);

  protected boolean requiresApiKey() {
    return true;
  }

  @Override
  public List<SearchHit> search(String query, int maxResults, Duration timeout) {
    if (requiresApiKey() && (settings.getApiKey() == null || settings.getApiKey().isBlank())) {
      throw new SearchProviderException(getName(), "missing api key");
    }

    JsonNode body;
    try {
      body = fetch(query, maxResults).timeout(timeout).block();
    } catch (WebClientResponseException e) {
      throw new SearchProviderException(
          getName(), "HTTP " + e.getStatusCode().value() + " " + e.getStatusText(), e);
    } catch (RuntimeException e) {
      Throwable cause = Exceptions.unwrap(e);
      if (cause instanceof TimeoutException) {
        throw new SearchProviderException(
            getName(), "timeout after " + timeout.toMillis() + "ms", cause);
      }
      throw new SearchProviderException(getName(), String.valueOf(cause.getMessage()), cause);
    }

    if (body == null || body.isMissingNode() || body.isNull()) {
      throw new SearchProviderException(getName(), "empty response");
    }

    List<SearchHit> hits;
    try {
      hits = parseHits(body);
    } catch (RuntimeException e) {
      throw new SearchProviderException(getName(), "malformed response: " + e.getMessage(), e);
    }

    List<SearchHit> valid = new ArrayList<>();
    for (SearchHit hit : hits) {
      if (hit.url() != null && hit.url().startsWith("http") && valid.size() < maxResults) {
        valid.add(hit);
      }
    }
    if (valid.isEmpty()) {
      throw new SearchProviderException(getName(), "empty response");
    }
    return valid;
  }

  protected static String text(JsonNode node, String field) {
    JsonNode value = node.path(field);
    return value.isTextual() ? value.asText() : "";
  }
}
