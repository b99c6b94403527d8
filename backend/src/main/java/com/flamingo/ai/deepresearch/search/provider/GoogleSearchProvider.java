package com.flamingo.ai.deepresearch.search.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.flamingo.ai.deepresearch.config.ResearchConfig;
import com.flamingo.ai.deepresearch.exception.SearchProviderException;
import com.flamingo.ai.deepresearch.search.SearchHit;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/** Google Programmable Search (Custom Search JSON API) adapter. */
@Component
public class GoogleSearchProvider extends AbstractWebClientSearchProvider {

  // Custom Search returns at most 10 items per request
  private static final int MAX_PAGE_SIZE = 10;

  public GoogleSearchProvider(ResearchConfig researchConfig) {
    super(researchConfig, "https://www.googleapis.com");
  }

  @Override
  public String getName() {
    return "google";
  }

  @Override
  public List<SearchHit> search(String query, int maxResults, Duration timeout) {
    if (settings.getCx() == null || settings.getCx().isBlank()) {
      throw new SearchProviderException(getName(), "missing search engine id (cx)");
    }
    return super.search(query, maxResults, timeout);
  }

  @Override
  protected Mono<JsonNode> fetch(String query, int maxResults) {
    return webClient
        .get()
        .uri(
            uriBuilder ->
                uriBuilder
                    .path("/customsearch/v1")
                    .queryParam("key", settings.getApiKey())
                    .queryParam("cx", settings.getCx())
                    .queryParam("q", query)
                    .queryParam("num", Math.min(maxResults, MAX_PAGE_SIZE))
                    .build())
        .retrieve()
        .bodyToMono(JsonNode.class);
  }

  @Override
  protected List<SearchHit> parseHits(JsonNode body) {
    List<SearchHit> hits = new ArrayList<>();
    for (JsonNode item : body.path("items")) {
      hits.add(new SearchHit(text(item, "link"), text(item, "title"), text(item, "snippet")));
    }
    return hits;
  }
}
