package com.flamingo.ai.deepresearch.search.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.flamingo.ai.deepresearch.config.ResearchConfig;
import com.flamingo.ai.deepresearch.search.SearchHit;
import java.util.ArrayList;
import java.util.List;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/** Brave web search API adapter. */
@Component
public class BraveSearchProvider extends AbstractWebClientSearchProvider {

  public BraveSearchProvider(ResearchConfig researchConfig) {
    super(researchConfig, "https://api.search.brave.com");
  }

  @Override
  public String getName() {
    return "brave";
  }

  @Override
  protected Mono<JsonNode> fetch(String query, int maxResults) {
    return webClient
        .get()
        .uri(
            uriBuilder ->
                uriBuilder
                    .path("/res/v1/web/search")
                    .queryParam("q", query)
                    .queryParam("count", Math.min(maxResults, 20))
                    .build())
        .accept(MediaType.APPLICATION_JSON)
        .header("X-Subscription-Token", settings.getApiKey())
        .retrieve()
        .bodyToMono(JsonNode.class);
  }

  @Override
  protected List<SearchHit> parseHits(JsonNode body) {
    List<SearchHit> hits = new ArrayList<>();
    for (JsonNode result : body.path("web").path("results")) {
      hits.add(
          new SearchHit(text(result, "url"), text(result, "title"), text(result, "description")));
    }
    return hits;
  }
}
