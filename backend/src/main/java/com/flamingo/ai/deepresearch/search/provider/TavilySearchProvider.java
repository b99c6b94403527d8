package com.flamingo.ai.deepresearch.search.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.flamingo.ai.deepresearch.config.ResearchConfig;
import com.flamingo.ai.deepresearch.search.SearchHit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/** Tavily search API adapter. */
@Component
public class TavilySearchProvider extends AbstractWebClientSearchProvider {

  public TavilySearchProvider(ResearchConfig researchConfig) {
    super(researchConfig, "https://api.tavily.com");
  }

  @Override
  public String getName() {
    return "tavily";
  }

  @Override
  protected Mono<JsonNode> fetch(String query, int maxResults) {
    return webClient
        .post()
        .uri("/search")
        .contentType(MediaType.APPLICATION_JSON)
        .headers(headers -> headers.setBearerAuth(settings.getApiKey()))
        .bodyValue(Map.of("query", query, "max_results", maxResults, "search_depth", "basic"))
        .retrieve()
        .bodyToMono(JsonNode.class);
  }

  @Override
  protected List<SearchHit> parseHits(JsonNode body) {
    List<SearchHit> hits = new ArrayList<>();
    for (JsonNode result : body.path("results")) {
      hits.add(new SearchHit(text(result, "url"), text(result, "title"), text(result, "content")));
    }
    return hits;
  }
}
