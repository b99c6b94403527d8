package com.flamingo.ai.deepresearch.search.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.flamingo.ai.deepresearch.config.ResearchConfig;
import com.flamingo.ai.deepresearch.search.SearchHit;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/** Bing Web Search v7 adapter. */
@Component
public class BingSearchProvider extends AbstractWebClientSearchProvider {

  public BingSearchProvider(ResearchConfig researchConfig) {
    super(researchConfig, "https://api.bing.microsoft.com");
  }

  @Override
  public String getName() {
    return "bing";
  }

  @Override
  protected Mono<JsonNode> fetch(String query, int maxResults) {
    return webClient
        .get()
        .uri(
            uriBuilder ->
                uriBuilder
                    .path("/v7.0/search")
                    .queryParam("q", query)
                    .queryParam("count", maxResults)
                    .queryParam("responseFilter", "Webpages")
                    .build())
        .header("Ocp-Apim-Subscription-Key", settings.getApiKey())
        .retrieve()
        .bodyToMono(JsonNode.class);
  }

  @Override
  protected List<SearchHit> parseHits(JsonNode body) {
    List<SearchHit> hits = new ArrayList<>();
    for (JsonNode page : body.path("webPages").path("value")) {
      hits.add(new SearchHit(text(page, "url"), text(page, "name"), text(page, "snippet")));
    }
    return hits;
  }
}
