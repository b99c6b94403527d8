package com.flamingo.ai.deepresearch.search.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.deepresearch.config.ResearchConfig;
import com.flamingo.ai.deepresearch.search.SearchHit;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * DuckDuckGo Instant Answer adapter. Needs no key; returns the abstract plus related topics, so it
 * is the usual last entry in the priority list.
 */
@Component
public class DuckDuckGoSearchProvider extends AbstractWebClientSearchProvider {

  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  public DuckDuckGoSearchProvider(ResearchConfig researchConfig) {
    super(researchConfig, "https://api.duckduckgo.com");
  }

  @Override
  public String getName() {
    return "duckduckgo";
  }

  @Override
  protected boolean requiresApiKey() {
    return false;
  }

  @Override
  protected Mono<JsonNode> fetch(String query, int maxResults) {
    return webClient
        .get()
        .uri(
            uriBuilder ->
                uriBuilder
                    .path("/")
                    .queryParam("q", query)
                    .queryParam("format", "json")
                    .queryParam("no_html", 1)
                    .queryParam("skip_disambig", 1)
                    .build())
        .retrieve()
        // the API answers with application/x-javascript
        .bodyToMono(String.class)
        .map(this::readTree);
  }

  @Override
  protected List<SearchHit> parseHits(JsonNode body) {
    List<SearchHit> hits = new ArrayList<>();
    String abstractUrl = text(body, "AbstractURL");
    if (!abstractUrl.isBlank()) {
      hits.add(new SearchHit(abstractUrl, text(body, "Heading"), text(body, "AbstractText")));
    }
    collectTopics(body.path("RelatedTopics"), hits);
    return hits;
  }

  private void collectTopics(JsonNode topics, List<SearchHit> hits) {
    for (JsonNode topic : topics) {
      if (topic.has("Topics")) {
        collectTopics(topic.path("Topics"), hits);
        continue;
      }
      String url = text(topic, "FirstURL");
      String description = text(topic, "Text");
      String title =
          description.contains(" - ")
              ? description.substring(0, description.indexOf(" - "))
              : description;
      hits.add(new SearchHit(url, title, description));
    }
  }

  private JsonNode readTree(String raw) {
    try {
      return OBJECT_MAPPER.readTree(raw);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Invalid DuckDuckGo response: " + e.getOriginalMessage(), e);
    }
  }
}
