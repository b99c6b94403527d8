package com.flamingo.ai.deepresearch.search.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.deepresearch.config.ResearchConfig;
import com.flamingo.ai.deepresearch.exception.SearchProviderException;
import com.flamingo.ai.deepresearch.search.SearchHit;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Search provider adapter Tests")
class SearchProviderParsingTest {

  private final ObjectMapper objectMapper = new ObjectMapper();
  private ResearchConfig researchConfig;

  @BeforeEach
  void setUp() {
    researchConfig = new ResearchConfig();
  }

  @Nested
  @DisplayName("Response parsing")
  class Parsing {

    @Test
    @DisplayName("Tavily results map url, title and content")
    void shouldParseTavily() throws Exception {
      JsonNode body =
          objectMapper.readTree(
              """
              {"results": [
                {"url": "https://ibm.com/qc", "title": "What is QC", "content": "Qubits..."}
              ]}
              """);

      List<SearchHit> hits = new TavilySearchProvider(researchConfig).parseHits(body);

      assertThat(hits)
          .containsExactly(new SearchHit("https://ibm.com/qc", "What is QC", "Qubits..."));
    }

    @Test
    @DisplayName("Brave web results map url, title and description")
    void shouldParseBrave() throws Exception {
      JsonNode body =
          objectMapper.readTree(
              """
              {"web": {"results": [
                {"url": "https://a.example", "title": "A", "description": "alpha"}
              ]}}
              """);

      List<SearchHit> hits = new BraveSearchProvider(researchConfig).parseHits(body);

      assertThat(hits).containsExactly(new SearchHit("https://a.example", "A", "alpha"));
    }

    @Test
    @DisplayName("Google items map link, title and snippet")
    void shouldParseGoogle() throws Exception {
      JsonNode body =
          objectMapper.readTree(
              """
              {"items": [{"link": "https://g.example", "title": "G", "snippet": "gamma"}]}
              """);

      List<SearchHit> hits = new GoogleSearchProvider(researchConfig).parseHits(body);

      assertThat(hits).containsExactly(new SearchHit("https://g.example", "G", "gamma"));
    }

    @Test
    @DisplayName("Bing web pages map url, name and snippet")
    void shouldParseBing() throws Exception {
      JsonNode body =
          objectMapper.readTree(
              """
              {"webPages": {"value": [
                {"url": "https://b.example", "name": "B", "snippet": "beta"}
              ]}}
              """);

      List<SearchHit> hits = new BingSearchProvider(researchConfig).parseHits(body);

      assertThat(hits).containsExactly(new SearchHit("https://b.example", "B", "beta"));
    }

    @Test
    @DisplayName("DuckDuckGo combines the abstract with nested related topics")
    void shouldParseDuckDuckGo() throws Exception {
      JsonNode body =
          objectMapper.readTree(
              """
              {
                "Heading": "Quantum computing",
                "AbstractURL": "https://en.wikipedia.org/wiki/Quantum_computing",
                "AbstractText": "A quantum computer exploits quantum mechanics.",
                "RelatedTopics": [
                  {"FirstURL": "https://duckduckgo.com/Qubit", "Text": "Qubit - unit of info"},
                  {"Name": "See also", "Topics": [
                    {"FirstURL": "https://duckduckgo.com/Shor", "Text": "Shor's algorithm"}
                  ]}
                ]
              }
              """);

      List<SearchHit> hits = new DuckDuckGoSearchProvider(researchConfig).parseHits(body);

      assertThat(hits)
          .extracting(SearchHit::url)
          .containsExactly(
              "https://en.wikipedia.org/wiki/Quantum_computing",
              "https://duckduckgo.com/Qubit",
              "https://duckduckgo.com/Shor");
      assertThat(hits.get(1).title()).isEqualTo("Qubit");
      assertThat(hits.get(2).title()).isEqualTo("Shor's algorithm");
    }
  }

  @Nested
  @DisplayName("Failure reporting")
  class Failures {

    @Test
    @DisplayName("Should fail fast without an api key")
    void shouldRequireApiKey() {
      TavilySearchProvider provider = new TavilySearchProvider(researchConfig);

      assertThatThrownBy(() -> provider.search("q", 5, Duration.ofSeconds(1)))
          .isInstanceOf(SearchProviderException.class)
          .hasMessageContaining("missing api key");
    }

    @Test
    @DisplayName("Google should require a search engine id")
    void shouldRequireGoogleCx() {
      researchConfig.getSearch().provider("google").setApiKey("key");
      GoogleSearchProvider provider = new GoogleSearchProvider(researchConfig);

      assertThatThrownBy(() -> provider.search("q", 5, Duration.ofSeconds(1)))
          .isInstanceOf(SearchProviderException.class)
          .hasMessageContaining("cx");
    }

    @Test
    @DisplayName("Should wrap connection errors in a provider exception")
    void shouldWrapConnectionErrors() {
      researchConfig.getSearch().provider("brave").setApiKey("key");
      researchConfig.getSearch().provider("brave").setBaseUrl("http://127.0.0.1:1");
      BraveSearchProvider provider = new BraveSearchProvider(researchConfig);

      assertThatThrownBy(() -> provider.search("q", 5, Duration.ofSeconds(2)))
          .isInstanceOfSatisfying(
              SearchProviderException.class,
              e -> assertThat(e.getProvider()).isEqualTo("brave"));
    }
  }

  @Test
  @DisplayName("Cited snippet should end with a markdown link")
  void shouldFormatCitedSnippet() {
    SearchHit hit = new SearchHit("https://a.example", "Title", " Body text ");

    assertThat(hit.toCitedSnippet()).isEqualTo("Body text [Title](https://a.example)");
    assertThat(new SearchHit("https://a.example", "", "").toCitedSnippet())
        .isEqualTo("[https://a.example](https://a.example)");
  }
}
