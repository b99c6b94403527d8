package com.flamingo.ai.deepresearch.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.mapping.DynamicMapping;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.bulk.BulkResponseItem;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.elasticsearch.indices.CreateIndexRequest;
import co.elastic.clients.elasticsearch.indices.PutMappingRequest;
import com.flamingo.ai.deepresearch.exception.IndexWriteException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Abstract base class for Elasticsearch index services.
 *
 * <p>Provides bulk indexing, partial updates, deletion and vector search for documents carrying an
 * embedding. Subclasses define the schema and the conversion logic. Write operations report
 * per-document failures instead of swallowing them.
 *
 * @param <T> the document type stored in the index
 */
@Slf4j
public abstract class AbstractElasticsearchIndexService<T>
    implements ElasticsearchIndexOperations<T, String> {

  protected final ElasticsearchClient elasticsearchClient;
  protected final MeterRegistry meterRegistry;

  protected AbstractElasticsearchIndexService(
      ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry) {
    this.elasticsearchClient = elasticsearchClient;
    this.meterRegistry = meterRegistry;
  }

  @Override
  public abstract String getIndexName();

  /**
   * Returns the vector embedding dimensions.
   *
   * @return the vector dimensions (e.g., 1536 for text-embedding-3-small)
   */
  protected abstract int getVectorDimensions();

  /**
   * Defines the index properties (schema) for this document type.
   *
   * @return a map of field names to Elasticsearch property definitions
   */
  protected abstract Map<String, Property> defineIndexProperties();

  protected abstract Map<String, Object> convertToDocument(T entity);

  protected abstract T convertFromDocument(Map<String, Object> source);

  protected abstract String getDocumentId(T entity);

  /**
   * Builds the vector search request with filters.
   *
   * @param filterCriteria the filter criteria
   * @param queryEmbedding the query embedding
   * @param topK the number of results
   * @return the search request
   */
  protected abstract SearchRequest buildVectorSearchRequest(
      Map<String, Object> filterCriteria, List<Float> queryEmbedding, int topK);

  /**
   * Returns the metric prefix for this index (e.g., "evidence_chunk").
   *
   * @return the metric prefix
   */
  protected abstract String getMetricPrefix();

  @PostConstruct
  @Override
  public void initIndex() {
    try {
      var indices = elasticsearchClient.indices();
      if (indices == null) {
        log.warn(
            "Elasticsearch client not available, skipping index initialization for {}",
            getIndexName());
        return;
      }
      boolean exists = indices.exists(e -> e.index(getIndexName())).value();
      if (!exists) {
        createIndex();
        log.info("Created Elasticsearch index: {}", getIndexName());
      } else {
        addMissingMappings();
      }
    } catch (Exception e) {
      // The durable store is optional at startup; writes fail per call until it is reachable.
      log.error(
          "Failed to initialize Elasticsearch index '{}': {}", getIndexName(), e.getMessage());
      meterRegistry.counter(getMetricPrefix() + ".init.errors").increment();
    }
  }

  private void createIndex() throws IOException {
    Map<String, Property> properties = defineIndexProperties();
    CreateIndexRequest request =
        CreateIndexRequest.of(
            c ->
                c.index(getIndexName())
                    .mappings(m -> m.dynamic(DynamicMapping.False).properties(properties)));
    elasticsearchClient.indices().create(request);
  }

  /** Adds fields declared by the subclass but missing from an existing index. */
  private void addMissingMappings() throws IOException {
    Map<String, Property> expectedProperties = defineIndexProperties();
    var response = elasticsearchClient.indices().getMapping(g -> g.index(getIndexName()));
    var indexMapping = response.get(getIndexName());
    if (indexMapping == null) {
      return;
    }
    Map<String, Property> actualProperties = indexMapping.mappings().properties();

    Map<String, Property> missingFields = new HashMap<>();
    for (Map.Entry<String, Property> entry : expectedProperties.entrySet()) {
      Property actual = actualProperties.get(entry.getKey());
      if (actual == null) {
        missingFields.put(entry.getKey(), entry.getValue());
      } else if (actual._kind() != entry.getValue()._kind()) {
        throw new IllegalStateException(
            String.format(
                "Mapping mismatch in index '%s': field '%s' expected type '%s' but found '%s'",
                getIndexName(), entry.getKey(), entry.getValue()._kind(), actual._kind()));
      }
    }

    if (!missingFields.isEmpty()) {
      PutMappingRequest putRequest =
          PutMappingRequest.of(p -> p.index(getIndexName()).properties(missingFields));
      elasticsearchClient.indices().putMapping(putRequest);
      log.info("Added {} new field(s) to index '{}'", missingFields.size(), getIndexName());
    }
  }

  @Override
  @Timed(value = "elasticsearch.index", description = "Time to index documents")
  public Map<String, String> indexDocuments(List<T> documents) {
    if (documents.isEmpty()) {
      return Map.of();
    }

    BulkRequest.Builder bulkBuilder = new BulkRequest.Builder();
    for (T document : documents) {
      String id = getDocumentId(document);
      Map<String, Object> docMap = convertToDocument(document);
      bulkBuilder.operations(
          op -> op.index(idx -> idx.index(getIndexName()).id(id).document(docMap)));
    }
    Map<String, String> rejected = executeBulk(bulkBuilder.build(), "index");
    meterRegistry
        .counter(getMetricPrefix() + ".indexed")
        .increment(documents.size() - rejected.size());
    return rejected;
  }

  @Override
  @Timed(value = "elasticsearch.update", description = "Time to update documents")
  public Map<String, String> updateDocuments(
      Collection<String> ids, Map<String, Object> partialDocument) {
    if (ids.isEmpty()) {
      return Map.of();
    }

    BulkRequest.Builder bulkBuilder = new BulkRequest.Builder();
    for (String id : ids) {
      bulkBuilder.operations(
          op ->
              op.update(
                  u -> u.index(getIndexName()).id(id).action(a -> a.doc(partialDocument))));
    }
    Map<String, String> rejected = executeBulk(bulkBuilder.build(), "update");
    // Updating a missing document is reported as 404; the caller only cares about existing ones.
    rejected.values().removeIf(reason -> reason.startsWith("404"));
    return rejected;
  }

  @Override
  @Timed(value = "elasticsearch.delete", description = "Time to delete documents")
  public Map<String, String> deleteDocuments(Collection<String> ids) {
    if (ids.isEmpty()) {
      return Map.of();
    }

    BulkRequest.Builder bulkBuilder = new BulkRequest.Builder();
    for (String id : ids) {
      bulkBuilder.operations(op -> op.delete(d -> d.index(getIndexName()).id(id)));
    }
    Map<String, String> rejected = executeBulk(bulkBuilder.build(), "delete");
    rejected.values().removeIf(reason -> reason.startsWith("404"));
    meterRegistry.counter(getMetricPrefix() + ".deleted").increment(ids.size() - rejected.size());
    return rejected;
  }

  private Map<String, String> executeBulk(BulkRequest request, String operation) {
    BulkResponse response;
    try {
      response = elasticsearchClient.bulk(request);
    } catch (IOException e) {
      log.error("Bulk {} failed for {}: {}", operation, getIndexName(), e.getMessage());
      meterRegistry.counter(getMetricPrefix() + "." + operation + ".errors").increment();
      throw new IndexWriteException(
          "elasticsearch", "Bulk " + operation + " failed: " + e.getMessage(), e);
    }

    Map<String, String> rejected = new LinkedHashMap<>();
    if (response.errors()) {
      for (BulkResponseItem item : response.items()) {
        if (item.error() != null) {
          rejected.put(item.id(), item.status() + " " + item.error().reason());
        }
      }
      log.warn("{} documents failed bulk {} in {}", rejected.size(), operation, getIndexName());
      meterRegistry.counter(getMetricPrefix() + "." + operation + ".errors").increment();
    } else {
      log.debug(
          "Bulk {} of {} documents in {}", operation, response.items().size(), getIndexName());
    }
    return rejected;
  }

  @Override
  @Timed(value = "elasticsearch.vector_search", description = "Time for vector search")
  @CircuitBreaker(name = "elasticsearch", fallbackMethod = "vectorSearchFallback")
  public List<T> vectorSearch(
      Map<String, Object> filterCriteria, List<Float> queryEmbedding, int topK) {
    try {
      SearchRequest request = buildVectorSearchRequest(filterCriteria, queryEmbedding, topK);
      SearchResponse<Map> response = elasticsearchClient.search(request, Map.class);
      List<T> results = mapHitsToDocuments(response.hits().hits());
      log.debug(
          "[vectorSearch] index={} filter={} returned={}",
          getIndexName(),
          filterCriteria,
          results.size());
      meterRegistry.counter(getMetricPrefix() + ".vector_search").increment();
      return results;
    } catch (IOException e) {
      log.error("Vector search failed for {}: {}", getIndexName(), e.getMessage(), e);
      throw new RuntimeException("Vector search failed", e);
    }
  }

  @SuppressWarnings("unused")
  private List<T> vectorSearchFallback(
      Map<String, Object> filterCriteria, List<Float> queryEmbedding, int topK, Throwable t) {
    log.warn("{} vector search fallback triggered: {}", getIndexName(), t.getMessage());
    meterRegistry.counter(getMetricPrefix() + ".vector_search.fallback").increment();
    return List.of();
  }

  /**
   * Runs a search request and converts every hit.
   *
   * @param request the search request
   * @return the converted documents
   */
  protected List<T> searchDocuments(SearchRequest request) {
    try {
      SearchResponse<Map> response = elasticsearchClient.search(request, Map.class);
      return mapHitsToDocuments(response.hits().hits());
    } catch (IOException e) {
      log.error("Search failed for {}: {}", getIndexName(), e.getMessage(), e);
      throw new RuntimeException("Search failed", e);
    }
  }

  @Override
  public void refresh() {
    try {
      elasticsearchClient.indices().refresh(r -> r.index(getIndexName()));
      log.debug("Refreshed index: {}", getIndexName());
    } catch (IOException e) {
      log.warn("Failed to refresh index {}: {}", getIndexName(), e.getMessage());
    }
  }

  @SuppressWarnings("unchecked")
  private List<T> mapHitsToDocuments(List<Hit<Map>> hits) {
    List<T> documents = new ArrayList<>();
    for (Hit<Map> hit : hits) {
      Map<String, Object> source = hit.source();
      if (source != null) {
        // Elasticsearch _id is metadata and not included in _source.
        source.put("id", hit.id());
        T document = convertFromDocument(source);
        if (document instanceof ScoredDocument scored && hit.score() != null) {
          scored.setRelevanceScore(hit.score());
        }
        documents.add(document);
      }
    }
    return documents;
  }

  /** Marker interface for documents that support relevance scoring. */
  public interface ScoredDocument {
    void setRelevanceScore(Double score);
  }
}
