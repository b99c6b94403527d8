package com.flamingo.ai.deepresearch.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.FieldValue;
import co.elastic.clients.elasticsearch._types.SortOrder;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorProperty;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorSimilarity;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.mapping.TextProperty;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Elasticsearch index service for evidence chunks.
 *
 * <p>Holds the durable copy of every ingested chunk. Vector search always filters out inactive
 * chunks; callers may add exact-match filters on {@code subgoalId} and {@code sourceUrl}.
 */
@Service
@Slf4j
public class EvidenceChunkIndexService
    extends AbstractElasticsearchIndexService<EvidenceChunkDocument> {

  public static final String FIELD_SUBGOAL_ID = "subgoalId";
  public static final String FIELD_SOURCE_URL = "sourceUrl";
  public static final String FIELD_ACTIVE = "active";
  public static final String FIELD_CHUNK_ID = "chunkId";

  @Value("${app.elasticsearch.index-name:deepresearch-evidence}")
  private String indexName;

  @Value("${app.elasticsearch.vector-dimensions:1536}")
  private int vectorDimensions;

  @Autowired
  public EvidenceChunkIndexService(
      ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry) {
    super(elasticsearchClient, meterRegistry);
  }

  /** Constructor for testing - allows setting index name and vector dimensions. */
  @VisibleForTesting
  public EvidenceChunkIndexService(
      ElasticsearchClient elasticsearchClient,
      MeterRegistry meterRegistry,
      String indexName,
      int vectorDimensions) {
    super(elasticsearchClient, meterRegistry);
    this.indexName = indexName;
    this.vectorDimensions = vectorDimensions;
  }

  @Override
  public String getIndexName() {
    return indexName;
  }

  @Override
  protected int getVectorDimensions() {
    return vectorDimensions;
  }

  @Override
  protected String getMetricPrefix() {
    return "evidence_chunk";
  }

  @Override
  protected Map<String, Property> defineIndexProperties() {
    Map<String, Property> properties = new HashMap<>();
    // Filter fields must be keyword for exact matching
    properties.put(FIELD_CHUNK_ID, Property.of(p -> p.keyword(k -> k)));
    properties.put(FIELD_SUBGOAL_ID, Property.of(p -> p.keyword(k -> k)));
    properties.put(FIELD_SOURCE_URL, Property.of(p -> p.keyword(k -> k)));
    properties.put("title", Property.of(p -> p.text(TextProperty.of(t -> t))));
    properties.put("text", Property.of(p -> p.text(TextProperty.of(t -> t))));
    properties.put(FIELD_ACTIVE, Property.of(p -> p.boolean_(b -> b)));
    properties.put("createdAt", Property.of(p -> p.date(d -> d)));
    properties.put(
        "embedding",
        Property.of(
            p ->
                p.denseVector(
                    DenseVectorProperty.of(
                        d ->
                            d.dims(vectorDimensions)
                                .index(true)
                                .similarity(DenseVectorSimilarity.Cosine)))));
    return properties;
  }

  @Override
  protected Map<String, Object> convertToDocument(EvidenceChunkDocument chunk) {
    Map<String, Object> document = new HashMap<>();
    document.put(FIELD_CHUNK_ID, chunk.getId());
    document.put(FIELD_SUBGOAL_ID, chunk.getSubgoalId());
    document.put("text", chunk.getText());
    document.put("embedding", chunk.getEmbedding());
    document.put(FIELD_ACTIVE, chunk.isActive());
    if (chunk.getSourceUrl() != null) {
      document.put(FIELD_SOURCE_URL, chunk.getSourceUrl());
    }
    if (chunk.getTitle() != null) {
      document.put("title", chunk.getTitle());
    }
    Instant createdAt = chunk.getCreatedAt() != null ? chunk.getCreatedAt() : Instant.now();
    document.put("createdAt", createdAt.toString());
    return document;
  }

  @Override
  protected EvidenceChunkDocument convertFromDocument(Map<String, Object> source) {
    EvidenceChunkDocument.EvidenceChunkDocumentBuilder builder =
        EvidenceChunkDocument.builder()
            .id((String) source.get("id"))
            .subgoalId((String) source.get(FIELD_SUBGOAL_ID))
            .sourceUrl((String) source.get(FIELD_SOURCE_URL))
            .title((String) source.get("title"))
            .text((String) source.get("text"))
            .active(!Boolean.FALSE.equals(source.get(FIELD_ACTIVE)))
            .embedding(toFloats(source.get("embedding")));
    if (source.get("createdAt") instanceof String createdAt) {
      builder.createdAt(Instant.parse(createdAt));
    }
    return builder.build();
  }

  // JSON numbers come back as Double
  private static List<Float> toFloats(Object raw) {
    if (!(raw instanceof Collection<?> values)) {
      return List.of();
    }
    List<Float> floats = new ArrayList<>(values.size());
    for (Object value : values) {
      floats.add(((Number) value).floatValue());
    }
    return floats;
  }

  @Override
  protected String getDocumentId(EvidenceChunkDocument entity) {
    return entity.getId();
  }

  @Override
  protected SearchRequest buildVectorSearchRequest(
      Map<String, Object> filterCriteria, List<Float> queryEmbedding, int topK) {
    List<Query> filters = new ArrayList<>();
    filters.add(Query.of(q -> q.term(t -> t.field(FIELD_ACTIVE).value(true))));
    for (Map.Entry<String, Object> criterion : filterCriteria.entrySet()) {
      String value = String.valueOf(criterion.getValue());
      filters.add(Query.of(q -> q.term(t -> t.field(criterion.getKey()).value(value))));
    }

    log.debug(
        "vectorSearch on {} topK={} dims={} filters={}",
        indexName,
        topK,
        queryEmbedding.size(),
        filterCriteria.keySet());

    return SearchRequest.of(
        s ->
            s.index(indexName)
                .knn(
                    k ->
                        k.field("embedding")
                            .queryVector(queryEmbedding)
                            .k(topK)
                            .numCandidates(Math.max(topK * 2, 10))
                            .filter(filters))
                .size(topK));
  }

  /**
   * Loads one page of active chunks ordered by chunk id, for rebuilding the in-memory store.
   *
   * @param pageSize maximum number of chunks in the page
   * @param searchAfter chunk id of the last chunk of the previous page, or null for the first page
   * @return active chunks with their embeddings
   */
  public List<EvidenceChunkDocument> findActivePage(int pageSize, String searchAfter) {
    SearchRequest request =
        SearchRequest.of(
            s -> {
              s.index(indexName)
                  .query(q -> q.term(t -> t.field(FIELD_ACTIVE).value(true)))
                  .sort(so -> so.field(f -> f.field(FIELD_CHUNK_ID).order(SortOrder.Asc)))
                  .size(pageSize);
              if (searchAfter != null) {
                s.searchAfter(FieldValue.of(searchAfter));
              }
              return s;
            });
    List<EvidenceChunkDocument> chunks = searchDocuments(request);
    log.debug(
        "Loaded page of {} active evidence chunks from {} after {}",
        chunks.size(),
        indexName,
        searchAfter);
    return chunks;
  }

  /**
   * Tombstones chunks so they are excluded from retrieval.
   *
   * @param chunkIds chunk ids
   * @return ids that could not be updated mapped to the reason
   */
  public Map<String, String> markInactive(Collection<String> chunkIds) {
    return updateDocuments(chunkIds, Map.of(FIELD_ACTIVE, false));
  }
}
