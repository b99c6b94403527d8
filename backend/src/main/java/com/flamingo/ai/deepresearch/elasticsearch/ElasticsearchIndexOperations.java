package com.flamingo.ai.deepresearch.elasticsearch;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Generic interface for Elasticsearch index operations.
 *
 * @param <T> the document type stored in the index
 * @param <ID> the document ID type
 */
public interface ElasticsearchIndexOperations<T, ID> {

  /**
   * Initializes the index with appropriate mappings.
   *
   * <p>Creates the index if it doesn't exist, using the schema defined by the implementation.
   */
  void initIndex();

  /**
   * Indexes multiple documents in bulk.
   *
   * @param documents the documents to index
   * @return ids of rejected documents mapped to the rejection reason
   */
  Map<ID, String> indexDocuments(List<T> documents);

  /**
   * Performs vector similarity search with filters.
   *
   * @param filterCriteria key-value pairs for exact-match filtering
   * @param queryEmbedding the query vector
   * @param topK number of results to return
   * @return list of matching documents ordered by similarity
   */
  List<T> vectorSearch(Map<String, Object> filterCriteria, List<Float> queryEmbedding, int topK);

  /**
   * Applies the same partial update to each document.
   *
   * @param ids the document ids
   * @param partialDocument the fields to overwrite
   * @return ids of documents that could not be updated mapped to the reason
   */
  Map<ID, String> updateDocuments(Collection<ID> ids, Map<String, Object> partialDocument);

  /**
   * Deletes documents by id. Missing ids are not errors.
   *
   * @param ids the document ids
   * @return ids of documents that could not be deleted mapped to the reason
   */
  Map<ID, String> deleteDocuments(Collection<ID> ids);

  /**
   * Refreshes the index to make recent changes visible for search.
   *
   * <p>Useful after bulk indexing operations to ensure documents are immediately searchable.
   */
  void refresh();

  /**
   * Gets the name of the Elasticsearch index.
   *
   * @return the index name
   */
  String getIndexName();
}
