package com.avaolo.ai.knowledge.elasticsearch;

import java.util.List;
import java.util.Map;

/**
 * Generic operations on a vector-enabled Elasticsearch index.
 *
 * @param <T> the document type stored in the index
 */
public interface ElasticsearchIndexOperations<T> {

  /** Creates the index, or reconciles the mapping of an existing one. */
  void initIndex();

  /**
   * Upserts documents by id in a single bulk request.
   *
   * @param documents the documents to index
   */
  void indexDocuments(List<T> documents);

  /**
   * Performs kNN similarity search restricted by the filter criteria.
   *
   * @param filterCriteria field/value pairs that every hit must match
   * @param queryEmbedding the query vector
   * @param topK number of results to return
   * @return matching documents ordered by similarity
   */
  List<T> vectorSearch(Map<String, Object> filterCriteria, List<Float> queryEmbedding, int topK);

  /**
   * Performs BM25 search restricted by the filter criteria.
   *
   * @param filterCriteria field/value pairs that every hit must match
   * @param query the search query text
   * @param topK number of results to return
   * @return matching documents ordered by relevance
   */
  List<T> keywordSearch(Map<String, Object> filterCriteria, String query, int topK);

  /**
   * Deletes documents matching the given criteria.
   *
   * @param criteria field/value pairs selecting the documents to delete
   */
  void deleteBy(Map<String, Object> criteria);

  /** Number of documents currently in the index. */
  long count();

  /** Makes recent writes visible to search. */
  void refresh();

  String getIndexName();
}
