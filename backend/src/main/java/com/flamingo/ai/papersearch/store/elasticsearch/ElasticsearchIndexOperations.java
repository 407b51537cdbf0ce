package com.flamingo.ai.papersearch.store.elasticsearch;

import java.util.List;
import java.util.Map;

/**
 * Raw operations on one Elasticsearch index.
 *
 * <p>Criteria are exact-match field/value pairs. Writes only become searchable once the index is
 * refreshed, either by its refresh interval or by {@link #refresh()}.
 *
 * @param <T> the entity stored in the index
 * @param <ID> the type of the index document id
 */
public interface ElasticsearchIndexOperations<T, ID> {

  /** Creates the index if it is missing, otherwise checks its mapping. */
  void initIndex();

  /** Indexes the entities in one bulk request, replacing documents with the same id. */
  void indexDocuments(List<T> entities);

  /**
   * Deletes every document matching the criteria.
   *
   * @return the number of deleted documents
   */
  long deleteBy(Map<String, Object> criteria);

  long count(Map<String, Object> criteria);

  /** Makes all completed writes visible to search. */
  void refresh();

  String getIndexName();
}
