package com.flamingo.ai.papersearch.store.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.mapping.DynamicMapping;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.DeleteByQueryRequest;
import co.elastic.clients.elasticsearch.core.DeleteByQueryResponse;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.bulk.BulkResponseItem;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.elasticsearch.indices.ElasticsearchIndicesClient;
import com.flamingo.ai.papersearch.exception.SearchException;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Base class for stores kept in a single Elasticsearch index.
 *
 * <p>Subclasses supply the schema, the source conversion and the criteria query. This class owns
 * the index lifecycle and the raw operations, and turns every transport failure into a {@link
 * SearchException}.
 *
 * <p>An existing index is checked against the schema on startup. Elasticsearch cannot change the
 * type of a mapped field, so a mismatch stops startup instead of silently degrading search.
 *
 * @param <T> the entity stored in the index
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

  /** Field name to mapping for every field the store reads or filters on. */
  protected abstract Map<String, Property> defineIndexProperties();

  protected abstract Map<String, Object> convertToDocument(T entity);

  protected abstract T convertFromDocument(Map<String, Object> source);

  protected abstract String getDocumentId(T entity);

  /**
   * Builds a filter query from exact-match criteria.
   *
   * @param criteria field/value pairs that must all match; empty matches everything
   */
  protected abstract Query buildCriteriaQuery(Map<String, Object> criteria);

  /** Prefix of the counters this store reports, e.g. {@code chunk_store}. */
  protected abstract String getMetricPrefix();

  /** Refresh interval the index is created with; {@code "-1"} leaves refresh to the caller. */
  protected String getRefreshInterval() {
    return "1s";
  }

  /**
   * Compares one mapped field against the schema. The default checks the field kind only.
   *
   * @return a description of the problem, or empty when the field is usable
   */
  protected Optional<String> checkField(String field, Property expected, Property actual) {
    if (expected._kind() != actual._kind()) {
      return Optional.of(
          String.format(
              "field '%s' is mapped as %s, expected %s", field, actual._kind(), expected._kind()));
    }
    return Optional.empty();
  }

  @Override
  public void initIndex() {
    ElasticsearchIndicesClient indices = elasticsearchClient.indices();
    try {
      if (indices.exists(e -> e.index(getIndexName())).value()) {
        verifyMapping(indices);
        log.info("Using existing Elasticsearch index '{}'", getIndexName());
        return;
      }
      Map<String, Property> properties = defineIndexProperties();
      indices.create(
          c ->
              c.index(getIndexName())
                  .settings(s -> s.refreshInterval(t -> t.time(getRefreshInterval())))
                  .mappings(m -> m.dynamic(DynamicMapping.False).properties(properties)));
      log.info(
          "Created Elasticsearch index '{}' (refresh interval {})",
          getIndexName(),
          getRefreshInterval());
    } catch (IOException e) {
      throw new IllegalStateException(
          "Could not initialize Elasticsearch index '" + getIndexName() + "'", e);
    }
  }

  private void verifyMapping(ElasticsearchIndicesClient indices) throws IOException {
    var mapping = indices.getMapping(g -> g.index(getIndexName())).get(getIndexName());
    if (mapping == null) {
      return;
    }
    Map<String, Property> actual = mapping.mappings().properties();
    List<String> problems = new ArrayList<>();
    defineIndexProperties()
        .forEach(
            (field, expected) -> {
              Property found = actual.get(field);
              if (found == null) {
                problems.add(String.format("field '%s' is not mapped", field));
              } else {
                checkField(field, expected, found).ifPresent(problems::add);
              }
            });
    if (!problems.isEmpty()) {
      throw new IllegalStateException(
          "Index '"
              + getIndexName()
              + "' does not match the expected schema ("
              + String.join("; ", problems)
              + "). Delete the index and re-ingest the documents.");
    }
  }

  @Override
  @Timed(value = "elasticsearch.index", description = "Time to bulk index entities")
  public void indexDocuments(List<T> entities) {
    if (entities.isEmpty()) {
      return;
    }
    BulkRequest.Builder bulk = new BulkRequest.Builder();
    for (T entity : entities) {
      String id = getDocumentId(entity);
      Map<String, Object> source = convertToDocument(entity);
      bulk.operations(op -> op.index(i -> i.index(getIndexName()).id(id).document(source)));
    }

    BulkResponse response;
    try {
      response = elasticsearchClient.bulk(bulk.build());
    } catch (IOException e) {
      throw new SearchException("Bulk indexing into " + getIndexName() + " failed", e);
    }
    if (response.errors()) {
      List<String> failedIds =
          response.items().stream()
              .filter(item -> item.error() != null)
              .map(BulkResponseItem::id)
              .toList();
      meterRegistry.counter(getMetricPrefix() + ".index.errors").increment();
      log.error(
          "Bulk indexing into {} rejected {} of {} entries: {}",
          getIndexName(),
          failedIds.size(),
          entities.size(),
          failedIds);
      throw new SearchException("Bulk indexing into " + getIndexName() + " reported errors");
    }
    meterRegistry.counter(getMetricPrefix() + ".indexed").increment(entities.size());
    log.debug("Bulk indexed {} entries into {}", entities.size(), getIndexName());
  }

  @Override
  @Timed(value = "elasticsearch.delete_by", description = "Time to delete entities by criteria")
  public long deleteBy(Map<String, Object> criteria) {
    Query query = buildCriteriaQuery(criteria);
    DeleteByQueryRequest request =
        DeleteByQueryRequest.of(d -> d.index(getIndexName()).query(query));
    DeleteByQueryResponse response;
    try {
      response = elasticsearchClient.deleteByQuery(request);
    } catch (IOException e) {
      throw new SearchException("Delete from " + getIndexName() + " failed", e);
    }
    long deleted = response.deleted() != null ? response.deleted() : 0L;
    meterRegistry.counter(getMetricPrefix() + ".deleted").increment(deleted);
    log.debug("Deleted {} entries from {} matching {}", deleted, getIndexName(), criteria);
    return deleted;
  }

  @Override
  public long count(Map<String, Object> criteria) {
    Query query = buildCriteriaQuery(criteria);
    try {
      return elasticsearchClient.count(c -> c.index(getIndexName()).query(query)).count();
    } catch (IOException e) {
      throw new SearchException("Count on " + getIndexName() + " failed", e);
    }
  }

  @Override
  public void refresh() {
    try {
      elasticsearchClient.indices().refresh(r -> r.index(getIndexName()));
    } catch (IOException e) {
      throw new SearchException("Refresh of " + getIndexName() + " failed", e);
    }
  }

  /** Runs a search and returns the raw hits in ranking order. */
  @SuppressWarnings("rawtypes")
  protected List<Hit<Map>> executeSearch(SearchRequest request) {
    try {
      SearchResponse<Map> response = elasticsearchClient.search(request, Map.class);
      meterRegistry.counter(getMetricPrefix() + ".queries").increment();
      return response.hits().hits();
    } catch (IOException e) {
      log.error("Search on {} failed: {}", getIndexName(), e.getMessage());
      throw new SearchException("Search on " + getIndexName() + " failed", e);
    }
  }

  /**
   * Converts a hit back into an entity.
   *
   * @return the entity, or null for a hit without source
   */
  @SuppressWarnings({"rawtypes", "unchecked"})
  protected T toEntity(Hit<Map> hit) {
    Map<String, Object> source = hit.source();
    return source == null ? null : convertFromDocument(source);
  }
}
