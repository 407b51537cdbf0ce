package com.flamingo.ai.papersearch.store.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.SortOrder;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorProperty;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorSimilarity;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.mapping.TextProperty;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.search.Hit;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.papersearch.domain.enums.ChunkType;
import com.flamingo.ai.papersearch.exception.SearchException;
import com.flamingo.ai.papersearch.store.ChunkFilter;
import com.flamingo.ai.papersearch.store.ChunkRecord;
import com.flamingo.ai.papersearch.store.ChunkStore;
import com.flamingo.ai.papersearch.store.ScoredChunk;
import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * {@link ChunkStore} backed by an Elasticsearch index with a cosine {@code dense_vector} field.
 *
 * <p>The index is created with automatic refresh disabled. A document replace deletes the old
 * chunks, bulk-indexes the new ones and then refreshes, so searchers keep seeing the old set until
 * the refresh publishes the new one. Writes are serialized within this store.
 *
 * <p>Search is exact: a {@code script_score} query over the filtered chunks computes {@code
 * cosineSimilarity + 1.0}, which is mapped back to the cosine on the way out.
 */
@Service
@ConditionalOnProperty(name = "rag.vector-store.type", havingValue = "elasticsearch")
@Slf4j
public class ElasticsearchChunkStore extends AbstractElasticsearchIndexService<ChunkRecord>
    implements ChunkStore {

  /** Largest result window Elasticsearch serves by default. */
  private static final int MAX_WINDOW = 10_000;

  private static final String COSINE_SCRIPT =
      "cosineSimilarity(params.query_vector, 'embedding') + 1.0";

  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  @Value("${elasticsearch.index-name:paper-chunks}")
  private String indexName;

  @Value("${rag.embedding.dimensions:384}")
  private int vectorDimensions;

  private final ReentrantLock writeLock = new ReentrantLock();

  @Autowired
  public ElasticsearchChunkStore(
      ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry) {
    super(elasticsearchClient, meterRegistry);
  }

  /** Constructor for testing - allows setting index name and vector dimensions. */
  @VisibleForTesting
  public ElasticsearchChunkStore(
      ElasticsearchClient elasticsearchClient,
      MeterRegistry meterRegistry,
      String indexName,
      int vectorDimensions) {
    super(elasticsearchClient, meterRegistry);
    this.indexName = indexName;
    this.vectorDimensions = vectorDimensions;
  }

  @PostConstruct
  @Override
  public void initIndex() {
    super.initIndex();
  }

  @Override
  public String getIndexName() {
    return indexName;
  }

  @Override
  protected String getRefreshInterval() {
    return "-1";
  }

  @Override
  protected Map<String, Property> defineIndexProperties() {
    Map<String, Property> properties = new HashMap<>();
    // identifiers and filter fields MUST be keyword type for exact matching
    properties.put("documentId", Property.of(p -> p.keyword(k -> k)));
    properties.put("section", Property.of(p -> p.keyword(k -> k)));
    properties.put("chunkType", Property.of(p -> p.keyword(k -> k)));
    properties.put("chunkIndex", Property.of(p -> p.integer(i -> i)));
    properties.put("pageNumber", Property.of(p -> p.integer(i -> i)));
    properties.put("content", Property.of(p -> p.text(TextProperty.of(t -> t))));
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
  protected Optional<String> checkField(String field, Property expected, Property actual) {
    if (expected.isDenseVector() && actual.isDenseVector()) {
      Integer dims = actual.denseVector().dims();
      if (dims != null && dims != vectorDimensions) {
        return Optional.of(
            String.format(
                "field '%s' holds %d-dimensional vectors but embeddings have %d",
                field, dims, vectorDimensions));
      }
    }
    return super.checkField(field, expected, actual);
  }

  @Override
  protected Map<String, Object> convertToDocument(ChunkRecord chunk) {
    Map<String, Object> document = new HashMap<>();
    document.put("documentId", chunk.getDocumentId().toString());
    document.put("chunkIndex", chunk.getOrdinal());
    document.put("content", chunk.getText());
    document.put("section", chunk.getSection());
    document.put("chunkType", chunk.getChunkType().getValue());
    if (chunk.getPageNumber() != null) {
      document.put("pageNumber", chunk.getPageNumber());
    }
    document.put("embedding", chunk.getEmbedding());
    return document;
  }

  @Override
  @SuppressWarnings("unchecked")
  protected ChunkRecord convertFromDocument(Map<String, Object> source) {
    List<Float> embedding = new ArrayList<>();
    Object vector = source.get("embedding");
    if (vector instanceof List<?> values) {
      for (Object value : values) {
        embedding.add(((Number) value).floatValue());
      }
    }
    Object page = source.get("pageNumber");
    return ChunkRecord.builder()
        .documentId(UUID.fromString((String) source.get("documentId")))
        .ordinal(((Number) source.get("chunkIndex")).intValue())
        .text((String) source.get("content"))
        .section((String) source.get("section"))
        .chunkType(ChunkType.fromValue((String) source.get("chunkType")))
        .pageNumber(page instanceof Number n ? n.intValue() : null)
        .embedding(embedding)
        .build();
  }

  @Override
  protected String getDocumentId(ChunkRecord entity) {
    return entity.getId();
  }

  @Override
  protected Query buildCriteriaQuery(Map<String, Object> criteria) {
    if (criteria.isEmpty()) {
      return Query.of(q -> q.matchAll(m -> m));
    }
    List<Query> filters = new ArrayList<>();
    for (Map.Entry<String, Object> entry : criteria.entrySet()) {
      String value = entry.getValue().toString();
      filters.add(Query.of(q -> q.term(t -> t.field(entry.getKey()).value(value))));
    }
    return Query.of(q -> q.bool(b -> b.filter(filters)));
  }

  @Override
  protected String getMetricPrefix() {
    return "chunk_store";
  }

  @Override
  public void store(ChunkRecord chunk) {
    writeLock.lock();
    try {
      indexDocuments(List.of(chunk));
      refresh();
    } finally {
      writeLock.unlock();
    }
  }

  /**
   * {@inheritDoc}
   *
   * <p>Deletes and writes are only made visible by the final refresh. If the bulk write fails, the
   * previous chunk set is written back before the lock is released, so a later refresh cannot
   * expose a half-replaced document.
   */
  @Override
  @Timed(value = "chunk_store.replace", description = "Time to replace the chunks of a document")
  public void replaceDocument(UUID documentId, List<ChunkRecord> chunks) {
    writeLock.lock();
    try {
      List<ChunkRecord> previous = findByDocument(documentId);
      long removed = deleteBy(Map.of("documentId", documentId));
      try {
        indexDocuments(chunks);
      } catch (SearchException e) {
        rollBack(documentId, previous, e);
        throw e;
      }
      refresh();
      log.info(
          "Replaced {} chunks of document {} with {} chunks", removed, documentId, chunks.size());
    } finally {
      writeLock.unlock();
    }
  }

  private void rollBack(UUID documentId, List<ChunkRecord> previous, SearchException cause) {
    try {
      deleteBy(Map.of("documentId", documentId));
      indexDocuments(previous);
      meterRegistry.counter("chunk_store.rollbacks").increment();
      log.warn(
          "Restored {} previous chunks of document {} after a failed replace",
          previous.size(),
          documentId);
    } catch (SearchException e) {
      cause.addSuppressed(e);
      log.error(
          "Could not restore the previous chunks of document {}: {}", documentId, e.getMessage());
    }
  }

  @Override
  public void deleteAll(UUID documentId) {
    writeLock.lock();
    try {
      long removed = deleteBy(Map.of("documentId", documentId));
      refresh();
      log.info("Deleted {} chunks of document {}", removed, documentId);
    } finally {
      writeLock.unlock();
    }
  }

  @Override
  @Timed(value = "chunk_store.search", description = "Time for exact vector search")
  @SuppressWarnings("rawtypes")
  public List<ScoredChunk> search(List<Float> queryVector, int k, ChunkFilter filter) {
    if (k <= 0) {
      return List.of();
    }
    Map<String, Object> criteria = criteriaOf(filter != null ? filter : ChunkFilter.none());
    int size = Math.min(k, MAX_WINDOW);

    boolean zeroQuery = queryVector.stream().allMatch(v -> v == 0f);
    Query query =
        zeroQuery ? buildCriteriaQuery(criteria) : scriptScoreQuery(criteria, queryVector);

    SearchRequest request =
        SearchRequest.of(
            s ->
                s.index(indexName)
                    .query(query)
                    .size(size)
                    .sort(so -> so.score(sc -> sc.order(SortOrder.Desc)))
                    .sort(so -> so.field(f -> f.field("chunkIndex").order(SortOrder.Asc)))
                    .sort(so -> so.field(f -> f.field("documentId").order(SortOrder.Asc))));

    List<ScoredChunk> results = new ArrayList<>();
    for (Hit<Map> hit : executeSearch(request)) {
      ChunkRecord chunk = toEntity(hit);
      if (chunk == null) {
        continue;
      }
      double score = zeroQuery || hit.score() == null ? 0.0 : hit.score() - 1.0;
      results.add(new ScoredChunk(chunk, score));
    }
    return results;
  }

  @Override
  @SuppressWarnings("rawtypes")
  public List<ChunkRecord> findByDocument(UUID documentId) {
    Query query = buildCriteriaQuery(Map.of("documentId", documentId));
    SearchRequest request =
        SearchRequest.of(
            s ->
                s.index(indexName)
                    .query(query)
                    .size(MAX_WINDOW)
                    .sort(so -> so.field(f -> f.field("chunkIndex").order(SortOrder.Asc))));
    List<ChunkRecord> chunks = new ArrayList<>();
    for (Hit<Map> hit : executeSearch(request)) {
      ChunkRecord chunk = toEntity(hit);
      if (chunk != null) {
        chunks.add(chunk);
      }
    }
    return chunks;
  }

  @Override
  public long countByDocument(UUID documentId) {
    return count(Map.of("documentId", documentId));
  }

  private Map<String, Object> criteriaOf(ChunkFilter filter) {
    Map<String, Object> criteria = new LinkedHashMap<>();
    if (filter.documentId() != null) {
      criteria.put("documentId", filter.documentId());
    }
    if (filter.section() != null) {
      criteria.put("section", filter.section());
    }
    if (filter.chunkType() != null) {
      criteria.put("chunkType", filter.chunkType().getValue());
    }
    return criteria;
  }

  /** Builds the exact cosine {@code script_score} query over the filtered chunks. */
  Query scriptScoreQuery(Map<String, Object> criteria, List<Float> queryVector) {
    List<Map<String, Object>> filters = new ArrayList<>();
    for (Map.Entry<String, Object> entry : criteria.entrySet()) {
      filters.add(Map.of("term", Map.of(entry.getKey(), entry.getValue().toString())));
    }
    Map<String, Object> inner =
        filters.isEmpty()
            ? Map.of("match_all", Map.of())
            : Map.of("bool", Map.of("filter", filters));
    Map<String, Object> scriptScore =
        Map.of(
            "script_score",
            Map.of(
                "query",
                inner,
                "script",
                Map.of("source", COSINE_SCRIPT, "params", Map.of("query_vector", queryVector))));
    try {
      String json = OBJECT_MAPPER.writeValueAsString(scriptScore);
      return Query.of(q -> q.withJson(new StringReader(json)));
    } catch (JsonProcessingException e) {
      throw new SearchException("Failed to build vector query", e);
    }
  }
}
