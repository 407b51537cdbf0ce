package com.flamingo.ai.papersearch.store.elasticsearch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.DeleteByQueryRequest;
import co.elastic.clients.elasticsearch.core.DeleteByQueryResponse;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.elasticsearch.core.search.HitsMetadata;
import co.elastic.clients.elasticsearch.indices.ElasticsearchIndicesClient;
import com.flamingo.ai.papersearch.domain.enums.ChunkType;
import com.flamingo.ai.papersearch.exception.SearchException;
import com.flamingo.ai.papersearch.store.ChunkFilter;
import com.flamingo.ai.papersearch.store.ChunkRecord;
import com.flamingo.ai.papersearch.store.ScoredChunk;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("ElasticsearchChunkStore Tests")
class ElasticsearchChunkStoreTest {

  private static final String INDEX = "paper-chunks-test";
  private static final UUID DOC_ID = UUID.fromString("11111111-2222-3333-4444-555555555555");

  @Mock private ElasticsearchClient elasticsearchClient;
  @Mock private ElasticsearchIndicesClient indicesClient;

  @Captor private ArgumentCaptor<SearchRequest> searchCaptor;
  @Captor private ArgumentCaptor<BulkRequest> bulkCaptor;

  private SimpleMeterRegistry meterRegistry;
  private ElasticsearchChunkStore store;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    store = new ElasticsearchChunkStore(elasticsearchClient, meterRegistry, INDEX, 3);
  }

  private void stubDeleted(long deleted) throws IOException {
    DeleteByQueryResponse response = mock(DeleteByQueryResponse.class);
    when(response.deleted()).thenReturn(deleted);
    when(elasticsearchClient.deleteByQuery(any(DeleteByQueryRequest.class))).thenReturn(response);
  }

  private static ChunkRecord chunk(int ordinal) {
    return ChunkRecord.builder()
        .documentId(DOC_ID)
        .ordinal(ordinal)
        .text("Dense retrieval with chunk " + ordinal)
        .section("methodology")
        .pageNumber(4)
        .chunkType(ChunkType.TEXT)
        .embedding(List.of(0.5f, 0.25f, 0f))
        .build();
  }

  @SuppressWarnings({"rawtypes", "unchecked"})
  private void stubSearchHits(Hit<Map>... hits) throws IOException {
    SearchResponse<Map> response = mock(SearchResponse.class);
    HitsMetadata<Map> metadata = mock(HitsMetadata.class);
    when(metadata.hits()).thenReturn(List.of(hits));
    when(response.hits()).thenReturn(metadata);
    when(elasticsearchClient.search(searchCaptor.capture(), eq(Map.class))).thenReturn(response);
  }

  @SuppressWarnings("rawtypes")
  private Hit<Map> hit(ChunkRecord chunk, Double score) {
    Map source = new HashMap<>(store.convertToDocument(chunk));
    return Hit.of(h -> h.index(INDEX).id(chunk.getId()).score(score).source(source));
  }

  @Nested
  @DisplayName("document conversion")
  class Conversion {

    @Test
    @DisplayName("Should map a chunk to index fields and back")
    void shouldConvertChunkBothWays() {
      // Given
      ChunkRecord original = chunk(7);

      // When
      Map<String, Object> document = store.convertToDocument(original);
      Map<String, Object> source = new HashMap<>(document);
      source.put("embedding", List.of(0.5, 0.25, 0.0));
      ChunkRecord restored = store.convertFromDocument(source);

      // Then
      assertThat(document)
          .containsEntry("documentId", DOC_ID.toString())
          .containsEntry("chunkIndex", 7)
          .containsEntry("chunkType", "text")
          .containsEntry("pageNumber", 4);
      assertThat(restored).isEqualTo(original);
      assertThat(store.getDocumentId(original)).isEqualTo(DOC_ID + "_7");
    }

    @Test
    @DisplayName("Should omit the page number when it is unknown")
    void shouldOmitPageNumber_whenNull() {
      ChunkRecord chunk = chunk(0).toBuilder().pageNumber(null).build();

      assertThat(store.convertToDocument(chunk)).doesNotContainKey("pageNumber");
    }
  }

  @Nested
  @DisplayName("writes")
  class Writes {

    @Test
    @DisplayName("Should delete, bulk index and then refresh when replacing a document")
    @SuppressWarnings("unchecked")
    void shouldReplaceThenRefresh() throws IOException {
      // Given
      when(elasticsearchClient.indices()).thenReturn(indicesClient);
      stubSearchHits();
      stubDeleted(4L);
      when(elasticsearchClient.bulk(any(BulkRequest.class)))
          .thenReturn(BulkResponse.of(b -> b.errors(false).took(3).items(List.of())));

      // When
      store.replaceDocument(DOC_ID, List.of(chunk(0), chunk(1)));

      // Then
      InOrder order = inOrder(elasticsearchClient, indicesClient);
      order.verify(elasticsearchClient).search(any(SearchRequest.class), eq(Map.class));
      order.verify(elasticsearchClient).deleteByQuery(any(DeleteByQueryRequest.class));
      order.verify(elasticsearchClient).bulk(any(BulkRequest.class));
      order.verify(indicesClient).refresh(any(Function.class));
      assertThat(meterRegistry.counter("chunk_store.indexed").count()).isEqualTo(2.0);
      assertThat(meterRegistry.counter("chunk_store.deleted").count()).isEqualTo(4.0);
    }

    @Test
    @DisplayName("Should report how many chunks a delete removed")
    void shouldReturnDeletedCount_whenDeletingByDocument() throws IOException {
      // Given
      stubDeleted(3L);

      // When
      long deleted = store.deleteBy(Map.of("documentId", DOC_ID));

      // Then
      assertThat(deleted).isEqualTo(3L);
      assertThat(meterRegistry.counter("chunk_store.deleted").count()).isEqualTo(3.0);
    }

    @Test
    @DisplayName("Should write the previous chunks back when bulk indexing fails")
    @SuppressWarnings("unchecked")
    void shouldRestorePreviousChunks_whenBulkFails() throws IOException {
      // Given
      stubSearchHits(hit(chunk(0), 1.0), hit(chunk(1), 1.0));
      stubDeleted(2L);
      when(elasticsearchClient.bulk(bulkCaptor.capture()))
          .thenReturn(BulkResponse.of(b -> b.errors(true).took(3).items(List.of())))
          .thenReturn(BulkResponse.of(b -> b.errors(false).took(3).items(List.of())));

      // When / Then
      assertThatThrownBy(() -> store.replaceDocument(DOC_ID, List.of(chunk(5))))
          .isInstanceOf(SearchException.class)
          .hasMessageContaining("reported errors");

      verify(elasticsearchClient, times(2)).deleteByQuery(any(DeleteByQueryRequest.class));
      List<BulkRequest> bulks = bulkCaptor.getAllValues();
      assertThat(bulks).hasSize(2);
      assertThat(bulks.get(0).operations())
          .extracting(op -> op.index().id())
          .containsExactly(DOC_ID + "_5");
      assertThat(bulks.get(1).operations())
          .extracting(op -> op.index().id())
          .containsExactly(DOC_ID + "_0", DOC_ID + "_1");
      verify(indicesClient, never()).refresh(any(Function.class));
      assertThat(meterRegistry.counter("chunk_store.index.errors").count()).isEqualTo(1.0);
      assertThat(meterRegistry.counter("chunk_store.rollbacks").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should keep the original failure when the previous chunks cannot be restored")
    void shouldSuppressRestoreFailure_whenRollbackFails() throws IOException {
      // Given
      stubSearchHits(hit(chunk(0), 1.0));
      stubDeleted(1L);
      when(elasticsearchClient.bulk(any(BulkRequest.class)))
          .thenReturn(BulkResponse.of(b -> b.errors(true).took(3).items(List.of())))
          .thenThrow(new IOException("connection reset"));

      // When / Then
      assertThatThrownBy(() -> store.replaceDocument(DOC_ID, List.of(chunk(5))))
          .isInstanceOf(SearchException.class)
          .hasMessageContaining("reported errors")
          .satisfies(e -> assertThat(e.getSuppressed()).hasSize(1));
      assertThat(meterRegistry.counter("chunk_store.rollbacks").count()).isZero();
    }

    @Test
    @DisplayName("Should wrap transport failures in SearchException")
    void shouldWrapIoException_whenDeleteFails() throws IOException {
      // Given
      when(elasticsearchClient.deleteByQuery(any(DeleteByQueryRequest.class)))
          .thenThrow(new IOException("connection refused"));

      // When / Then
      assertThatThrownBy(() -> store.deleteAll(DOC_ID))
          .isInstanceOf(SearchException.class)
          .hasCauseInstanceOf(IOException.class);
    }
  }

  @Nested
  @DisplayName("search")
  class Search {

    @Test
    @DisplayName("Should map script scores back to cosine similarity")
    void shouldReturnCosineScores() throws IOException {
      // Given
      stubSearchHits(hit(chunk(2), 1.8), hit(chunk(5), 1.25));

      // When
      List<ScoredChunk> hits =
          store.search(List.of(1f, 0f, 0f), 2, new ChunkFilter(DOC_ID, "methodology", null));

      // Then
      assertThat(hits).extracting(h -> h.chunk().getOrdinal()).containsExactly(2, 5);
      assertThat(hits.get(0).score()).isCloseTo(0.8, within(1e-9));
      assertThat(hits.get(1).score()).isCloseTo(0.25, within(1e-9));
      SearchRequest request = searchCaptor.getValue();
      assertThat(request.index()).containsExactly(INDEX);
      assertThat(request.size()).isEqualTo(2);
      assertThat(request.query().isScriptScore()).isTrue();
      assertThat(meterRegistry.counter("chunk_store.queries").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should use a plain filter query and zero scores for a zero query vector")
    void shouldScoreZero_whenQueryVectorZero() throws IOException {
      // Given
      stubSearchHits(hit(chunk(0), 1.0));

      // When
      List<ScoredChunk> hits =
          store.search(List.of(0f, 0f, 0f), 5, ChunkFilter.forDocument(DOC_ID));

      // Then
      assertThat(hits).singleElement().satisfies(h -> assertThat(h.score()).isZero());
      assertThat(searchCaptor.getValue().query().isBool()).isTrue();
    }

    @Test
    @DisplayName("Should not query the index when k is not positive")
    void shouldReturnEmpty_whenKNotPositive() {
      assertThat(store.search(List.of(1f, 0f, 0f), 0, null)).isEmpty();
      verifyNoInteractions(elasticsearchClient);
    }
  }

  @Nested
  @DisplayName("queries")
  class Queries {

    @Test
    @DisplayName("Should wrap the criteria filters inside a script_score query")
    void shouldBuildScriptScoreQuery() {
      // Given
      Map<String, Object> criteria = new LinkedHashMap<>();
      criteria.put("documentId", DOC_ID);
      criteria.put("chunkType", "reference");

      // When
      Query query = store.scriptScoreQuery(criteria, List.of(0.1f, 0.2f, 0.3f));

      // Then
      assertThat(query.isScriptScore()).isTrue();
      assertThat(query.scriptScore().query().bool().filter()).hasSize(2);
    }

    @Test
    @DisplayName("Should match everything when there are no criteria")
    void shouldMatchAll_whenNoCriteria() {
      assertThat(store.buildCriteriaQuery(Map.of()).isMatchAll()).isTrue();
      assertThat(store.scriptScoreQuery(Map.of(), List.of(1f, 0f, 0f)).scriptScore().query())
          .satisfies(q -> assertThat(q.isMatchAll()).isTrue());
    }
  }

  @Nested
  @DisplayName("mapping checks")
  class MappingChecks {

    @Test
    @DisplayName("Should reject an embedding field with a different dimension")
    void shouldReportProblem_whenVectorDimensionsDiffer() {
      Property expected = Property.of(p -> p.denseVector(d -> d.dims(3)));
      Property actual = Property.of(p -> p.denseVector(d -> d.dims(384)));

      assertThat(store.checkField("embedding", expected, actual))
          .hasValueSatisfying(problem -> assertThat(problem).contains("384").contains("3"));
    }

    @Test
    @DisplayName("Should reject a filter field mapped as text")
    void shouldReportProblem_whenKindDiffers() {
      Property expected = Property.of(p -> p.keyword(k -> k));
      Property actual = Property.of(p -> p.text(t -> t));

      assertThat(store.checkField("section", expected, actual)).isPresent();
    }

    @Test
    @DisplayName("Should accept a matching field")
    void shouldAcceptField_whenMappingMatches() {
      Property expected = Property.of(p -> p.denseVector(d -> d.dims(3)));

      assertThat(store.checkField("embedding", expected, expected)).isEmpty();
    }
  }
}
