package com.flamingo.ai.papersearch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

import com.flamingo.ai.papersearch.api.dto.response.SearchResponse;
import com.flamingo.ai.papersearch.domain.entity.Document;
import com.flamingo.ai.papersearch.domain.enums.DocumentStatus;
import com.flamingo.ai.papersearch.service.document.DocumentService;
import com.flamingo.ai.papersearch.service.extraction.model.SectionText;
import com.flamingo.ai.papersearch.service.ingestion.DocumentIngestionService;
import com.flamingo.ai.papersearch.service.ingestion.ExtractedContent;
import com.flamingo.ai.papersearch.service.ingestion.IngestionOutcome;
import com.flamingo.ai.papersearch.service.search.SearchCommand;
import com.flamingo.ai.papersearch.service.search.SearchService;
import com.flamingo.ai.papersearch.store.ChunkStore;
import com.flamingo.ai.papersearch.store.InMemoryChunkStore;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

/**
 * Integration test that verifies the Spring application context loads correctly. Uses @MockitoBean
 * to mock the embedding model so the test runs without downloading or calling a model.
 */
@SpringBootTest
class ApplicationContextTest {

  private static final int DIMENSIONS = 384;

  @MockitoBean private EmbeddingModel embeddingModel;

  @Autowired private ApplicationContext applicationContext;
  @Autowired private DocumentService documentService;
  @Autowired private SearchService searchService;

  /** Unit vector along one axis; texts about retrieval point one way, everything else another. */
  private static Embedding embeddingOf(String text) {
    float[] vector = new float[DIMENSIONS];
    vector[text.toLowerCase().contains("retrieval") ? 0 : 1] = 1f;
    return Embedding.from(vector);
  }

  @Test
  @DisplayName("Application context should load successfully")
  void contextLoads() {
    assertThat(applicationContext).isNotNull();
  }

  @Test
  @DisplayName("All core service beans should be available")
  void coreServiceBeansShouldBeAvailable() {
    assertThat(applicationContext.getBean(DocumentService.class)).isNotNull();
    assertThat(applicationContext.getBean(DocumentIngestionService.class)).isNotNull();
    assertThat(applicationContext.getBean(SearchService.class)).isNotNull();
    assertThat(applicationContext.getBean(ChunkStore.class))
        .isInstanceOf(InMemoryChunkStore.class);
  }

  @Test
  @DisplayName("Supplied text should become searchable")
  void suppliedTextShouldBeSearchable() {
    // Given
    when(embeddingModel.embedAll(anyList()))
        .thenAnswer(
            invocation -> {
              List<TextSegment> segments = invocation.getArgument(0);
              return Response.from(segments.stream().map(s -> embeddingOf(s.text())).toList());
            });
    when(embeddingModel.embed(anyString()))
        .thenAnswer(invocation -> Response.from(embeddingOf(invocation.getArgument(0))));
    UUID documentId = UUID.randomUUID();
    ExtractedContent content =
        new ExtractedContent(
            "Dense retrieval ranks passages.\n\nWe thank the reviewers.",
            List.of(
                new SectionText("abstract", "Dense retrieval ranks passages.", 0),
                new SectionText("acknowledgments", "We thank the reviewers.", 33)));

    // When
    IngestionOutcome outcome = documentService.ingestContent(documentId, "notes.txt", content);
    SearchResponse response =
        searchService.search(new SearchCommand("retrieval", 1, documentId, null, null));

    // Then
    assertThat(outcome.isIndexed()).isTrue();
    assertThat(outcome.chunkCount()).isEqualTo(2);
    Document document = documentService.getDocument(documentId);
    assertThat(document.getStatus()).isEqualTo(DocumentStatus.INDEXED);
    assertThat(document.getFileName()).isEqualTo("notes.txt");
    assertThat(response.getChunks()).hasSize(1);
    assertThat(response.getChunks().get(0).getSection()).isEqualTo("abstract");
    assertThat(response.getChunks().get(0).getSimilarityScore()).isCloseTo(1.0, within(1e-6));

    documentService.deleteDocument(documentId);
  }
}
