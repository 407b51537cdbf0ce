package com.flamingo.ai.papersearch.service.embedding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.papersearch.config.RagConfig;
import com.flamingo.ai.papersearch.exception.SearchException;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("EmbeddingService Tests")
class EmbeddingServiceTest {

  private static final List<Float> VECTOR = List.of(1f, 0f);

  @Mock private EmbeddingClient embeddingClient;

  private EmbeddingService embeddingService;

  @BeforeEach
  void setUp() {
    RagConfig ragConfig = new RagConfig();
    ragConfig.getEmbedding().setBatchSize(2);
    RetryRegistry retryRegistry =
        RetryRegistry.of(
            RetryConfig.custom().maxAttempts(2).waitDuration(Duration.ofMillis(1)).build());
    embeddingService =
        new EmbeddingService(embeddingClient, ragConfig, retryRegistry, Runnable::run);
  }

  @Nested
  @DisplayName("embedText")
  class EmbedText {

    @Test
    @DisplayName("Should return the vector computed by the model")
    void shouldReturnVector() {
      when(embeddingClient.embed("dense retrieval")).thenReturn(VECTOR);

      assertThat(embeddingService.embedText("dense retrieval")).isEqualTo(VECTOR);
    }

    @Test
    @DisplayName("Should report a model failure as a search failure")
    void shouldWrapFailure_whenModelFails() {
      when(embeddingClient.embed("dense retrieval"))
          .thenThrow(new IllegalStateException("model offline"));

      assertThatThrownBy(() -> embeddingService.embedText("dense retrieval"))
          .isInstanceOf(SearchException.class)
          .hasMessageContaining("model offline");
    }
  }

  @Nested
  @DisplayName("embedChunks")
  class EmbedChunks {

    @Test
    @DisplayName("Should split texts into batches and keep input order")
    void shouldEmbedInBatches() {
      // Given
      when(embeddingClient.embedAll(anyList()))
          .thenAnswer(
              invocation -> {
                List<String> batch = invocation.getArgument(0);
                return batch.stream().map(t -> List.of((float) t.length())).toList();
              });

      // When
      EmbeddingBatchResult result =
          embeddingService.embedChunks(List.of("a", "bb", "ccc", "dddd", "eeeee"));

      // Then
      verify(embeddingClient, times(3)).embedAll(anyList());
      assertThat(result.vectors())
          .containsExactly(List.of(1f), List.of(2f), List.of(3f), List.of(4f), List.of(5f));
      assertThat(result.failedIndices()).isEmpty();
      assertThat(result.allFailed()).isFalse();
    }

    @Test
    @DisplayName("Should embed texts one by one when a batch fails and report what still fails")
    void shouldFallBackToSingleTexts_whenBatchFails() {
      // Given
      when(embeddingClient.embedAll(anyList())).thenThrow(new RuntimeException("batch failed"));
      when(embeddingClient.embed("good")).thenReturn(VECTOR);
      when(embeddingClient.embed("bad")).thenThrow(new RuntimeException("bad input"));

      // When
      EmbeddingBatchResult result = embeddingService.embedChunks(List.of("good", "bad"));

      // Then
      assertThat(result.vectors()).containsExactly(VECTOR, null);
      assertThat(result.failedIndices()).containsExactly(1);
      assertThat(result.allFailed()).isFalse();
      verify(embeddingClient, times(2)).embed("bad");
    }

    @Test
    @DisplayName("Should retry a text that fails once")
    void shouldRetrySingleText_whenTransientFailure() {
      // Given
      when(embeddingClient.embedAll(anyList())).thenThrow(new RuntimeException("batch failed"));
      when(embeddingClient.embed("flaky"))
          .thenThrow(new RuntimeException("timeout"))
          .thenReturn(VECTOR);

      // When
      EmbeddingBatchResult result = embeddingService.embedChunks(List.of("flaky"));

      // Then
      assertThat(result.vectors()).containsExactly(VECTOR);
      assertThat(result.failedIndices()).isEmpty();
      verify(embeddingClient, times(2)).embed("flaky");
    }

    @Test
    @DisplayName("Should report global indices of failures in later batches")
    void shouldReportAllFailed_whenEveryTextFails() {
      // Given
      when(embeddingClient.embedAll(anyList())).thenThrow(new RuntimeException("down"));
      when(embeddingClient.embed(anyString())).thenThrow(new RuntimeException("down"));

      // When
      EmbeddingBatchResult result = embeddingService.embedChunks(List.of("a", "b", "c"));

      // Then
      assertThat(result.failedIndices()).containsExactly(0, 1, 2);
      assertThat(result.allFailed()).isTrue();
    }

    @Test
    @DisplayName("Should return an empty result without calling the client")
    void shouldReturnEmpty_whenNoTexts() {
      // When
      EmbeddingBatchResult result = embeddingService.embedChunks(List.of());

      // Then
      assertThat(result.vectors()).isEmpty();
      assertThat(result.allFailed()).isFalse();
      verifyNoInteractions(embeddingClient);
    }
  }

  @Test
  @DisplayName("Should embed queries with a single call")
  void shouldEmbedQuery() {
    // Given
    when(embeddingClient.embed("what is chunking")).thenReturn(VECTOR);

    // When
    List<Float> result = embeddingService.embedQuery("what is chunking");

    // Then
    assertThat(result).isEqualTo(VECTOR);
    verify(embeddingClient, never()).embedAll(anyList());
  }
}
