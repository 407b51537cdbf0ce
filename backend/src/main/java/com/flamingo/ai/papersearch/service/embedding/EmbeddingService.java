package com.flamingo.ai.papersearch.service.embedding;

import com.flamingo.ai.papersearch.config.RagConfig;
import com.flamingo.ai.papersearch.exception.SearchException;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import io.micrometer.core.annotation.Timed;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Embeds chunk texts in parallel batches.
 *
 * <p>Batches of {@code rag.embedding.batch-size} texts run on the {@code embeddingExecutor}. When a
 * batch call fails, each of its texts is embedded on its own under the {@code embedding} retry
 * policy; texts that still fail are reported by index rather than dropped.
 */
@Service
@Slf4j
public class EmbeddingService {

  static final String RETRY_NAME = "embedding";

  private final EmbeddingClient embeddingClient;
  private final RagConfig ragConfig;
  private final RetryRegistry retryRegistry;
  private final Executor embeddingExecutor;

  public EmbeddingService(
      EmbeddingClient embeddingClient,
      RagConfig ragConfig,
      RetryRegistry retryRegistry,
      @Qualifier("embeddingExecutor") Executor embeddingExecutor) {
    this.embeddingClient = embeddingClient;
    this.ragConfig = ragConfig;
    this.retryRegistry = retryRegistry;
    this.embeddingExecutor = embeddingExecutor;
  }

  /**
   * Embeds a query for search.
   *
   * @param query the query text, possibly blank
   * @return the query vector
   */
  public List<Float> embedQuery(String query) {
    return embeddingClient.embed(query);
  }

  /**
   * Embeds arbitrary text on behalf of an API caller.
   *
   * @param text the text to embed
   * @return the vector, in the same space as chunk and query vectors
   * @throws SearchException if the embedding model fails
   */
  @Timed(value = "embedding.embedText", description = "Time to embed text for an API caller")
  public List<Float> embedText(String text) {
    try {
      return embeddingClient.embed(text);
    } catch (RuntimeException e) {
      log.error("Failed to embed text of length {}: {}", text.length(), e.getMessage());
      throw new SearchException("Failed to embed text: " + e.getMessage(), e);
    }
  }

  /**
   * Embeds chunk texts.
   *
   * @param texts the chunk texts in ordinal order
   * @return vectors aligned with {@code texts}, plus the indices that failed
   */
  @Timed(value = "embedding.embedChunks", description = "Time to embed all chunks of a document")
  public EmbeddingBatchResult embedChunks(List<String> texts) {
    if (texts.isEmpty()) {
      return new EmbeddingBatchResult(List.of(), List.of());
    }
    int batchSize = Math.max(1, ragConfig.getEmbedding().getBatchSize());

    List<CompletableFuture<List<List<Float>>>> futures = new ArrayList<>();
    for (int from = 0; from < texts.size(); from += batchSize) {
      List<String> batch = texts.subList(from, Math.min(from + batchSize, texts.size()));
      int offset = from;
      futures.add(
          CompletableFuture.supplyAsync(() -> embedBatch(batch, offset), embeddingExecutor));
    }

    List<List<Float>> vectors = new ArrayList<>(texts.size());
    for (CompletableFuture<List<List<Float>>> future : futures) {
      vectors.addAll(future.join());
    }

    List<Integer> failed = new ArrayList<>();
    for (int i = 0; i < vectors.size(); i++) {
      if (vectors.get(i) == null) {
        failed.add(i);
      }
    }
    if (!failed.isEmpty()) {
      log.warn(
          "{} of {} chunk texts could not be embedded: {}", failed.size(), texts.size(), failed);
    }
    return new EmbeddingBatchResult(vectors, List.copyOf(failed));
  }

  private List<List<Float>> embedBatch(List<String> batch, int offset) {
    try {
      return embeddingClient.embedAll(batch);
    } catch (RuntimeException e) {
      log.warn(
          "Embedding batch at offset {} ({} texts) failed, retrying texts individually: {}",
          offset,
          batch.size(),
          e.getMessage());
    }

    Retry retry = retryRegistry.retry(RETRY_NAME);
    List<List<Float>> vectors = new ArrayList<>(batch.size());
    for (int i = 0; i < batch.size(); i++) {
      String text = batch.get(i);
      try {
        vectors.add(Retry.decorateSupplier(retry, () -> embeddingClient.embed(text)).get());
      } catch (RuntimeException e) {
        log.warn("Embedding failed for text {} after retries: {}", offset + i, e.getMessage());
        vectors.add(null);
      }
    }
    return vectors;
  }
}
