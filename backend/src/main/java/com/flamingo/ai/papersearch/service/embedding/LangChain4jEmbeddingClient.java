package com.flamingo.ai.papersearch.service.embedding;

import com.flamingo.ai.papersearch.config.RagConfig;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * {@link EmbeddingClient} backed by a LangChain4j {@link EmbeddingModel}.
 *
 * <p>Blank input yields a zero vector without calling the model, so an empty query is valid.
 * Inputs longer than {@code rag.embedding.max-chars-per-text} are truncated.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LangChain4jEmbeddingClient implements EmbeddingClient {

  private final EmbeddingModel embeddingModel;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "embedding.embed", description = "Time to embed one text")
  public List<Float> embed(String text) {
    if (text == null || text.isBlank()) {
      return zeroVector();
    }
    try {
      Response<Embedding> response = embeddingModel.embed(truncate(text));
      List<Float> vector = toFloatList(response.content().vector());
      meterRegistry.counter("embedding.requests.success", "type", "single").increment();
      return vector;
    } catch (RuntimeException e) {
      meterRegistry.counter("embedding.requests.failure", "type", "single").increment();
      throw e;
    }
  }

  @Override
  @Timed(value = "embedding.embedBatch", description = "Time to embed a batch of texts")
  public List<List<Float>> embedAll(List<String> texts) {
    if (texts.isEmpty()) {
      return List.of();
    }
    List<Integer> nonBlank = new ArrayList<>();
    List<TextSegment> segments = new ArrayList<>();
    for (int i = 0; i < texts.size(); i++) {
      String text = texts.get(i);
      if (text != null && !text.isBlank()) {
        nonBlank.add(i);
        segments.add(TextSegment.from(truncate(text)));
      }
    }

    List<List<Float>> result = new ArrayList<>(Collections.nCopies(texts.size(), zeroVector()));
    if (segments.isEmpty()) {
      return result;
    }
    try {
      List<Embedding> embeddings = embeddingModel.embedAll(segments).content();
      if (embeddings.size() != segments.size()) {
        throw new IllegalStateException(
            "Embedding model returned "
                + embeddings.size()
                + " vectors for "
                + segments.size()
                + " texts");
      }
      for (int i = 0; i < embeddings.size(); i++) {
        result.set(nonBlank.get(i), toFloatList(embeddings.get(i).vector()));
      }
      meterRegistry.counter("embedding.requests.success", "type", "batch").increment();
      return result;
    } catch (RuntimeException e) {
      meterRegistry.counter("embedding.requests.failure", "type", "batch").increment();
      throw e;
    }
  }

  @Override
  public int dimensions() {
    return ragConfig.getEmbedding().getDimensions();
  }

  private String truncate(String text) {
    int max = ragConfig.getEmbedding().getMaxCharsPerText();
    if (text.length() <= max) {
      return text;
    }
    log.warn(
        "Text too long for embedding, truncating from {} chars to {} chars", text.length(), max);
    return text.substring(0, max);
  }

  private List<Float> toFloatList(float[] vector) {
    if (vector.length != dimensions()) {
      throw new IllegalStateException(
          "Embedding dimension mismatch: expected " + dimensions() + " but got " + vector.length);
    }
    List<Float> result = new ArrayList<>(vector.length);
    for (float f : vector) {
      result.add(f);
    }
    return result;
  }

  private List<Float> zeroVector() {
    return Collections.nCopies(dimensions(), 0f);
  }
}
