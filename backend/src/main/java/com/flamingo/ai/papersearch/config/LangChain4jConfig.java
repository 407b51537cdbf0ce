package com.flamingo.ai.papersearch.config;

import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.allminilml6v2.AllMiniLmL6V2EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import java.time.Duration;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Embedding model selected by {@code rag.embedding.provider}.
 *
 * <p>{@code local} runs all-MiniLM-L6-v2 in process and always produces 384-dimensional vectors;
 * {@code openai} calls the OpenAI embeddings API with the configured dimension.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class LangChain4jConfig {

  static final int LOCAL_MODEL_DIMENSIONS = 384;

  private final RagConfig ragConfig;

  @Value("${langchain4j.openai.api-key:}")
  private String openAiApiKey;

  @Value("${langchain4j.openai.embedding-model.model-name:text-embedding-3-small}")
  private String embeddingModelName;

  @Value("${langchain4j.openai.timeout:30s}")
  private Duration openAiTimeout;

  @Bean
  public EmbeddingModel embeddingModel() {
    String provider = ragConfig.getEmbedding().getProvider().toLowerCase(Locale.ROOT);
    int dimensions = ragConfig.getEmbedding().getDimensions();
    EmbeddingModel model =
        switch (provider) {
          case "openai" -> openAiEmbeddingModel(dimensions);
          case "local" -> localEmbeddingModel(dimensions);
          default -> throw new IllegalStateException("Unknown embedding provider: " + provider);
        };
    log.info("Embedding provider '{}' producing {}-dimensional vectors", provider, dimensions);
    return model;
  }

  private EmbeddingModel localEmbeddingModel(int dimensions) {
    if (dimensions != LOCAL_MODEL_DIMENSIONS) {
      throw new IllegalStateException(
          "The local embedding model produces "
              + LOCAL_MODEL_DIMENSIONS
              + "-dimensional vectors but rag.embedding.dimensions is "
              + dimensions);
    }
    return new AllMiniLmL6V2EmbeddingModel();
  }

  private EmbeddingModel openAiEmbeddingModel(int dimensions) {
    if (openAiApiKey == null || openAiApiKey.isBlank()) {
      throw new IllegalStateException(
          "OpenAI API key is required. Set OPENAI_API_KEY environment variable.");
    }
    // retries are handled per chunk by EmbeddingService
    return OpenAiEmbeddingModel.builder()
        .apiKey(openAiApiKey)
        .modelName(embeddingModelName)
        .dimensions(dimensions)
        .timeout(openAiTimeout)
        .maxRetries(0)
        .build();
  }
}
