package com.flamingo.ai.papersearch.api.dto.response;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO carrying the vector computed for a piece of text. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmbeddingResponse {

  private String text;
  private List<Float> embedding;
  private int dimensions;

  public static EmbeddingResponse of(String text, List<Float> embedding) {
    return EmbeddingResponse.builder()
        .text(text)
        .embedding(embedding)
        .dimensions(embedding.size())
        .build();
  }
}
