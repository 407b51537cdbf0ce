package com.flamingo.ai.papersearch.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for embedding a piece of text. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmbeddingRequest {

  @NotBlank(message = "Text is required")
  @Size(max = 10000, message = "Text must be at most 10000 characters")
  private String text;
}
