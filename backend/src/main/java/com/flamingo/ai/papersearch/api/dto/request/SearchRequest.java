package com.flamingo.ai.papersearch.api.dto.request;

import com.flamingo.ai.papersearch.domain.enums.ChunkType;
import com.flamingo.ai.papersearch.service.search.SearchCommand;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for a semantic search. An empty query is allowed. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchRequest {

  @NotNull(message = "Query is required")
  @Size(max = 1000, message = "Query must be at most 1000 characters")
  private String query;

  /** Clamped to the configured range; null selects the default. */
  private Integer maxResults;

  private UUID documentId;
  private String section;
  private ChunkType chunkType;

  public SearchCommand toCommand() {
    return new SearchCommand(query, maxResults, documentId, section, chunkType);
  }
}
