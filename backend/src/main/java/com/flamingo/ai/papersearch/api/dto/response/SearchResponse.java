package com.flamingo.ai.papersearch.api.dto.response;

import com.flamingo.ai.papersearch.domain.enums.ChunkType;
import com.flamingo.ai.papersearch.store.ScoredChunk;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Ranked chunks answering a search. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchResponse {

  private String query;
  private int resultsCount;
  private long searchTimeMs;
  private List<ChunkResult> chunks;

  /** One ranked chunk. */
  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class ChunkResult {
    private String chunkId;
    private UUID documentId;
    private String section;
    private ChunkType chunkType;
    private String text;
    private double similarityScore;
    private Integer pageNumber;

    public static ChunkResult fromScored(ScoredChunk hit) {
      return ChunkResult.builder()
          .chunkId(hit.chunk().getId())
          .documentId(hit.chunk().getDocumentId())
          .section(hit.chunk().getSection())
          .chunkType(hit.chunk().getChunkType())
          .text(hit.chunk().getText())
          .similarityScore(hit.score())
          .pageNumber(hit.chunk().getPageNumber())
          .build();
    }
  }
}
