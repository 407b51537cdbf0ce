package com.flamingo.ai.papersearch.api.dto.response;

import com.flamingo.ai.papersearch.domain.enums.ChunkType;
import com.flamingo.ai.papersearch.store.ChunkRecord;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** An indexed chunk, without its embedding. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChunkResponse {

  private String chunkId;
  private int ordinal;
  private String section;
  private ChunkType chunkType;
  private Integer pageNumber;
  private String text;

  public static ChunkResponse fromRecord(ChunkRecord chunk) {
    return ChunkResponse.builder()
        .chunkId(chunk.getId())
        .ordinal(chunk.getOrdinal())
        .section(chunk.getSection())
        .chunkType(chunk.getChunkType())
        .pageNumber(chunk.getPageNumber())
        .text(chunk.getText())
        .build();
  }
}
