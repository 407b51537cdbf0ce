package com.flamingo.ai.papersearch.store;

import com.flamingo.ai.papersearch.domain.enums.ChunkType;
import java.util.UUID;

/**
 * Equality filters applied before ranking. A null field matches everything.
 *
 * @param documentId only chunks of this document
 * @param section only chunks with this section label
 * @param chunkType only chunks of this content type
 */
public record ChunkFilter(UUID documentId, String section, ChunkType chunkType) {

  private static final ChunkFilter NONE = new ChunkFilter(null, null, null);

  public static ChunkFilter none() {
    return NONE;
  }

  public static ChunkFilter forDocument(UUID documentId) {
    return new ChunkFilter(documentId, null, null);
  }

  public boolean matches(ChunkRecord chunk) {
    return (documentId == null || documentId.equals(chunk.getDocumentId()))
        && (section == null || section.equals(chunk.getSection()))
        && (chunkType == null || chunkType == chunk.getChunkType());
  }
}
