package com.flamingo.ai.papersearch.store;

import com.flamingo.ai.papersearch.domain.enums.ChunkType;
import java.util.List;
import java.util.UUID;
import lombok.Builder;
import lombok.Value;

/**
 * A chunk of paper text together with its embedding, as held by a {@link ChunkStore}.
 *
 * <p>Instances are immutable: stores hand the same instance to every reader.
 */
@Value
public class ChunkRecord {

  UUID documentId;
  int ordinal;
  String text;
  String section;
  Integer pageNumber;
  ChunkType chunkType;
  List<Float> embedding;

  @Builder(toBuilder = true)
  public ChunkRecord(
      UUID documentId,
      int ordinal,
      String text,
      String section,
      Integer pageNumber,
      ChunkType chunkType,
      List<Float> embedding) {
    this.documentId = documentId;
    this.ordinal = ordinal;
    this.text = text;
    this.section = section;
    this.pageNumber = pageNumber;
    this.chunkType = chunkType != null ? chunkType : ChunkType.TEXT;
    this.embedding = embedding != null ? List.copyOf(embedding) : List.of();
  }

  /** Identifier unique across documents: {@code <documentId>_<ordinal>}. */
  public String getId() {
    return idOf(documentId, ordinal);
  }

  public static String idOf(UUID documentId, int ordinal) {
    return documentId + "_" + ordinal;
  }
}
