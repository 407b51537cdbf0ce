package com.flamingo.ai.papersearch.service.ingestion;

import com.flamingo.ai.papersearch.domain.enums.DocumentStatus;
import java.util.List;
import java.util.UUID;

/**
 * Result of one ingestion run.
 *
 * @param documentId the document
 * @param status the status the document was left in
 * @param chunkCount number of searchable chunks written, 0 unless indexed
 * @param failedChunkOrdinals ordinals of chunks that could not be embedded
 * @param error failure reason, or null
 */
public record IngestionOutcome(
    UUID documentId,
    DocumentStatus status,
    int chunkCount,
    List<Integer> failedChunkOrdinals,
    String error) {

  public static IngestionOutcome indexed(UUID documentId, int chunkCount, List<Integer> failed) {
    return new IngestionOutcome(
        documentId, DocumentStatus.INDEXED, chunkCount, List.copyOf(failed), null);
  }

  public static IngestionOutcome failed(UUID documentId, String error) {
    return new IngestionOutcome(documentId, DocumentStatus.FAILED, 0, List.of(), error);
  }

  /** The run was cancelled and the document was restored to {@code status}. */
  public static IngestionOutcome cancelled(UUID documentId, DocumentStatus status, int chunkCount) {
    return new IngestionOutcome(documentId, status, chunkCount, List.of(), "Cancelled");
  }

  public boolean isIndexed() {
    return status == DocumentStatus.INDEXED;
  }
}
