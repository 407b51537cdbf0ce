package com.flamingo.ai.papersearch.exception;

import java.util.UUID;

/** Exception thrown when a document is already being ingested. */
public class IngestionInProgressException extends RuntimeException {

  private final UUID documentId;

  public IngestionInProgressException(UUID documentId) {
    super("Ingestion already in progress for document: " + documentId);
    this.documentId = documentId;
  }

  public UUID getDocumentId() {
    return documentId;
  }
}
