package com.flamingo.ai.papersearch.domain.enums;

/** Ingestion pipeline state of a document. */
public enum DocumentStatus {
  /** Document record created, nothing processed yet. */
  UPLOADED,

  /** Structural extraction from the PDF is running. */
  EXTRACTING,

  /** Extracted text is being split into chunks. */
  CHUNKING,

  /** Chunk embeddings are being generated. */
  EMBEDDING,

  /** Chunk set is written to the store and searchable. */
  INDEXED,

  /** An unrecoverable error stopped ingestion. */
  FAILED;

  public boolean isTerminal() {
    return this == INDEXED || this == FAILED;
  }
}
