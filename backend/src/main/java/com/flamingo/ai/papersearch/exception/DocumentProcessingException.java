package com.flamingo.ai.papersearch.exception;

import java.util.UUID;

/**
 * A document cannot be ingested at all: the PDF is unreadable, too large, has no text, or timed
 * out. The document is marked failed and its chunk set is left as it was.
 */
public class DocumentProcessingException extends RuntimeException {

  private static final String DEFAULT_USER_MESSAGE = "The document could not be processed";

  private final UUID documentId;
  private final String userMessage;

  public DocumentProcessingException(UUID documentId, String message) {
    this(documentId, message, null, DEFAULT_USER_MESSAGE);
  }

  public DocumentProcessingException(UUID documentId, String message, Throwable cause) {
    this(documentId, message, cause, DEFAULT_USER_MESSAGE);
  }

  public DocumentProcessingException(UUID documentId, String message, String userMessage) {
    this(documentId, message, null, userMessage);
  }

  private DocumentProcessingException(
      UUID documentId, String message, Throwable cause, String userMessage) {
    super(message, cause);
    this.documentId = documentId;
    this.userMessage = userMessage;
  }

  /** The affected document, or null when the upload was rejected before one was created. */
  public UUID getDocumentId() {
    return documentId;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
