package com.flamingo.ai.papersearch.service.extraction;

import java.util.Optional;
import java.util.UUID;

/** Stores figure images outside the database; only the returned reference is kept. */
public interface FigureStorage {

  /**
   * Stores one figure image.
   *
   * @param documentId owning document
   * @param pageNumber 1-based page number
   * @param index 1-based ordinal of the figure within the page
   * @param png PNG-encoded image bytes
   * @return a reference to the stored image, or empty when it was not stored
   */
  Optional<String> store(UUID documentId, int pageNumber, int index, byte[] png);

  /** Removes every stored image of a document. */
  void deleteAll(UUID documentId);
}
