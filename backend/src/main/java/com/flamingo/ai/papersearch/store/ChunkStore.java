package com.flamingo.ai.papersearch.store;

import java.util.List;
import java.util.UUID;

/**
 * Holds embedded chunks and ranks them against a query vector.
 *
 * <p>Writes are atomic per document: a concurrent search sees either the complete old chunk set of
 * a document or the complete new one, never a mix.
 */
public interface ChunkStore {

  /** Inserts or replaces one chunk, keyed by document id and ordinal. */
  void store(ChunkRecord chunk);

  /**
   * Replaces every chunk of a document in one step.
   *
   * @param documentId the document
   * @param chunks the new chunk set, possibly empty
   */
  void replaceDocument(UUID documentId, List<ChunkRecord> chunks);

  /** Removes every chunk of a document. */
  void deleteAll(UUID documentId);

  /**
   * Finds the chunks most similar to the query vector.
   *
   * @param queryVector the query embedding
   * @param k maximum number of results; nothing is returned when {@code k <= 0}
   * @param filter equality filters applied before ranking
   * @return at most {@code k} hits ordered by descending cosine similarity, then ascending ordinal,
   *     then document id
   */
  List<ScoredChunk> search(List<Float> queryVector, int k, ChunkFilter filter);

  /** Returns the chunks of a document in ordinal order. */
  List<ChunkRecord> findByDocument(UUID documentId);

  long countByDocument(UUID documentId);
}
