package com.flamingo.ai.papersearch.store;

import java.util.Comparator;

/**
 * A search hit.
 *
 * @param chunk the matching chunk
 * @param score cosine similarity to the query, in [-1, 1]
 */
public record ScoredChunk(ChunkRecord chunk, double score) {

  /** Ranking order: higher score first, then lower ordinal, then document id. */
  public static final Comparator<ScoredChunk> RANKING =
      Comparator.comparingDouble(ScoredChunk::score)
          .reversed()
          .thenComparingInt((ScoredChunk s) -> s.chunk().getOrdinal())
          .thenComparing(s -> s.chunk().getDocumentId().toString());
}
