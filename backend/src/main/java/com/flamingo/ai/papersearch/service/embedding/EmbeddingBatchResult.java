package com.flamingo.ai.papersearch.service.embedding;

import java.util.List;

/**
 * Vectors for a list of texts, with the texts that could not be embedded.
 *
 * @param vectors one entry per input text, null where embedding failed
 * @param failedIndices input positions whose embedding failed, ascending
 */
public record EmbeddingBatchResult(List<List<Float>> vectors, List<Integer> failedIndices) {

  public boolean allFailed() {
    return !vectors.isEmpty() && failedIndices.size() == vectors.size();
  }
}
