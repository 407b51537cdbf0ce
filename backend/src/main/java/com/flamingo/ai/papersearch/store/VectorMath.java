package com.flamingo.ai.papersearch.store;

import java.util.List;

/** Vector helpers for similarity ranking. */
public final class VectorMath {

  private VectorMath() {}

  /**
   * Cosine similarity of two vectors.
   *
   * @return the similarity, or 0 when either vector has zero norm
   * @throws IllegalArgumentException if the dimensions differ
   */
  public static double cosine(List<Float> a, List<Float> b) {
    if (a.size() != b.size()) {
      throw new IllegalArgumentException(
          "Vector dimension mismatch: " + a.size() + " vs " + b.size());
    }
    double dot = 0;
    double normA = 0;
    double normB = 0;
    for (int i = 0; i < a.size(); i++) {
      double x = a.get(i);
      double y = b.get(i);
      dot += x * y;
      normA += x * x;
      normB += y * y;
    }
    if (normA == 0 || normB == 0) {
      return 0;
    }
    return dot / (Math.sqrt(normA) * Math.sqrt(normB));
  }
}
