package com.flamingo.ai.papersearch.service.embedding;

import java.util.List;

/** Narrow seam over whatever model turns text into fixed-size vectors. */
public interface EmbeddingClient {

  /**
   * Embeds one text.
   *
   * @param text the text, possibly blank
   * @return a vector of {@link #dimensions()} values
   */
  List<Float> embed(String text);

  /**
   * Embeds several texts in one model call.
   *
   * @param texts the texts
   * @return one vector per text, in input order
   */
  List<List<Float>> embedAll(List<String> texts);

  /** Dimension of every vector this client returns. */
  int dimensions();
}
