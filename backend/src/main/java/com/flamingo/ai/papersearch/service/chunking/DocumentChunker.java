package com.flamingo.ai.papersearch.service.chunking;

import java.util.List;

/**
 * Splits extracted paper text into {@link RawChunk}s ready for embedding.
 *
 * <p>Implementations must be stateless and deterministic: the same request always yields the same
 * chunks.
 */
public interface DocumentChunker {

  /**
   * Produces chunks from the section texts of a document.
   *
   * @param request full text, sections and optional page map
   * @return ordered list of chunks with globally increasing ordinals
   */
  List<RawChunk> chunk(ChunkingRequest request);
}
