package com.flamingo.ai.papersearch.service.search;

import com.flamingo.ai.papersearch.domain.enums.ChunkType;
import java.util.UUID;

/**
 * A semantic search over indexed chunks.
 *
 * @param query the query text; may be empty but not null
 * @param maxResults requested number of hits, or null for the configured default
 * @param documentId restricts hits to one document, or null
 * @param section restricts hits to one section label, or null
 * @param chunkType restricts hits to one content type, or null
 */
public record SearchCommand(
    String query, Integer maxResults, UUID documentId, String section, ChunkType chunkType) {

  public static SearchCommand of(String query) {
    return new SearchCommand(query, null, null, null, null);
  }
}
