package com.flamingo.ai.papersearch.service.chunking;

import com.flamingo.ai.papersearch.service.extraction.model.PageMap;
import com.flamingo.ai.papersearch.service.extraction.model.SectionText;
import java.util.List;

/**
 * Input of a {@link DocumentChunker}.
 *
 * @param fullText the whole document text, used when no section carries text
 * @param sections section texts in the order they should be chunked
 * @param pageMap page start offsets, or null when page numbers are unknown
 */
public record ChunkingRequest(String fullText, List<SectionText> sections, PageMap pageMap) {

  public ChunkingRequest {
    fullText = fullText == null ? "" : fullText;
    sections = sections == null ? List.of() : List.copyOf(sections);
  }
}
