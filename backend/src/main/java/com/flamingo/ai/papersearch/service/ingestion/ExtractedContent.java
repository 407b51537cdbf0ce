package com.flamingo.ai.papersearch.service.ingestion;

import com.flamingo.ai.papersearch.service.extraction.model.SectionText;
import java.util.List;

/**
 * Text supplied by a caller that extracted the document itself.
 *
 * @param fullText the document text in reading order
 * @param sections optional section split; when empty the whole text is chunked as one section
 */
public record ExtractedContent(String fullText, List<SectionText> sections) {

  public ExtractedContent {
    fullText = fullText == null ? "" : fullText;
    sections = sections == null ? List.of() : List.copyOf(sections);
  }
}
