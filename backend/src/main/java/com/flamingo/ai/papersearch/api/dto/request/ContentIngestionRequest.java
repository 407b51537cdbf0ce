package com.flamingo.ai.papersearch.api.dto.request;

import com.flamingo.ai.papersearch.service.extraction.model.SectionText;
import com.flamingo.ai.papersearch.service.ingestion.ExtractedContent;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO carrying text that was extracted outside this service. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContentIngestionRequest {

  /** Recorded when the document does not exist yet. */
  private String fileName;

  @NotNull(message = "Full text is required")
  private String fullText;

  private List<SectionText> sections;

  public ExtractedContent toContent() {
    return new ExtractedContent(fullText, sections);
  }
}
