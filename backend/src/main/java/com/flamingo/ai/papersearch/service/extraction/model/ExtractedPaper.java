package com.flamingo.ai.papersearch.service.extraction.model;

import com.flamingo.ai.papersearch.domain.enums.StageStatus;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

/** Result of structural extraction, including which stages succeeded. */
@Getter
@Builder
public class ExtractedPaper {

  private final int pageCount;
  private final String title;
  private final List<String> authors;
  private final String doi;
  @Builder.Default private final List<String> keywords = List.of();
  @Builder.Default private final String fullText = "";

  /** Sections in canonical paper order. */
  @Builder.Default private final List<SectionText> sections = List.of();

  private final PageMap pageMap;
  @Builder.Default private final List<ExtractedTable> tables = List.of();
  @Builder.Default private final List<ExtractedFigure> figures = List.of();
  @Builder.Default private final List<ExtractedReference> references = List.of();

  @Builder.Default private final StageStatus textStatus = StageStatus.PENDING;
  @Builder.Default private final StageStatus tablesStatus = StageStatus.PENDING;
  @Builder.Default private final StageStatus figuresStatus = StageStatus.PENDING;
  @Builder.Default private final StageStatus referencesStatus = StageStatus.PENDING;
}
