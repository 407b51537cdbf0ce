package com.flamingo.ai.papersearch.api.dto.response;

import com.flamingo.ai.papersearch.domain.entity.Document;
import com.flamingo.ai.papersearch.domain.enums.DocumentStatus;
import com.flamingo.ai.papersearch.domain.enums.StageStatus;
import com.flamingo.ai.papersearch.service.extraction.model.SectionText;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for document data. Extracted artifacts are served by their own endpoints. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentResponse {

  private UUID id;
  private String fileName;
  private Long fileSize;
  private Integer pageCount;
  private String title;
  private List<String> authors;
  private String doi;
  private List<String> keywords;
  private DocumentStatus status;
  private StageStatus textStatus;
  private StageStatus tablesStatus;
  private StageStatus figuresStatus;
  private StageStatus referencesStatus;
  private List<String> sections;
  private int tableCount;
  private int figureCount;
  private int referenceCount;
  private Integer chunkCount;
  private List<Integer> failedChunkOrdinals;
  private String processingError;
  private LocalDateTime uploadedAt;
  private LocalDateTime processedAt;

  /** Creates a DocumentResponse from a Document entity. */
  public static DocumentResponse fromEntity(Document document) {
    return DocumentResponse.builder()
        .id(document.getId())
        .fileName(document.getFileName())
        .fileSize(document.getFileSize())
        .pageCount(document.getPageCount())
        .title(document.getTitle())
        .authors(document.getAuthors())
        .doi(document.getDoi())
        .keywords(document.getKeywords())
        .status(document.getStatus())
        .textStatus(document.getTextStatus())
        .tablesStatus(document.getTablesStatus())
        .figuresStatus(document.getFiguresStatus())
        .referencesStatus(document.getReferencesStatus())
        .sections(document.getSections().stream().map(SectionText::label).toList())
        .tableCount(document.getTables().size())
        .figureCount(document.getFigures().size())
        .referenceCount(document.getReferences().size())
        .chunkCount(document.getChunkCount())
        .failedChunkOrdinals(document.getFailedChunkOrdinals())
        .processingError(document.getProcessingError())
        .uploadedAt(document.getUploadedAt())
        .processedAt(document.getProcessedAt())
        .build();
  }
}
