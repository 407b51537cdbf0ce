package com.flamingo.ai.papersearch.domain.entity;

import com.flamingo.ai.papersearch.domain.converter.FigureListConverter;
import com.flamingo.ai.papersearch.domain.converter.IntegerListConverter;
import com.flamingo.ai.papersearch.domain.converter.ReferenceListConverter;
import com.flamingo.ai.papersearch.domain.converter.SectionListConverter;
import com.flamingo.ai.papersearch.domain.converter.StringListConverter;
import com.flamingo.ai.papersearch.domain.converter.TableListConverter;
import com.flamingo.ai.papersearch.domain.enums.DocumentStatus;
import com.flamingo.ai.papersearch.domain.enums.StageStatus;
import com.flamingo.ai.papersearch.service.extraction.model.ExtractedFigure;
import com.flamingo.ai.papersearch.service.extraction.model.ExtractedPaper;
import com.flamingo.ai.papersearch.service.extraction.model.ExtractedReference;
import com.flamingo.ai.papersearch.service.extraction.model.ExtractedTable;
import com.flamingo.ai.papersearch.service.extraction.model.SectionText;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * An uploaded research paper and everything extracted from it.
 *
 * <p>The identifier is assigned at upload so that figures and chunks can be keyed before the row
 * is first flushed.
 */
@Entity
@Table(name = "documents")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Document {

  @Id private UUID id;

  @Column(nullable = false)
  private String fileName;

  private Long fileSize;

  private Integer pageCount;

  @Column(columnDefinition = "TEXT")
  private String title;

  @Convert(converter = StringListConverter.class)
  @Column(columnDefinition = "TEXT")
  private List<String> authors;

  private String doi;

  @Convert(converter = StringListConverter.class)
  @Column(columnDefinition = "TEXT")
  @Builder.Default
  private List<String> keywords = new ArrayList<>();

  @Column(columnDefinition = "TEXT")
  private String fullText;

  /** Section texts in canonical paper order. */
  @Convert(converter = SectionListConverter.class)
  @Column(columnDefinition = "TEXT")
  @Builder.Default
  private List<SectionText> sections = new ArrayList<>();

  @Convert(converter = TableListConverter.class)
  @Column(columnDefinition = "TEXT")
  @Builder.Default
  private List<ExtractedTable> tables = new ArrayList<>();

  @Convert(converter = FigureListConverter.class)
  @Column(columnDefinition = "TEXT")
  @Builder.Default
  private List<ExtractedFigure> figures = new ArrayList<>();

  @Convert(converter = ReferenceListConverter.class)
  @Column(name = "reference_list", columnDefinition = "TEXT")
  @Builder.Default
  private List<ExtractedReference> references = new ArrayList<>();

  @Enumerated(EnumType.STRING)
  @Builder.Default
  private StageStatus textStatus = StageStatus.PENDING;

  @Enumerated(EnumType.STRING)
  @Builder.Default
  private StageStatus tablesStatus = StageStatus.PENDING;

  @Enumerated(EnumType.STRING)
  @Builder.Default
  private StageStatus figuresStatus = StageStatus.PENDING;

  @Enumerated(EnumType.STRING)
  @Builder.Default
  private StageStatus referencesStatus = StageStatus.PENDING;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  @Builder.Default
  private DocumentStatus status = DocumentStatus.UPLOADED;

  /** Number of chunks in the searchable chunk set. */
  @Builder.Default private Integer chunkCount = 0;

  /** Ordinals of chunks whose embedding failed and which are therefore not searchable. */
  @Convert(converter = IntegerListConverter.class)
  @Column(columnDefinition = "TEXT")
  @Builder.Default
  private List<Integer> failedChunkOrdinals = new ArrayList<>();

  /** Error message if processing failed. */
  @Column(columnDefinition = "TEXT")
  private String processingError;

  @Column(nullable = false, updatable = false)
  private LocalDateTime uploadedAt;

  private LocalDateTime processedAt;

  @PrePersist
  protected void onCreate() {
    if (uploadedAt == null) {
      uploadedAt = LocalDateTime.now();
    }
  }

  /** Copies the extraction result onto this document. */
  public void applyExtraction(ExtractedPaper paper) {
    this.pageCount = paper.getPageCount();
    this.title = paper.getTitle();
    this.authors = paper.getAuthors();
    this.doi = paper.getDoi();
    this.keywords = new ArrayList<>(paper.getKeywords());
    this.fullText = paper.getFullText();
    this.sections = new ArrayList<>(paper.getSections());
    this.tables = new ArrayList<>(paper.getTables());
    this.figures = new ArrayList<>(paper.getFigures());
    this.references = new ArrayList<>(paper.getReferences());
    this.textStatus = paper.getTextStatus();
    this.tablesStatus = paper.getTablesStatus();
    this.figuresStatus = paper.getFiguresStatus();
    this.referencesStatus = paper.getReferencesStatus();
  }

  /** Records that extraction produced nothing, so none of its stages completed. */
  public void markExtractionFailed() {
    this.textStatus = StageStatus.FAILED;
    this.tablesStatus = StageStatus.FAILED;
    this.figuresStatus = StageStatus.FAILED;
    this.referencesStatus = StageStatus.FAILED;
  }

  /** Marks the document as searchable. */
  public void markIndexed(int chunkCount, List<Integer> failedOrdinals) {
    this.status = DocumentStatus.INDEXED;
    this.chunkCount = chunkCount;
    this.failedChunkOrdinals = new ArrayList<>(failedOrdinals);
    this.processingError = null;
    this.processedAt = LocalDateTime.now();
  }

  /** Marks the document as failed with an error message. */
  public void markFailed(String errorMessage) {
    this.status = DocumentStatus.FAILED;
    this.processingError = errorMessage;
    this.processedAt = LocalDateTime.now();
  }
}
