package com.flamingo.ai.papersearch.service.extraction;

import com.flamingo.ai.papersearch.config.RagConfig;
import com.flamingo.ai.papersearch.domain.enums.StageStatus;
import com.flamingo.ai.papersearch.exception.DocumentProcessingException;
import com.flamingo.ai.papersearch.service.extraction.model.ExtractedFigure;
import com.flamingo.ai.papersearch.service.extraction.model.ExtractedPaper;
import com.flamingo.ai.papersearch.service.extraction.model.ExtractedReference;
import com.flamingo.ai.papersearch.service.extraction.model.ExtractedTable;
import com.flamingo.ai.papersearch.service.extraction.model.Glyph;
import com.flamingo.ai.papersearch.service.extraction.model.PageLayout;
import com.flamingo.ai.papersearch.service.extraction.model.PageMap;
import com.flamingo.ai.papersearch.service.extraction.model.PageText;
import com.flamingo.ai.papersearch.service.extraction.model.SectionText;
import io.micrometer.core.annotation.Timed;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.springframework.stereotype.Service;

/**
 * Recovers the structure of a research paper PDF.
 *
 * <p>Every page is laid out independently (single or two columns) and assembled into reading
 * order. On top of the page texts four stages run, each guarded on its own so that a failure in
 * one leaves the others intact:
 *
 * <ol>
 *   <li>text: full text, sections, title, authors, DOI and keywords
 *   <li>tables: ruled grids with captions
 *   <li>figures: raster images with captions, stored through {@link FigureStorage}
 *   <li>references: the parsed bibliography
 * </ol>
 *
 * <p>An unreadable PDF, or one with more pages than allowed, is rejected with a {@link
 * DocumentProcessingException}. The extraction checks for interruption between pages and stops
 * with a {@link CancellationException} when interrupted.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PdfStructureExtractor {

  static final String PAGE_SEPARATOR = "\n\n";

  private final RagConfig ragConfig;
  private final LayoutAnalyzer layoutAnalyzer;
  private final PageTextAssembler pageTextAssembler;
  private final TitleAuthorExtractor titleAuthorExtractor;
  private final SectionClassifier sectionClassifier;
  private final TableExtractor tableExtractor;
  private final FigureExtractor figureExtractor;
  private final ReferenceParser referenceParser;
  private final PaperMetadataExtractor paperMetadataExtractor;

  /**
   * Extracts the structure of a PDF.
   *
   * @param documentId the document being processed
   * @param pdf the raw PDF bytes
   * @return the extracted paper with per-stage status
   * @throws DocumentProcessingException if the PDF cannot be read or has too many pages
   * @throws CancellationException if the calling thread is interrupted
   */
  @Timed(value = "document.extraction", description = "Time to extract the structure of a PDF")
  public ExtractedPaper extract(UUID documentId, byte[] pdf) {
    try (PDDocument document = Loader.loadPDF(pdf)) {
      return extract(documentId, document);
    } catch (IOException e) {
      throw new DocumentProcessingException(documentId, "Unreadable PDF: " + e.getMessage(), e);
    }
  }

  private ExtractedPaper extract(UUID documentId, PDDocument document) throws IOException {
    int pageCount = document.getNumberOfPages();
    int maxPages = ragConfig.getExtraction().getMaxPages();
    if (pageCount > maxPages) {
      throw new DocumentProcessingException(
          documentId,
          "PDF has " + pageCount + " pages, limit is " + maxPages,
          "Document has too many pages");
    }
    log.info("Extracting {} pages from document {}", pageCount, documentId);

    ExtractedPaper.ExtractedPaperBuilder builder = ExtractedPaper.builder().pageCount(pageCount);
    boolean textFailed = false;

    GlyphCollector glyphCollector = new GlyphCollector();
    List<PageText> pages = new ArrayList<>();
    for (int pageNumber = 1; pageNumber <= pageCount; pageNumber++) {
      checkInterrupted(documentId);
      PDPage page = document.getPage(pageNumber - 1);
      PDRectangle cropBox = page.getCropBox();
      List<Glyph> glyphs;
      try {
        glyphs = glyphCollector.collect(document, pageNumber);
      } catch (IOException | RuntimeException e) {
        log.warn(
            "Text of page {} in document {} unreadable: {}",
            pageNumber,
            documentId,
            e.getMessage());
        textFailed = true;
        glyphs = List.of();
      }
      PageLayout layout = layoutAnalyzer.analyze(glyphs, cropBox.getWidth());
      PageText pageText =
          pageTextAssembler.assemble(
              pageNumber, cropBox.getWidth(), cropBox.getHeight(), glyphs, layout);
      log.debug(
          "Page {}: {} glyphs, {} lines, two-column={}",
          pageNumber,
          glyphs.size(),
          pageText.lines().size(),
          layout.isTwoColumn());
      pages.add(pageText);
    }

    StringBuilder fullText = new StringBuilder();
    List<Integer> pageStarts = new ArrayList<>();
    for (PageText page : pages) {
      if (fullText.length() > 0) {
        fullText.append(PAGE_SEPARATOR);
      }
      pageStarts.add(fullText.length());
      fullText.append(page.text());
    }
    String text = fullText.toString();
    builder.fullText(text).pageMap(new PageMap(List.copyOf(pageStarts)));

    builder.textStatus(textStage(documentId, document, pages, text, builder, textFailed));
    checkInterrupted(documentId);
    builder.tablesStatus(tablesStage(documentId, document, pages, builder));
    checkInterrupted(documentId);
    builder.figuresStatus(figuresStage(documentId, document, pages, builder));
    checkInterrupted(documentId);
    builder.referencesStatus(referencesStage(documentId, text, builder));

    ExtractedPaper paper = builder.build();
    log.info(
        "Extracted document {}: {} sections, {} tables, {} figures, {} references",
        documentId,
        paper.getSections().size(),
        paper.getTables().size(),
        paper.getFigures().size(),
        paper.getReferences().size());
    return paper;
  }

  private StageStatus textStage(
      UUID documentId,
      PDDocument document,
      List<PageText> pages,
      String text,
      ExtractedPaper.ExtractedPaperBuilder builder,
      boolean pageFailed) {
    try {
      List<SectionText> sections = sectionClassifier.classify(text);
      builder.sections(sections);

      if (!pages.isEmpty()) {
        PageText firstPage = pages.get(0);
        Optional<String> title =
            titleAuthorExtractor.extractTitle(firstPage).or(() -> infoTitle(document));
        builder.title(title.orElse(null));
        builder.authors(titleAuthorExtractor.extractAuthors(firstPage).orElse(null));
      }
      builder.doi(paperMetadataExtractor.extractDoi(text).orElse(null));
      builder.keywords(paperMetadataExtractor.extractKeywords(text));
      return pageFailed ? StageStatus.FAILED : StageStatus.DONE;
    } catch (RuntimeException e) {
      log.warn("Text stage failed for document {}: {}", documentId, e.getMessage(), e);
      return StageStatus.FAILED;
    }
  }

  private StageStatus tablesStage(
      UUID documentId,
      PDDocument document,
      List<PageText> pages,
      ExtractedPaper.ExtractedPaperBuilder builder) {
    List<ExtractedTable> tables = new ArrayList<>();
    StageStatus status = StageStatus.DONE;
    for (PageText pageText : pages) {
      try {
        tables.addAll(
            tableExtractor.extract(document.getPage(pageText.pageNumber() - 1), pageText));
      } catch (IOException | RuntimeException e) {
        log.warn(
            "Table detection failed on page {} of document {}: {}",
            pageText.pageNumber(),
            documentId,
            e.getMessage());
        status = StageStatus.FAILED;
      }
    }
    builder.tables(List.copyOf(tables));
    return status;
  }

  private StageStatus figuresStage(
      UUID documentId,
      PDDocument document,
      List<PageText> pages,
      ExtractedPaper.ExtractedPaperBuilder builder) {
    List<ExtractedFigure> figures = new ArrayList<>();
    StageStatus status = StageStatus.DONE;
    for (PageText pageText : pages) {
      try {
        figures.addAll(
            figureExtractor.extract(
                documentId, document.getPage(pageText.pageNumber() - 1), pageText));
      } catch (IOException | RuntimeException e) {
        log.warn(
            "Figure extraction failed on page {} of document {}: {}",
            pageText.pageNumber(),
            documentId,
            e.getMessage());
        status = StageStatus.FAILED;
      }
    }
    builder.figures(List.copyOf(figures));
    return status;
  }

  private StageStatus referencesStage(
      UUID documentId, String text, ExtractedPaper.ExtractedPaperBuilder builder) {
    try {
      List<ExtractedReference> references = referenceParser.parse(text);
      builder.references(references);
      return StageStatus.DONE;
    } catch (RuntimeException e) {
      log.warn("Reference parsing failed for document {}: {}", documentId, e.getMessage(), e);
      return StageStatus.FAILED;
    }
  }

  private Optional<String> infoTitle(PDDocument document) {
    PDDocumentInformation info = document.getDocumentInformation();
    if (info == null || info.getTitle() == null || info.getTitle().isBlank()) {
      return Optional.empty();
    }
    return Optional.of(info.getTitle().trim());
  }

  private void checkInterrupted(UUID documentId) {
    if (Thread.currentThread().isInterrupted()) {
      log.warn("Extraction of document {} interrupted", documentId);
      throw new CancellationException("Extraction of document " + documentId + " interrupted");
    }
  }
}
