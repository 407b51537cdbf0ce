package com.flamingo.ai.papersearch.service.extraction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.papersearch.config.RagConfig;
import com.flamingo.ai.papersearch.domain.enums.StageStatus;
import com.flamingo.ai.papersearch.exception.DocumentProcessingException;
import com.flamingo.ai.papersearch.service.extraction.model.ExtractedFigure;
import com.flamingo.ai.papersearch.service.extraction.model.ExtractedPaper;
import com.flamingo.ai.papersearch.service.extraction.model.ExtractedReference;
import com.flamingo.ai.papersearch.service.extraction.model.ExtractedTable;
import com.flamingo.ai.papersearch.service.extraction.model.SectionText;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PdfStructureExtractorTest {

  private static final String TITLE = "Structured Retrieval of Research Papers";
  private static final float COLUMN_TOP = PaperPdfBuilder.TOP + 12f;

  private static final String[] FIRST_AUTHORS = {
    "A. Smith", "B. Okafor", "C. Lindqvist", "D. Ng", "E. Rossi", "F. Haddad", "G. Petrov"
  };
  private static final String[] SECOND_AUTHORS = {
    "H. Kim", "J. Alvarez-Ruiz", "K. Tanaka", "L. Dubois", "M. Chen", "N. Osei", "P. Novak",
    "R. Iyer", "S. Walsh", "T. Brandt", "V. Costa"
  };
  private static final String[] VENUES = {
    "Proc. SIGIR", "J. Doc. Eng.", "Proc. ACL", "Inf. Retr. J.", "Proc. EMNLP"
  };

  @TempDir Path figureDir;

  private RagConfig ragConfig;
  private PdfStructureExtractor extractor;
  private final UUID documentId = UUID.randomUUID();

  @BeforeEach
  void setUp() {
    ragConfig = new RagConfig();
    ragConfig.getFigures().setBasePath(figureDir.toString());
    CaptionLocator captionLocator = new CaptionLocator(ragConfig);
    extractor =
        new PdfStructureExtractor(
            ragConfig,
            new LayoutAnalyzer(ragConfig),
            new PageTextAssembler(),
            new TitleAuthorExtractor(ragConfig),
            new SectionClassifier(),
            new TableExtractor(captionLocator),
            new FigureExtractor(new LocalFigureStorage(ragConfig), captionLocator),
            new ReferenceParser(),
            new PaperMetadataExtractor(ragConfig));
  }

  /** The rendered paper plus the first-page column lines used for reading-order checks. */
  private record Paper(byte[] pdf, List<String> firstLeft, List<String> firstRight) {}

  private static String[][] cells(String... values) {
    String[][] rows = new String[values.length / 2][];
    for (int i = 0; i < rows.length; i++) {
      rows[i] = new String[] {values[2 * i], values[2 * i + 1]};
    }
    return rows;
  }

  private static String reference(int n) {
    String[] words = PaperPdfBuilder.sentences(1, 500 + n).split(" ");
    String title = String.join(" ", Arrays.copyOf(words, 5));
    return "["
        + n
        + "] "
        + FIRST_AUTHORS[n % FIRST_AUTHORS.length]
        + " and "
        + SECOND_AUTHORS[(n * 3) % SECOND_AUTHORS.length]
        + ", \""
        + title
        + ",\" "
        + VENUES[n % VENUES.length]
        + ", "
        + (1990 + n)
        + ".";
  }

  private Paper ninePagePaper() throws IOException {
    PaperPdfBuilder builder = new PaperPdfBuilder();

    PaperPdfBuilder.Page first =
        builder
            .page()
            .centered(TITLE, true, 18f, 80f)
            .centered("Alice Smith, Bob Jones and Carol White", false, 11f, 104f);
    PaperPdfBuilder.Column firstLeft =
        first
            .left(130f)
            .line("Example University")
            .line("contact: alice@example.edu")
            .line("DOI: 10.1234/papersearch.2024.001")
            .heading("Abstract")
            .paragraph(PaperPdfBuilder.sentences(3, 1))
            .heading("1 Introduction")
            .fill(100);
    PaperPdfBuilder.Column firstRight = first.right(130f).fill(200);

    PaperPdfBuilder.Page second = builder.page();
    second.left(COLUMN_TOP).figure("Figure 1: Layout of a two-column page", 64, 32, 1).fill(210);
    second
        .right(COLUMN_TOP)
        .heading("2 Related Work")
        .figure("Figure 2: Prior systems compared", 48, 48, 2)
        .fill(220);

    PaperPdfBuilder.Page third = builder.page();
    third
        .left(COLUMN_TOP)
        .heading("3 Methodology")
        .table(
            "Table 1: Corpus statistics",
            cells("Corpus", "Papers", "arXiv", "1200", "ACL", "800"))
        .fill(310);
    third
        .right(COLUMN_TOP)
        .figure("Figure 3: Pipeline overview", 80, 40, 3)
        .figure("Figure 4: Gutter detection", 60, 30, 4)
        .fill(320);

    PaperPdfBuilder.Page fourth = builder.page();
    fourth
        .left(COLUMN_TOP)
        .table("Table 2: Chunking parameters", cells("Size", "500", "Overlap", "50"))
        .fill(410);
    fourth.right(COLUMN_TOP).figure("Figure 5: Chunk length histogram", 50, 25, 5).fill(420);

    PaperPdfBuilder.Page fifth = builder.page();
    fifth
        .left(COLUMN_TOP)
        .heading("4 Results")
        .table(
            "Table 3: Retrieval quality",
            cells("BM25", "0.61", "Dense", "0.74", "Hybrid", "0.79"))
        .figure("Figure 6: Recall at depth", 70, 35, 6)
        .fill(510);
    fifth.right(COLUMN_TOP).figure("Figure 7: Precision at depth", 70, 35, 7).fill(520);

    PaperPdfBuilder.Page sixth = builder.page();
    sixth
        .left(COLUMN_TOP)
        .table("Table 4: Latency per query", cells("Local", "12 ms", "Remote", "85 ms"))
        .fill(610);
    sixth.right(COLUMN_TOP).figure("Figure 8: Latency distribution", 40, 40, 8).fill(620);

    PaperPdfBuilder.Page seventh = builder.page();
    seventh.left(COLUMN_TOP).figure("Figure 9: Error analysis", 36, 24, 9).fill(710);
    seventh.right(COLUMN_TOP).figure("Figure 10: Ablation overview", 52, 26, 10).fill(720);

    PaperPdfBuilder.Page eighth = builder.page();
    eighth.left(COLUMN_TOP).heading("5 Conclusion").fill(810);
    eighth.right(COLUMN_TOP + 16f).fill(820);

    PaperPdfBuilder.Column bibliography = builder.page().full(COLUMN_TOP).heading("References");
    for (int n = 1; n <= 28; n++) {
      bibliography.line(reference(n));
    }

    return new Paper(builder.build(), firstLeft.lines(), firstRight.lines());
  }

  @Nested
  @DisplayName("nine-page two-column paper")
  class NinePagePaper {

    private Paper paper;
    private ExtractedPaper extracted;

    @BeforeEach
    void extract() throws IOException {
      paper = ninePagePaper();
      extracted = extractor.extract(documentId, paper.pdf());
    }

    @Test
    @DisplayName("Should complete every stage")
    void shouldCompleteAllStages() {
      assertThat(extracted.getPageCount()).isEqualTo(9);
      assertThat(extracted.getTextStatus()).isEqualTo(StageStatus.DONE);
      assertThat(extracted.getTablesStatus()).isEqualTo(StageStatus.DONE);
      assertThat(extracted.getFiguresStatus()).isEqualTo(StageStatus.DONE);
      assertThat(extracted.getReferencesStatus()).isEqualTo(StageStatus.DONE);
    }

    @Test
    @DisplayName("Should extract title, authors and DOI from the first page")
    void shouldExtractMetadata() {
      assertThat(extracted.getTitle()).isEqualTo(TITLE);
      assertThat(extracted.getAuthors()).containsExactly("Alice Smith", "Bob Jones", "Carol White");
      assertThat(extracted.getDoi()).isEqualTo("10.1234/papersearch.2024.001");
      assertThat(extracted.getKeywords()).isNotEmpty();
    }

    @Test
    @DisplayName("Should read the left column before the right column")
    void shouldKeepColumnReadingOrder() {
      String text = extracted.getFullText();
      String lastLeft = paper.firstLeft().get(paper.firstLeft().size() - 1);
      String firstRight = paper.firstRight().get(0);

      assertThat(text.indexOf(TITLE)).isZero();
      assertThat(text.indexOf(lastLeft)).isPositive();
      assertThat(text.indexOf(firstRight)).isGreaterThan(text.indexOf(lastLeft));
      assertThat(text.indexOf("1 Introduction")).isLessThan(text.indexOf(firstRight));
    }

    @Test
    @DisplayName("Should classify the numbered section headings")
    void shouldClassifySections() {
      assertThat(extracted.getSections())
          .extracting(SectionText::label)
          .contains(
              "abstract",
              "introduction",
              "related_work",
              "methodology",
              "results",
              "conclusion",
              "references");
    }

    @Test
    @DisplayName("Should map full-text offsets back to pages")
    void shouldMapOffsetsToPages() {
      String text = extracted.getFullText();

      assertThat(extracted.getPageMap().pageAt(0)).isEqualTo(1);
      assertThat(extracted.getPageMap().pageAt(text.indexOf("3 Methodology"))).isEqualTo(3);
      assertThat(extracted.getPageMap().pageAt(text.indexOf("5 Conclusion"))).isEqualTo(8);
      assertThat(extracted.getPageMap().pageAt(text.length() - 1)).isEqualTo(9);
    }

    @Test
    @DisplayName("Should find the four ruled tables with their captions")
    void shouldExtractTables() {
      List<ExtractedTable> tables = extracted.getTables();

      assertThat(tables).hasSize(4);
      assertThat(tables).extracting(ExtractedTable::pageNumber).containsExactly(3, 4, 5, 6);
      assertThat(tables).extracting(ExtractedTable::index).containsOnly(1);
      for (int i = 0; i < tables.size(); i++) {
        assertThat(tables.get(i).caption()).startsWith("Table " + (i + 1) + ":");
      }
      assertThat(tables.get(2).cells())
          .containsExactly(
              List.of("BM25", "0.61"), List.of("Dense", "0.74"), List.of("Hybrid", "0.79"));
    }

    @Test
    @DisplayName("Should extract all ten images and store them")
    void shouldExtractFigures() {
      List<ExtractedFigure> figures = extracted.getFigures();

      assertThat(figures).hasSize(10);
      assertThat(figures)
          .extracting(ExtractedFigure::pageNumber)
          .containsExactly(2, 2, 3, 3, 4, 5, 5, 6, 7, 7);
      for (int i = 0; i < figures.size(); i++) {
        ExtractedFigure figure = figures.get(i);
        assertThat(figure.caption()).startsWith("Figure " + (i + 1) + ":");
        assertThat(figure.imagePath()).isNotNull();
        assertThat(Path.of(figure.imagePath())).exists();
      }
      assertThat(figures.get(0).width()).isEqualTo(64);
      assertThat(figures.get(0).height()).isEqualTo(32);
      assertThat(figures.get(3).index()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should parse all 28 bibliography entries")
    void shouldParseReferences() {
      List<ExtractedReference> references = extracted.getReferences();

      assertThat(references).hasSize(28);
      for (int i = 0; i < references.size(); i++) {
        ExtractedReference reference = references.get(i);
        assertThat(reference.index()).isEqualTo(i + 1);
        assertThat(reference.year()).isEqualTo(1991 + i);
        assertThat(reference.authors()).hasSize(2);
        assertThat(reference.title()).isNotBlank();
      }
    }
  }

  @Test
  @DisplayName("Should fall back to the document info title for a page without text")
  void shouldUseInfoTitle_whenPageHasNoText() throws IOException {
    // Given
    PaperPdfBuilder builder = new PaperPdfBuilder().infoTitle("Metadata Title");
    builder.page();
    byte[] pdf = builder.build();

    // When
    ExtractedPaper extracted = extractor.extract(documentId, pdf);

    // Then
    assertThat(extracted.getPageCount()).isEqualTo(1);
    assertThat(extracted.getTitle()).isEqualTo("Metadata Title");
    assertThat(extracted.getFullText()).isEmpty();
    assertThat(extracted.getSections()).isEmpty();
    assertThat(extracted.getReferences()).isEmpty();
    assertThat(extracted.getTextStatus()).isEqualTo(StageStatus.DONE);
  }

  @Test
  @DisplayName("Should reject documents over the page limit")
  void shouldThrow_whenTooManyPages() throws IOException {
    // Given
    ragConfig.getExtraction().setMaxPages(2);
    PaperPdfBuilder builder = new PaperPdfBuilder();
    for (int i = 0; i < 3; i++) {
      builder.page().full(COLUMN_TOP).line("Page body.");
    }
    byte[] pdf = builder.build();

    // When / Then
    assertThatThrownBy(() -> extractor.extract(documentId, pdf))
        .isInstanceOf(DocumentProcessingException.class)
        .hasFieldOrPropertyWithValue("userMessage", "Document has too many pages");
  }

  @Test
  @DisplayName("Should reject bytes that are not a PDF")
  void shouldThrow_whenPdfUnreadable() {
    byte[] garbage = "definitely not a pdf".getBytes(StandardCharsets.UTF_8);

    assertThatThrownBy(() -> extractor.extract(documentId, garbage))
        .isInstanceOf(DocumentProcessingException.class)
        .hasMessageStartingWith("Unreadable PDF");
  }

  @Test
  @DisplayName("Should stop with a cancellation when the thread is interrupted")
  void shouldCancel_whenInterrupted() throws IOException {
    // Given
    PaperPdfBuilder builder = new PaperPdfBuilder();
    builder.page().full(COLUMN_TOP).line("Page body.");
    byte[] pdf = builder.build();

    // When / Then
    Thread.currentThread().interrupt();
    try {
      assertThatThrownBy(() -> extractor.extract(documentId, pdf))
          .isInstanceOf(CancellationException.class);
    } finally {
      Thread.interrupted();
    }
    assertThat(Files.exists(figureDir.resolve(documentId.toString()))).isFalse();
  }
}
