package com.flamingo.ai.papersearch.service.extraction;

import com.flamingo.ai.papersearch.service.extraction.model.Glyph;
import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;

/**
 * Collects the glyphs of a single page with their positions.
 *
 * <p>The stripper's own text output is discarded; only the positioned characters are kept so that
 * line grouping and column ordering can be done by {@link PageTextAssembler}.
 */
final class GlyphCollector extends PDFTextStripper {

  private final List<Glyph> glyphs = new ArrayList<>();

  GlyphCollector() throws IOException {
    super();
  }

  /**
   * Returns the glyphs of the given page.
   *
   * @param document the loaded document
   * @param pageNumber 1-based page number
   * @return glyphs in content-stream order
   * @throws IOException if the page content cannot be parsed
   */
  List<Glyph> collect(PDDocument document, int pageNumber) throws IOException {
    glyphs.clear();
    setStartPage(pageNumber);
    setEndPage(pageNumber);
    writeText(document, new StringWriter());
    return List.copyOf(glyphs);
  }

  @Override
  protected void processTextPosition(TextPosition text) {
    Glyph glyph = Glyph.from(text);
    if (!glyph.text().isEmpty()) {
      glyphs.add(glyph);
    }
  }
}
