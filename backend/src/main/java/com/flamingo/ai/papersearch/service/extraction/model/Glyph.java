package com.flamingo.ai.papersearch.service.extraction.model;

import org.apache.pdfbox.text.TextPosition;

/**
 * One rendered character with its position in top-left page coordinates.
 *
 * @param text the Unicode text of the glyph (ligatures may carry several characters)
 * @param x left edge
 * @param baseline baseline y, measured down from the top of the page
 * @param width advance width
 * @param height glyph height
 * @param fontSize rendered font size in points
 */
public record Glyph(
    String text, float x, float baseline, float width, float height, float fontSize) {

  /** Creates a glyph from a PDFBox text position. */
  public static Glyph from(TextPosition position) {
    String unicode = position.getUnicode() != null ? position.getUnicode() : "";
    float size = position.getFontSizeInPt();
    if (size <= 0) {
      size = position.getHeightDir();
    }
    return new Glyph(
        unicode,
        position.getXDirAdj(),
        position.getYDirAdj(),
        position.getWidthDirAdj(),
        position.getHeightDir(),
        size);
  }

  public float centerX() {
    return x + width / 2f;
  }

  public float right() {
    return x + width;
  }

  /** Top edge, falling back to the font size when the font reports no glyph height. */
  public float top() {
    float h = height > 0 ? height : fontSize;
    return baseline - h;
  }

  public boolean isWhitespace() {
    return text.isBlank();
  }
}
