package com.flamingo.ai.papersearch.service.extraction.model;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Predicate;

/**
 * A run of glyphs sharing a baseline, sorted left to right.
 *
 * @param text the line text with inferred word spaces
 * @param box bounding box of the visible glyphs
 * @param fontSize average font size of the visible glyphs
 * @param glyphs the glyphs, sorted by x
 */
public record TextLine(String text, BoundingBox box, float fontSize, List<Glyph> glyphs) {

  /** Gap between glyphs, as a fraction of the font size, that reads as a word space. */
  private static final float WORD_GAP_RATIO = 0.12f;

  /** Builds a line from unsorted glyphs. */
  public static TextLine of(List<Glyph> glyphs) {
    if (glyphs.isEmpty()) {
      throw new IllegalArgumentException("A text line needs at least one glyph");
    }
    List<Glyph> sorted = new ArrayList<>(glyphs);
    sorted.sort(Comparator.comparingDouble(Glyph::x));

    float x0 = Float.MAX_VALUE;
    float top = Float.MAX_VALUE;
    float x1 = -Float.MAX_VALUE;
    float bottom = -Float.MAX_VALUE;
    double sizeSum = 0;
    int visible = 0;
    for (Glyph g : sorted) {
      if (g.isWhitespace()) {
        continue;
      }
      x0 = Math.min(x0, g.x());
      x1 = Math.max(x1, g.right());
      top = Math.min(top, g.top());
      bottom = Math.max(bottom, g.baseline());
      sizeSum += g.fontSize();
      visible++;
    }
    if (visible == 0) {
      Glyph first = sorted.get(0);
      return new TextLine(
          "",
          new BoundingBox(first.x(), first.top(), first.right(), first.baseline()),
          first.fontSize(),
          List.copyOf(sorted));
    }
    return new TextLine(
        join(sorted, g -> true),
        new BoundingBox(x0, top, x1, bottom),
        (float) (sizeSum / visible),
        List.copyOf(sorted));
  }

  /**
   * Re-renders the line text keeping only glyphs accepted by the filter.
   *
   * @param keep predicate selecting the glyphs to keep
   * @return the filtered text
   */
  public String text(Predicate<Glyph> keep) {
    return join(glyphs, keep);
  }

  public boolean isBlank() {
    return text.isBlank();
  }

  private static String join(List<Glyph> sorted, Predicate<Glyph> keep) {
    StringBuilder sb = new StringBuilder();
    Glyph previous = null;
    for (Glyph g : sorted) {
      if (g.text().isEmpty() || !keep.test(g)) {
        continue;
      }
      if (previous != null && !previous.isWhitespace() && !g.isWhitespace()) {
        float gap = g.x() - previous.right();
        if (gap > WORD_GAP_RATIO * Math.max(previous.fontSize(), g.fontSize())) {
          sb.append(' ');
        }
      }
      sb.append(g.text());
      previous = g;
    }
    return sb.toString().replaceAll("\\s+", " ").trim();
  }
}
