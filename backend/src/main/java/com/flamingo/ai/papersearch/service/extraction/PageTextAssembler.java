package com.flamingo.ai.papersearch.service.extraction;

import com.flamingo.ai.papersearch.service.extraction.model.Glyph;
import com.flamingo.ai.papersearch.service.extraction.model.PageLayout;
import com.flamingo.ai.papersearch.service.extraction.model.PageText;
import com.flamingo.ai.papersearch.service.extraction.model.TextLine;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Groups page glyphs into lines and orders them for reading.
 *
 * <p>On two-column pages every line of the left column is emitted before any line of the right
 * column. Lines that run across the gutter (a centred title, a full-width abstract) are emitted
 * before the columns when they sit above them and after the columns when they sit below.
 */
@Component
public class PageTextAssembler {

  /** Baseline distance, relative to the font size, within which glyphs share a line. */
  private static final float SAME_LINE_RATIO = 0.5f;

  /** Gap across the gutter, relative to the font size, below which a line spans both columns. */
  private static final float SPANNING_GAP_RATIO = 0.6f;

  /** Vertical gap, relative to the font size, that starts a new paragraph. */
  private static final float PARAGRAPH_GAP_RATIO = 0.8f;

  /**
   * Assembles the text of one page.
   *
   * @param pageNumber 1-based page number
   * @param width page width
   * @param height page height
   * @param glyphs glyphs of the page in any order
   * @param layout the page layout
   * @return the page text with reading-order and page-wide lines
   */
  public PageText assemble(
      int pageNumber, float width, float height, List<Glyph> glyphs, PageLayout layout) {
    List<TextLine> pageLines = groupLines(glyphs);
    List<TextLine> ordered;
    String text;
    if (layout instanceof PageLayout.TwoColumn twoColumn) {
      List<List<TextLine>> blocks = splitColumns(pageLines, twoColumn.boundary());
      ordered = new ArrayList<>();
      StringBuilder sb = new StringBuilder();
      for (List<TextLine> block : blocks) {
        if (block.isEmpty()) {
          continue;
        }
        ordered.addAll(block);
        if (sb.length() > 0) {
          sb.append("\n\n");
        }
        sb.append(render(block));
      }
      text = sb.toString();
    } else {
      ordered = pageLines;
      text = render(pageLines);
    }
    return new PageText(pageNumber, width, height, layout, ordered, pageLines, glyphs, text);
  }

  /** Groups glyphs sharing a baseline into lines, ordered top to bottom. */
  List<TextLine> groupLines(List<Glyph> glyphs) {
    List<Glyph> sorted = new ArrayList<>(glyphs);
    sorted.sort(Comparator.comparingDouble(Glyph::baseline).thenComparingDouble(Glyph::x));

    List<TextLine> lines = new ArrayList<>();
    List<Glyph> current = new ArrayList<>();
    Glyph anchor = null;
    for (Glyph glyph : sorted) {
      if (anchor != null) {
        float tolerance = SAME_LINE_RATIO * Math.max(anchor.fontSize(), glyph.fontSize());
        if (glyph.baseline() - anchor.baseline() > tolerance) {
          addLine(lines, current);
          current = new ArrayList<>();
          anchor = null;
        }
      }
      current.add(glyph);
      if (anchor == null || (!glyph.isWhitespace() && glyph.fontSize() > anchor.fontSize())) {
        anchor = glyph;
      }
    }
    addLine(lines, current);
    lines.sort(Comparator.comparingDouble(l -> l.box().top()));
    return lines;
  }

  private void addLine(List<TextLine> lines, List<Glyph> glyphs) {
    if (glyphs.isEmpty()) {
      return;
    }
    TextLine line = TextLine.of(glyphs);
    if (!line.isBlank()) {
      lines.add(line);
    }
  }

  /** Returns header, left column, right column and footer blocks. */
  private List<List<TextLine>> splitColumns(List<TextLine> pageLines, float boundary) {
    List<TextLine> spanning = new ArrayList<>();
    List<TextLine> left = new ArrayList<>();
    List<TextLine> right = new ArrayList<>();
    for (TextLine line : pageLines) {
      if (spansGutter(line, boundary)) {
        spanning.add(line);
        continue;
      }
      List<Glyph> leftGlyphs = new ArrayList<>();
      List<Glyph> rightGlyphs = new ArrayList<>();
      for (Glyph glyph : line.glyphs()) {
        (glyph.centerX() < boundary ? leftGlyphs : rightGlyphs).add(glyph);
      }
      addLine(left, leftGlyphs);
      addLine(right, rightGlyphs);
    }

    float columnsTop = Float.MAX_VALUE;
    float columnsBottom = -Float.MAX_VALUE;
    for (TextLine line : left) {
      columnsTop = Math.min(columnsTop, line.box().top());
      columnsBottom = Math.max(columnsBottom, line.box().bottom());
    }
    for (TextLine line : right) {
      columnsTop = Math.min(columnsTop, line.box().top());
      columnsBottom = Math.max(columnsBottom, line.box().bottom());
    }

    List<TextLine> header = new ArrayList<>();
    List<TextLine> footer = new ArrayList<>();
    for (TextLine line : spanning) {
      if (line.box().bottom() <= columnsTop) {
        header.add(line);
      } else if (line.box().top() >= columnsBottom) {
        footer.add(line);
      } else {
        left.add(line);
      }
    }
    Comparator<TextLine> byTop = Comparator.comparingDouble(l -> l.box().top());
    left.sort(byTop);
    right.sort(byTop);
    return List.of(header, left, right, footer);
  }

  /** A line spans the gutter when no wide gap separates its glyphs at the boundary. */
  private boolean spansGutter(TextLine line, float boundary) {
    Glyph lastLeft = null;
    Glyph firstRight = null;
    for (Glyph glyph : line.glyphs()) {
      if (glyph.isWhitespace()) {
        continue;
      }
      if (glyph.centerX() < boundary) {
        lastLeft = glyph;
      } else if (firstRight == null) {
        firstRight = glyph;
      }
    }
    if (lastLeft == null || firstRight == null) {
      return false;
    }
    float gap = firstRight.x() - lastLeft.right();
    return gap < SPANNING_GAP_RATIO * line.fontSize();
  }

  private String render(List<TextLine> lines) {
    StringBuilder sb = new StringBuilder();
    TextLine previous = null;
    for (TextLine line : lines) {
      if (previous != null) {
        float gap = line.box().top() - previous.box().bottom();
        sb.append(gap > PARAGRAPH_GAP_RATIO * previous.fontSize() ? "\n\n" : "\n");
      }
      sb.append(line.text());
      previous = line;
    }
    return sb.toString();
  }
}
