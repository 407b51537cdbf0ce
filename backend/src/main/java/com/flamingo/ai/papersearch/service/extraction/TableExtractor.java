package com.flamingo.ai.papersearch.service.extraction;

import com.flamingo.ai.papersearch.service.extraction.RulingCollector.Ruling;
import com.flamingo.ai.papersearch.service.extraction.model.BoundingBox;
import com.flamingo.ai.papersearch.service.extraction.model.ExtractedTable;
import com.flamingo.ai.papersearch.service.extraction.model.Glyph;
import com.flamingo.ai.papersearch.service.extraction.model.PageText;
import com.flamingo.ai.papersearch.service.extraction.model.TextLine;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.TreeSet;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDPage;
import org.springframework.stereotype.Component;

/**
 * Detects ruled tables: connected grids of horizontal and vertical rulings.
 *
 * <p>A grid needs at least two rulings in each direction. Its cells are the rectangles between
 * consecutive distinct ruling coordinates, and each glyph is placed in the cell holding its centre.
 * Borderless tables are not detected.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TableExtractor {

  /** Distance in points within which rulings touch or coordinates merge. */
  private static final float TOLERANCE = 2f;

  private final CaptionLocator captionLocator;

  /**
   * Extracts the ruled tables of one page.
   *
   * @param page the PDF page
   * @param pageText the assembled text of the same page
   * @return tables ordered top to bottom, then left to right, with 1-based per-page ordinals
   * @throws IOException if the page content stream cannot be read
   */
  public List<ExtractedTable> extract(PDPage page, PageText pageText) throws IOException {
    List<Ruling> rulings = new RulingCollector(page).collect();
    if (rulings.size() < 4) {
      return List.of();
    }
    List<List<Ruling>> grids = connectedGrids(rulings);

    List<BoundingBox> boxes = new ArrayList<>();
    List<List<List<String>>> cellGrids = new ArrayList<>();
    for (List<Ruling> grid : grids) {
      TreeSet<Float> rows = mergedPositions(grid, true);
      TreeSet<Float> columns = mergedPositions(grid, false);
      if (rows.size() < 2 || columns.size() < 2) {
        continue;
      }
      BoundingBox box = new BoundingBox(columns.first(), rows.first(), columns.last(), rows.last());
      boxes.add(box);
      cellGrids.add(cells(new ArrayList<>(rows), new ArrayList<>(columns), pageText.glyphs()));
    }

    List<Integer> order = new ArrayList<>();
    for (int i = 0; i < boxes.size(); i++) {
      order.add(i);
    }
    order.sort(
        Comparator.comparingDouble((Integer i) -> boxes.get(i).top())
            .thenComparingDouble(i -> boxes.get(i).x0()));

    List<ExtractedTable> tables = new ArrayList<>();
    for (int i : order) {
      BoundingBox box = boxes.get(i);
      String caption =
          captionLocator
              .locate(pageText.lines(), box, CaptionLocator.TABLE_CAPTION)
              .orElse(null);
      tables.add(
          new ExtractedTable(
              pageText.pageNumber(), tables.size() + 1, caption, cellGrids.get(i), box));
    }
    if (!tables.isEmpty()) {
      log.debug("Found {} tables on page {}", tables.size(), pageText.pageNumber());
    }
    return tables;
  }

  /** Groups rulings that touch each other, keeping groups with two or more of each direction. */
  List<List<Ruling>> connectedGrids(List<Ruling> rulings) {
    int n = rulings.size();
    int[] parent = new int[n];
    for (int i = 0; i < n; i++) {
      parent[i] = i;
    }
    for (int i = 0; i < n; i++) {
      for (int j = i + 1; j < n; j++) {
        if (touches(rulings.get(i), rulings.get(j))) {
          parent[find(parent, i)] = find(parent, j);
        }
      }
    }

    List<List<Ruling>> groups = new ArrayList<>();
    List<Integer> roots = new ArrayList<>();
    for (int i = 0; i < n; i++) {
      int root = find(parent, i);
      int slot = roots.indexOf(root);
      if (slot < 0) {
        roots.add(root);
        groups.add(new ArrayList<>());
        slot = groups.size() - 1;
      }
      groups.get(slot).add(rulings.get(i));
    }
    return groups.stream()
        .filter(g -> g.stream().filter(Ruling::horizontal).count() >= 2)
        .filter(g -> g.stream().filter(r -> !r.horizontal()).count() >= 2)
        .toList();
  }

  private static int find(int[] parent, int i) {
    while (parent[i] != i) {
      parent[i] = parent[parent[i]];
      i = parent[i];
    }
    return i;
  }

  private static boolean touches(Ruling a, Ruling b) {
    if (a.horizontal() == b.horizontal()) {
      return Math.abs(a.position() - b.position()) <= TOLERANCE
          && a.start() <= b.end() + TOLERANCE
          && b.start() <= a.end() + TOLERANCE;
    }
    Ruling h = a.horizontal() ? a : b;
    Ruling v = a.horizontal() ? b : a;
    return v.position() >= h.start() - TOLERANCE
        && v.position() <= h.end() + TOLERANCE
        && h.position() >= v.start() - TOLERANCE
        && h.position() <= v.end() + TOLERANCE;
  }

  private static TreeSet<Float> mergedPositions(List<Ruling> grid, boolean horizontal) {
    TreeSet<Float> merged = new TreeSet<>();
    grid.stream()
        .filter(r -> r.horizontal() == horizontal)
        .map(Ruling::position)
        .sorted()
        .forEach(
            p -> {
              if (merged.isEmpty() || p - merged.last() > TOLERANCE) {
                merged.add(p);
              }
            });
    return merged;
  }

  private static List<List<String>> cells(
      List<Float> rows, List<Float> columns, List<Glyph> glyphs) {
    int rowCount = rows.size() - 1;
    int columnCount = columns.size() - 1;
    List<List<List<Glyph>>> buckets = new ArrayList<>();
    for (int r = 0; r < rowCount; r++) {
      List<List<Glyph>> row = new ArrayList<>();
      for (int c = 0; c < columnCount; c++) {
        row.add(new ArrayList<>());
      }
      buckets.add(row);
    }

    for (Glyph glyph : glyphs) {
      if (glyph.isWhitespace()) {
        continue;
      }
      float cx = glyph.centerX();
      float cy = (glyph.top() + glyph.baseline()) / 2f;
      int r = slot(rows, cy);
      int c = slot(columns, cx);
      if (r >= 0 && c >= 0) {
        buckets.get(r).get(c).add(glyph);
      }
    }

    List<List<String>> cells = new ArrayList<>();
    for (List<List<Glyph>> row : buckets) {
      cells.add(row.stream().map(TableExtractor::cellText).toList());
    }
    return cells;
  }

  /** Index of the interval between consecutive bounds containing the value, or -1. */
  private static int slot(List<Float> bounds, float value) {
    for (int i = 0; i < bounds.size() - 1; i++) {
      if (value >= bounds.get(i) && value < bounds.get(i + 1)) {
        return i;
      }
    }
    return -1;
  }

  private static String cellText(List<Glyph> glyphs) {
    if (glyphs.isEmpty()) {
      return "";
    }
    List<Glyph> sorted = new ArrayList<>(glyphs);
    sorted.sort(Comparator.comparingDouble(Glyph::baseline));
    List<String> lines = new ArrayList<>();
    List<Glyph> current = new ArrayList<>();
    for (Glyph glyph : sorted) {
      if (!current.isEmpty()
          && glyph.baseline() - current.get(0).baseline() > glyph.fontSize() / 2f) {
        lines.add(TextLine.of(current).text());
        current = new ArrayList<>();
      }
      current.add(glyph);
    }
    lines.add(TextLine.of(current).text());
    return String.join(" ", lines).trim();
  }
}
