package com.flamingo.ai.papersearch.service.extraction;

import java.awt.geom.Point2D;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.apache.pdfbox.contentstream.PDFGraphicsStreamEngine;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.graphics.image.PDImage;

/**
 * Collects horizontal and vertical rulings drawn on a page.
 *
 * <p>Stroked straight segments and rectangle edges count as rulings, as do filled rectangles thin
 * enough to read as a line. Coordinates are converted to top-left page space.
 */
final class RulingCollector extends PDFGraphicsStreamEngine {

  /** Maximum deviation, in points, for a segment to count as axis-aligned. */
  private static final float AXIS_TOLERANCE = 1f;

  /** Filled rectangles thinner than this read as a ruling. */
  private static final float MAX_FILLED_THICKNESS = 3f;

  private final float originX;
  private final float topY;
  private final List<Ruling> rulings = new ArrayList<>();
  private final List<float[]> segments = new ArrayList<>();
  private final List<float[]> rectangles = new ArrayList<>();
  private final Point2D.Float current = new Point2D.Float();
  private final Point2D.Float subpathStart = new Point2D.Float();

  RulingCollector(PDPage page) {
    super(page);
    PDRectangle cropBox = page.getCropBox();
    this.originX = cropBox.getLowerLeftX();
    this.topY = cropBox.getUpperRightY();
  }

  /** Processes the page and returns its rulings. */
  List<Ruling> collect() throws IOException {
    processPage(getPage());
    return List.copyOf(rulings);
  }

  @Override
  public void appendRectangle(Point2D p0, Point2D p1, Point2D p2, Point2D p3) {
    float x0 = (float) Math.min(Math.min(p0.getX(), p1.getX()), Math.min(p2.getX(), p3.getX()));
    float x1 = (float) Math.max(Math.max(p0.getX(), p1.getX()), Math.max(p2.getX(), p3.getX()));
    float y0 = (float) Math.min(Math.min(p0.getY(), p1.getY()), Math.min(p2.getY(), p3.getY()));
    float y1 = (float) Math.max(Math.max(p0.getY(), p1.getY()), Math.max(p2.getY(), p3.getY()));
    rectangles.add(new float[] {x0, y0, x1, y1});
    current.setLocation(p0.getX(), p0.getY());
  }

  @Override
  public void moveTo(float x, float y) {
    current.setLocation(x, y);
    subpathStart.setLocation(x, y);
  }

  @Override
  public void lineTo(float x, float y) {
    segments.add(new float[] {current.x, current.y, x, y});
    current.setLocation(x, y);
  }

  @Override
  public void curveTo(float x1, float y1, float x2, float y2, float x3, float y3) {
    current.setLocation(x3, y3);
  }

  @Override
  public Point2D getCurrentPoint() {
    return current;
  }

  @Override
  public void closePath() {
    segments.add(new float[] {current.x, current.y, subpathStart.x, subpathStart.y});
    current.setLocation(subpathStart);
  }

  @Override
  public void endPath() {
    clearPath();
  }

  @Override
  public void strokePath() {
    for (float[] s : segments) {
      addSegment(s[0], s[1], s[2], s[3]);
    }
    for (float[] r : rectangles) {
      addSegment(r[0], r[1], r[2], r[1]);
      addSegment(r[0], r[3], r[2], r[3]);
      addSegment(r[0], r[1], r[0], r[3]);
      addSegment(r[2], r[1], r[2], r[3]);
    }
    clearPath();
  }

  @Override
  public void fillPath(int windingRule) {
    for (float[] r : rectangles) {
      float width = r[2] - r[0];
      float height = r[3] - r[1];
      if (height <= MAX_FILLED_THICKNESS && width > height) {
        float y = (r[1] + r[3]) / 2f;
        addSegment(r[0], y, r[2], y);
      } else if (width <= MAX_FILLED_THICKNESS && height > width) {
        float x = (r[0] + r[2]) / 2f;
        addSegment(x, r[1], x, r[3]);
      }
    }
    clearPath();
  }

  @Override
  public void fillAndStrokePath(int windingRule) {
    strokePath();
  }

  @Override
  public void clip(int windingRule) {
    // clipping paths are not rulings; endPath clears them
  }

  @Override
  public void drawImage(PDImage pdImage) {
    // images are handled by FigureExtractor
  }

  @Override
  public void shadingFill(COSName shadingName) {
    // shadings carry no rulings
  }

  private void addSegment(float x0, float y0, float x1, float y1) {
    float left = Math.min(x0, x1) - originX;
    float right = Math.max(x0, x1) - originX;
    float top = topY - Math.max(y0, y1);
    float bottom = topY - Math.min(y0, y1);
    if (Math.abs(y1 - y0) <= AXIS_TOLERANCE && right - left > AXIS_TOLERANCE) {
      rulings.add(new Ruling(true, (top + bottom) / 2f, left, right));
    } else if (Math.abs(x1 - x0) <= AXIS_TOLERANCE && bottom - top > AXIS_TOLERANCE) {
      rulings.add(new Ruling(false, (left + right) / 2f, top, bottom));
    }
  }

  private void clearPath() {
    segments.clear();
    rectangles.clear();
  }

  /**
   * An axis-aligned line segment in top-left page coordinates.
   *
   * @param horizontal true for a horizontal ruling
   * @param position y of a horizontal ruling, x of a vertical one
   * @param start left end of a horizontal ruling, top end of a vertical one
   * @param end right end of a horizontal ruling, bottom end of a vertical one
   */
  record Ruling(boolean horizontal, float position, float start, float end) {}
}
