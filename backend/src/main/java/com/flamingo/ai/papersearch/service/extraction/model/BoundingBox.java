package com.flamingo.ai.papersearch.service.extraction.model;

/**
 * Axis-aligned box in top-left page coordinates (y grows downwards).
 *
 * @param x0 left edge
 * @param top top edge
 * @param x1 right edge
 * @param bottom bottom edge
 */
public record BoundingBox(float x0, float top, float x1, float bottom) {

  public float width() {
    return x1 - x0;
  }

  public float height() {
    return bottom - top;
  }

  public boolean overlapsHorizontally(BoundingBox other) {
    return x0 < other.x1 && other.x0 < x1;
  }

  /** Returns true if the point lies inside this box. */
  public boolean contains(float x, float y) {
    return x >= x0 && x <= x1 && y >= top && y <= bottom;
  }

  /**
   * Vertical distance between this box and another, or 0 when they overlap vertically.
   *
   * @param other the other box
   * @return the gap in points
   */
  public float verticalGap(BoundingBox other) {
    if (other.bottom <= top) {
      return top - other.bottom;
    }
    if (other.top >= bottom) {
      return other.top - bottom;
    }
    return 0f;
  }

  public BoundingBox union(BoundingBox other) {
    return new BoundingBox(
        Math.min(x0, other.x0),
        Math.min(top, other.top),
        Math.max(x1, other.x1),
        Math.max(bottom, other.bottom));
  }
}
