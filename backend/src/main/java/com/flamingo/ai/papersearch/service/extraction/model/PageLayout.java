package com.flamingo.ai.papersearch.service.extraction.model;

/** Column layout of a single page, decided independently for every page. */
public interface PageLayout {

  PageLayout SINGLE_COLUMN = new SingleColumn();

  /** Whether glyphs should be split into left and right columns. */
  boolean isTwoColumn();

  /** Text flows across the full page width. */
  record SingleColumn() implements PageLayout {
    @Override
    public boolean isTwoColumn() {
      return false;
    }
  }

  /**
   * Text flows down the left column, then down the right column.
   *
   * @param boundary x coordinate of the gutter centre separating the columns
   */
  record TwoColumn(float boundary) implements PageLayout {
    @Override
    public boolean isTwoColumn() {
      return true;
    }
  }
}
