package com.flamingo.ai.papersearch.service.extraction.model;

import java.util.List;

/**
 * Text content of one page.
 *
 * @param pageNumber 1-based page number
 * @param width page width in points
 * @param height page height in points
 * @param layout the detected column layout
 * @param lines lines in reading order (column-aware)
 * @param pageLines lines grouped across the full page width, top to bottom
 * @param glyphs all glyphs of the page
 * @param text the page text in reading order
 */
public record PageText(
    int pageNumber,
    float width,
    float height,
    PageLayout layout,
    List<TextLine> lines,
    List<TextLine> pageLines,
    List<Glyph> glyphs,
    String text) {}
