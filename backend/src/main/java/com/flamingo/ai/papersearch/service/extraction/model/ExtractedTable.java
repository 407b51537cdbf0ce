package com.flamingo.ai.papersearch.service.extraction.model;

import java.util.List;

/**
 * A table found on a ruled grid.
 *
 * @param pageNumber 1-based page number
 * @param index 1-based ordinal of the table within its page
 * @param caption caption text, or null when no caption line was found nearby
 * @param cells cell text, row by row
 * @param boundingBox grid bounds in top-left page coordinates
 */
public record ExtractedTable(
    int pageNumber, int index, String caption, List<List<String>> cells, BoundingBox boundingBox) {}
