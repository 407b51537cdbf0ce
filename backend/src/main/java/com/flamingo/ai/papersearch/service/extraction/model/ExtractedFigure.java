package com.flamingo.ai.papersearch.service.extraction.model;

/**
 * A raster image drawn on a page.
 *
 * @param pageNumber 1-based page number
 * @param index 1-based ordinal of the figure within its page
 * @param caption caption text, or null when no caption line was found nearby
 * @param width image width in pixels
 * @param height image height in pixels
 * @param boundingBox placement on the page in top-left page coordinates
 * @param imagePath path of the stored image file, or null when it could not be stored
 */
public record ExtractedFigure(
    int pageNumber,
    int index,
    String caption,
    int width,
    int height,
    BoundingBox boundingBox,
    String imagePath) {}
