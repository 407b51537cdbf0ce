package com.flamingo.ai.papersearch.service.extraction.model;

import java.util.List;

/**
 * One bibliography entry. Every parsed field is best effort.
 *
 * @param index ordinal of the entry (its printed number when present)
 * @param rawText entry text with whitespace normalised
 * @param year publication year, or null
 * @param authors author names, or null when none could be isolated
 * @param title quoted title, or null
 */
public record ExtractedReference(
    int index, String rawText, Integer year, List<String> authors, String title) {}
