package com.flamingo.ai.papersearch.service.extraction.model;

/**
 * Text of one logical section.
 *
 * @param label section label, e.g. "methodology"
 * @param text the section body
 * @param startOffset offset of the body in the document full text, or null when unknown
 */
public record SectionText(String label, String text, Integer startOffset) {}
