package com.flamingo.ai.papersearch.domain.enums;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Logical sections of a research paper, declared in canonical paper order.
 *
 * <p>The set is bounded but open: text that cannot be attributed to a recognised heading lands in
 * {@link #UNCLASSIFIED}, and {@link #FULL_TEXT} labels whole-document text when no heading was
 * recognised at all.
 */
public enum PaperSection {
  ABSTRACT("abstract", Set.of("abstract", "summary")),
  INTRODUCTION("introduction", Set.of("introduction", "background")),
  RELATED_WORK(
      "related_work",
      Set.of("related work", "related works", "prior work", "literature review")),
  METHODOLOGY(
      "methodology",
      Set.of(
          "methodology",
          "methods",
          "method",
          "materials and methods",
          "approach",
          "proposed method")),
  RESULTS(
      "results",
      Set.of("results", "findings", "experiments", "experimental results", "evaluation")),
  DISCUSSION("discussion", Set.of("discussion")),
  CONCLUSION(
      "conclusion",
      Set.of(
          "conclusion",
          "conclusions",
          "concluding remarks",
          "conclusion and future work",
          "conclusions and future work")),
  ACKNOWLEDGMENTS(
      "acknowledgments",
      Set.of("acknowledgments", "acknowledgements", "acknowledgment", "acknowledgement")),
  REFERENCES("references", Set.of("references", "bibliography", "works cited")),
  APPENDIX("appendix", Set.of("appendix", "appendices")),
  UNCLASSIFIED("unclassified", Set.of()),
  FULL_TEXT("full_text", Set.of());

  private final String label;
  private final Set<String> headings;

  PaperSection(String label, Set<String> headings) {
    this.label = label;
    this.headings = headings;
  }

  public String getLabel() {
    return label;
  }

  /**
   * Finds the section whose heading vocabulary contains the given heading text.
   *
   * @param heading heading text with numbering already removed
   * @return the matching section, or empty if the heading is not recognised
   */
  public static Optional<PaperSection> fromHeading(String heading) {
    if (heading == null) {
      return Optional.empty();
    }
    String normalized = heading.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
    if (normalized.startsWith("appendix ")) {
      return Optional.of(APPENDIX);
    }
    return Arrays.stream(values()).filter(s -> s.headings.contains(normalized)).findFirst();
  }

  /**
   * Resolves a section from its label.
   *
   * @param label the label, e.g. "methodology"
   * @return the matching section, or empty if no section uses that label
   */
  public static Optional<PaperSection> fromLabel(String label) {
    return Arrays.stream(values()).filter(s -> s.label.equalsIgnoreCase(label)).findFirst();
  }

  /**
   * Canonical form of a free-form section label, used both when storing chunks and when filtering
   * on them. A known label or heading maps to its section label; anything else is trimmed and
   * lower-cased.
   *
   * @param label caller-supplied label, e.g. "Related Work"
   * @return the canonical label, or the input unchanged when it is null or blank
   */
  public static String normalizeLabel(String label) {
    if (label == null || label.isBlank()) {
      return label;
    }
    String trimmed = label.trim();
    return fromLabel(trimmed)
        .or(() -> fromHeading(trimmed))
        .map(PaperSection::getLabel)
        .orElseGet(() -> trimmed.toLowerCase(Locale.ROOT));
  }
}
