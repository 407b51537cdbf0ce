package com.flamingo.ai.papersearch.service.extraction;

import com.flamingo.ai.papersearch.domain.enums.PaperSection;
import com.flamingo.ai.papersearch.service.extraction.model.SectionText;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Splits the reading-order full text into named paper sections.
 *
 * <p>A heading is a short line holding a known section name, optionally numbered with arabic
 * ("3", "3.", "3.1") or roman ("II.") numerals. An abstract may also be introduced inline, as in
 * {@code Abstract— We study ...}. Text before the first heading is kept as {@code unclassified};
 * repeated headings append to the section already seen.
 */
@Component
@Slf4j
public class SectionClassifier {

  private static final int MAX_HEADING_LENGTH = 60;

  private static final Pattern HEADING =
      Pattern.compile(
          "^(?:(?:\\d+(?:\\.\\d+)*|[IVXLC]+)\\.?\\s+)?([A-Za-z][A-Za-z &\\-]*?)\\s*:?$");

  private static final Pattern INLINE_ABSTRACT =
      Pattern.compile("^(abstract|summary)\\s*[—–:.\\-]\\s*(\\S.*)$", Pattern.CASE_INSENSITIVE);

  /**
   * Classifies the text into sections.
   *
   * @param fullText the document text in reading order
   * @return sections in canonical paper order with unclassified text last, or an empty list when no
   *     heading was recognised
   */
  public List<SectionText> classify(String fullText) {
    if (fullText == null || fullText.isBlank()) {
      return List.of();
    }
    List<Boundary> boundaries = findBoundaries(fullText);
    if (boundaries.isEmpty()) {
      log.debug("No section headings recognised");
      return List.of();
    }

    Map<PaperSection, StringBuilder> texts = new EnumMap<>(PaperSection.class);
    Map<PaperSection, Integer> offsets = new EnumMap<>(PaperSection.class);

    String preamble = fullText.substring(0, boundaries.get(0).headingStart());
    if (!preamble.isBlank()) {
      append(texts, offsets, PaperSection.UNCLASSIFIED, preamble, 0);
    }
    for (int i = 0; i < boundaries.size(); i++) {
      Boundary boundary = boundaries.get(i);
      int end =
          i + 1 < boundaries.size() ? boundaries.get(i + 1).headingStart() : fullText.length();
      String body = fullText.substring(boundary.bodyStart(), end);
      append(texts, offsets, boundary.section(), body, boundary.bodyStart());
    }

    List<SectionText> result = new ArrayList<>();
    for (PaperSection section : PaperSection.values()) {
      if (section == PaperSection.UNCLASSIFIED) {
        continue;
      }
      addIfPresent(result, texts, offsets, section);
    }
    addIfPresent(result, texts, offsets, PaperSection.UNCLASSIFIED);
    return result;
  }

  /**
   * Recognises a heading line.
   *
   * @param line a single line of text
   * @return the section named by the heading, or empty
   */
  public Optional<PaperSection> headingOf(String line) {
    String trimmed = line.trim();
    if (trimmed.isEmpty() || trimmed.length() > MAX_HEADING_LENGTH) {
      return Optional.empty();
    }
    Matcher matcher = HEADING.matcher(trimmed);
    if (!matcher.matches()) {
      return Optional.empty();
    }
    return PaperSection.fromHeading(matcher.group(1));
  }

  private List<Boundary> findBoundaries(String fullText) {
    List<Boundary> boundaries = new ArrayList<>();
    int lineStart = 0;
    while (lineStart <= fullText.length()) {
      int newline = fullText.indexOf('\n', lineStart);
      int lineEnd = newline < 0 ? fullText.length() : newline;
      String line = fullText.substring(lineStart, lineEnd);

      Optional<PaperSection> heading = headingOf(line);
      if (heading.isPresent()) {
        int bodyStart = Math.min(lineEnd + 1, fullText.length());
        boundaries.add(new Boundary(heading.get(), lineStart, bodyStart));
      } else {
        Matcher inline = INLINE_ABSTRACT.matcher(line.trim());
        if (inline.matches()) {
          int leading = line.indexOf(line.trim());
          int bodyStart = lineStart + leading + inline.start(2);
          boundaries.add(new Boundary(PaperSection.ABSTRACT, lineStart, bodyStart));
        }
      }
      if (newline < 0) {
        break;
      }
      lineStart = newline + 1;
    }
    return boundaries;
  }

  private void append(
      Map<PaperSection, StringBuilder> texts,
      Map<PaperSection, Integer> offsets,
      PaperSection section,
      String body,
      int offset) {
    if (body.isBlank()) {
      return;
    }
    StringBuilder sb = texts.get(section);
    if (sb == null) {
      texts.put(section, new StringBuilder(body.strip()));
      offsets.put(section, offset + leadingWhitespace(body));
    } else {
      sb.append("\n\n").append(body.strip());
    }
  }

  private void addIfPresent(
      List<SectionText> result,
      Map<PaperSection, StringBuilder> texts,
      Map<PaperSection, Integer> offsets,
      PaperSection section) {
    StringBuilder sb = texts.get(section);
    if (sb != null) {
      result.add(new SectionText(section.getLabel(), sb.toString(), offsets.get(section)));
    }
  }

  private static int leadingWhitespace(String text) {
    int i = 0;
    while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
      i++;
    }
    return i;
  }

  /** Position of a heading and of the body text that follows it. */
  private record Boundary(PaperSection section, int headingStart, int bodyStart) {}
}
