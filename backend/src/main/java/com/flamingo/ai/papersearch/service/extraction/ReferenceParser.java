package com.flamingo.ai.papersearch.service.extraction;

import com.flamingo.ai.papersearch.service.extraction.model.ExtractedReference;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Best-effort bibliography parser working on the reading-order full text.
 *
 * <p>Entries are split on bracketed numbers, then on numbered lines, then on blank lines. Year,
 * authors and a quoted title are pulled out of each entry where the common citation styles allow;
 * the raw text is always kept.
 */
@Component
@Slf4j
public class ReferenceParser {

  private static final Pattern REFERENCES_HEADING =
      Pattern.compile(
          "^\\s*(?:(?:\\d+|[IVXLC]+)\\.?\\s+)?(references|bibliography|works cited)\\s*:?\\s*$",
          Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);

  private static final Pattern END_HEADING =
      Pattern.compile(
          "^\\s*(?:(?:\\d+|[IVXLC]+)\\.?\\s+)?(appendix(?:\\s+\\S+)?|appendices|acknowledge?ments?)"
              + "\\s*:?\\s*$",
          Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);

  private static final Pattern BRACKETED =
      Pattern.compile("^\\s*\\[(\\d{1,4})\\]\\s*", Pattern.MULTILINE);
  private static final Pattern NUMBERED =
      Pattern.compile("^\\s*(\\d{1,4})\\.\\s+", Pattern.MULTILINE);
  private static final Pattern BLANK_LINE = Pattern.compile("\\n\\s*\\n");

  private static final Pattern YEAR_IN_PARENS = Pattern.compile("\\((\\d{4})\\)");
  private static final Pattern YEAR = Pattern.compile("\\b(19|20)\\d{2}\\b");
  private static final Pattern WORD_PERIOD = Pattern.compile("(?<=\\p{L}{2})\\.");
  private static final Pattern OPENING_QUOTE = Pattern.compile("[\"“]");
  private static final Pattern QUOTED = Pattern.compile("[\"“]([^\"”]+)[\"”]");
  private static final Pattern AUTHOR_SEPARATOR = Pattern.compile("\\s*(?:,|;|&|\\band\\b)\\s*");
  private static final Pattern INITIALS = Pattern.compile("^(?:\\p{Lu}\\.\\s*)+$");

  /**
   * Parses the bibliography of a paper.
   *
   * @param fullText the document text in reading order
   * @return parsed entries in order, empty when there is no references heading
   */
  public List<ExtractedReference> parse(String fullText) {
    if (fullText == null || fullText.isBlank()) {
      return List.of();
    }
    String span = referencesSpan(fullText);
    if (span == null || span.isBlank()) {
      return List.of();
    }

    List<ExtractedReference> references = new ArrayList<>();
    for (Entry entry : splitEntries(span)) {
      String raw = normalize(entry.text());
      if (raw.isEmpty()) {
        continue;
      }
      int index = entry.number() != null ? entry.number() : references.size() + 1;
      references.add(new ExtractedReference(index, raw, year(raw), authors(raw), title(raw)));
    }
    log.debug("Parsed {} references", references.size());
    return references;
  }

  /** Text between the last references heading and the next appendix/acknowledgments heading. */
  String referencesSpan(String fullText) {
    Matcher heading = REFERENCES_HEADING.matcher(fullText);
    int start = -1;
    while (heading.find()) {
      start = heading.end();
    }
    if (start < 0) {
      return null;
    }
    Matcher end = END_HEADING.matcher(fullText);
    int stop = end.find(start) ? end.start() : fullText.length();
    return fullText.substring(start, stop);
  }

  List<Entry> splitEntries(String span) {
    List<Entry> entries = splitOnMarker(span, BRACKETED);
    if (entries.isEmpty()) {
      entries = splitOnMarker(span, NUMBERED);
    }
    if (entries.isEmpty()) {
      entries = new ArrayList<>();
      for (String block : BLANK_LINE.split(span)) {
        if (!block.isBlank()) {
          entries.add(new Entry(null, block));
        }
      }
    }
    return entries;
  }

  /**
   * Splits on entry markers. After the first marker only the next number in sequence starts a new
   * entry; any other marker-shaped line, such as a wrapped line opening with "2019.", stays in the
   * current entry.
   */
  private List<Entry> splitOnMarker(String span, Pattern marker) {
    Matcher matcher = marker.matcher(span);
    List<Entry> entries = new ArrayList<>();
    Integer number = null;
    int bodyStart = -1;
    while (matcher.find()) {
      int found = Integer.parseInt(matcher.group(1));
      if (number != null && found != number + 1) {
        continue;
      }
      if (bodyStart >= 0) {
        entries.add(new Entry(number, span.substring(bodyStart, matcher.start())));
      }
      number = found;
      bodyStart = matcher.end();
    }
    if (bodyStart >= 0) {
      entries.add(new Entry(number, span.substring(bodyStart)));
    }
    return entries.size() >= 2 ? entries : List.of();
  }

  Integer year(String raw) {
    Matcher parens = YEAR_IN_PARENS.matcher(raw);
    if (parens.find()) {
      return Integer.valueOf(parens.group(1));
    }
    Matcher plain = YEAR.matcher(raw);
    return plain.find() ? Integer.valueOf(plain.group()) : null;
  }

  List<String> authors(String raw) {
    int cut = raw.length();
    cut = Math.min(cut, firstIndex(YEAR_IN_PARENS, raw));
    cut = Math.min(cut, firstIndex(YEAR, raw));
    cut = Math.min(cut, firstIndex(OPENING_QUOTE, raw));
    cut = Math.min(cut, firstIndex(WORD_PERIOD, raw));
    String segment = raw.substring(0, cut).trim();
    if (segment.isEmpty()) {
      return null;
    }

    List<String> names = new ArrayList<>();
    for (String part : AUTHOR_SEPARATOR.split(segment)) {
      String name = part.trim();
      if (name.isEmpty()) {
        continue;
      }
      if (INITIALS.matcher(name).matches() && !names.isEmpty()) {
        int last = names.size() - 1;
        names.set(last, names.get(last) + " " + name);
      } else {
        names.add(name);
      }
    }
    return names.isEmpty() ? null : List.copyOf(names);
  }

  String title(String raw) {
    Matcher matcher = QUOTED.matcher(raw);
    if (!matcher.find()) {
      return null;
    }
    String title = matcher.group(1).trim().replaceAll("[,.]+$", "");
    return title.isEmpty() ? null : title;
  }

  private static int firstIndex(Pattern pattern, String text) {
    Matcher matcher = pattern.matcher(text);
    return matcher.find() ? matcher.start() : Integer.MAX_VALUE;
  }

  private static String normalize(String text) {
    return text.replaceAll("\\s+", " ").trim();
  }

  /**
   * A raw bibliography entry.
   *
   * @param number the printed entry number, or null for unnumbered styles
   * @param text the entry text without its marker
   */
  record Entry(Integer number, String text) {}
}
