package com.flamingo.ai.papersearch.service.extraction;

import com.flamingo.ai.papersearch.config.RagConfig;
import com.flamingo.ai.papersearch.service.extraction.model.Glyph;
import com.flamingo.ai.papersearch.service.extraction.model.PageText;
import com.flamingo.ai.papersearch.service.extraction.model.TextLine;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Guesses the paper title and author list from the layout of page 1.
 *
 * <p>The title is the largest-font line on the page, together with directly following lines of
 * the same size. The search can be limited to a top region of the page through {@code
 * rag.extraction.title-region-ratio}. Authors come from the lines right below the title, after
 * superscript markers, affiliation lines and email addresses are removed.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TitleAuthorExtractor {

  private static final float MIN_TITLE_FONT_SIZE = 6f;
  private static final float SAME_SIZE_TOLERANCE = 0.5f;
  private static final float SUPERSCRIPT_RATIO = 0.8f;
  private static final int MAX_AUTHOR_LINES = 3;
  private static final int MAX_TITLE_LINES = 3;
  /** Author lines sit within this many font sizes of the line above them. */
  private static final float MAX_AUTHOR_GAP_RATIO = 3f;

  private static final Pattern AUTHOR_SEPARATOR =
      Pattern.compile("\\s*(?:,|;|&|\\band\\b)\\s*", Pattern.CASE_INSENSITIVE);
  private static final Pattern EMAIL = Pattern.compile("\\S+@\\S+");
  private static final Pattern MARKERS = Pattern.compile("[\\d*†‡§¶#]+");

  private static final List<String> AFFILIATION_KEYWORDS =
      List.of(
          "@",
          "university",
          "institute",
          "dept",
          "department",
          "school of",
          "laboratory",
          "college",
          "center for",
          "centre for",
          "inc.",
          "corporation",
          "email",
          ".com",
          ".edu",
          ".org",
          "orcid");

  private final RagConfig ragConfig;

  /**
   * Finds the title on the first page.
   *
   * @param firstPage page 1
   * @return the title, or empty when no line is large enough
   */
  public Optional<String> extractTitle(PageText firstPage) {
    return findTitleBlock(firstPage).map(this::joinText);
  }

  /**
   * Finds the author names listed under the title on the first page.
   *
   * @param firstPage page 1
   * @return the author names, or empty when none survive filtering
   */
  public Optional<List<String>> extractAuthors(PageText firstPage) {
    Optional<List<TextLine>> titleBlock = findTitleBlock(firstPage);
    if (titleBlock.isEmpty()) {
      return Optional.empty();
    }
    List<TextLine> lines = topLines(firstPage);
    TextLine lastTitleLine = titleBlock.get().get(titleBlock.get().size() - 1);
    int start = lines.indexOf(lastTitleLine) + 1;

    List<String> names = new ArrayList<>();
    TextLine previous = lastTitleLine;
    for (int i = start; i < Math.min(lines.size(), start + MAX_AUTHOR_LINES); i++) {
      TextLine line = lines.get(i);
      if (line.box().top() - previous.box().bottom() > MAX_AUTHOR_GAP_RATIO * previous.fontSize()) {
        break;
      }
      previous = line;
      float threshold = SUPERSCRIPT_RATIO * maxFontSize(line);
      String text = line.text(g -> g.fontSize() >= threshold);
      if (text.length() < 3 || isAffiliation(text)) {
        continue;
      }
      for (String candidate : AUTHOR_SEPARATOR.split(EMAIL.matcher(text).replaceAll(" "))) {
        cleanName(candidate).ifPresent(names::add);
      }
    }
    if (names.isEmpty()) {
      log.debug("No author names found below the title");
      return Optional.empty();
    }
    return Optional.of(names);
  }

  private Optional<List<TextLine>> findTitleBlock(PageText firstPage) {
    List<TextLine> lines = topLines(firstPage);
    TextLine largest = null;
    for (TextLine line : lines) {
      if (largest == null || line.fontSize() > largest.fontSize()) {
        largest = line;
      }
    }
    if (largest == null || largest.fontSize() <= MIN_TITLE_FONT_SIZE) {
      return Optional.empty();
    }
    List<TextLine> block = new ArrayList<>();
    block.add(largest);
    int start = lines.indexOf(largest) + 1;
    for (int i = start; i < lines.size() && block.size() < MAX_TITLE_LINES; i++) {
      TextLine next = lines.get(i);
      if (Math.abs(next.fontSize() - largest.fontSize()) > SAME_SIZE_TOLERANCE) {
        break;
      }
      block.add(next);
    }
    return Optional.of(block);
  }

  private List<TextLine> topLines(PageText page) {
    float limit = (float) (page.height() * ragConfig.getExtraction().getTitleRegionRatio());
    List<TextLine> top = new ArrayList<>();
    for (TextLine line : page.pageLines()) {
      if (line.box().top() < limit) {
        top.add(line);
      }
    }
    if (top.isEmpty()) {
      return page.pageLines().subList(0, Math.min(8, page.pageLines().size()));
    }
    return top;
  }

  private String joinText(List<TextLine> block) {
    StringBuilder sb = new StringBuilder();
    for (TextLine line : block) {
      if (sb.length() > 0) {
        sb.append(' ');
      }
      sb.append(line.text());
    }
    return sb.toString().trim();
  }

  private float maxFontSize(TextLine line) {
    float max = 0f;
    for (Glyph glyph : line.glyphs()) {
      if (!glyph.isWhitespace()) {
        max = Math.max(max, glyph.fontSize());
      }
    }
    return max;
  }

  private boolean isAffiliation(String text) {
    String lower = text.toLowerCase(Locale.ROOT);
    return AFFILIATION_KEYWORDS.stream().anyMatch(lower::contains);
  }

  /** Keeps candidates of 2 to 5 words, most of them capitalised. */
  private Optional<String> cleanName(String candidate) {
    String cleaned = MARKERS.matcher(candidate).replaceAll("").replaceAll("\\s+", " ").trim();
    cleaned = cleaned.replaceAll("^[.,;:]+|[.,;:]+$", "").trim();
    if (cleaned.isEmpty() || isAffiliation(cleaned)) {
      return Optional.empty();
    }
    String[] words = cleaned.split(" ");
    if (words.length < 2 || words.length > 5) {
      return Optional.empty();
    }
    int capitalized = 0;
    for (String word : words) {
      if (Character.isUpperCase(word.charAt(0))) {
        capitalized++;
      }
    }
    return capitalized >= words.length * 0.6 ? Optional.of(cleaned) : Optional.empty();
  }
}
