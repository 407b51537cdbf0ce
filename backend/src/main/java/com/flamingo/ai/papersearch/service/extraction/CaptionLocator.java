package com.flamingo.ai.papersearch.service.extraction;

import com.flamingo.ai.papersearch.config.RagConfig;
import com.flamingo.ai.papersearch.service.extraction.model.BoundingBox;
import com.flamingo.ai.papersearch.service.extraction.model.TextLine;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Finds the caption line of a table or figure by proximity and pattern.
 *
 * <p>Only lines that overlap the artifact horizontally and lie within the configured vertical
 * distance above or below it are considered; the nearest matching line wins. Captioning styles
 * other than the given pattern yield no caption.
 */
@Component
@RequiredArgsConstructor
public class CaptionLocator {

  public static final Pattern TABLE_CAPTION = Pattern.compile("^(Table|TABLE)\\s+[IVXLC\\d]+[:.]");
  public static final Pattern FIGURE_CAPTION =
      Pattern.compile("^(Figure|FIGURE|Fig\\.?|FIG\\.?)\\s+\\d+");

  private static final int MAX_CAPTION_LENGTH = 200;

  private final RagConfig ragConfig;

  /**
   * Locates a caption for the artifact at {@code box}.
   *
   * @param lines text lines of the page
   * @param box bounds of the table or figure
   * @param pattern caption pattern anchored at the line start
   * @return the caption text, or empty when no line matches
   */
  public Optional<String> locate(List<TextLine> lines, BoundingBox box, Pattern pattern) {
    float maxDistance = ragConfig.getExtraction().getCaptionMaxDistance();
    return lines.stream()
        .filter(line -> line.box().overlapsHorizontally(box))
        .filter(line -> !isInside(line.box(), box))
        .filter(line -> line.box().verticalGap(box) <= maxDistance)
        .filter(line -> pattern.matcher(line.text()).find())
        .min(
            Comparator.comparingDouble((TextLine line) -> line.box().verticalGap(box))
                .thenComparingDouble(line -> line.box().top()))
        .map(line -> truncate(line.text()));
  }

  private boolean isInside(BoundingBox line, BoundingBox box) {
    float centerY = (line.top() + line.bottom()) / 2f;
    float centerX = (line.x0() + line.x1()) / 2f;
    return box.contains(centerX, centerY);
  }

  private String truncate(String text) {
    String trimmed = text.trim();
    return trimmed.length() > MAX_CAPTION_LENGTH
        ? trimmed.substring(0, MAX_CAPTION_LENGTH)
        : trimmed;
  }
}
