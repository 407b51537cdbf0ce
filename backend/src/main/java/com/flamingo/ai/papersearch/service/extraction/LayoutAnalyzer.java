package com.flamingo.ai.papersearch.service.extraction;

import com.flamingo.ai.papersearch.config.RagConfig;
import com.flamingo.ai.papersearch.service.extraction.model.Glyph;
import com.flamingo.ai.papersearch.service.extraction.model.PageLayout;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Detects single- versus two-column layout for one page from glyph x-positions.
 *
 * <p>Glyph centres are projected onto the horizontal axis. A run of near-empty histogram bins in
 * the middle band of the page, with enough text on both sides of it, is taken as the column gutter.
 * Anything inconclusive is reported as {@link PageLayout#SINGLE_COLUMN}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LayoutAnalyzer {

  private static final float MIN_BIN_SIZE = 8f;

  private final RagConfig ragConfig;

  /**
   * Analyzes the layout of one page.
   *
   * @param glyphs the page glyphs
   * @param pageWidth the page width in points
   * @return the detected layout, never null
   */
  public PageLayout analyze(List<Glyph> glyphs, float pageWidth) {
    try {
      return detect(glyphs, pageWidth);
    } catch (RuntimeException e) {
      log.warn("Layout analysis failed, assuming single column: {}", e.getMessage());
      return PageLayout.SINGLE_COLUMN;
    }
  }

  private PageLayout detect(List<Glyph> glyphs, float pageWidth) {
    RagConfig.Layout config = ragConfig.getLayout();
    if (glyphs == null || glyphs.size() < config.getMinGlyphs() || pageWidth <= 0) {
      return PageLayout.SINGLE_COLUMN;
    }

    float binSize = Math.max(MIN_BIN_SIZE, pageWidth / 100f);
    int binCount = (int) (pageWidth / binSize) + 1;
    int[] bins = new int[binCount];
    int counted = 0;
    for (Glyph glyph : glyphs) {
      float center = glyph.centerX();
      if (glyph.isWhitespace() || center < 0 || center >= pageWidth) {
        continue;
      }
      bins[(int) (center / binSize)]++;
      counted++;
    }
    if (counted < config.getMinGlyphs()) {
      return PageLayout.SINGLE_COLUMN;
    }

    double maxDensity = 0;
    for (double value : smooth(bins)) {
      maxDensity = Math.max(maxDensity, value);
    }
    double threshold = config.getGapDensityRatio() * maxDensity;

    int from = (int) (binCount * config.getSearchStart());
    int to = Math.min(binCount - 1, (int) (binCount * config.getSearchEnd()));
    float pageCenter = pageWidth / 2f;
    Float boundary = null;

    int i = from;
    while (i <= to) {
      if (bins[i] <= threshold) {
        int start = i;
        while (i + 1 <= to && bins[i + 1] <= threshold) {
          i++;
        }
        float gapStart = start * binSize;
        float gapEnd = (i + 1) * binSize;
        float mid = (gapStart + gapEnd) / 2f;
        if (gapEnd - gapStart >= config.getMinGapWidth()
            && (boundary == null || Math.abs(mid - pageCenter) < Math.abs(boundary - pageCenter))) {
          boundary = mid;
        }
      }
      i++;
    }
    if (boundary == null) {
      return PageLayout.SINGLE_COLUMN;
    }

    int left = 0;
    for (Glyph glyph : glyphs) {
      if (!glyph.isWhitespace() && glyph.centerX() < boundary) {
        left++;
      }
    }
    int right = counted - left;
    double minShare = config.getMinColumnShare() * counted;
    if (left < minShare || right < minShare) {
      log.debug(
          "Gutter candidate at x={} rejected: {} left / {} right glyphs", boundary, left, right);
      return PageLayout.SINGLE_COLUMN;
    }
    return new PageLayout.TwoColumn(boundary);
  }

  /** Moving average over each bin and its direct neighbours. */
  private double[] smooth(int[] bins) {
    double[] smoothed = new double[bins.length];
    for (int i = 0; i < bins.length; i++) {
      int from = Math.max(0, i - 1);
      int to = Math.min(bins.length - 1, i + 1);
      double sum = 0;
      for (int j = from; j <= to; j++) {
        sum += bins[j];
      }
      smoothed[i] = sum / (to - from + 1);
    }
    return smoothed;
  }
}
