package com.flamingo.ai.papersearch.service.extraction.model;

import java.util.List;

/**
 * Character offsets at which each page starts in the document full text.
 *
 * @param pageStartOffsets start offset of page {@code i + 1} at index {@code i}, ascending
 */
public record PageMap(List<Integer> pageStartOffsets) {

  /**
   * Returns the 1-based page containing the given full-text offset.
   *
   * @param offset character offset into the full text
   * @return the page number, or null when the map is empty or the offset is negative
   */
  public Integer pageAt(int offset) {
    if (pageStartOffsets.isEmpty() || offset < 0) {
      return null;
    }
    int low = 0;
    int high = pageStartOffsets.size() - 1;
    while (low < high) {
      int mid = (low + high + 1) >>> 1;
      if (pageStartOffsets.get(mid) <= offset) {
        low = mid;
      } else {
        high = mid - 1;
      }
    }
    return low + 1;
  }
}
