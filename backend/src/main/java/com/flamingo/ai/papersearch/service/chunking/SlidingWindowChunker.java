package com.flamingo.ai.papersearch.service.chunking;

import com.flamingo.ai.papersearch.config.RagConfig;
import com.flamingo.ai.papersearch.domain.enums.ChunkType;
import com.flamingo.ai.papersearch.domain.enums.PaperSection;
import com.flamingo.ai.papersearch.service.extraction.model.PageMap;
import com.flamingo.ai.papersearch.service.extraction.model.SectionText;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * {@link DocumentChunker} that slides a fixed-size character window over each section.
 *
 * <p>Window ends are pulled back to the last sentence end, then paragraph break, line break or
 * space, as long as that keeps the chunk at least {@code minSize} long; otherwise the window is cut
 * hard. Consecutive windows of a section overlap by {@code overlap} characters. Chunks never cross
 * section boundaries.
 *
 * <p>If no section carries text, the whole document is chunked as a single {@code full_text}
 * section.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SlidingWindowChunker implements DocumentChunker {

  private static final String[] SENTENCE_ENDS = {". ", "! ", "? "};
  private static final String[] SOFT_BREAKS = {"\n\n", "\n", " "};

  private final RagConfig ragConfig;

  @Override
  public List<RawChunk> chunk(ChunkingRequest request) {
    RagConfig.Chunking config = ragConfig.getChunking();
    validate(config);

    List<SectionText> sections = request.sections();
    if (sections.stream().allMatch(s -> s.text() == null || s.text().isBlank())) {
      sections =
          List.of(new SectionText(PaperSection.FULL_TEXT.getLabel(), request.fullText(), 0));
    }

    List<RawChunk> result = new ArrayList<>();
    for (SectionText section : sections) {
      String raw = section.text() == null ? "" : section.text();
      String content = raw.trim();
      if (content.isEmpty()) {
        continue;
      }
      int leading = raw.indexOf(content);
      ChunkType type =
          PaperSection.REFERENCES.getLabel().equals(section.label())
              ? ChunkType.REFERENCE
              : ChunkType.TEXT;

      for (int[] window : windows(content, config)) {
        Integer page = pageOf(request.pageMap(), section.startOffset(), leading + window[0]);
        result.add(
            new RawChunk(
                result.size(),
                content.substring(window[0], window[1]),
                section.label(),
                page,
                type));
      }
    }

    log.debug(
        "SlidingWindowChunker produced {} chunks from {} sections", result.size(), sections.size());
    return result;
  }

  /**
   * Computes the window bounds over one trimmed section text.
   *
   * @return {@code [start, end)} pairs in order
   */
  List<int[]> windows(String text, RagConfig.Chunking config) {
    int size = config.getSize();
    int overlap = config.getOverlap();
    int minSize = config.getMinSize();
    int length = text.length();

    List<int[]> windows = new ArrayList<>();
    int start = 0;
    while (start < length) {
      int end = Math.min(start + size, length);
      if (end < length) {
        end = snap(text, start, end, minSize);
      }
      windows.add(new int[] {start, end});
      if (end >= length) {
        break;
      }
      int next = end - overlap;
      while (next < length && Character.isWhitespace(text.charAt(next))) {
        next++;
      }
      // always make progress
      start = Math.max(next, start + 1);
    }
    return windows;
  }

  private int snap(String text, int start, int end, int minSize) {
    String window = text.substring(start, end);
    int best = -1;
    for (String marker : SENTENCE_ENDS) {
      best = Math.max(best, window.lastIndexOf(marker));
    }
    if (best >= minSize) {
      return start + best + 1;
    }
    for (String marker : SOFT_BREAKS) {
      int pos = window.lastIndexOf(marker);
      if (pos >= minSize) {
        return start + pos;
      }
    }
    return end;
  }

  private Integer pageOf(PageMap pageMap, Integer sectionStart, int offsetInSection) {
    if (pageMap == null || sectionStart == null) {
      return null;
    }
    return pageMap.pageAt(sectionStart + offsetInSection);
  }

  private static void validate(RagConfig.Chunking config) {
    int overlap = config.getOverlap();
    int minSize = config.getMinSize();
    int size = config.getSize();
    if (overlap < 0 || overlap >= minSize || minSize > size) {
      throw new IllegalArgumentException(
          "Invalid chunking configuration: require 0 <= overlap < minSize <= size, got overlap="
              + overlap
              + ", minSize="
              + minSize
              + ", size="
              + size);
    }
  }
}
