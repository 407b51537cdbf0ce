package com.flamingo.ai.papersearch.service.extraction;

import com.flamingo.ai.papersearch.config.RagConfig;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Extracts the DOI and the keywords of a paper.
 *
 * <p>Keywords declared by the authors ({@code Keywords:} or {@code Index Terms—}) win. Otherwise
 * the most frequent content words are used, ties going to the word that appears first.
 */
@Component
@RequiredArgsConstructor
public class PaperMetadataExtractor {

  private static final Pattern DOI =
      Pattern.compile("10\\.\\d{4,9}/[-._;()/:A-Z0-9]+", Pattern.CASE_INSENSITIVE);

  private static final Pattern DECLARED_KEYWORDS =
      Pattern.compile(
          "^\\s*(?:key\\s?words|index terms)\\s*[:—–.\\-]\\s*(.+)$",
          Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);

  private static final Pattern WORD = Pattern.compile("\\p{L}[\\p{L}\\p{N}'\\-]*");

  private static final int MIN_WORD_LENGTH = 3;

  private static final Set<String> STOP_WORDS =
      Set.of(
          // function words
          "the", "and", "for", "are", "was", "were", "with", "from", "that", "this", "these",
          "those", "there", "their", "they", "them", "then", "than", "which", "while", "where",
          "when", "what", "who", "whom", "how", "why", "into", "onto", "over", "under", "between",
          "through", "during", "before", "after", "above", "below", "about", "against", "again",
          "also", "both", "each", "every", "all", "any", "some", "such", "many", "much", "more",
          "most", "other", "only", "same", "very", "just", "not", "nor", "can", "could", "should",
          "would", "might", "must", "may", "shall", "will", "has", "have", "had", "been", "being",
          "does", "did", "its", "our", "ours", "you", "your", "her", "his", "him", "here", "even",
          "however", "thus", "hence", "therefore", "whereas", "although", "because", "via", "per",
          "one", "two", "three",
          // words every paper uses
          "paper", "papers", "section", "figure", "fig", "table", "et", "al", "using", "used",
          "use", "based", "show", "shows", "shown", "propose", "proposed", "approach", "results",
          "result", "work", "works", "method", "methods", "new", "well", "first", "second");

  private final RagConfig ragConfig;

  /**
   * Finds the first DOI in the text.
   *
   * @param text the paper text
   * @return the DOI without trailing punctuation, or empty
   */
  public Optional<String> extractDoi(String text) {
    if (text == null || text.isEmpty()) {
      return Optional.empty();
    }
    Matcher matcher = DOI.matcher(text);
    if (!matcher.find()) {
      return Optional.empty();
    }
    return Optional.of(matcher.group().replaceAll("[.,;:]+$", ""));
  }

  /** Extracts keywords with the configured count. */
  public List<String> extractKeywords(String content) {
    return extractKeywords(content, ragConfig.getExtraction().getMaxKeywords());
  }

  /**
   * Extracts up to {@code limit} keywords.
   *
   * @param content the paper text
   * @param limit maximum number of keywords
   * @return the declared keywords in author order, else content words by descending frequency
   */
  public List<String> extractKeywords(String content, int limit) {
    if (content == null || content.isBlank() || limit <= 0) {
      return List.of();
    }
    List<String> declared = declaredKeywords(content);
    if (!declared.isEmpty()) {
      return declared.size() > limit ? declared.subList(0, limit) : declared;
    }
    return frequentWords(content, limit);
  }

  private List<String> declaredKeywords(String content) {
    Matcher matcher = DECLARED_KEYWORDS.matcher(content);
    if (!matcher.find()) {
      return List.of();
    }
    Set<String> keywords = new LinkedHashSet<>();
    for (String part : matcher.group(1).split("[;,·•]")) {
      String keyword = part.replaceAll("\\s+", " ").strip().replaceAll("\\.$", "");
      if (!keyword.isEmpty()) {
        keywords.add(keyword);
      }
    }
    return new ArrayList<>(keywords);
  }

  private List<String> frequentWords(String content, int limit) {
    Map<String, Integer> counts = new HashMap<>();
    Map<String, Integer> firstSeen = new HashMap<>();
    Matcher matcher = WORD.matcher(content.toLowerCase(Locale.ROOT));
    while (matcher.find()) {
      String word = matcher.group().replaceAll("['\\-]+$", "");
      if (word.length() >= MIN_WORD_LENGTH && !STOP_WORDS.contains(word)) {
        counts.merge(word, 1, Integer::sum);
        firstSeen.putIfAbsent(word, matcher.start());
      }
    }
    return counts.keySet().stream()
        .sorted(
            Comparator.comparing((String word) -> counts.get(word))
                .reversed()
                .thenComparing(firstSeen::get))
        .limit(limit)
        .toList();
  }
}
