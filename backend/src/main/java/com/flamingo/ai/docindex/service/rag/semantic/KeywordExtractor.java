package com.flamingo.ai.docindex.service.rag.semantic;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Frequency-based keyword extraction used for topic-shift detection and chunk keywords.
 *
 * <p>Text is lowercased and stripped of punctuation, so "self-service" counts as one word; every
 * word of four or more characters is counted. Ties keep first-occurrence order.
 */
@Component
public class KeywordExtractor {

  private static final int MIN_WORD_LENGTH = 4;

  /**
   * Returns the most frequent keywords of a text.
   *
   * @param text the text
   * @param limit maximum number of keywords
   * @return keywords, most frequent first
   */
  public List<String> extract(String text, int limit) {
    if (text == null || text.isBlank() || limit <= 0) {
      return List.of();
    }
    Map<String, Integer> counts = new LinkedHashMap<>();
    for (String word : tokenize(text)) {
      if (word.length() >= MIN_WORD_LENGTH) {
        counts.merge(word, 1, Integer::sum);
      }
    }
    List<Map.Entry<String, Integer>> entries = new ArrayList<>(counts.entrySet());
    // stable: equal counts keep first-occurrence order
    entries.sort((x, y) -> Integer.compare(y.getValue(), x.getValue()));
    return entries.stream().limit(limit).map(Map.Entry::getKey).toList();
  }

  /**
   * Jaccard overlap of two keyword sets. Two empty sets overlap fully.
   *
   * @param first first keyword list
   * @param second second keyword list
   * @return intersection size over union size
   */
  public double overlap(List<String> first, List<String> second) {
    Set<String> union = new HashSet<>(first);
    union.addAll(second);
    if (union.isEmpty()) {
      return 1.0;
    }
    Set<String> intersection = new HashSet<>(first);
    intersection.retainAll(new HashSet<>(second));
    return (double) intersection.size() / union.size();
  }

  /** Lowercase word tokens with punctuation removed. */
  public List<String> tokenize(String text) {
    String cleaned = text.toLowerCase(Locale.ROOT).replaceAll("[^\\p{L}\\p{N}\\s]", "");
    List<String> words = new ArrayList<>();
    for (String word : cleaned.split("\\s+")) {
      if (!word.isEmpty()) {
        words.add(word);
      }
    }
    return words;
  }
}
