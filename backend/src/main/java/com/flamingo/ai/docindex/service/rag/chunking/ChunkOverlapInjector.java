package com.flamingo.ai.docindex.service.rag.chunking;

import com.flamingo.ai.docindex.service.rag.model.DocumentChunk;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Carries the tail of each chunk forward as context for the next one.
 *
 * <p>The overlap target is {@code overlapPercentage} of the earlier chunk's tokens. Whole trailing
 * sentences are preferred as long as they stay within one and a half times the target; otherwise
 * the trailing words up to the target are used. The overlap text is stored on the earlier chunk,
 * and both chunks of a pair are flagged.
 */
@Component
@RequiredArgsConstructor
public class ChunkOverlapInjector {

  private static final Pattern SENTENCE_BREAK = Pattern.compile("(?<=[.!?])\\s+");
  private static final double SENTENCE_SLACK = 1.5;

  private final TokenCounter tokenCounter;

  /**
   * Adds overlap to adjacent chunk pairs.
   *
   * @param chunks chunks in document order
   * @param overlapPercentage share of each chunk to repeat, 0 disables overlap
   * @return new chunk instances with overlap fields set
   */
  public List<DocumentChunk> apply(List<DocumentChunk> chunks, int overlapPercentage) {
    if (chunks.size() < 2 || overlapPercentage <= 0) {
      return chunks;
    }
    List<DocumentChunk> result = new ArrayList<>(chunks);
    for (int i = 0; i < result.size() - 1; i++) {
      DocumentChunk current = result.get(i);
      String overlap = overlapText(current, overlapPercentage);
      if (overlap.isEmpty()) {
        continue;
      }
      result.set(i, current.toBuilder().overlapNext(true).overlapText(overlap).build());
      result.set(i + 1, result.get(i + 1).toBuilder().overlapPrevious(true).build());
    }
    return List.copyOf(result);
  }

  private String overlapText(DocumentChunk chunk, int overlapPercentage) {
    int target = chunk.getTokens() * overlapPercentage / 100;
    if (target <= 0) {
      return "";
    }

    String[] sentences = SENTENCE_BREAK.split(chunk.getContent().strip());
    if (sentences.length > 1) {
      String tail = "";
      for (int i = sentences.length - 1; i > 0; i--) {
        String candidate = tail.isEmpty() ? sentences[i] : sentences[i] + " " + tail;
        int tokens = tokenCounter.count(candidate);
        if (tokens > SENTENCE_SLACK * target) {
          break;
        }
        tail = candidate;
        if (tokens >= target) {
          return tail;
        }
      }
    }

    String[] words = chunk.getContent().strip().split("\\s+");
    if (words.length < 2) {
      return "";
    }
    int from = words.length;
    while (from > 1) {
      String candidate = String.join(" ", List.of(words).subList(from - 1, words.length));
      if (tokenCounter.count(candidate) > target) {
        break;
      }
      from--;
    }
    return from == words.length ? "" : String.join(" ", List.of(words).subList(from, words.length));
  }
}
