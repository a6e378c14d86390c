package com.flamingo.ai.docindex.service.rag.chunking;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Token counting with the cl100k_base encoding (JTokkit).
 *
 * <p>If the encoding cannot be loaded, or a count fails, the estimate {@code ceil(words × 0.75)}
 * is used instead so chunking can continue.
 */
@Component
@Slf4j
public class TokenCounter {

  private static final double TOKENS_PER_WORD = 0.75;

  private final Encoding encoding;

  public TokenCounter() {
    this.encoding = loadEncoding();
  }

  /** Counts tokens; {@code null} and blank text count as zero. */
  public int count(String text) {
    if (text == null || text.isBlank()) {
      return 0;
    }
    if (encoding != null) {
      try {
        return encoding.countTokens(text);
      } catch (RuntimeException e) {
        log.debug("Tokenizer failed on {} chars, estimating from words", text.length(), e);
      }
    }
    return estimate(text);
  }

  /** Word-based estimate, also used when the tokenizer is unavailable. */
  public static int estimate(String text) {
    if (text == null || text.isBlank()) {
      return 0;
    }
    int words = text.trim().split("\\s+").length;
    return (int) Math.ceil(words * TOKENS_PER_WORD);
  }

  private static Encoding loadEncoding() {
    try {
      return Encodings.newDefaultEncodingRegistry().getEncoding(EncodingType.CL100K_BASE);
    } catch (RuntimeException e) {
      log.warn(
          "cl100k_base encoding unavailable, token counts will be estimated: {}", e.getMessage());
      return null;
    }
  }
}
