package com.flamingo.ai.docindex.exception;

/**
 * Thrown at call entry when a chunking configuration has inverted or out-of-range bounds.
 *
 * <p>Carries the offending field so the caller can correct its input.
 */
public class InvalidChunkingConfigException extends RuntimeException {

  private final String field;

  public InvalidChunkingConfigException(String field, String message) {
    super(message);
    this.field = field;
  }

  public String getField() {
    return field;
  }
}
