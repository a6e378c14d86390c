package com.flamingo.ai.docindex.exception;

/** Raised when an embedding's length disagrees with the configured dimension. */
public class EmbeddingDimensionException extends RuntimeException {

  private final int expected;
  private final int actual;

  public EmbeddingDimensionException(int expected, int actual) {
    super("Embedding dimension mismatch: expected " + expected + " but got " + actual);
    this.expected = expected;
    this.actual = actual;
  }

  public int getExpected() {
    return expected;
  }

  public int getActual() {
    return actual;
  }
}
