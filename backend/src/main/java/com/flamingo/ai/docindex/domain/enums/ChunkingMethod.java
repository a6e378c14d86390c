package com.flamingo.ai.docindex.domain.enums;

/** How chunk boundaries were decided for a document. */
public enum ChunkingMethod {
  /** Document structure only. */
  STRUCTURAL,

  /** Semantic boundaries only. */
  SEMANTIC,

  /** Structure first, vetoed by strong semantic boundaries. */
  HYBRID
}
