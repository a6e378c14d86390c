package com.flamingo.ai.docindex.domain.enums;

/** Query strategies supported by the chunk retriever. */
public enum RetrievalStrategy {
  /** Vector similarity over chunk embeddings. */
  SEMANTIC,

  /** Level and heading-path cues parsed from the query text. */
  HIERARCHICAL,

  /** Semantic and hierarchical results merged and reranked. */
  HYBRID,

  /** Semantic hits expanded with their neighbouring chunks. */
  CONTEXTUAL,

  /** Literal term matching against content and topic keywords. */
  KEYWORD
}
