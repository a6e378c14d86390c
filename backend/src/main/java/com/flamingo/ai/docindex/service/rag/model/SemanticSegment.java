package com.flamingo.ai.docindex.service.rag.model;

import java.util.List;
import lombok.Builder;
import lombok.Value;

/** A run of adjacent nodes that read as one topic. */
@Value
@Builder
public class SemanticSegment {

  int startPosition;
  int endPosition;
  String content;

  /** Mean pairwise similarity of the member embeddings; 1.0 for a single member. */
  double coherenceScore;

  List<String> topicKeywords;

  /** Normalized mean of the member embeddings. */
  float[] averageEmbedding;

  /** Absent for the first segment. */
  Double similarityToPrevious;

  /** Absent for the last segment. */
  Double similarityToNext;
}
