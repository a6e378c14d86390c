package com.flamingo.ai.docindex.service.rag.model;

import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/** Output of semantic boundary analysis over a node sequence. */
@Value
@Builder
public class SemanticAnalysisResult {

  private static final SemanticAnalysisResult EMPTY =
      SemanticAnalysisResult.builder()
          .segments(List.of())
          .boundaries(List.of())
          .overallCoherence(1.0)
          .recommendedSplitPoints(List.of())
          .nodeEmbeddings(Map.of())
          .nodeKeywords(Map.of())
          .degraded(false)
          .build();

  List<SemanticSegment> segments;
  List<SemanticBoundary> boundaries;

  /** Mean of all adjacent similarities; 1.0 when there are fewer than two units. */
  double overallCoherence;

  /** Node positions at which a new chunk should preferably start. */
  List<Integer> recommendedSplitPoints;

  /** Embedding per analysed node id. */
  Map<String, float[]> nodeEmbeddings;

  /** Top keywords per analysed node id. */
  Map<String, List<String>> nodeKeywords;

  /** True when any embedding came from the local fallback rather than the provider. */
  boolean degraded;

  public static SemanticAnalysisResult empty() {
    return EMPTY;
  }
}
