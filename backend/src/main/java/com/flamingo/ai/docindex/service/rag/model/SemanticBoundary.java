package com.flamingo.ai.docindex.service.rag.model;

import com.flamingo.ai.docindex.domain.enums.BoundaryType;
import lombok.Builder;
import lombok.Value;

/**
 * Annotation between two adjacent text units.
 *
 * @see com.flamingo.ai.docindex.service.rag.semantic.SemanticBoundaryDetector
 */
@Value
@Builder
public class SemanticBoundary {

  /** Position of the node on the right-hand side of the boundary. */
  int position;

  /** Position of the node on the left-hand side. */
  int previousPosition;

  /** Raw cosine similarity of the two units, in [0,1]. */
  double similarity;

  /** How far the similarity falls below its local average, relative to that average. */
  double boundaryStrength;

  double similarityDrop;
  boolean topicShiftDetected;
  BoundaryType boundaryType;

  /** True when this boundary separates two {@link SemanticSegment}s. */
  public boolean isSegmentCut() {
    return boundaryType == BoundaryType.STRONG
        || (boundaryType == BoundaryType.MODERATE && topicShiftDetected);
  }
}
