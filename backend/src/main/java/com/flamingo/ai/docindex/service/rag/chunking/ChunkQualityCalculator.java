package com.flamingo.ai.docindex.service.rag.chunking;

import com.flamingo.ai.docindex.service.rag.model.DocumentChunk;
import java.util.List;
import org.springframework.stereotype.Component;

/** Quality metrics over the chunks of one document, each in [0,1]. */
@Component
public class ChunkQualityCalculator {

  /** Fraction of adjacent pairs joined by overlap text; 0 with fewer than two chunks. */
  public double overlapEfficiency(List<DocumentChunk> chunks) {
    if (chunks.size() < 2) {
      return 0.0;
    }
    long withOverlap =
        chunks.subList(0, chunks.size() - 1).stream().filter(DocumentChunk::isOverlapNext).count();
    return (double) withOverlap / (chunks.size() - 1);
  }

  public double semanticCoherence(List<DocumentChunk> chunks) {
    return chunks.stream().mapToDouble(DocumentChunk::getSemanticDensity).average().orElse(0.0);
  }

  /**
   * Fraction of adjacent pairs whose heading paths are related: both empty, or sharing the same
   * top-level heading. 1.0 with fewer than two chunks.
   */
  public double hierarchyPreservation(List<DocumentChunk> chunks) {
    if (chunks.size() < 2) {
      return 1.0;
    }
    int related = 0;
    for (int i = 0; i < chunks.size() - 1; i++) {
      if (related(chunks.get(i).getHeadingPath(), chunks.get(i + 1).getHeadingPath())) {
        related++;
      }
    }
    return (double) related / (chunks.size() - 1);
  }

  private static boolean related(List<String> first, List<String> second) {
    if (first.isEmpty() || second.isEmpty()) {
      return first.isEmpty() && second.isEmpty();
    }
    return first.get(0).equals(second.get(0));
  }
}
