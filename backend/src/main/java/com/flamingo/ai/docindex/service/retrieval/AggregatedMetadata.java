package com.flamingo.ai.docindex.service.retrieval;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.TreeSet;
import lombok.Builder;
import lombok.Value;

/** What a result set covers: documents, heading paths, hierarchy levels and mean similarity. */
@Value
@Builder
public class AggregatedMetadata {

  private static final AggregatedMetadata EMPTY =
      AggregatedMetadata.builder()
          .documents(List.of())
          .headingPaths(List.of())
          .hierarchyLevels(List.of())
          .build();

  List<String> documents;
  List<String> headingPaths;

  /** Distinct levels, ascending. */
  List<Integer> hierarchyLevels;

  /** Mean of the similarities present, {@code null} when no hit carries one. */
  Double averageSimilarity;

  public static AggregatedMetadata empty() {
    return EMPTY;
  }

  public static AggregatedMetadata of(List<RetrievedChunk> hits) {
    if (hits.isEmpty()) {
      return EMPTY;
    }
    Set<String> documents = new LinkedHashSet<>();
    Set<String> headingPaths = new LinkedHashSet<>();
    Set<Integer> levels = new TreeSet<>();
    for (RetrievedChunk hit : hits) {
      documents.add(hit.getChunk().getDocumentId());
      headingPaths.add(hit.getChunk().headingPathText());
      levels.add(hit.getChunk().getHierarchyLevel());
    }
    OptionalDouble average =
        hits.stream()
            .map(RetrievedChunk::getSimilarity)
            .filter(Objects::nonNull)
            .mapToDouble(Double::doubleValue)
            .average();
    return AggregatedMetadata.builder()
        .documents(List.copyOf(documents))
        .headingPaths(List.copyOf(headingPaths))
        .hierarchyLevels(List.copyOf(levels))
        .averageSimilarity(average.isPresent() ? average.getAsDouble() : null)
        .build();
  }
}
