package com.flamingo.ai.docindex.service.retrieval;

import com.flamingo.ai.docindex.domain.enums.RetrievalStrategy;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/** Hits of one retrieval request. */
@Value
@Builder
public class RetrievalResult {

  List<RetrievedChunk> chunks;

  /** Matches found before truncation to the requested result count. */
  int totalFound;

  RetrievalStrategy strategy;
  long processingTimeMs;
  AggregatedMetadata aggregatedMetadata;

  public static RetrievalResult empty(RetrievalStrategy strategy, long processingTimeMs) {
    return RetrievalResult.builder()
        .chunks(List.of())
        .totalFound(0)
        .strategy(strategy)
        .processingTimeMs(processingTimeMs)
        .aggregatedMetadata(AggregatedMetadata.empty())
        .build();
  }
}
