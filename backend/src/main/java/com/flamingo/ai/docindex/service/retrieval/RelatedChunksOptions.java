package com.flamingo.ai.docindex.service.retrieval;

import com.flamingo.ai.docindex.config.RagConfig;
import lombok.Builder;
import lombok.Value;

/** Which relations {@link ChunkRetriever#getRelatedChunks} follows and how many hits it keeps. */
@Value
@Builder(toBuilder = true)
public class RelatedChunksOptions {

  @Builder.Default boolean includeSiblings = true;
  @Builder.Default boolean includeParentChildren = true;
  @Builder.Default boolean includeSemantic = true;
  @Builder.Default double similarityThreshold = 0.6;
  @Builder.Default int maxResults = 10;

  public static RelatedChunksOptions defaults(RagConfig.Retrieval properties) {
    return RelatedChunksOptions.builder()
        .similarityThreshold(properties.getRelatedSimilarityThreshold())
        .maxResults(properties.getRelatedMaxResults())
        .build();
  }
}
