package com.flamingo.ai.docindex.service.rag.model;

import com.flamingo.ai.docindex.domain.enums.ChunkingMethod;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/** Where a chunk came from and how it was cut. */
@Value
@Builder
public class ChunkProvenance {
  String sourceFileId;
  String sourceFileName;
  ChunkingMethod chunkingMethod;
  Instant createdAt;
}
