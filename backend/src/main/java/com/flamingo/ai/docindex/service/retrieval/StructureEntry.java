package com.flamingo.ai.docindex.service.retrieval;

import java.util.List;
import lombok.Builder;
import lombok.Value;

/** One heading in a table of contents. */
@Value
@Builder
public class StructureEntry {
  String chunkId;
  String documentId;
  String title;
  List<String> headingPath;
  int level;
  int position;
  @Builder.Default List<String> contentChunkIds = List.of();
  @Builder.Default List<StructureEntry> children = List.of();
}
