package com.flamingo.ai.docindex.service.retrieval;

import java.util.List;
import lombok.Builder;
import lombok.Value;

/** Heading tree rebuilt from stored heading chunks, one root list across documents. */
@Value
@Builder
public class TableOfContents {
  List<StructureEntry> entries;
  int totalHeadings;
}
