package com.flamingo.ai.docindex.service.retrieval;

import lombok.Builder;
import lombok.Value;

/**
 * Table-of-contents request.
 *
 * <p>{@code documentId} restricts to one document, {@code maxDepth} drops headings nested deeper
 * than the given level, and {@code includeContent} lists the content chunks under each heading.
 */
@Value
@Builder
public class BrowseOptions {
  String documentId;
  Integer maxDepth;
  boolean includeContent;
}
