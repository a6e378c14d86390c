package com.flamingo.ai.docindex.service.rag.model;

import com.flamingo.ai.docindex.domain.enums.NodeType;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * One structural unit of a parsed document.
 *
 * <p>Nodes are immutable once {@link
 * com.flamingo.ai.docindex.service.rag.parsing.DocumentStructureParser} returns. {@code
 * childrenIds} always lists exactly the nodes whose {@code parentId} is this node's id, and {@code
 * path} holds one title per ancestor heading.
 */
@Value
@Builder(toBuilder = true)
public class HierarchyNode {

  String id;
  NodeType type;

  /** Heading depth as written (1 = top heading). Content nodes carry their section's level. */
  int level;

  /** Normalized text. */
  String content;

  /** Enclosing heading, or {@code null} at document root. */
  String parentId;

  @Builder.Default List<String> childrenIds = List.of();

  /** Titles of the ancestor headings, outermost first. */
  @Builder.Default List<String> path = List.of();

  /** Document order, 0-based and gap-free. */
  int position;

  String rawText;

  public boolean isHeading() {
    return type == NodeType.HEADING;
  }
}
