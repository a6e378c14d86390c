package com.flamingo.ai.docindex.service.rag.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The parsed node set of one document, stored as an arena.
 *
 * <p>Nodes live in a flat list in document order; parent and child links are ids resolved through
 * an id-to-index map. Read-only after construction.
 */
public final class DocumentStructure {

  private static final DocumentStructure EMPTY = new DocumentStructure(List.of());

  private final List<HierarchyNode> nodes;
  private final List<String> rootNodeIds;
  private final Map<String, Integer> indexById;
  private final Map<String, List<String>> headingPaths;

  private DocumentStructure(List<HierarchyNode> nodes) {
    this.nodes = List.copyOf(nodes);
    Map<String, Integer> index = new HashMap<>();
    Map<String, List<String>> paths = new HashMap<>();
    List<String> roots = new ArrayList<>();
    for (int i = 0; i < this.nodes.size(); i++) {
      HierarchyNode node = this.nodes.get(i);
      index.put(node.getId(), i);
      if (node.getParentId() == null) {
        roots.add(node.getId());
      }
      if (node.isHeading()) {
        List<String> own = new ArrayList<>(node.getPath());
        own.add(node.getContent());
        paths.put(node.getId(), List.copyOf(own));
      } else {
        paths.put(node.getId(), node.getPath());
      }
    }
    this.indexById = Collections.unmodifiableMap(index);
    this.headingPaths = Collections.unmodifiableMap(paths);
    this.rootNodeIds = List.copyOf(roots);
  }

  /**
   * Creates a structure over nodes that are already linked and positioned.
   *
   * @param nodes nodes in document order
   * @return the structure
   */
  public static DocumentStructure of(List<HierarchyNode> nodes) {
    return nodes.isEmpty() ? EMPTY : new DocumentStructure(nodes);
  }

  public static DocumentStructure empty() {
    return EMPTY;
  }

  public List<HierarchyNode> getNodes() {
    return nodes;
  }

  public List<String> getRootNodeIds() {
    return rootNodeIds;
  }

  public boolean isEmpty() {
    return nodes.isEmpty();
  }

  public int size() {
    return nodes.size();
  }

  public Optional<HierarchyNode> getNode(String id) {
    Integer idx = indexById.get(id);
    return idx == null ? Optional.empty() : Optional.of(nodes.get(idx));
  }

  /**
   * Heading path of a node. For headings the path ends with the heading's own title; for content
   * it is the path of the enclosing section.
   *
   * @param id the node id
   * @return the heading path, empty when unknown
   */
  public List<String> getHeadingPath(String id) {
    return headingPaths.getOrDefault(id, List.of());
  }

  /** Returns the nodes with the given ids, in the order given. Unknown ids are skipped. */
  public List<HierarchyNode> resolve(List<String> ids) {
    List<HierarchyNode> resolved = new ArrayList<>(ids.size());
    for (String id : ids) {
      getNode(id).ifPresent(resolved::add);
    }
    return resolved;
  }
}
