package com.flamingo.ai.docindex.service.rag.chunking;

import com.flamingo.ai.docindex.service.rag.model.DocumentStructure;
import com.flamingo.ai.docindex.service.rag.model.HierarchyNode;
import java.util.ArrayList;
import java.util.List;

/**
 * Explicit tree over a parsed structure, with every node tagged by the top-level section it
 * belongs to. Content before the first heading hangs directly off the virtual root.
 */
final class HierarchyTree {

  private HierarchyTree() {}

  /**
   * One tree position.
   *
   * @param node the structural node, {@code null} for the virtual root
   * @param sectionId id of the enclosing top-level heading, {@code null} outside any section
   * @param children child positions in document order
   */
  record TreeNode(HierarchyNode node, String sectionId, List<TreeNode> children) {

    boolean isRoot() {
      return node == null;
    }
  }

  static TreeNode build(DocumentStructure structure) {
    List<TreeNode> roots = new ArrayList<>();
    for (String id : structure.getRootNodeIds()) {
      structure.getNode(id).ifPresent(node -> roots.add(buildNode(structure, node, null)));
    }
    return new TreeNode(null, null, List.copyOf(roots));
  }

  private static TreeNode buildNode(
      DocumentStructure structure, HierarchyNode node, String sectionId) {
    if (!node.isHeading()) {
      return new TreeNode(node, sectionId, List.of());
    }
    String section = sectionId == null ? node.getId() : sectionId;
    List<TreeNode> children = new ArrayList<>();
    for (HierarchyNode child : structure.resolve(node.getChildrenIds())) {
      children.add(buildNode(structure, child, section));
    }
    return new TreeNode(node, section, List.copyOf(children));
  }
}
