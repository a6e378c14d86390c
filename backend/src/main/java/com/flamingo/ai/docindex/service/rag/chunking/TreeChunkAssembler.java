package com.flamingo.ai.docindex.service.rag.chunking;

import com.flamingo.ai.docindex.domain.enums.ChunkType;
import com.flamingo.ai.docindex.domain.enums.NodeType;
import com.flamingo.ai.docindex.service.rag.chunking.HierarchyTree.TreeNode;
import com.flamingo.ai.docindex.service.rag.model.ChunkingConfig;
import com.flamingo.ai.docindex.service.rag.model.DocumentStructure;
import com.flamingo.ai.docindex.service.rag.model.HierarchyNode;
import com.flamingo.ai.docindex.service.rag.model.SemanticAnalysisResult;
import com.flamingo.ai.docindex.service.rag.model.SemanticBoundary;
import com.flamingo.ai.docindex.service.rag.semantic.VectorMath;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Objects;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Bottom-up assembly of draft chunks for one document.
 *
 * <p>The tree is walked post-order with an explicit stack. Each subtree reduces to an immutable
 * list of drafts, which its parent combines:
 *
 * <ol>
 *   <li>A leaf becomes one draft, or several if it exceeds the maximum size.
 *   <li>A heading is prepended to the first draft of its subtree when the result still fits,
 *       otherwise it stands alone.
 *   <li>Adjacent drafts are grouped greedily, see {@link #canMerge}.
 * </ol>
 *
 * <p>A final pass folds remaining undersized drafts into a neighbour where the same merge rules
 * allow it. Instances are single-use and not thread-safe.
 */
final class TreeChunkAssembler {

  private static final Pattern SENTENCE_BREAK = Pattern.compile("(?<=[.!?])\\s+");
  private static final String BLOCK_SEPARATOR = "\n\n";

  private final DocumentStructure structure;
  private final SemanticAnalysisResult analysis;
  private final ChunkingConfig config;
  private final TokenCounter tokenCounter;
  private final NavigableSet<Integer> strongBoundaryPositions = new TreeSet<>();

  TreeChunkAssembler(
      DocumentStructure structure,
      SemanticAnalysisResult analysis,
      ChunkingConfig config,
      double strongBoundaryStrength,
      TokenCounter tokenCounter) {
    this.structure = structure;
    this.analysis = analysis;
    this.config = config;
    this.tokenCounter = tokenCounter;
    if (config.isPreferSemanticBoundaries()) {
      for (SemanticBoundary boundary : analysis.getBoundaries()) {
        if (boundary.getBoundaryStrength() > strongBoundaryStrength) {
          strongBoundaryPositions.add(boundary.getPosition());
        }
      }
    }
  }

  List<DraftChunk> assemble(TreeNode root) {
    Map<TreeNode, List<DraftChunk>> reduced = new IdentityHashMap<>();
    Deque<Frame> stack = new ArrayDeque<>();
    stack.push(new Frame(root, false));

    while (!stack.isEmpty()) {
      Frame frame = stack.pop();
      TreeNode tree = frame.tree();
      if (!frame.childrenDone()) {
        stack.push(new Frame(tree, true));
        for (int i = tree.children().size() - 1; i >= 0; i--) {
          stack.push(new Frame(tree.children().get(i), false));
        }
        continue;
      }
      List<DraftChunk> fromChildren = new ArrayList<>();
      for (TreeNode child : tree.children()) {
        fromChildren.addAll(reduced.remove(child));
      }
      reduced.put(tree, reduce(tree, fromChildren));
    }

    return absorbUndersized(reduced.get(root));
  }

  private List<DraftChunk> reduce(TreeNode tree, List<DraftChunk> fromChildren) {
    if (tree.isRoot()) {
      return group(fromChildren);
    }
    HierarchyNode node = tree.node();
    if (!node.isHeading()) {
      return leafDrafts(tree);
    }

    List<DraftChunk> headingDrafts = leafDrafts(tree);
    if (fromChildren.isEmpty()) {
      return headingDrafts;
    }

    List<DraftChunk> combined = new ArrayList<>();
    if (config.isIncludeHeadingContext() && headingDrafts.size() == 1) {
      DraftChunk attached = merge(headingDrafts.get(0), fromChildren.get(0));
      if (attached.tokens() <= config.getMaxChunkSize()) {
        combined.add(attached);
        combined.addAll(fromChildren.subList(1, fromChildren.size()));
        return group(combined);
      }
    }
    combined.addAll(headingDrafts);
    combined.addAll(fromChildren);
    return group(combined);
  }

  // ---- leaves ----

  private List<DraftChunk> leafDrafts(TreeNode tree) {
    HierarchyNode node = tree.node();
    String content = node.getContent().trim();
    if (content.isEmpty()) {
      return List.of();
    }
    List<String> path = structure.getHeadingPath(node.getId());
    ChunkType type = ChunkType.fromNodeType(node.getType());
    double density = density(List.of(node.getId()));

    int tokens = tokenCounter.count(content);
    if (tokens <= config.getMaxChunkSize()) {
      return List.of(draft(content, tokens, type, path, node, density, tree.sectionId()));
    }

    List<DraftChunk> pieces = new ArrayList<>();
    for (String piece : split(content, node.getType())) {
      pieces.add(
          draft(piece, tokenCounter.count(piece), type, path, node, density, tree.sectionId()));
    }
    return pieces;
  }

  private DraftChunk draft(
      String content,
      int tokens,
      ChunkType type,
      List<String> path,
      HierarchyNode node,
      double density,
      String sectionId) {
    return new DraftChunk(
        content,
        tokens,
        type,
        path,
        node.getPosition(),
        node.getPosition(),
        List.of(node.getId()),
        density,
        sectionId);
  }

  /**
   * Splits oversized text into pieces of at most the target size. Line-oriented content splits on
   * lines, prose on sentences; anything still too long falls back to words.
   */
  private List<String> split(String content, NodeType type) {
    boolean lineOriented =
        type == NodeType.LIST || type == NodeType.TABLE || type == NodeType.CODE;
    String[] units = lineOriented ? content.split("\n") : SENTENCE_BREAK.split(content);
    return pack(units, lineOriented ? "\n" : " ", config.getTargetChunkSize());
  }

  private List<String> pack(String[] units, String joiner, int limit) {
    List<String> pieces = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    for (String raw : units) {
      String unit = raw.strip();
      if (unit.isEmpty()) {
        continue;
      }
      if (tokenCounter.count(unit) > limit) {
        flush(current, pieces);
        pieces.addAll(packWords(unit, limit));
        continue;
      }
      if (current.length() > 0
          && tokenCounter.count(current + joiner + unit) > limit) {
        flush(current, pieces);
      }
      if (current.length() > 0) {
        current.append(joiner);
      }
      current.append(unit);
    }
    flush(current, pieces);
    return pieces;
  }

  private List<String> packWords(String text, int limit) {
    List<String> pieces = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    for (String word : text.split("\\s+")) {
      if (tokenCounter.count(word) > limit) {
        flush(current, pieces);
        pieces.addAll(splitCharacters(word, limit));
        continue;
      }
      if (current.length() > 0 && tokenCounter.count(current + " " + word) > limit) {
        flush(current, pieces);
      }
      if (current.length() > 0) {
        current.append(' ');
      }
      current.append(word);
    }
    flush(current, pieces);
    return pieces;
  }

  private List<String> splitCharacters(String word, int limit) {
    List<String> pieces = new ArrayList<>();
    int start = 0;
    while (start < word.length()) {
      int end = Math.min(word.length(), start + Math.max(1, limit));
      while (end - start > 1 && tokenCounter.count(word.substring(start, end)) > limit) {
        end = start + (end - start) / 2;
      }
      pieces.add(word.substring(start, end));
      start = end;
    }
    return pieces;
  }

  private static void flush(StringBuilder current, List<String> pieces) {
    if (current.length() > 0) {
      pieces.add(current.toString());
      current.setLength(0);
    }
  }

  // ---- grouping ----

  private List<DraftChunk> group(List<DraftChunk> drafts) {
    List<DraftChunk> grouped = new ArrayList<>(drafts.size());
    for (DraftChunk draft : drafts) {
      int last = grouped.size() - 1;
      if (last >= 0) {
        DraftChunk merged = tryMerge(grouped.get(last), draft);
        if (merged != null) {
          grouped.set(last, merged);
          continue;
        }
      }
      grouped.add(draft);
    }
    return List.copyOf(grouped);
  }

  private List<DraftChunk> absorbUndersized(List<DraftChunk> drafts) {
    List<DraftChunk> result = new ArrayList<>(drafts);
    boolean changed = true;
    while (changed) {
      changed = false;
      for (int i = 0; i < result.size() && !changed; i++) {
        if (result.get(i).tokens() >= config.getMinChunkSize()) {
          continue;
        }
        if (i > 0) {
          DraftChunk merged = tryMerge(result.get(i - 1), result.get(i));
          if (merged != null) {
            result.set(i - 1, merged);
            result.remove(i);
            changed = true;
            continue;
          }
        }
        if (i + 1 < result.size()) {
          DraftChunk merged = tryMerge(result.get(i), result.get(i + 1));
          if (merged != null) {
            result.set(i, merged);
            result.remove(i + 1);
            changed = true;
          }
        }
      }
    }
    return List.copyOf(result);
  }

  /** Returns the merged draft, or {@code null} when the pair must stay apart. */
  private DraftChunk tryMerge(DraftChunk first, DraftChunk second) {
    if (!canMerge(first, second)) {
      return null;
    }
    DraftChunk merged = merge(first, second);
    return merged.tokens() <= config.getMaxChunkSize() ? merged : null;
  }

  /**
   * Merge preconditions other than size: same top-level section when sections are respected, no
   * strong semantic boundary in between when semantic boundaries are preferred, and a reason to
   * merge (an undersized side, two code blocks, or related content).
   */
  private boolean canMerge(DraftChunk first, DraftChunk second) {
    if (config.isRespectSectionBoundaries()
        && !Objects.equals(first.sectionId(), second.sectionId())) {
      return false;
    }
    if (strongBoundaryBetween(first, second)) {
      return false;
    }
    int min = config.getMinChunkSize();
    return first.tokens() < min
        || second.tokens() < min
        || (first.type() == ChunkType.CODE && second.type() == ChunkType.CODE)
        || related(first, second);
  }

  private boolean strongBoundaryBetween(DraftChunk first, DraftChunk second) {
    Integer next = strongBoundaryPositions.higher(first.lastPosition());
    return next != null && next <= second.firstPosition();
  }

  private static boolean related(DraftChunk first, DraftChunk second) {
    boolean headingThenContent =
        first.type() == ChunkType.HEADING && second.type() != ChunkType.HEADING;
    boolean sameLevel = first.level() > 0 && first.level() == second.level();
    return headingThenContent || sameLevel;
  }

  private DraftChunk merge(DraftChunk first, DraftChunk second) {
    String content = first.content() + BLOCK_SEPARATOR + second.content();
    List<String> nodeIds = new ArrayList<>(first.nodeIds());
    nodeIds.addAll(second.nodeIds());
    return new DraftChunk(
        content,
        tokenCounter.count(content),
        mergedType(first.type(), second.type()),
        commonPrefix(first.headingPath(), second.headingPath()),
        Math.min(first.firstPosition(), second.firstPosition()),
        Math.max(first.lastPosition(), second.lastPosition()),
        List.copyOf(nodeIds),
        (first.density() + second.density()) / 2.0,
        Objects.equals(first.sectionId(), second.sectionId()) ? first.sectionId() : null);
  }

  private static ChunkType mergedType(ChunkType first, ChunkType second) {
    if (first == second) {
      return first;
    }
    return first == ChunkType.HEADING ? ChunkType.HEADING : ChunkType.MIXED;
  }

  private static List<String> commonPrefix(List<String> first, List<String> second) {
    int length = 0;
    while (length < first.size()
        && length < second.size()
        && first.get(length).equals(second.get(length))) {
      length++;
    }
    return List.copyOf(first.subList(0, length));
  }

  private double density(List<String> nodeIds) {
    List<float[]> vectors = new ArrayList<>();
    for (String id : nodeIds) {
      float[] vector = analysis.getNodeEmbeddings().get(id);
      if (vector != null) {
        vectors.add(vector);
      }
    }
    return VectorMath.meanPairwise(vectors);
  }

  private record Frame(TreeNode tree, boolean childrenDone) {}
}
