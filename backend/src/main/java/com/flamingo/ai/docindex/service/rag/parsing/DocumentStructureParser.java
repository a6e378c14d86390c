package com.flamingo.ai.docindex.service.rag.parsing;

import com.flamingo.ai.docindex.domain.enums.NodeType;
import com.flamingo.ai.docindex.service.rag.model.DocumentStructure;
import com.flamingo.ai.docindex.service.rag.model.HierarchyNode;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Recovers a heading/content tree from flat text.
 *
 * <p>Lines are classified in a fixed order: code fence, markdown heading, numbered heading, list
 * item, table row, indented or backtick code, and finally paragraph. Headings nest through a level
 * stack; every other node hangs off the heading on top of the stack. A grouping pass then folds
 * runs of same-type siblings into single nodes so one-line paragraphs and list items do not turn
 * into one-line chunks later.
 *
 * <p>Parsing never fails. Anything unrecognised becomes a paragraph.
 */
@Service
@Slf4j
public class DocumentStructureParser {

  private static final Pattern MARKDOWN_HEADING = Pattern.compile("^(#{1,6})\\s+(.+?)\\s*#*\\s*$");

  /** "1.2 Title" or "1.2. Title"; level is the number of numeric parts. */
  private static final Pattern MULTI_LEVEL_NUMBERED_HEADING =
      Pattern.compile("^(\\d+(?:\\.\\d+)+)\\.?\\s+(\\S.*)$");

  /** "1. Title"; only a heading when the text reads like a title, see {@link #looksLikeTitle}. */
  private static final Pattern SINGLE_NUMBERED_HEADING = Pattern.compile("^(\\d+)\\.\\s+(\\S.*)$");

  private static final Pattern BULLET_ITEM = Pattern.compile("^\\s*[-*+•]\\s+(.+)$");
  private static final Pattern NUMBERED_ITEM = Pattern.compile("^\\s*\\d+[.)]\\s+(.+)$");
  private static final Pattern INLINE_CODE = Pattern.compile("^`[^`]+`$");
  private static final String FENCE = "```";
  private static final int MAX_TITLE_LENGTH = 80;

  private static final String BULLET = "• ";

  /**
   * Parses raw text into a document structure.
   *
   * @param text the raw document text, may be {@code null} or blank
   * @return the structure, empty for blank input
   */
  public DocumentStructure parse(String text) {
    if (text == null || text.isBlank()) {
      return DocumentStructure.empty();
    }

    List<Draft> drafts = classifyLines(text.split("\\r?\\n", -1));
    List<Draft> grouped = groupSiblings(drafts);
    DocumentStructure structure = freeze(grouped);

    log.debug(
        "Parsed {} lines into {} nodes ({} before grouping)",
        text.lines().count(),
        structure.size(),
        drafts.size());
    return structure;
  }

  /**
   * Renders a structure back to markdown-like text. Headings and content survive a re-parse;
   * whitespace does not.
   */
  public String structureToText(DocumentStructure structure) {
    List<String> blocks = new ArrayList<>();
    for (HierarchyNode node : structure.getNodes()) {
      switch (node.getType()) {
        case HEADING ->
            blocks.add("#".repeat(clampHeadingLevel(node.getLevel())) + " " + node.getContent());
        case CODE -> blocks.add(FENCE + "\n" + node.getContent() + "\n" + FENCE);
        case PARAGRAPH, LIST, TABLE, TEXT -> blocks.add(node.getContent());
      }
    }
    return String.join("\n\n", blocks);
  }

  /**
   * Returns every node below a heading, in document order.
   *
   * @param structure the parsed document
   * @param headingId id of the heading
   * @return descendants of the heading, empty if the id is unknown
   */
  public List<HierarchyNode> getNodesUnderHeading(DocumentStructure structure, String headingId) {
    List<HierarchyNode> result = new ArrayList<>();
    HierarchyNode heading = structure.getNode(headingId).orElse(null);
    if (heading == null) {
      return result;
    }
    Deque<String> stack = new ArrayDeque<>();
    pushReversed(stack, heading.getChildrenIds());
    while (!stack.isEmpty()) {
      HierarchyNode node = structure.getNode(stack.pop()).orElse(null);
      if (node != null) {
        result.add(node);
        pushReversed(stack, node.getChildrenIds());
      }
    }
    return result;
  }

  public List<HierarchyNode> getHeadingsAtLevel(DocumentStructure structure, int level) {
    return structure.getNodes().stream()
        .filter(node -> node.isHeading() && node.getLevel() == level)
        .toList();
  }

  // ---- line classification ----

  private List<Draft> classifyLines(String[] lines) {
    List<Draft> drafts = new ArrayList<>();
    Deque<Draft> headingStack = new ArrayDeque<>();

    int i = 0;
    while (i < lines.length) {
      String line = lines[i];
      String trimmed = line.trim();
      if (trimmed.isEmpty()) {
        i++;
        continue;
      }

      Draft draft;
      if (trimmed.startsWith(FENCE)) {
        int end = findClosingFence(lines, i + 1);
        List<String> body = new ArrayList<>();
        for (int j = i + 1; j < end && j < lines.length; j++) {
          body.add(lines[j]);
        }
        int last = Math.min(end, lines.length - 1);
        draft = new Draft(NodeType.CODE, 0, String.join("\n", body), joinRaw(lines, i, last));
        i = last + 1;
      } else {
        draft = classifyLine(line, trimmed);
        i++;
      }

      if (draft.type == NodeType.HEADING) {
        while (!headingStack.isEmpty() && headingStack.peek().level >= draft.level) {
          headingStack.pop();
        }
        draft.parent = headingStack.peek();
        headingStack.push(draft);
      } else {
        draft.parent = headingStack.peek();
        draft.level = draft.parent == null ? 0 : draft.parent.level;
      }
      drafts.add(draft);
    }
    return drafts;
  }

  private Draft classifyLine(String line, String trimmed) {
    Matcher markdown = MARKDOWN_HEADING.matcher(trimmed);
    if (markdown.matches()) {
      return new Draft(NodeType.HEADING, markdown.group(1).length(), markdown.group(2), line);
    }

    Matcher multiLevel = MULTI_LEVEL_NUMBERED_HEADING.matcher(trimmed);
    if (multiLevel.matches()) {
      int level = multiLevel.group(1).split("\\.").length;
      return new Draft(NodeType.HEADING, level, trimmed, line);
    }

    Matcher singleLevel = SINGLE_NUMBERED_HEADING.matcher(trimmed);
    if (singleLevel.matches() && looksLikeTitle(singleLevel.group(2))) {
      return new Draft(NodeType.HEADING, 1, trimmed, line);
    }

    Matcher bullet = BULLET_ITEM.matcher(line);
    if (bullet.matches()) {
      return new Draft(NodeType.LIST, 0, BULLET + bullet.group(1).trim(), line);
    }
    Matcher numbered = NUMBERED_ITEM.matcher(line);
    if (numbered.matches()) {
      return new Draft(NodeType.LIST, 0, BULLET + numbered.group(1).trim(), line);
    }

    if (countPipes(trimmed) >= 2) {
      return new Draft(NodeType.TABLE, 0, trimmed, line);
    }

    if (line.startsWith("    ")
        || line.startsWith("\t")
        || INLINE_CODE.matcher(trimmed).matches()) {
      return new Draft(NodeType.CODE, 0, line.strip(), line);
    }

    return new Draft(NodeType.PARAGRAPH, 0, trimmed, line);
  }

  /** Short, capitalised, and not ending like a sentence. */
  private boolean looksLikeTitle(String text) {
    if (text.length() > MAX_TITLE_LENGTH || !Character.isUpperCase(text.codePointAt(0))) {
      return false;
    }
    char last = text.charAt(text.length() - 1);
    return ".!?:;,".indexOf(last) < 0;
  }

  private int findClosingFence(String[] lines, int from) {
    for (int j = from; j < lines.length; j++) {
      if (lines[j].trim().startsWith(FENCE)) {
        return j;
      }
    }
    return lines.length;
  }

  // ---- grouping ----

  private List<Draft> groupSiblings(List<Draft> drafts) {
    List<Draft> grouped = new ArrayList<>();
    for (Draft draft : drafts) {
      Draft previous = grouped.isEmpty() ? null : grouped.get(grouped.size() - 1);
      if (previous != null && canGroup(previous, draft)) {
        previous.absorb(draft);
      } else {
        grouped.add(draft);
      }
    }
    return grouped;
  }

  private boolean canGroup(Draft previous, Draft next) {
    return previous.type == next.type
        && previous.type != NodeType.HEADING
        && previous.parent == next.parent;
  }

  // ---- freezing into immutable nodes ----

  private DocumentStructure freeze(List<Draft> drafts) {
    Map<Draft, String> ids = new LinkedHashMap<>();
    for (int position = 0; position < drafts.size(); position++) {
      ids.put(drafts.get(position), "node_" + position);
    }

    Map<Draft, List<String>> children = new LinkedHashMap<>();
    for (Draft draft : drafts) {
      if (draft.parent != null) {
        children.computeIfAbsent(draft.parent, k -> new ArrayList<>()).add(ids.get(draft));
      }
    }

    List<HierarchyNode> nodes = new ArrayList<>(drafts.size());
    for (int position = 0; position < drafts.size(); position++) {
      Draft draft = drafts.get(position);
      nodes.add(
          HierarchyNode.builder()
              .id(ids.get(draft))
              .type(draft.type)
              .level(draft.level)
              .content(draft.content.toString())
              .parentId(draft.parent == null ? null : ids.get(draft.parent))
              .childrenIds(List.copyOf(children.getOrDefault(draft, List.of())))
              .path(ancestorTitles(draft))
              .position(position)
              .rawText(draft.raw.toString())
              .build());
    }
    return DocumentStructure.of(nodes);
  }

  private List<String> ancestorTitles(Draft draft) {
    List<String> titles = new ArrayList<>();
    for (Draft p = draft.parent; p != null; p = p.parent) {
      titles.add(0, p.content.toString());
    }
    return List.copyOf(titles);
  }

  private static void pushReversed(Deque<String> stack, List<String> ids) {
    for (int i = ids.size() - 1; i >= 0; i--) {
      stack.push(ids.get(i));
    }
  }

  private static int countPipes(String text) {
    int count = 0;
    for (int i = 0; i < text.length(); i++) {
      if (text.charAt(i) == '|') {
        count++;
      }
    }
    return count;
  }

  private static String joinRaw(String[] lines, int from, int to) {
    StringBuilder sb = new StringBuilder();
    for (int j = from; j <= to; j++) {
      if (j > from) {
        sb.append('\n');
      }
      sb.append(lines[j]);
    }
    return sb.toString();
  }

  private static int clampHeadingLevel(int level) {
    return Math.max(1, Math.min(6, level));
  }

  /** Mutable node used only while a single parse is in progress. */
  private static final class Draft {
    private final NodeType type;
    private int level;
    private final StringBuilder content;
    private final StringBuilder raw;
    private Draft parent;

    private Draft(NodeType type, int level, String content, String raw) {
      this.type = type;
      this.level = level;
      this.content = new StringBuilder(content);
      this.raw = new StringBuilder(raw);
    }

    private void absorb(Draft next) {
      content.append(separator()).append(next.content);
      raw.append('\n').append(next.raw);
    }

    private String separator() {
      return type == NodeType.PARAGRAPH || type == NodeType.TEXT ? " " : "\n";
    }
  }
}
