package com.flamingo.ai.docindex.service.retrieval;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Reads structural cues out of a free-text query.
 *
 * <p>Recognised cues are a level ("level 2", "h2", "heading 2", "top-level" for 1, "subsection"
 * for 2) and a heading reference ("section 2", "subsection 2.1", "chapter: Background"). An
 * explicit level number wins over the level words; level numbers have at most three digits. A
 * numeric heading reference matches a heading whose title starts with that number, so "section 2"
 * matches "2 Methods" and "2.1 Setup" but not "12 Appendix". Any other reference matches headings
 * containing it, ignoring case.
 */
@Component
public class HierarchicalQueryParser {

  private static final Pattern LEVEL =
      Pattern.compile(
          "\\blevel\\s*(\\d{1,3})\\b|\\bh(\\d{1,3})\\b|\\bheading\\s*(\\d{1,3})\\b",
          Pattern.CASE_INSENSITIVE);

  private static final Pattern TOP_LEVEL =
      Pattern.compile("\\btop[-\\s]?level\\b", Pattern.CASE_INSENSITIVE);

  private static final Pattern SUBSECTION =
      Pattern.compile("\\bsub-?sections?\\b", Pattern.CASE_INSENSITIVE);

  private static final Pattern HEADING =
      Pattern.compile(
          "\\b(?:sub-?section|section|heading|chapter)\\b\\s*[\":]*\\s*(\\d+(?:\\.\\d+)*|[^,.\"]+)",
          Pattern.CASE_INSENSITIVE);

  private static final Pattern NUMERIC = Pattern.compile("\\d+(?:\\.\\d+)*");

  /**
   * Structural cues of one query.
   *
   * @param level requested hierarchy level, {@code null} if none
   * @param heading heading reference, {@code null} if none
   */
  public record HierarchyHints(Integer level, String heading) {

    public boolean isEmpty() {
      return level == null && heading == null;
    }
  }

  public HierarchyHints parse(String query) {
    if (query == null || query.isBlank()) {
      return new HierarchyHints(null, null);
    }
    Integer level = null;
    Matcher levelMatcher = LEVEL.matcher(query);
    if (levelMatcher.find()) {
      for (int group = 1; group <= 3 && level == null; group++) {
        if (levelMatcher.group(group) != null) {
          level = Integer.parseInt(levelMatcher.group(group));
        }
      }
    } else if (TOP_LEVEL.matcher(query).find()) {
      level = 1;
    } else if (SUBSECTION.matcher(query).find()) {
      level = 2;
    }

    String heading = null;
    Matcher headingMatcher = HEADING.matcher(query);
    if (headingMatcher.find()) {
      String reference = headingMatcher.group(1).trim();
      if (!reference.isEmpty()) {
        heading = reference;
      }
    }
    return new HierarchyHints(level, heading);
  }

  /**
   * Whether any heading of a path matches a heading reference.
   *
   * @param headingPath the chunk's heading path
   * @param reference the heading reference from {@link #parse}
   */
  public boolean matchesHeading(List<String> headingPath, String reference) {
    String needle = reference.toLowerCase(Locale.ROOT);
    if (NUMERIC.matcher(reference).matches()) {
      Pattern numbered =
          Pattern.compile(
              "^(?:section|chapter)?\\s*" + Pattern.quote(needle) + "(?!\\d)",
              Pattern.CASE_INSENSITIVE);
      return headingPath.stream().anyMatch(h -> numbered.matcher(h.strip()).find());
    }
    return headingPath.stream().anyMatch(h -> h.toLowerCase(Locale.ROOT).contains(needle));
  }
}
