package com.flamingo.ai.docindex.store;

import com.flamingo.ai.docindex.domain.enums.ChunkType;
import com.flamingo.ai.docindex.service.rag.model.DocumentChunk;
import java.util.List;
import java.util.Locale;
import lombok.Builder;
import lombok.Value;

/**
 * Store-independent chunk filter. Unset fields do not restrict.
 *
 * <p>{@link #matches} is the reference semantics; store adapters translate the same conditions
 * into their own query language.
 */
@Value
@Builder(toBuilder = true)
public class ChunkFilter {

  String projectId;
  String documentId;
  ChunkType chunkType;
  Integer hierarchyLevel;

  /** Case-insensitive substring of the joined heading path. */
  String headingPathContains;

  Integer minPosition;
  Integer maxPosition;

  /** At least one of these lowercase terms must occur in the content or the keywords. */
  @Builder.Default List<String> anyTerms = List.of();

  /** Keyset cursor: only chunks after (afterDocumentId, afterPosition) in document order. */
  String afterDocumentId;

  Integer afterPosition;

  public static ChunkFilter forProject(String projectId) {
    return ChunkFilter.builder().projectId(projectId).build();
  }

  /** This filter resumed after the given chunk, for reading results page by page. */
  public ChunkFilter after(DocumentChunk last) {
    return toBuilder()
        .afterDocumentId(last.getDocumentId())
        .afterPosition(last.getPosition())
        .build();
  }

  public boolean matches(String chunkProjectId, DocumentChunk chunk) {
    if (projectId != null && !projectId.equals(chunkProjectId)) {
      return false;
    }
    if (documentId != null && !documentId.equals(chunk.getDocumentId())) {
      return false;
    }
    if (chunkType != null && chunkType != chunk.getChunkType()) {
      return false;
    }
    if (hierarchyLevel != null && hierarchyLevel != chunk.getHierarchyLevel()) {
      return false;
    }
    if (headingPathContains != null
        && !lower(chunk.headingPathText()).contains(lower(headingPathContains))) {
      return false;
    }
    if (minPosition != null && chunk.getPosition() < minPosition) {
      return false;
    }
    if (maxPosition != null && chunk.getPosition() > maxPosition) {
      return false;
    }
    if (afterDocumentId != null && !isAfterCursor(chunk)) {
      return false;
    }
    return anyTerms.isEmpty() || anyTerms.stream().anyMatch(term -> containsTerm(chunk, term));
  }

  private boolean isAfterCursor(DocumentChunk chunk) {
    int order = chunk.getDocumentId().compareTo(afterDocumentId);
    return order > 0
        || (order == 0 && afterPosition != null && chunk.getPosition() > afterPosition);
  }

  private static boolean containsTerm(DocumentChunk chunk, String term) {
    String needle = lower(term);
    return lower(chunk.getContent()).contains(needle)
        || chunk.getTopicKeywords().stream().anyMatch(k -> lower(k).equals(needle));
  }

  private static String lower(String value) {
    return value == null ? "" : value.toLowerCase(Locale.ROOT);
  }
}
