package com.flamingo.ai.docindex.elasticsearch;

import com.flamingo.ai.docindex.domain.enums.ChunkType;
import com.flamingo.ai.docindex.domain.enums.ChunkingMethod;
import com.flamingo.ai.docindex.exception.MalformedChunkDataException;
import com.flamingo.ai.docindex.service.rag.model.ChunkProvenance;
import com.flamingo.ai.docindex.service.rag.model.DocumentChunk;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Converts chunks to and from the flat field maps stored in the chunk index.
 *
 * <p>Decoding is strict on the fields retrieval depends on (ids, content, position, type, heading
 * path) and lenient on the rest. A record missing or mistyping a required field raises {@link
 * MalformedChunkDataException}.
 */
@Component
public class ChunkDocumentMapper {

  static final String PROJECT_ID = "projectId";
  static final String CHUNK_ID = "chunkId";
  static final String DOCUMENT_ID = "documentId";
  static final String CONTENT = "content";
  static final String TOKENS = "tokens";
  static final String POSITION = "position";
  static final String HEADING_PATH = "headingPath";
  static final String HEADING_PATH_TEXT = "headingPathText";
  static final String HIERARCHY_LEVEL = "hierarchyLevel";
  static final String CHUNK_TYPE = "chunkType";
  static final String SEMANTIC_DENSITY = "semanticDensity";
  static final String TOPIC_KEYWORDS = "topicKeywords";
  static final String OVERLAP_PREVIOUS = "overlapPrevious";
  static final String OVERLAP_NEXT = "overlapNext";
  static final String OVERLAP_TEXT = "overlapText";
  static final String PREVIOUS_CHUNK_ID = "previousChunkId";
  static final String NEXT_CHUNK_ID = "nextChunkId";
  static final String SIBLING_CHUNK_IDS = "siblingChunkIds";
  static final String CHILD_CHUNK_IDS = "childChunkIds";
  static final String SOURCE_FILE_ID = "sourceFileId";
  static final String SOURCE_FILE_NAME = "sourceFileName";
  static final String CHUNKING_METHOD = "chunkingMethod";
  static final String CREATED_AT = "createdAt";
  static final String EMBEDDING = "embedding";

  public Map<String, Object> toDocument(String projectId, DocumentChunk chunk, float[] vector) {
    Map<String, Object> document = new HashMap<>();
    document.put(PROJECT_ID, projectId);
    document.put(CHUNK_ID, chunk.getId());
    document.put(DOCUMENT_ID, chunk.getDocumentId());
    document.put(CONTENT, chunk.getContent());
    document.put(TOKENS, chunk.getTokens());
    document.put(POSITION, chunk.getPosition());
    document.put(HEADING_PATH, chunk.getHeadingPath());
    document.put(HEADING_PATH_TEXT, chunk.headingPathText());
    document.put(HIERARCHY_LEVEL, chunk.getHierarchyLevel());
    document.put(CHUNK_TYPE, chunk.getChunkType().name());
    document.put(SEMANTIC_DENSITY, chunk.getSemanticDensity());
    document.put(TOPIC_KEYWORDS, chunk.getTopicKeywords());
    document.put(OVERLAP_PREVIOUS, chunk.isOverlapPrevious());
    document.put(OVERLAP_NEXT, chunk.isOverlapNext());
    putIfPresent(document, OVERLAP_TEXT, chunk.getOverlapText());
    putIfPresent(document, PREVIOUS_CHUNK_ID, chunk.getPreviousChunkId());
    putIfPresent(document, NEXT_CHUNK_ID, chunk.getNextChunkId());
    document.put(SIBLING_CHUNK_IDS, chunk.getSiblingChunkIds());
    document.put(CHILD_CHUNK_IDS, chunk.getChildChunkIds());
    ChunkProvenance provenance = chunk.getMetadata();
    if (provenance != null) {
      putIfPresent(document, SOURCE_FILE_ID, provenance.getSourceFileId());
      putIfPresent(document, SOURCE_FILE_NAME, provenance.getSourceFileName());
      if (provenance.getChunkingMethod() != null) {
        document.put(CHUNKING_METHOD, provenance.getChunkingMethod().name());
      }
      if (provenance.getCreatedAt() != null) {
        document.put(CREATED_AT, provenance.getCreatedAt().toString());
      }
    }
    document.put(EMBEDDING, toFloatList(vector));
    return document;
  }

  /**
   * Rebuilds a chunk from a stored record.
   *
   * @param recordId the stored record id, used in error messages
   * @param source the stored fields
   * @return the chunk
   * @throws MalformedChunkDataException if a required field is missing or has the wrong type
   */
  public DocumentChunk fromDocument(String recordId, Map<String, Object> source) {
    if (source == null) {
      throw new MalformedChunkDataException(recordId, "record has no source");
    }
    try {
      List<String> headingPath = stringList(source.get(HEADING_PATH));
      return DocumentChunk.builder()
          .id(requiredString(source, CHUNK_ID))
          .documentId(requiredString(source, DOCUMENT_ID))
          .content(requiredString(source, CONTENT))
          .tokens(intValue(source.get(TOKENS), 0))
          .position(requiredInt(source, POSITION))
          .headingPath(headingPath)
          .hierarchyLevel(intValue(source.get(HIERARCHY_LEVEL), headingPath.size()))
          .chunkType(ChunkType.valueOf(requiredString(source, CHUNK_TYPE)))
          .semanticDensity(doubleValue(source.get(SEMANTIC_DENSITY)))
          .topicKeywords(stringList(source.get(TOPIC_KEYWORDS)))
          .overlapPrevious(Boolean.TRUE.equals(source.get(OVERLAP_PREVIOUS)))
          .overlapNext(Boolean.TRUE.equals(source.get(OVERLAP_NEXT)))
          .overlapText((String) source.get(OVERLAP_TEXT))
          .previousChunkId((String) source.get(PREVIOUS_CHUNK_ID))
          .nextChunkId((String) source.get(NEXT_CHUNK_ID))
          .siblingChunkIds(stringList(source.get(SIBLING_CHUNK_IDS)))
          .childChunkIds(stringList(source.get(CHILD_CHUNK_IDS)))
          .metadata(provenance(source))
          .build();
    } catch (ClassCastException | IllegalArgumentException | DateTimeParseException e) {
      throw new MalformedChunkDataException(recordId, e.getMessage(), e);
    }
  }

  static List<Float> toFloatList(float[] vector) {
    List<Float> values = new ArrayList<>(vector.length);
    for (float value : vector) {
      values.add(value);
    }
    return values;
  }

  private static ChunkProvenance provenance(Map<String, Object> source) {
    String method = (String) source.get(CHUNKING_METHOD);
    String createdAt = (String) source.get(CREATED_AT);
    return ChunkProvenance.builder()
        .sourceFileId((String) source.get(SOURCE_FILE_ID))
        .sourceFileName((String) source.get(SOURCE_FILE_NAME))
        .chunkingMethod(method == null ? null : ChunkingMethod.valueOf(method))
        .createdAt(createdAt == null ? null : Instant.parse(createdAt))
        .build();
  }

  private static String requiredString(Map<String, Object> source, String field) {
    Object value = source.get(field);
    if (value == null) {
      throw new IllegalArgumentException("missing field " + field);
    }
    return (String) value;
  }

  private static int requiredInt(Map<String, Object> source, String field) {
    Object value = source.get(field);
    if (value == null) {
      throw new IllegalArgumentException("missing field " + field);
    }
    return ((Number) value).intValue();
  }

  private static int intValue(Object value, int fallback) {
    return value == null ? fallback : ((Number) value).intValue();
  }

  private static double doubleValue(Object value) {
    return value == null ? 0.0 : ((Number) value).doubleValue();
  }

  private static List<String> stringList(Object value) {
    if (value == null) {
      return List.of();
    }
    List<String> result = new ArrayList<>();
    for (Object item : (List<?>) value) {
      result.add((String) item);
    }
    return List.copyOf(result);
  }

  private static void putIfPresent(Map<String, Object> document, String field, Object value) {
    if (value != null) {
      document.put(field, value);
    }
  }
}
