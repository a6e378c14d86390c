package com.flamingo.ai.docindex.domain.enums;

/** Content classification of a produced chunk. */
public enum ChunkType {
  HEADING,
  PARAGRAPH,
  LIST,
  TABLE,
  CODE,

  /** Chunk assembled from content of different types. */
  MIXED;

  /**
   * Maps a structural node type onto the chunk type it produces on its own.
   *
   * @param nodeType the node type
   * @return the matching chunk type
   */
  public static ChunkType fromNodeType(NodeType nodeType) {
    return switch (nodeType) {
      case HEADING -> HEADING;
      case LIST -> LIST;
      case TABLE -> TABLE;
      case CODE -> CODE;
      case PARAGRAPH, TEXT -> PARAGRAPH;
    };
  }
}
