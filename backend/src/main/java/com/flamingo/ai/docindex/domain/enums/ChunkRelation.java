package com.flamingo.ai.docindex.domain.enums;

/** Why a chunk was returned as related to another chunk. */
public enum ChunkRelation {
  SIBLING,
  PARENT,
  CHILD,
  SEMANTIC
}
