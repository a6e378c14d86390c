package com.flamingo.ai.docindex.exception;

/** Exception thrown when a chunk is not found in a project. */
public class ChunkNotFoundException extends RuntimeException {

  private final String projectId;
  private final String chunkId;

  public ChunkNotFoundException(String projectId, String chunkId) {
    super("Chunk not found: " + chunkId + " in project " + projectId);
    this.projectId = projectId;
    this.chunkId = chunkId;
  }

  public String getProjectId() {
    return projectId;
  }

  public String getChunkId() {
    return chunkId;
  }
}
