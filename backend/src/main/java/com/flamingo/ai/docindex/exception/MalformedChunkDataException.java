package com.flamingo.ai.docindex.exception;

/** Thrown by a chunk store when a stored record cannot be decoded into a chunk. */
public class MalformedChunkDataException extends SearchException {

  private final String recordId;

  public MalformedChunkDataException(String recordId, String message) {
    super("Malformed chunk record " + recordId + ": " + message);
    this.recordId = recordId;
  }

  public MalformedChunkDataException(String recordId, String message, Throwable cause) {
    super("Malformed chunk record " + recordId + ": " + message, cause);
    this.recordId = recordId;
  }

  public String getRecordId() {
    return recordId;
  }
}
