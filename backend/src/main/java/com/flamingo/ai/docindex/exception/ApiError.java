package com.flamingo.ai.docindex.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String CHUNK_NOT_FOUND = "CHUNK_001";
  public static final String DOCUMENT_PROCESSING_ERROR = "DOCUMENT_001";
  public static final String SEARCH_FAILED = "SEARCH_001";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INVALID_CHUNKING_CONFIG = "VALIDATION_002";
  public static final String MALFORMED_REQUEST = "VALIDATION_003";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  /** What to fix, when the caller can fix it. */
  private final String details;

  /** Timestamp of the error. */
  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
