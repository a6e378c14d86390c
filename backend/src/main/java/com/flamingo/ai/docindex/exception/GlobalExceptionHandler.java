package com.flamingo.ai.docindex.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(ChunkNotFoundException.class)
  public ResponseEntity<ApiError> handleChunkNotFound(
      ChunkNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("chunk_not_found");
    String errorId = generateErrorId();
    log.warn("Chunk not found [{}]: {} (project {})", errorId, ex.getChunkId(), ex.getProjectId());

    return error(
        HttpStatus.NOT_FOUND, errorId, ApiError.CHUNK_NOT_FOUND, "Chunk not found", null, request);
  }

  @ExceptionHandler(InvalidChunkingConfigException.class)
  public ResponseEntity<ApiError> handleInvalidChunkingConfig(
      InvalidChunkingConfigException ex, HttpServletRequest request) {

    incrementErrorCounter("invalid_chunking_config");
    String errorId = generateErrorId();
    log.warn("Invalid chunking config [{}]: {}", errorId, ex.getMessage());

    return error(
        HttpStatus.BAD_REQUEST,
        errorId,
        ApiError.INVALID_CHUNKING_CONFIG,
        "Invalid chunking configuration",
        ex.getField() + ": " + ex.getMessage(),
        request);
  }

  @ExceptionHandler(DocumentProcessingException.class)
  public ResponseEntity<ApiError> handleDocumentProcessing(
      DocumentProcessingException ex, HttpServletRequest request) {

    incrementErrorCounter("document_processing");
    String errorId = generateErrorId();
    log.error("Document processing error [{}]: {}", errorId, ex.getMessage(), ex);

    return error(
        HttpStatus.UNPROCESSABLE_ENTITY,
        errorId,
        ApiError.DOCUMENT_PROCESSING_ERROR,
        ex.getUserMessage(),
        null,
        request);
  }

  @ExceptionHandler(SearchException.class)
  public ResponseEntity<ApiError> handleSearch(SearchException ex, HttpServletRequest request) {

    incrementErrorCounter("search_error");
    String errorId = generateErrorId();
    log.error("Search error [{}]: {}", errorId, ex.getMessage(), ex);

    return error(
        HttpStatus.SERVICE_UNAVAILABLE,
        errorId,
        ApiError.SEARCH_FAILED,
        ex.getUserMessage(),
        null,
        request);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleValidation(
      MethodArgumentNotValidException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();

    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .orElse("Validation failed");

    log.warn("Validation error [{}]: {}", errorId, message);

    return error(
        HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, message, null, request);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiError> handleUnreadable(
      HttpMessageNotReadableException ex, HttpServletRequest request) {

    incrementErrorCounter("malformed_request");
    String errorId = generateErrorId();
    log.warn("Malformed request body [{}]: {}", errorId, ex.getMessage());

    return error(
        HttpStatus.BAD_REQUEST,
        errorId,
        ApiError.MALFORMED_REQUEST,
        "Request body could not be read",
        null,
        request);
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<ApiError> handleTypeMismatch(
      MethodArgumentTypeMismatchException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    String message = ex.getName() + ": invalid value '" + ex.getValue() + "'";
    log.warn("Invalid request parameter [{}]: {}", errorId, message);

    return error(
        HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, message, null, request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);

    return error(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.INTERNAL_ERROR,
        "An unexpected error occurred. Please try again later.",
        null,
        request);
  }

  private ResponseEntity<ApiError> error(
      HttpStatus status,
      String errorId,
      String code,
      String message,
      String details,
      HttpServletRequest request) {
    return ResponseEntity.status(status)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(code)
                .message(message)
                .details(details)
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  private void incrementErrorCounter(String errorType) {
    meterRegistry.counter("api_errors_total", "error_type", errorType).increment();
  }

  private String generateErrorId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
