package com.flamingo.ai.indexer.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.BindException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  // Rejected metadata answers 500, which is what existing clients of /index expect.
  @ExceptionHandler(InvalidMetadataException.class)
  public ResponseEntity<ApiError> handleInvalidMetadata(
      InvalidMetadataException ex, HttpServletRequest request) {
    log.warn("Rejected metadata: {}", ex.getMessage());
    return respond(
        HttpStatus.INTERNAL_SERVER_ERROR,
        "invalid_metadata",
        ApiError.INVALID_METADATA,
        ex.getMessage(),
        request);
  }

  @ExceptionHandler(MissingCollectionException.class)
  public ResponseEntity<ApiError> handleMissingCollection(
      MissingCollectionException ex, HttpServletRequest request) {
    log.warn("No collection for batch: {}", ex.getMessage());
    return respond(
        HttpStatus.INTERNAL_SERVER_ERROR,
        "missing_collection",
        ApiError.MISSING_COLLECTION,
        ex.getMessage(),
        request);
  }

  @ExceptionHandler(InvalidPipelineParameterException.class)
  public ResponseEntity<ApiError> handleInvalidParameter(
      InvalidPipelineParameterException ex, HttpServletRequest request) {
    log.warn("Invalid pipeline parameter '{}': {}", ex.getParameter(), ex.getMessage());
    return respond(
        HttpStatus.BAD_REQUEST,
        "invalid_parameter",
        ApiError.INVALID_PARAMETER,
        ex.getMessage(),
        request);
  }

  @ExceptionHandler(BindException.class)
  public ResponseEntity<ApiError> handleBinding(BindException ex, HttpServletRequest request) {
    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(
                error ->
                    error.getField() + ": could not read value '" + error.getRejectedValue() + "'")
            .orElse("Invalid form parameters");
    log.warn("Form binding error: {}", message);
    return respond(
        HttpStatus.BAD_REQUEST, "validation_error", ApiError.INVALID_PARAMETER, message, request);
  }

  @ExceptionHandler({
    MissingServletRequestPartException.class,
    MissingServletRequestParameterException.class
  })
  public ResponseEntity<ApiError> handleMissingPart(Exception ex, HttpServletRequest request) {
    log.warn("Incomplete index request: {}", ex.getMessage());
    return respond(
        HttpStatus.BAD_REQUEST,
        "validation_error",
        ApiError.INVALID_PARAMETER,
        ex.getMessage(),
        request);
  }

  @ExceptionHandler(RequestLimitExceededException.class)
  public ResponseEntity<ApiError> handleRequestLimit(
      RequestLimitExceededException ex, HttpServletRequest request) {
    log.warn("Request rejected, {} concurrent requests in flight", ex.getLimit());
    return respond(
        HttpStatus.SERVICE_UNAVAILABLE,
        "request_limit",
        ApiError.TOO_MANY_REQUESTS,
        "The server is busy processing requests.",
        request);
  }

  @ExceptionHandler(DocumentConversionException.class)
  public ResponseEntity<ApiError> handleConversion(
      DocumentConversionException ex, HttpServletRequest request) {
    String errorId = generateErrorId();
    log.error("Conversion error [{}] for {}: {}", errorId, ex.getFilePath(), ex.getMessage(), ex);
    return respond(
        errorId,
        HttpStatus.INTERNAL_SERVER_ERROR,
        "conversion_error",
        ApiError.CONVERSION_FAILED,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(EmbeddingException.class)
  public ResponseEntity<ApiError> handleEmbedding(
      EmbeddingException ex, HttpServletRequest request) {
    String errorId = generateErrorId();
    log.error("Embedding error [{}]: {}", errorId, ex.getMessage(), ex);
    return respond(
        errorId,
        HttpStatus.INTERNAL_SERVER_ERROR,
        "embedding_error",
        ApiError.EMBEDDING_FAILED,
        "An unexpected error occurred. Please try again later.",
        request);
  }

  @ExceptionHandler(DocumentStoreException.class)
  public ResponseEntity<ApiError> handleStore(
      DocumentStoreException ex, HttpServletRequest request) {
    String errorId = generateErrorId();
    log.error(
        "Document store error [{}] on index '{}': {}",
        errorId,
        ex.getCollection(),
        ex.getMessage(),
        ex);
    return respond(
        errorId,
        HttpStatus.INTERNAL_SERVER_ERROR,
        "store_error",
        ApiError.STORE_ERROR,
        "An unexpected error occurred. Please try again later.",
        request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);
    return respond(
        errorId,
        HttpStatus.INTERNAL_SERVER_ERROR,
        "internal_error",
        ApiError.INTERNAL_ERROR,
        "An unexpected error occurred. Please try again later.",
        request);
  }

  private ResponseEntity<ApiError> respond(
      HttpStatus status,
      String errorType,
      String code,
      String message,
      HttpServletRequest request) {
    return respond(generateErrorId(), status, errorType, code, message, request);
  }

  private ResponseEntity<ApiError> respond(
      String errorId,
      HttpStatus status,
      String errorType,
      String code,
      String message,
      HttpServletRequest request) {
    meterRegistry.counter("api_errors_total", "error_type", errorType).increment();
    return ResponseEntity.status(status)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(code)
                .message(message)
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  private String generateErrorId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
