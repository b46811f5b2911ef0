package com.flamingo.ai.indexer.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String INVALID_METADATA = "META_001";
  public static final String MISSING_COLLECTION = "META_002";
  public static final String INVALID_PARAMETER = "PARAM_001";
  public static final String CONVERSION_FAILED = "DOCUMENT_001";
  public static final String EMBEDDING_FAILED = "EMBEDDING_001";
  public static final String STORE_ERROR = "STORE_001";
  public static final String TOO_MANY_REQUESTS = "LIMIT_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  /** Timestamp of the error. */
  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
