package com.flamingo.ai.adaptiverag.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String INVALID_WORKFLOW_OPTIONS = "WORKFLOW_001";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String MALFORMED_REQUEST = "VALIDATION_002";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  /** Option that was rejected, when the error concerns a single option. */
  private final String field;

  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
