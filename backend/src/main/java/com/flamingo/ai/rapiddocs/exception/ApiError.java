package com.flamingo.ai.rapiddocs.exception;

import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String GENERATION_FAILED = "GENERATION_001";
  public static final String IMPORT_FAILED = "IMPORT_001";
  public static final String FILE_NOT_FOUND = "FILE_001";
  public static final String LLM_UNAVAILABLE = "LLM_001";
  public static final String LLM_RATE_LIMITED = "LLM_002";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  /** Individual validation problems, if any. */
  private final List<String> details;

  /** Generation job the error belongs to, if one was started. */
  private final String jobId;

  /** Timestamp of the error. */
  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
