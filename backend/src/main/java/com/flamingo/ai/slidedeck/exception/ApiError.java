package com.flamingo.ai.slidedeck.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String SESSION_NOT_FOUND = "SESSION_001";
  public static final String SESSION_BUSY = "SESSION_002";
  public static final String INVALID_STATE = "STATE_001";
  public static final String DRAFT_NOT_READY = "STATE_002";
  public static final String NO_DRAFT = "STATE_003";
  public static final String TEMPLATE_NOT_FOUND = "TEMPLATE_001";
  public static final String GUIDED_MODE_NOT_SUPPORTED = "TEMPLATE_002";
  public static final String MALFORMED_DRAFT = "DRAFT_001";
  public static final String LLM_UNAVAILABLE = "LLM_001";
  public static final String LLM_RATE_LIMITED = "LLM_002";
  public static final String RENDER_FAILED = "RENDER_001";
  public static final String ARTIFACT_NOT_FOUND = "RENDER_002";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
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
