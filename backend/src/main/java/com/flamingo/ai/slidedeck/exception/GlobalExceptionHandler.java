package com.flamingo.ai.slidedeck.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(SessionNotFoundException.class)
  public ResponseEntity<ApiError> handleSessionNotFound(
      SessionNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("session_not_found");
    String errorId = generateErrorId();
    log.warn("Session not found [{}]: {}", errorId, ex.getSessionId());

    return respond(
        HttpStatus.NOT_FOUND,
        errorId,
        ApiError.SESSION_NOT_FOUND,
        "Session not found or expired",
        request);
  }

  @ExceptionHandler(SessionBusyException.class)
  public ResponseEntity<ApiError> handleSessionBusy(
      SessionBusyException ex, HttpServletRequest request) {

    incrementErrorCounter("session_busy");
    String errorId = generateErrorId();
    log.warn("Session busy [{}]: {}", errorId, ex.getSessionId());

    return respond(
        HttpStatus.CONFLICT,
        errorId,
        ApiError.SESSION_BUSY,
        "The session is busy with another request. Please try again.",
        request);
  }

  @ExceptionHandler(DraftNotReadyException.class)
  public ResponseEntity<ApiError> handleDraftNotReady(
      DraftNotReadyException ex, HttpServletRequest request) {

    incrementErrorCounter("draft_not_ready");
    String errorId = generateErrorId();
    log.warn("Draft not ready [{}]: {}", errorId, ex.getMessage());

    return respond(
        HttpStatus.CONFLICT,
        errorId,
        ApiError.DRAFT_NOT_READY,
        "Not enough information has been gathered to create a draft yet",
        request);
  }

  @ExceptionHandler(NoDraftException.class)
  public ResponseEntity<ApiError> handleNoDraft(NoDraftException ex, HttpServletRequest request) {

    incrementErrorCounter("no_draft");
    String errorId = generateErrorId();
    log.warn("No draft [{}]: {}", errorId, ex.getMessage());

    return respond(
        HttpStatus.CONFLICT,
        errorId,
        ApiError.NO_DRAFT,
        "No draft available. Create a draft first.",
        request);
  }

  @ExceptionHandler(InvalidStateException.class)
  public ResponseEntity<ApiError> handleInvalidState(
      InvalidStateException ex, HttpServletRequest request) {

    incrementErrorCounter("invalid_state");
    String errorId = generateErrorId();
    log.warn("Invalid state [{}]: {}", errorId, ex.getMessage());

    return respond(
        HttpStatus.CONFLICT,
        errorId,
        ApiError.INVALID_STATE,
        "This operation is not allowed in the session's current state ("
            + ex.getCurrentState()
            + ")",
        request);
  }

  @ExceptionHandler(TemplateNotFoundException.class)
  public ResponseEntity<ApiError> handleTemplateNotFound(
      TemplateNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("template_not_found");
    String errorId = generateErrorId();
    log.warn("Template not found [{}]: {}", errorId, ex.getTemplateKey());

    return respond(
        HttpStatus.NOT_FOUND,
        errorId,
        ApiError.TEMPLATE_NOT_FOUND,
        "Template '" + ex.getTemplateKey() + "' not found",
        request);
  }

  @ExceptionHandler(GuidedModeNotSupportedException.class)
  public ResponseEntity<ApiError> handleGuidedModeNotSupported(
      GuidedModeNotSupportedException ex, HttpServletRequest request) {

    incrementErrorCounter("guided_mode_not_supported");
    String errorId = generateErrorId();
    log.warn("Guided mode not supported [{}]: {}", errorId, ex.getTemplateKey());

    return respond(
        HttpStatus.BAD_REQUEST,
        errorId,
        ApiError.GUIDED_MODE_NOT_SUPPORTED,
        "Template '" + ex.getTemplateKey() + "' does not support guided mode",
        request);
  }

  @ExceptionHandler(MalformedDraftException.class)
  public ResponseEntity<ApiError> handleMalformedDraft(
      MalformedDraftException ex, HttpServletRequest request) {

    incrementErrorCounter("malformed_draft");
    log.error("Malformed draft [{}]: {}", ex.getErrorId(), ex.getMessage());

    return respond(
        HttpStatus.BAD_GATEWAY,
        ex.getErrorId(),
        ApiError.MALFORMED_DRAFT,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(BackendUnavailableException.class)
  public ResponseEntity<ApiError> handleBackendUnavailable(
      BackendUnavailableException ex, HttpServletRequest request) {

    String errorType = ex.isRateLimited() ? "llm_rate_limited" : "llm_unavailable";
    incrementErrorCounter(errorType);
    String errorId = generateErrorId();
    log.error("LLM backend error [{}]: {}", errorId, ex.getMessage(), ex);

    String code = ex.isRateLimited() ? ApiError.LLM_RATE_LIMITED : ApiError.LLM_UNAVAILABLE;

    return respond(HttpStatus.SERVICE_UNAVAILABLE, errorId, code, ex.getUserMessage(), request);
  }

  @ExceptionHandler(RenderFailedException.class)
  public ResponseEntity<ApiError> handleRenderFailed(
      RenderFailedException ex, HttpServletRequest request) {

    incrementErrorCounter("render_failed");
    String errorId = generateErrorId();
    log.error("Render failed [{}]: {}", errorId, ex.getMessage(), ex);

    return respond(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.RENDER_FAILED,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(ArtifactNotFoundException.class)
  public ResponseEntity<ApiError> handleArtifactNotFound(
      ArtifactNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("artifact_not_found");
    String errorId = generateErrorId();
    log.warn("Artifact not found [{}]: {}", errorId, ex.getArtifactId());

    return respond(
        HttpStatus.NOT_FOUND, errorId, ApiError.ARTIFACT_NOT_FOUND, "File not found", request);
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

    return respond(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, message, request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);

    return respond(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.INTERNAL_ERROR,
        "An unexpected error occurred. Please try again later.",
        request);
  }

  private ResponseEntity<ApiError> respond(
      HttpStatus status, String errorId, String code, String message, HttpServletRequest request) {
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

  private void incrementErrorCounter(String errorType) {
    meterRegistry.counter("api_errors_total", "error_type", errorType).increment();
  }

  private String generateErrorId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
