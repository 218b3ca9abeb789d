package com.flamingo.ai.slidedeck.exception;

/**
 * Exception thrown when the model's draft answer cannot be parsed into an outline. The raw output
 * is logged under {@link #getErrorId()} and never exposed to callers.
 */
public class MalformedDraftException extends RuntimeException {

  private final String errorId;
  private final String userMessage;

  public MalformedDraftException(String errorId, String message) {
    super(message);
    this.errorId = errorId;
    this.userMessage = "The AI returned a draft that could not be read. Please try again.";
  }

  public MalformedDraftException(String errorId, String message, Throwable cause) {
    super(message, cause);
    this.errorId = errorId;
    this.userMessage = "The AI returned a draft that could not be read. Please try again.";
  }

  public String getErrorId() {
    return errorId;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
