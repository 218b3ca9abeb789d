package com.flamingo.ai.slidedeck.exception;

/** Exception thrown when the model backend is unreachable, failing, or timed out. Retryable. */
public class BackendUnavailableException extends RuntimeException {

  private final boolean rateLimited;
  private final String userMessage;

  public BackendUnavailableException(String message) {
    this(message, null, false);
  }

  public BackendUnavailableException(String message, Throwable cause) {
    this(message, cause, false);
  }

  public BackendUnavailableException(String message, Throwable cause, boolean rateLimited) {
    super(message, cause);
    this.rateLimited = rateLimited;
    this.userMessage =
        rateLimited
            ? "Service is temporarily busy. Please try again in a moment."
            : "AI service is temporarily unavailable. Please try again later.";
  }

  public boolean isRateLimited() {
    return rateLimited;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
